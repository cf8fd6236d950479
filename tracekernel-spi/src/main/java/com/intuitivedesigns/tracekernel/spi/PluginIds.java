/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

import java.util.Locale;

public final class PluginIds {

    private PluginIds() {}

    /**
     * Plugin ids are matched case-insensitively; "flat-file" and "FLAT_FILE" are the same id.
     */
    public static String normalize(String id) {
        if (id == null) return "";
        return id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
