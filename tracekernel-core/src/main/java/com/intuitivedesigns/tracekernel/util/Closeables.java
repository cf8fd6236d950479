/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Closeables {

    private static final Logger log = LoggerFactory.getLogger(Closeables.class);

    private Closeables() {}

    /**
     * Closes {@code resource} if it is {@link AutoCloseable}, logging failures at WARN.
     *
     * @return true if the resource closed cleanly (or was null)
     */
    public static boolean closeQuietly(Object resource, String what) {
        if (resource instanceof AutoCloseable c) {
            try {
                c.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", what, e.toString());
                return false;
            }
        }
        return true;
    }
}
