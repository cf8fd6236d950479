/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

public enum PluginKind {
    SINK,
    FORMATTER
}
