/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.diagnostics;

/**
 * Keyword bits of the diagnostics provider.
 */
public final class DiagnosticKeywords {

    public static final long SINK = 0x1L;
    public static final long FORMATTING = 0x2L;

    private DiagnosticKeywords() {}
}
