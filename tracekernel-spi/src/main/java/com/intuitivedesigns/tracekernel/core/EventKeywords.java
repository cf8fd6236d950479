/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.util.Locale;

/**
 * Helpers for the 64-bit keyword mask used for category filtering.
 */
public final class EventKeywords {

    /** No keyword filtering requested. Matches every event. */
    public static final long NONE = 0L;

    /** All bits set. Matches every event. */
    public static final long ALL = -1L;

    private EventKeywords() {}

    /**
     * An event passes when the mask does not restrict anything, when the event carries no
     * keywords, or when at least one bit is shared.
     */
    public static boolean matches(long eventKeywords, long mask) {
        if (mask == NONE || mask == ALL) return true;
        if (eventKeywords == NONE) return true;
        return (eventKeywords & mask) != 0L;
    }

    /**
     * Parses "0x1F", "31" or "ALL"/"NONE".
     */
    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) return ALL;
        final String s = raw.trim().toUpperCase(Locale.ROOT);
        if ("ALL".equals(s)) return ALL;
        if ("NONE".equals(s)) return NONE;
        if (s.startsWith("0X")) {
            return Long.parseUnsignedLong(s.substring(2), 16);
        }
        return Long.parseLong(s);
    }

    public static String toHex(long keywords) {
        return "0x" + Long.toHexString(keywords).toUpperCase(Locale.ROOT);
    }
}
