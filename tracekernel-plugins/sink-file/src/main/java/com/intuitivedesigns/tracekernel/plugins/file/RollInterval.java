/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import java.time.LocalDateTime;

/**
 * How often a {@link RollingFlatFileSink} starts a new file regardless of its size.
 */
public enum RollInterval {
    NONE,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    YEAR,
    /** At the first midnight after the file was started. */
    MIDNIGHT;

    /**
     * @return the next roll time after {@code start}, or null when this interval never rolls
     */
    LocalDateTime next(LocalDateTime start) {
        switch (this) {
            case MINUTE:
                return start.plusMinutes(1);
            case HOUR:
                return start.plusHours(1);
            case DAY:
                return start.plusDays(1);
            case WEEK:
                return start.plusWeeks(1);
            case MONTH:
                return start.plusMonths(1);
            case YEAR:
                return start.plusYears(1);
            case MIDNIGHT:
                return start.toLocalDate().plusDays(1).atStartOfDay();
            default:
                return null;
        }
    }
}
