/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

/**
 * What a roll does when the archive name it computed is already taken.
 */
public enum RollFileExistsBehavior {
    /** Replace the existing archive. Without a timestamp pattern the active file is truncated instead. */
    OVERWRITE,
    /** Append the next free sequence number ({@code events.2025-07-01.3.log}). */
    INCREMENT
}
