/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Subscription-time filter: a maximum level and a keyword mask.
 *
 * @param level    least severe level that passes
 * @param keywords keyword mask, {@link EventKeywords#ALL} to accept everything
 */
public record EventFilter(EventLevel level, long keywords) implements Predicate<TraceEvent> {

    public static final EventFilter ALL = new EventFilter(EventLevel.VERBOSE, EventKeywords.ALL);

    public EventFilter {
        Objects.requireNonNull(level, "level");
    }

    @Override
    public boolean test(TraceEvent event) {
        return event.level().isEnabledFor(level) && EventKeywords.matches(event.keywords(), keywords);
    }
}
