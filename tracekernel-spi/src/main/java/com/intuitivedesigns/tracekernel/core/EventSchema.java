/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Static description of one event type of a provider.
 * <p>
 * Supplied by a {@link SchemaLookup}; the pipeline never derives schemas by itself.
 *
 * @param id                  event id, unique within the provider
 * @param providerId          provider identifier
 * @param providerName        human readable provider name
 * @param level               declared level
 * @param task                task code
 * @param taskName            task name, may be empty
 * @param opcode              opcode
 * @param opcodeName          opcode name, may be empty
 * @param keywords            declared keyword mask
 * @param keywordsDescription comma separated keyword names, may be empty
 * @param version             event version
 * @param payloadNames        ordered payload field names
 */
public record EventSchema(
        int id,
        UUID providerId,
        String providerName,
        EventLevel level,
        int task,
        String taskName,
        int opcode,
        String opcodeName,
        long keywords,
        String keywordsDescription,
        int version,
        List<String> payloadNames
) {

    public EventSchema {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(level, "level");
        providerName = (providerName == null) ? "" : providerName;
        taskName = (taskName == null) ? "" : taskName;
        opcodeName = (opcodeName == null) ? "" : opcodeName;
        keywordsDescription = (keywordsDescription == null) ? "" : keywordsDescription;
        payloadNames = (payloadNames == null) ? List.of() : List.copyOf(payloadNames);
    }

    public String eventName() {
        return taskName + opcodeName;
    }

    public int payloadSize() {
        return payloadNames.size();
    }
}
