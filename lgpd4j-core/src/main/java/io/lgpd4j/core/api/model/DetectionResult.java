/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Final, immutable outcome of a detection call. Entities are ordered by start offset. */
public record DetectionResult(
        boolean hasPii,
        Classification classification,
        List<Entity> entities,
        double aggregateConfidence,
        String mode,
        DetectionMetadata metadata) {

    public DetectionResult {
        entities = List.copyOf(entities);
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(metadata, "metadata");
        if (hasPii == entities.isEmpty()) {
            throw new IllegalStateException("hasPii must reflect entity presence");
        }
        if ((classification == Classification.NON_PUBLIC) != hasPii) {
            throw new IllegalStateException("classification must be NON_PUBLIC iff hasPii");
        }
    }

    public static DetectionResult empty(String mode, DetectionMetadata metadata) {
        return new DetectionResult(false, Classification.PUBLIC, List.of(), 0.0, mode, metadata);
    }

    /** Number of entities per type, in type declaration order. */
    public Map<PiiType, Integer> countsByType() {
        Map<PiiType, Integer> out = new EnumMap<>(PiiType.class);
        for (Entity e : entities) out.merge(e.type(), 1, Integer::sum);
        return Collections.unmodifiableMap(out);
    }
}
