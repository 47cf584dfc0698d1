/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/** Value-free view of an entity (type + offsets + confidence), safe to keep for metrics. */
public record Finding(PiiType type, int start, int end, double confidence) {
    public static Finding of(Entity e) {
        return new Finding(e.type(), e.start(), e.end(), e.confidence());
    }
}
