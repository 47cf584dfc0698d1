/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

import java.util.Objects;

/**
 * Candidate returned by a contextual recognizer. Only contextual types are accepted; anything else
 * is a contract violation.
 */
public record ContextualCandidate(PiiType type, int start, int end, double confidence) {
    public ContextualCandidate {
        Objects.requireNonNull(type, "type");
        if (!type.isContextual()) {
            throw new IllegalArgumentException("Contextual recognizers cannot produce type " + type);
        }
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + "," + end + ")");
        }
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
    }
}
