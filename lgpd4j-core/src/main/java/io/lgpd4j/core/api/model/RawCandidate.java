/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

import java.util.Objects;

/** A pattern match before validation. Span indices [start,end). */
public record RawCandidate(PiiType type, String rawValue, int start, int end, double baseConfidence) {
    public RawCandidate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rawValue, "rawValue");
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + "," + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
