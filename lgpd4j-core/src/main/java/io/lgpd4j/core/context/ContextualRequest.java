/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import java.util.Objects;

/**
 * Input of one contextual recognition call.
 *
 * @param text text to analyse, already truncated to {@code maxLength}
 * @param maxLength upper bound on analysed chars
 * @param minConfidence candidates below this value may be omitted by the recognizer
 */
public record ContextualRequest(String text, int maxLength, double minConfidence) {
    public ContextualRequest {
        Objects.requireNonNull(text, "text");
        if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be positive");
        if (!Double.isFinite(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence out of range: " + minConfidence);
        }
    }
}
