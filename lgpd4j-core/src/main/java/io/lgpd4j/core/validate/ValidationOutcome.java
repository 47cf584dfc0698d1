/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

/**
 * @param valid verdict
 * @param normalizedValue canonical form, or the best-effort cleaned input when invalid
 * @param message short human-readable explanation
 */
public record ValidationOutcome(boolean valid, String normalizedValue, String message) {
    public static ValidationOutcome valid(String normalized, String message) {
        return new ValidationOutcome(true, normalized, message);
    }

    public static ValidationOutcome invalid(String normalized, String message) {
        return new ValidationOutcome(false, normalized, message);
    }
}
