/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api;

/** Raised at configuration time for an unknown mode or an out-of-range policy value. */
public class PolicyConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
