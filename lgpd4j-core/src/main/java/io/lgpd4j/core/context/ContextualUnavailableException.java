/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

/** The contextual recognizer could not answer (not loaded, timed out, crashed). Not the same as "found nothing". */
public class ContextualUnavailableException extends Exception {
    private static final long serialVersionUID = 1L;

    public ContextualUnavailableException(String message) {
        super(message);
    }

    public ContextualUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
