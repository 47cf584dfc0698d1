/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api;

/** Input bytes are not valid UTF-8, or the text holds an unpaired surrogate. */
public class InvalidTextEncodingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public InvalidTextEncodingException(String message) {
        super(message);
    }

    public InvalidTextEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
