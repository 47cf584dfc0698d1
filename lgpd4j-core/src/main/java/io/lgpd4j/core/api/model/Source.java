/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/** Stage that produced (or corroborated) an entity. */
public enum Source {
    REGEX,
    CONTEXTUAL,
    AFN
}
