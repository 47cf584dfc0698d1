/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/** How far the anti-false-negative escalation goes. */
public enum AfnPasses {
    NONE, // never escalate
    SINGLE, // numeric rescan + context-expansion re-score
    DOUBLE // SINGLE + contextual rescan at half the threshold
}
