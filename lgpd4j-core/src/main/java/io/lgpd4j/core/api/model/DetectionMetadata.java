/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/**
 * Per-call facts about how a result was produced.
 *
 * @param textLength length of the analysed text (chars)
 * @param contextualDegraded the contextual recognizer was unavailable and the run is regex-only
 * @param degradedReason why the contextual pass degraded, or null
 * @param afnTriggered the anti-false-negative escalation ran
 * @param afnAdded number of entities the escalation added to the final set
 */
public record DetectionMetadata(
        int textLength, boolean contextualDegraded, String degradedReason, boolean afnTriggered, int afnAdded) {

    public static DetectionMetadata empty(int textLength) {
        return new DetectionMetadata(textLength, false, null, false, 0);
    }
}
