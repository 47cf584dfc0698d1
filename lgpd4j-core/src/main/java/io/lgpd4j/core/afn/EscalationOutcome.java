/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.afn;

import io.lgpd4j.core.api.model.Entity;
import java.util.List;

/**
 * Entity set after escalation.
 *
 * @param entities fused and re-scored entities, sorted by start
 * @param triggered whether the escalation ran at all
 * @param contextualDegraded the lowered-threshold contextual rescan was unavailable
 * @param degradedReason reason of the degraded rescan, or null
 */
public record EscalationOutcome(
        List<Entity> entities, boolean triggered, boolean contextualDegraded, String degradedReason) {
    public EscalationOutcome {
        entities = List.copyOf(entities);
    }

    static EscalationOutcome skipped(List<Entity> entities) {
        return new EscalationOutcome(entities, false, false, null);
    }
}
