/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import io.lgpd4j.core.api.model.Entity;
import java.util.List;

/** Entities from one contextual call, or the reason the call degraded. */
public record ContextualPass(List<Entity> entities, boolean degraded, String reason) {
    public ContextualPass {
        entities = List.copyOf(entities);
    }

    public static ContextualPass of(List<Entity> entities) {
        return new ContextualPass(entities, false, null);
    }

    public static ContextualPass degraded(String reason) {
        return new ContextualPass(List.of(), true, reason);
    }
}
