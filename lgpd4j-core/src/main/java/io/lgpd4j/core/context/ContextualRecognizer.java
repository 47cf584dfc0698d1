/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import io.lgpd4j.core.api.model.ContextualCandidate;
import java.util.List;
import java.util.Objects;

/**
 * Out-of-core recognizer of names, addresses, birth dates and organisations. Implementations must be
 * safe for concurrent use and may block; callers bound the call with a timeout.
 */
@FunctionalInterface
public interface ContextualRecognizer {

    /**
     * @return candidates with spans relative to {@code request.text()}
     * @throws ContextualUnavailableException when no answer can be produced
     */
    List<ContextualCandidate> recognize(ContextualRequest request) throws ContextualUnavailableException;

    /** Recognizer that is available and never finds anything. */
    static ContextualRecognizer none() {
        return request -> List.of();
    }

    /** Recognizer that is never available; every detection runs in degraded mode. */
    static ContextualRecognizer unavailable(String reason) {
        Objects.requireNonNull(reason, "reason");
        return request -> {
            throw new ContextualUnavailableException(reason);
        };
    }
}
