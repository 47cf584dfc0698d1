/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.lgpd4j.core.api.model.ContextualCandidate;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;

/**
 * Core side of the contextual boundary: applies the policy limits, turns candidates into entities
 * and maps unavailability to a degraded pass.
 */
@Slf4j
public final class ContextualGateway {
    private final ContextualRecognizer recognizer;
    private final ExecutorService executor;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Executor is shared with the owning detector")
    public ContextualGateway(ContextualRecognizer recognizer, ExecutorService executor) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public ContextualPass run(String text, ModePolicy policy, double minConfidence) {
        String analysed = truncate(text, policy.contextualMaxLength());
        var bounded = new TimeBoundedRecognizer(recognizer, policy.contextualTimeout(), executor);
        List<ContextualCandidate> found;
        try {
            found = bounded.recognize(new ContextualRequest(analysed, policy.contextualMaxLength(), minConfidence));
        } catch (ContextualUnavailableException e) {
            log.warn("Contextual recognizer unavailable, continuing with patterns only: {}", e.getMessage());
            return ContextualPass.degraded(e.getMessage());
        }

        List<Entity> out = new ArrayList<>(found.size());
        for (ContextualCandidate c : found) {
            if (c == null) throw new IllegalArgumentException("Contextual recognizer returned a null candidate");
            if (c.end() > analysed.length()) {
                log.warn("Dropping {} candidate with span [{},{}) outside text of length {}",
                        c.type(), c.start(), c.end(), analysed.length());
                continue;
            }
            if (c.confidence() < minConfidence) continue;
            String raw = analysed.substring(c.start(), c.end());
            out.add(Entity.of(c.type(), raw, raw.strip(), c.start(), c.end(), c.confidence(),
                    ValidationStatus.NOT_APPLICABLE, Source.CONTEXTUAL, "contextual recognizer"));
        }
        log.debug("Contextual pass: {} candidate(s), {} kept (min confidence {})", found.size(), out.size(), minConfidence);
        return ContextualPass.of(out);
    }

    /** Cuts at {@code max} chars without splitting a surrogate pair. */
    static String truncate(String text, int max) {
        if (text.length() <= max) return text;
        int end = max;
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end);
    }
}
