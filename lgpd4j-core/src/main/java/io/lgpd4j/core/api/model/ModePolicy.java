/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

import io.lgpd4j.core.api.PolicyConfigurationException;
import java.time.Duration;

/**
 * Read-only configuration bundle that parameterises every pipeline stage.
 *
 * @param name policy name reported in results
 * @param baseThreshold minimum final confidence, exclusive range (0,1)
 * @param regexAggressiveness enabled pattern tiers
 * @param afnPasses escalation depth
 * @param acceptInvalidChecksum keep structurally correct CPF/CNPJ whose check digits fail
 * @param afnEntityThreshold escalate when fewer entities than this would be retained
 * @param contextWindow chars scanned on each side of a span for keyword indicators
 * @param expandedContextWindow window used by the escalation re-score
 * @param contextualTimeout bound on the contextual recognizer call
 * @param contextualMaxLength chars handed to the contextual recognizer; longer text is truncated
 */
public record ModePolicy(
        String name,
        double baseThreshold,
        RegexAggressiveness regexAggressiveness,
        AfnPasses afnPasses,
        boolean acceptInvalidChecksum,
        int afnEntityThreshold,
        int contextWindow,
        int expandedContextWindow,
        Duration contextualTimeout,
        int contextualMaxLength) {

    public static final int DEFAULT_AFN_ENTITY_THRESHOLD = 2;
    public static final int DEFAULT_CONTEXT_WINDOW = 50;
    public static final int DEFAULT_EXPANDED_CONTEXT_WINDOW = 100;
    public static final Duration DEFAULT_CONTEXTUAL_TIMEOUT = Duration.ofSeconds(2);
    public static final int DEFAULT_CONTEXTUAL_MAX_LENGTH = 5000;

    public ModePolicy {
        if (name == null || name.isBlank()) throw new PolicyConfigurationException("Policy name is required");
        if (!(baseThreshold > 0.0 && baseThreshold < 1.0)) {
            throw new PolicyConfigurationException("baseThreshold must be in (0,1), got " + baseThreshold);
        }
        if (regexAggressiveness == null) throw new PolicyConfigurationException("regexAggressiveness is required");
        if (afnPasses == null) throw new PolicyConfigurationException("afnPasses is required");
        if (afnEntityThreshold < 0) {
            throw new PolicyConfigurationException("afnEntityThreshold must be >= 0, got " + afnEntityThreshold);
        }
        if (contextWindow < 0 || expandedContextWindow < contextWindow) {
            throw new PolicyConfigurationException(
                    "context windows must satisfy 0 <= contextWindow <= expandedContextWindow");
        }
        if (contextualTimeout == null || contextualTimeout.isZero() || contextualTimeout.isNegative()) {
            throw new PolicyConfigurationException("contextualTimeout must be positive");
        }
        if (contextualMaxLength <= 0) {
            throw new PolicyConfigurationException("contextualMaxLength must be positive");
        }
    }

    /** Policy with default windows, escalation threshold and contextual limits. */
    public static ModePolicy of(
            String name,
            double baseThreshold,
            RegexAggressiveness aggressiveness,
            AfnPasses afnPasses,
            boolean acceptInvalidChecksum) {
        return new ModePolicy(
                name,
                baseThreshold,
                aggressiveness,
                afnPasses,
                acceptInvalidChecksum,
                DEFAULT_AFN_ENTITY_THRESHOLD,
                DEFAULT_CONTEXT_WINDOW,
                DEFAULT_EXPANDED_CONTEXT_WINDOW,
                DEFAULT_CONTEXTUAL_TIMEOUT,
                DEFAULT_CONTEXTUAL_MAX_LENGTH);
    }

    /** Threshold used by the second contextual pass of a DOUBLE escalation. */
    public double reducedThreshold() {
        return baseThreshold / 2.0;
    }

    public boolean escalates() {
        return afnPasses != AfnPasses.NONE;
    }

    public ModePolicy withBaseThreshold(double t) {
        return new ModePolicy(name, t, regexAggressiveness, afnPasses, acceptInvalidChecksum, afnEntityThreshold,
                contextWindow, expandedContextWindow, contextualTimeout, contextualMaxLength);
    }

    public ModePolicy withAfnEntityThreshold(int n) {
        return new ModePolicy(name, baseThreshold, regexAggressiveness, afnPasses, acceptInvalidChecksum, n,
                contextWindow, expandedContextWindow, contextualTimeout, contextualMaxLength);
    }

    public ModePolicy withContextual(Duration timeout, int maxLength) {
        return new ModePolicy(name, baseThreshold, regexAggressiveness, afnPasses, acceptInvalidChecksum,
                afnEntityThreshold, contextWindow, expandedContextWindow, timeout, maxLength);
    }
}
