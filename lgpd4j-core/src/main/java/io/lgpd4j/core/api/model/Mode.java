/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/** Named presets. Adding a mode means adding a constant, not a code path. */
public enum Mode {
    STRICT(ModePolicy.of("strict", 0.50, RegexAggressiveness.ON, AfnPasses.DOUBLE, true)), // max recall
    BALANCED(ModePolicy.of("balanced", 0.70, RegexAggressiveness.PARTIAL, AfnPasses.SINGLE, false)),
    PRECISE(ModePolicy.of("precise", 0.85, RegexAggressiveness.OFF, AfnPasses.NONE, false)); // max precision

    private final ModePolicy policy;

    Mode(ModePolicy policy) {
        this.policy = policy;
    }

    public ModePolicy policy() {
        return policy;
    }
}
