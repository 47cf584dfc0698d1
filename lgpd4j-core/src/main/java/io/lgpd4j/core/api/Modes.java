/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api;

import io.lgpd4j.core.api.model.Mode;
import io.lgpd4j.core.api.model.ModePolicy;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public final class Modes {
    private Modes() {}

    /** Resolves "strict" / "balanced" / "precise" (case-insensitive). Unknown names fail fast. */
    public static Mode parse(String name) {
        if (name == null || name.isBlank()) throw new PolicyConfigurationException("Mode name is required");
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (Mode m : Mode.values()) {
            if (m.name().equals(n)) return m;
        }
        throw new PolicyConfigurationException("Unknown mode '" + name + "', expected one of " + names());
    }

    public static ModePolicy policyFor(String name) {
        return parse(name).policy();
    }

    public static String names() {
        return Arrays.stream(Mode.values())
                .map(m -> m.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }
}
