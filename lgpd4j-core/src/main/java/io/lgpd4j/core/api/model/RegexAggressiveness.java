/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/** Which pattern tiers are enabled. Each tier includes the ones before it. */
public enum RegexAggressiveness {
    OFF, // formatted identifiers only
    PARTIAL, // + unformatted digit runs
    ON; // + loose shapes (local phones, bare CNH, spaced e-mail)

    public boolean enables(RegexAggressiveness required) {
        return this.compareTo(required) >= 0;
    }
}
