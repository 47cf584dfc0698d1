/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.detect;

import io.lgpd4j.core.api.model.RegexAggressiveness;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One compiled pattern of a detector.
 *
 * @param name short label, reported in debug logs
 * @param pattern compiled matcher; the value is capture group {@code group}
 * @param group capture group holding the value (0 = whole match)
 * @param confidence base confidence of a match
 * @param tier lowest aggressiveness level that enables the rule
 */
public record PatternRule(String name, Pattern pattern, int group, double confidence, RegexAggressiveness tier) {
    /** No letter, digit or mask character (*, #, •) immediately before the value. */
    public static final String LEFT = "(?<![\\p{L}\\d*#\u2022])";
    /** No letter, digit or mask character immediately after the value. */
    public static final String RIGHT = "(?![\\p{L}\\d*#\u2022])";

    public PatternRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(tier, "tier");
        if (group < 0 || group > pattern.matcher("").groupCount()) {
            throw new IllegalArgumentException("Pattern " + name + " has no group " + group);
        }
    }

    public static PatternRule of(String name, String regex, double confidence, RegexAggressiveness tier) {
        return new PatternRule(name, Pattern.compile(regex), 1, confidence, tier);
    }

    public static PatternRule caseInsensitive(
            String name, String regex, double confidence, RegexAggressiveness tier) {
        return new PatternRule(
                name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), 1, confidence, tier);
    }
}
