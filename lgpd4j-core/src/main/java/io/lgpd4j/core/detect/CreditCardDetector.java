/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.detect;

import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.RegexAggressiveness;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Card numbers with a known brand prefix (Visa, Mastercard, Amex, Discover), 4-digit groups with
 * optional spaces/dashes. Luhn is checked later by the validators.
 */
public final class CreditCardDetector implements Detector {
    private static final double CONFIDENCE = 0.90;
    private static final Pattern CARD = Pattern.compile(
            PatternRule.LEFT + "((?:4\\d{3}|5[1-5]\\d{2}|6011|3[47]\\d{2})(?:[ -]?\\d{4}){2}[ -]?\\d{3,4})"
                    + PatternRule.RIGHT);

    @Override
    public PiiType type() {
        return PiiType.CREDIT_CARD;
    }

    @Override
    public List<RawCandidate> detect(String s, RegexAggressiveness level) {
        if (s == null || s.isEmpty()) return List.of();
        List<RawCandidate> out = new ArrayList<>();
        Matcher m = CARD.matcher(s);
        while (m.find()) {
            out.add(new RawCandidate(PiiType.CREDIT_CARD, m.group(1), m.start(1), m.end(1), CONFIDENCE));
        }
        return List.copyOf(out);
    }
}
