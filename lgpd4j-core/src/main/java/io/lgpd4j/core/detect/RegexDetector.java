/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.detect;

import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.RegexAggressiveness;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Runs every enabled rule of one type. When two rules hit the same span the higher confidence is
 * kept, so the output has at most one candidate per span.
 */
public final class RegexDetector implements Detector {
    static final Comparator<RawCandidate> ORDER = Comparator.comparingInt(RawCandidate::start)
            .thenComparing(Comparator.comparingInt(RawCandidate::length).reversed())
            .thenComparing(Comparator.comparingDouble(RawCandidate::baseConfidence).reversed());

    private final PiiType type;
    private final List<PatternRule> rules;

    public RegexDetector(PiiType type, List<PatternRule> rules) {
        if (type.isContextual()) throw new IllegalArgumentException(type + " is not a pattern type");
        this.type = type;
        this.rules = List.copyOf(rules);
    }

    @Override
    public PiiType type() {
        return type;
    }

    public List<PatternRule> rules() {
        return rules;
    }

    @Override
    public List<RawCandidate> detect(String text, RegexAggressiveness level) {
        if (text == null || text.isEmpty()) return List.of();
        Map<Long, RawCandidate> bySpan = new LinkedHashMap<>();
        for (PatternRule rule : rules) {
            if (!level.enables(rule.tier())) continue;
            Matcher m = rule.pattern().matcher(text);
            while (m.find()) {
                int s = m.start(rule.group());
                int e = m.end(rule.group());
                if (s < 0 || e <= s) continue;
                var c = new RawCandidate(type, text.substring(s, e), s, e, rule.confidence());
                bySpan.merge(spanKey(s, e), c, (a, b) -> b.baseConfidence() > a.baseConfidence() ? b : a);
            }
        }
        if (bySpan.isEmpty()) return List.of();
        List<RawCandidate> out = new ArrayList<>(bySpan.values());
        out.sort(ORDER);
        return List.copyOf(out);
    }

    private static long spanKey(int s, int e) {
        return ((long) s << 32) | e;
    }
}
