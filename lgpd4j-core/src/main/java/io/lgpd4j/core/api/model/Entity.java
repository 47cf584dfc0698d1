/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A detected personal-data span. Indices are [start,end) into the original text.
 *
 * <p>Instances are immutable; the fusion and scoring stages derive new instances through the
 * {@code with*} methods. {@code baseConfidence} is the value assigned by the producing stage and
 * never changes after creation, so scoring can be re-applied without accumulating bonuses.
 */
public record Entity(
        PiiType type,
        String rawValue,
        String normalizedValue,
        int start,
        int end,
        double baseConfidence,
        double confidence,
        ValidationStatus validationStatus,
        Set<Source> sources,
        String reason) {

    public Entity {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rawValue, "rawValue");
        Objects.requireNonNull(validationStatus, "validationStatus");
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + "," + end + ")");
        }
        checkConfidence(baseConfidence);
        checkConfidence(confidence);
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("Entity needs at least one source");
        }
        // EnumSet keeps iteration order stable (REGEX, CONTEXTUAL, AFN)
        sources = Collections.unmodifiableSet(EnumSet.copyOf(sources));
        normalizedValue = normalizedValue == null ? rawValue : normalizedValue;
        reason = reason == null ? "" : reason;
    }

    private static void checkConfidence(double c) {
        if (!Double.isFinite(c) || c < 0.0 || c > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + c);
        }
    }

    public static Entity of(
            PiiType type,
            String rawValue,
            String normalizedValue,
            int start,
            int end,
            double baseConfidence,
            ValidationStatus status,
            Source source,
            String reason) {
        return new Entity(
                type, rawValue, normalizedValue, start, end, baseConfidence, baseConfidence, status, Set.of(source),
                reason);
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(Entity other) {
        return start < other.end && other.start < end;
    }

    public boolean hasSource(Source s) {
        return sources.contains(s);
    }

    public boolean isCorroborated() {
        return sources.size() > 1;
    }

    public Entity withConfidence(double c) {
        return new Entity(
                type, rawValue, normalizedValue, start, end, baseConfidence, c, validationStatus, sources, reason);
    }

    public Entity withBaseConfidence(double base) {
        return new Entity(
                type, rawValue, normalizedValue, start, end, base, confidence, validationStatus, sources, reason);
    }

    public Entity withSources(Collection<Source> s) {
        return new Entity(
                type, rawValue, normalizedValue, start, end, baseConfidence, confidence, validationStatus,
                EnumSet.copyOf(s), reason);
    }

    public Entity withReason(String r) {
        return new Entity(
                type, rawValue, normalizedValue, start, end, baseConfidence, confidence, validationStatus, sources, r);
    }
}
