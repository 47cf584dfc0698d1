/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.preset;

import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.RegexAggressiveness;
import io.lgpd4j.core.detect.Detector;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of structural detectors, one per pattern type.
 *
 * <h3>Output order</h3>
 * <ul>
 *   <li><b>1.</b> start offset ascending</li>
 *   <li><b>2.</b> {@link PiiType} declaration order</li>
 *   <li><b>3.</b> longer span first</li>
 * </ul>
 */
public final class PatternLibrary {
    static final Comparator<RawCandidate> ORDER = Comparator.comparingInt(RawCandidate::start)
            .thenComparing(RawCandidate::type)
            .thenComparing(Comparator.comparingInt(RawCandidate::length).reversed());

    private static final PatternLibrary STANDARD = new PatternLibrary(BuiltInPatterns.all());

    private final Map<PiiType, Detector> detectors;

    public PatternLibrary(List<Detector> detectors) {
        Objects.requireNonNull(detectors, "detectors");
        Map<PiiType, Detector> m = new EnumMap<>(PiiType.class);
        for (Detector d : detectors) {
            if (m.putIfAbsent(d.type(), d) != null) {
                throw new IllegalArgumentException("Duplicate detector for " + d.type());
            }
        }
        this.detectors = m;
    }

    /** Shared instance with the built-in patterns. */
    public static PatternLibrary standard() {
        return STANDARD;
    }

    public List<PiiType> types() {
        return List.copyOf(detectors.keySet());
    }

    public List<RawCandidate> extract(String text, RegexAggressiveness level) {
        if (text == null || text.isEmpty()) return List.of();
        Objects.requireNonNull(level, "level");
        List<RawCandidate> out = new ArrayList<>();
        for (Detector d : detectors.values()) out.addAll(d.detect(text, level));
        out.sort(ORDER);
        return List.copyOf(out);
    }
}
