/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.fuse;

import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Greedy interval resolution over pattern, contextual and escalation entities.
 *
 * <p>Candidates are swept by start (longer first, then source priority). A candidate that overlaps
 * accepted entities replaces them only if it beats every one of them: higher confidence, then
 * VALID over anything else, then longer span; otherwise the incumbent stays. A candidate whose span
 * is within {@value #NEAR_SPAN} chars of a single accepted entity on both ends, and whose sources
 * are disjoint from it, is merged into that entity instead.
 */
public final class FusionEngine {
    public static final int NEAR_SPAN = 2;

    static final Comparator<Entity> SWEEP_ORDER = Comparator.comparingInt(Entity::start)
            .thenComparing(Comparator.comparingInt(Entity::length).reversed())
            .thenComparingInt(FusionEngine::sourcePriority)
            .thenComparing(Entity::type);

    public List<Entity> fuse(List<Entity> patternEntities, List<Entity> contextualEntities) {
        List<Entity> all = new ArrayList<>(patternEntities.size() + contextualEntities.size());
        all.addAll(patternEntities);
        all.addAll(contextualEntities);
        return fuse(all);
    }

    public List<Entity> fuse(List<Entity> candidates) {
        if (candidates.isEmpty()) return List.of();
        List<Entity> sorted = new ArrayList<>(candidates);
        sorted.sort(SWEEP_ORDER);

        List<Entity> accepted = new ArrayList<>();
        for (Entity c : sorted) {
            List<Entity> overlapping = new ArrayList<>();
            for (Entity a : accepted) if (a.overlaps(c)) overlapping.add(a);

            if (overlapping.isEmpty()) {
                accepted.add(c);
                continue;
            }
            if (overlapping.size() == 1 && mergeable(overlapping.get(0), c)) {
                Entity incumbent = overlapping.get(0);
                accepted.set(accepted.indexOf(incumbent), merge(incumbent, c));
                continue;
            }
            if (overlapping.stream().allMatch(o -> beats(c, o))) {
                accepted.removeAll(overlapping);
                accepted.add(c.withReason(appendReason(c, "outranked " + describe(overlapping))));
            }
        }
        accepted.sort(Comparator.comparingInt(Entity::start));
        return List.copyOf(accepted);
    }

    /** Strict ordering used for overlap conflicts; equal candidates keep the incumbent. */
    static boolean beats(Entity challenger, Entity incumbent) {
        int byConfidence = Double.compare(challenger.confidence(), incumbent.confidence());
        if (byConfidence != 0) return byConfidence > 0;
        boolean cValid = challenger.validationStatus() == ValidationStatus.VALID;
        boolean iValid = incumbent.validationStatus() == ValidationStatus.VALID;
        if (cValid != iValid) return cValid;
        return challenger.length() > incumbent.length();
    }

    static boolean mergeable(Entity a, Entity b) {
        return Math.abs(a.start() - b.start()) <= NEAR_SPAN
                && Math.abs(a.end() - b.end()) <= NEAR_SPAN
                && Collections.disjoint(a.sources(), b.sources());
    }

    static Entity merge(Entity incumbent, Entity challenger) {
        Entity winner = beats(challenger, incumbent) ? challenger : incumbent;
        EnumSet<Source> union = EnumSet.copyOf(incumbent.sources());
        union.addAll(challenger.sources());
        return winner.withSources(union)
                .withBaseConfidence(Math.max(incumbent.baseConfidence(), challenger.baseConfidence()))
                .withConfidence(Math.max(incumbent.confidence(), challenger.confidence()))
                .withReason(appendReason(winner, "corroborated by " + union));
    }

    /** 0 = validated pattern/escalation match, 1 = contextual, 2 = unvalidated pattern match. */
    static int sourcePriority(Entity e) {
        if (e.hasSource(Source.CONTEXTUAL) && !e.hasSource(Source.REGEX) && !e.hasSource(Source.AFN)) return 1;
        return e.validationStatus() == ValidationStatus.VALID ? 0 : 2;
    }

    private static String appendReason(Entity e, String r) {
        return e.reason().isEmpty() ? r : e.reason() + "; " + r;
    }

    private static String describe(List<Entity> losers) {
        StringBuilder sb = new StringBuilder();
        for (Entity l : losers) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(l.type()).append(" [").append(l.start()).append(',').append(l.end()).append(')');
        }
        return sb.toString();
    }
}
