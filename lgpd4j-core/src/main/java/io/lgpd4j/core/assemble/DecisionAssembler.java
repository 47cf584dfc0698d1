/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.assemble;

import io.lgpd4j.core.api.model.AfnPasses;
import io.lgpd4j.core.api.model.Classification;
import io.lgpd4j.core.api.model.DetectionMetadata;
import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import io.lgpd4j.core.validate.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Applies the policy threshold and derives the final decision from the surviving entities. */
public final class DecisionAssembler {

    public DetectionResult assemble(List<Entity> scored, ModePolicy policy, DetectionMetadata metadata) {
        List<Entity> kept = retained(scored, policy);
        if (kept.isEmpty()) return DetectionResult.empty(policy.name(), metadata);
        double aggregate = 0.0;
        for (Entity e : kept) aggregate = Math.max(aggregate, e.confidence());
        return new DetectionResult(true, Classification.NON_PUBLIC, kept, aggregate, policy.name(), metadata);
    }

    public List<Entity> retained(List<Entity> scored, ModePolicy policy) {
        List<Entity> kept = new ArrayList<>();
        for (Entity e : scored) if (retains(e, policy)) kept.add(e);
        kept.sort(Comparator.comparingInt(Entity::start));
        return kept;
    }

    /**
     * At or above the threshold; or, when the policy accepts invalid checksums, a CPF/CNPJ with the
     * right digit count whose check digits fail; or, under DOUBLE escalation, an escalation addition
     * at or above the reduced threshold it was requested at.
     */
    public static boolean retains(Entity e, ModePolicy policy) {
        if (e.confidence() >= policy.baseThreshold()) return true;
        if (policy.acceptInvalidChecksum() && isChecksumFailure(e)) return true;
        return isRescanAdmission(e, policy);
    }

    static boolean isRescanAdmission(Entity e, ModePolicy policy) {
        return policy.afnPasses() == AfnPasses.DOUBLE
                && e.hasSource(Source.AFN)
                && e.confidence() >= policy.reducedThreshold();
    }

    static boolean isChecksumFailure(Entity e) {
        if (!e.type().isTaxId() || e.validationStatus() != ValidationStatus.INVALID) return false;
        String digits = Validator.digits(e.rawValue());
        int expected = e.type() == PiiType.CPF ? 11 : 14;
        return digits.length() == expected && !Validator.allSameDigit(digits);
    }
}
