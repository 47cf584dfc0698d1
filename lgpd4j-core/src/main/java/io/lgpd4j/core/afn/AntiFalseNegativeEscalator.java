/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.afn;

import io.lgpd4j.core.api.model.AfnPasses;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.ModePolicy;
import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import io.lgpd4j.core.assemble.DecisionAssembler;
import io.lgpd4j.core.context.ContextualGateway;
import io.lgpd4j.core.context.ContextualPass;
import io.lgpd4j.core.fuse.FusionEngine;
import io.lgpd4j.core.score.ConfidenceScorer;
import io.lgpd4j.core.validate.ValidationOutcome;
import io.lgpd4j.core.validate.Validator;
import io.lgpd4j.core.validate.Validators;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Second, more aggressive pass for texts that yielded few entities.
 *
 * <p>SINGLE escalates when fewer than {@code afnEntityThreshold} entities would be retained; DOUBLE
 * escalates every text, so a recall-oriented policy never skips a rescan that a stricter one runs.
 *
 * <ol>
 *   <li>numeric rescan: digit runs of exactly 11 or 14 digits (separators allowed, letters around
 *       them ignored) that pass the CPF/CNPJ check are added with base {@value #NUMERIC_CONFIDENCE}</li>
 *   <li>keyword rescan: local phone numbers right after "telefone", "celular" and the like, and
 *       partial CPFs right after "CPF"</li>
 *   <li>DOUBLE only: contextual rescan at half the base threshold, skipped when the first contextual
 *       pass already degraded; its admissions are kept down to that reduced threshold</li>
 *   <li>fusion of the additions, then a re-score of the entities still below the threshold using
 *       the expanded context window</li>
 * </ol>
 *
 * <p>Every addition carries source {@link Source#AFN}.
 */
@Slf4j
public final class AntiFalseNegativeEscalator {
    public static final double NUMERIC_CONFIDENCE = 0.75;
    /** Runs overlapping an entity at or above this confidence are left alone. */
    public static final double OCCUPIED_CONFIDENCE = 0.75;
    public static final double KEYWORD_PHONE_CONFIDENCE = 0.88;
    public static final double KEYWORD_CPF_CONFIDENCE = 0.85;
    public static final String RESCAN_REASON = "lowered-threshold contextual rescan";

    private static final Pattern DIGIT_RUN = Pattern.compile("(?<!\\d)\\d(?:[./\\-]?\\d){10,13}(?!\\d)");
    private static final String VALUE_END = "(?![\\p{L}\\d*#\\u2022])";
    private static final Pattern KEYWORD_PHONE = Pattern.compile(
            "(?<!\\p{L})(?:n[úu]mero|telefone|celular|fone|contato|whatsapp)[ \\t]{0,3}(?:é|:)?[ \\t]{0,3}"
                    + "(\\d{4,5}[- ]?\\d{4})" + VALUE_END,
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern KEYWORD_CPF = Pattern.compile(
            "(?<!\\p{L})(?:cpf|c\\.p\\.f\\.?)[ \\t]{0,3}(?:é|:)?[ \\t]{0,3}(\\d[\\d. \\-]{7,16}\\d)" + VALUE_END,
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final Validators validators;
    private final ConfidenceScorer scorer;
    private final FusionEngine fusion;
    private final ContextualGateway contextual;

    public AntiFalseNegativeEscalator(
            Validators validators, ConfidenceScorer scorer, FusionEngine fusion, ContextualGateway contextual) {
        this.validators = Objects.requireNonNull(validators, "validators");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.fusion = Objects.requireNonNull(fusion, "fusion");
        this.contextual = Objects.requireNonNull(contextual, "contextual");
    }

    public boolean shouldEscalate(List<Entity> scored, ModePolicy policy) {
        if (policy.afnPasses() == AfnPasses.NONE) return false;
        if (policy.afnPasses() == AfnPasses.DOUBLE) return true;
        long retained = scored.stream().filter(e -> DecisionAssembler.retains(e, policy)).count();
        return retained < policy.afnEntityThreshold();
    }

    public EscalationOutcome escalate(String text, List<Entity> scored, ModePolicy policy) {
        return escalate(text, scored, policy, true);
    }

    /**
     * @param contextualAvailable false when the first contextual pass degraded; the DOUBLE rescan is
     *     then skipped instead of waiting on the same recognizer again
     */
    public EscalationOutcome escalate(
            String text, List<Entity> scored, ModePolicy policy, boolean contextualAvailable) {
        if (!shouldEscalate(scored, policy)) return EscalationOutcome.skipped(scored);

        List<Entity> additions = new ArrayList<>(numericRescan(text, scored));
        List<Entity> occupied = new ArrayList<>(scored);
        occupied.addAll(additions);
        additions.addAll(keywordRescan(text, occupied));
        boolean degraded = false;
        String reason = null;
        if (policy.afnPasses() == AfnPasses.DOUBLE && !contextualAvailable) {
            log.debug("Skipping contextual rescan: first pass degraded");
        } else if (policy.afnPasses() == AfnPasses.DOUBLE) {
            ContextualPass pass = contextual.run(text, policy, policy.reducedThreshold());
            if (pass.degraded()) {
                degraded = true;
                reason = pass.reason();
            } else {
                for (Entity e : pass.entities()) {
                    if (!containsSpan(scored, e)) {
                        additions.add(e.withSources(EnumSet.of(Source.AFN)).withReason(RESCAN_REASON));
                    }
                }
            }
        }

        List<Entity> merged = new ArrayList<>(scored);
        merged.addAll(additions);
        List<Entity> rescored = scorer.scoreAll(fusion.fuse(merged), text, policy.contextWindow());

        List<Entity> out = new ArrayList<>(rescored.size());
        for (Entity e : rescored) {
            out.add(e.confidence() < policy.baseThreshold()
                    ? scorer.score(e, text, policy.expandedContextWindow())
                    : e);
        }
        log.debug("Escalation ({}): {} addition(s), {} entities after re-fusion",
                policy.afnPasses(), additions.size(), out.size());
        return new EscalationOutcome(out, true, degraded, reason);
    }

    List<Entity> numericRescan(String text, List<Entity> existing) {
        List<Entity> found = new ArrayList<>();
        Matcher m = DIGIT_RUN.matcher(text);
        while (m.find()) {
            int s = m.start();
            int e = m.end();
            if (occupied(existing, s, e)) continue;
            String raw = m.group();
            int n = Validator.digits(raw).length();
            PiiType type = n == 11 ? PiiType.CPF : n == 14 ? PiiType.CNPJ : null;
            if (type == null) continue;
            Optional<ValidationOutcome> outcome = validators.validate(type, raw);
            if (outcome.isEmpty() || !outcome.get().valid()) continue;
            found.add(Entity.of(type, raw, outcome.get().normalizedValue(), s, e, NUMERIC_CONFIDENCE,
                    ValidationStatus.VALID, Source.AFN, "numeric rescan: " + outcome.get().message()));
        }
        return found;
    }

    /** Values announced by a keyword that the patterns cannot confirm on their own. */
    List<Entity> keywordRescan(String text, List<Entity> existing) {
        List<Entity> found = new ArrayList<>();
        Matcher m = KEYWORD_PHONE.matcher(text);
        while (m.find()) {
            int s = m.start(1);
            int e = m.end(1);
            String digits = Validator.digits(m.group(1));
            if (occupied(existing, s, e) || Validator.allSameDigit(digits)) continue;
            found.add(Entity.of(PiiType.PHONE, m.group(1), digits, s, e, KEYWORD_PHONE_CONFIDENCE,
                    ValidationStatus.NOT_APPLICABLE, Source.AFN, "keyword-anchored local phone, no DDD to check"));
        }
        m = KEYWORD_CPF.matcher(text);
        while (m.find()) {
            int s = m.start(1);
            int e = m.end(1);
            if (occupied(existing, s, e)) continue;
            String raw = m.group(1);
            int n = Validator.digits(raw).length();
            if (n == 9 || n == 10) {
                found.add(Entity.of(PiiType.CPF, raw, Validator.digits(raw), s, e, KEYWORD_CPF_CONFIDENCE,
                        ValidationStatus.NOT_APPLICABLE, Source.AFN, "keyword-anchored partial CPF"));
            } else if (n == 11) {
                // complete numbers keep the checksum rules; only valid ones are added
                Optional<ValidationOutcome> outcome = validators.validate(PiiType.CPF, raw);
                if (outcome.isPresent() && outcome.get().valid()) {
                    found.add(Entity.of(PiiType.CPF, raw, outcome.get().normalizedValue(), s, e,
                            KEYWORD_CPF_CONFIDENCE, ValidationStatus.VALID, Source.AFN,
                            "keyword-anchored CPF: " + outcome.get().message()));
                }
            }
        }
        return found;
    }

    private static boolean occupied(List<Entity> existing, int s, int e) {
        for (Entity x : existing) {
            if (x.start() < e && s < x.end() && x.confidence() >= OCCUPIED_CONFIDENCE) return true;
        }
        return false;
    }

    private static boolean containsSpan(List<Entity> existing, Entity e) {
        for (Entity x : existing) {
            if (x.type() == e.type() && x.start() == e.start() && x.end() == e.end()) return true;
        }
        return false;
    }

    /** Entities of {@code after} with no same-type, same-span counterpart in {@code before}. */
    public static int countAdded(List<Entity> before, List<Entity> after) {
        Set<String> keys = new HashSet<>();
        for (Entity e : before) keys.add(key(e));
        int n = 0;
        for (Entity e : after) if (!keys.contains(key(e))) n++;
        return n;
    }

    private static String key(Entity e) {
        return e.type() + ":" + e.start() + ":" + e.end();
    }
}
