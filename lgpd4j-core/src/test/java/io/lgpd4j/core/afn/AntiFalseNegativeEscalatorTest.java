/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.afn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.lgpd4j.core.api.model.ContextualCandidate;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.Mode;
import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import io.lgpd4j.core.context.ContextualGateway;
import io.lgpd4j.core.context.ContextualRecognizer;
import io.lgpd4j.core.fuse.FusionEngine;
import io.lgpd4j.core.score.ConfidenceScorer;
import io.lgpd4j.core.validate.Validators;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AntiFalseNegativeEscalatorTest {
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private AntiFalseNegativeEscalator escalator(ContextualRecognizer recognizer) {
        return new AntiFalseNegativeEscalator(
                Validators.standard(),
                ConfidenceScorer.standard(),
                new FusionEngine(),
                new ContextualGateway(recognizer, executor));
    }

    @Test
    void preciseNeverEscalates() {
        assertThat(escalator(ContextualRecognizer.none()).shouldEscalate(List.of(), Mode.PRECISE.policy())).isFalse();
    }

    @Test
    void escalatesOnlyBelowEntityThreshold() {
        var a = Entity.of(PiiType.EMAIL, "a@b.com", null, 0, 7, 0.9, ValidationStatus.VALID, Source.REGEX, "");
        var b = Entity.of(PiiType.EMAIL, "c@d.com", null, 10, 17, 0.9, ValidationStatus.VALID, Source.REGEX, "");
        var esc = escalator(ContextualRecognizer.none());
        assertThat(esc.shouldEscalate(List.of(a), Mode.BALANCED.policy())).isTrue();
        assertThat(esc.shouldEscalate(List.of(a, b), Mode.BALANCED.policy())).isFalse();
    }

    @Test
    void numericRescanRecoversIdsGluedToLetters() {
        String text = "protocolo ABC52998224725XYZ ref REF11222333000181X";
        EscalationOutcome out = escalator(ContextualRecognizer.none()).escalate(text, List.of(), Mode.BALANCED.policy());
        assertThat(out.triggered()).isTrue();
        assertThat(out.entities())
                .extracting(Entity::type, Entity::normalizedValue)
                .containsExactly(
                        tuple(PiiType.CPF, "529.982.247-25"),
                        tuple(PiiType.CNPJ, "11.222.333/0001-81"));
        assertThat(out.entities()).allSatisfy(e -> {
            assertThat(e.sources()).containsExactly(Source.AFN);
            assertThat(e.baseConfidence()).isEqualTo(AntiFalseNegativeEscalator.NUMERIC_CONFIDENCE);
        });
    }

    @Test
    void numericRescanSkipsInvalidAndOccupiedRuns() {
        String text = "CPF 123.456.789-09 e 123.456.789-00";
        var existing = Entity.of(PiiType.CPF, "123.456.789-09", null, 4, 18, 0.90, ValidationStatus.VALID,
                        Source.REGEX, "")
                .withConfidence(0.98);
        List<Entity> found = escalator(ContextualRecognizer.none()).numericRescan(text, List.of(existing));
        assertThat(found).isEmpty();
    }

    @Test
    void doubleEscalatesRegardlessOfEntityCount() {
        var a = Entity.of(PiiType.EMAIL, "a@b.com", null, 0, 7, 0.9, ValidationStatus.VALID, Source.REGEX, "");
        var b = Entity.of(PiiType.EMAIL, "c@d.com", null, 10, 17, 0.9, ValidationStatus.VALID, Source.REGEX, "");
        assertThat(escalator(ContextualRecognizer.none()).shouldEscalate(List.of(a, b), Mode.STRICT.policy()))
                .isTrue();
    }

    @Test
    void doublePassAsksRecognizerAtHalfThreshold() {
        double[] seen = new double[1];
        ContextualRecognizer recognizer = req -> {
            seen[0] = req.minConfidence();
            return List.of(new ContextualCandidate(PiiType.NAME, 11, 22, 0.30));
        };
        String text = "Requerente Maria Silva pediu acesso";
        EscalationOutcome out = escalator(recognizer).escalate(text, List.of(), Mode.STRICT.policy());
        assertThat(seen[0]).isEqualTo(0.25);
        assertThat(out.entities()).extracting(Entity::type).containsExactly(PiiType.NAME);
        Entity name = out.entities().get(0);
        assertThat(name.reason()).contains("lowered-threshold");
        assertThat(name.sources()).containsExactly(Source.AFN);
        assertThat(name.confidence()).isEqualTo(0.30);
    }

    @Test
    void rescanIsSkippedWhenFirstPassDegraded() {
        AtomicInteger calls = new AtomicInteger();
        ContextualRecognizer counting = req -> {
            calls.incrementAndGet();
            return List.of(new ContextualCandidate(PiiType.NAME, 11, 22, 0.80));
        };
        EscalationOutcome out = escalator(counting)
                .escalate("Requerente Maria Silva pediu acesso", List.of(), Mode.STRICT.policy(), false);
        assertThat(calls).hasValue(0);
        assertThat(out.triggered()).isTrue();
        assertThat(out.entities()).isEmpty();
        assertThat(out.contextualDegraded()).isFalse();
    }

    @Nested
    class KeywordRescan {
        private final AntiFalseNegativeEscalator esc = escalator(ContextualRecognizer.none());

        @Test
        void localPhoneAndPartialCpfAfterKeywords() {
            String text = "Meu celular é 99999-8888 e CPF: 123.456.789";
            assertThat(esc.keywordRescan(text, List.of()))
                    .extracting(Entity::type, Entity::start, Entity::end, Entity::validationStatus, Entity::baseConfidence)
                    .containsExactly(
                            tuple(PiiType.PHONE, 14, 24, ValidationStatus.NOT_APPLICABLE,
                                    AntiFalseNegativeEscalator.KEYWORD_PHONE_CONFIDENCE),
                            tuple(PiiType.CPF, 32, 43, ValidationStatus.NOT_APPLICABLE,
                                    AntiFalseNegativeEscalator.KEYWORD_CPF_CONFIDENCE));
        }

        @Test
        void completeCpfMustPassChecksum() {
            assertThat(esc.keywordRescan("CPF: 123.456.789-00", List.of())).isEmpty();
            assertThat(esc.keywordRescan("CPF: 123.456.789-09", List.of()))
                    .extracting(Entity::type, Entity::validationStatus)
                    .containsExactly(tuple(PiiType.CPF, ValidationStatus.VALID));
        }

        @Test
        void occupiedSpansAndRepeatedDigitsAreSkipped() {
            String text = "telefone 99999-8888";
            var existing = Entity.of(PiiType.PHONE, "99999-8888", null, 9, 19, 0.70, ValidationStatus.INVALID,
                            Source.REGEX, "")
                    .withConfidence(0.80);
            assertThat(esc.keywordRescan(text, List.of(existing))).isEmpty();
            assertThat(esc.keywordRescan("fone 11111-1111", List.of())).isEmpty();
        }

        @Test
        void keywordMustStartAWord() {
            assertThat(esc.keywordRescan("microfone 99999-8888", List.of())).isEmpty();
        }

        @Test
        void balancedEscalationAddsTheKeywordPhone() {
            EscalationOutcome out = esc.escalate("Meu celular é 99999-8888", List.of(), Mode.BALANCED.policy());
            assertThat(out.entities()).singleElement().satisfies(e -> {
                assertThat(e.type()).isEqualTo(PiiType.PHONE);
                assertThat(e.sources()).containsExactly(Source.AFN);
                assertThat(e.confidence()).isGreaterThanOrEqualTo(Mode.BALANCED.policy().baseThreshold());
            });
        }
    }

    @Test
    void degradedRescanIsReported() {
        EscalationOutcome out = escalator(ContextualRecognizer.unavailable("model not loaded"))
                .escalate("sem dados", List.of(), Mode.STRICT.policy());
        assertThat(out.contextualDegraded()).isTrue();
        assertThat(out.degradedReason()).isEqualTo("model not loaded");
    }

    @Test
    void countsOnlyNewSpans() {
        var a = Entity.of(PiiType.CPF, "52998224725", null, 0, 11, 0.75, ValidationStatus.VALID, Source.AFN, "");
        var b = Entity.of(PiiType.EMAIL, "a@b.com", null, 20, 27, 0.9, ValidationStatus.VALID, Source.REGEX, "");
        assertThat(AntiFalseNegativeEscalator.countAdded(List.of(b), List.of(a, b))).isEqualTo(1);
    }
}
