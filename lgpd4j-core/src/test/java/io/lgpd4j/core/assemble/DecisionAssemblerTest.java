/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.assemble;

import static org.assertj.core.api.Assertions.assertThat;

import io.lgpd4j.core.api.model.Classification;
import io.lgpd4j.core.api.model.DetectionMetadata;
import io.lgpd4j.core.api.model.DetectionResult;
import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.Mode;
import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import java.util.List;
import org.junit.jupiter.api.Test;

class DecisionAssemblerTest {
    private final DecisionAssembler assembler = new DecisionAssembler();
    private final DetectionMetadata meta = DetectionMetadata.empty(40);

    private static Entity cpf(String raw, double c, ValidationStatus st) {
        return Entity.of(PiiType.CPF, raw, null, 0, raw.length(), c, st, Source.REGEX, "");
    }

    @Test
    void emptyIsPublic() {
        DetectionResult r = assembler.assemble(List.of(), Mode.BALANCED.policy(), meta);
        assertThat(r.hasPii()).isFalse();
        assertThat(r.classification()).isEqualTo(Classification.PUBLIC);
        assertThat(r.aggregateConfidence()).isZero();
        assertThat(r.mode()).isEqualTo("balanced");
    }

    @Test
    void dropsBelowThresholdAndReportsMaxConfidence() {
        var hi = Entity.of(PiiType.EMAIL, "a@b.com", null, 20, 27, 0.90, ValidationStatus.VALID, Source.REGEX, "");
        var mid = Entity.of(PiiType.RG, "12.345.678-9", null, 0, 12, 0.75, ValidationStatus.NOT_APPLICABLE,
                Source.REGEX, "");
        var lo = Entity.of(PiiType.PHONE, "9999-8888", null, 30, 39, 0.52, ValidationStatus.INVALID, Source.REGEX, "");
        DetectionResult r = assembler.assemble(List.of(hi, mid, lo), Mode.BALANCED.policy(), meta);
        assertThat(r.entities()).containsExactly(mid, hi);
        assertThat(r.aggregateConfidence()).isEqualTo(0.90);
        assertThat(r.classification()).isEqualTo(Classification.NON_PUBLIC);
    }

    @Test
    void invalidChecksumRetainedOnlyWhenPolicyAcceptsIt() {
        var bad = cpf("123.456.789-00", 0.48, ValidationStatus.INVALID);
        assertThat(DecisionAssembler.retains(bad, Mode.STRICT.policy())).isTrue();
        assertThat(DecisionAssembler.retains(bad, Mode.BALANCED.policy())).isFalse();
    }

    @Test
    void repeatedDigitsAreNotStructurallyCorrect() {
        var repeated = cpf("111.111.111-11", 0.48, ValidationStatus.INVALID);
        assertThat(DecisionAssembler.retains(repeated, Mode.STRICT.policy())).isFalse();
    }

    @Test
    void nonTaxIdsNeverGetTheChecksumException() {
        var phone = Entity.of(PiiType.PHONE, "99999-8888", null, 0, 10, 0.2, ValidationStatus.INVALID, Source.REGEX, "");
        assertThat(DecisionAssembler.retains(phone, Mode.STRICT.policy())).isFalse();
    }

    @Test
    void rescanAdmissionsKeptDownToTheReducedThreshold() {
        var name = Entity.of(PiiType.NAME, "Maria Silva", null, 11, 22, 0.30, ValidationStatus.NOT_APPLICABLE,
                Source.AFN, "lowered-threshold contextual rescan");
        assertThat(DecisionAssembler.retains(name, Mode.STRICT.policy())).isTrue();
        assertThat(DecisionAssembler.retains(name.withConfidence(0.20), Mode.STRICT.policy())).isFalse();
        assertThat(DecisionAssembler.retains(name, Mode.BALANCED.policy())).isFalse();

        var firstPass = Entity.of(PiiType.NAME, "Maria Silva", null, 11, 22, 0.30, ValidationStatus.NOT_APPLICABLE,
                Source.CONTEXTUAL, "contextual recognizer");
        assertThat(DecisionAssembler.retains(firstPass, Mode.STRICT.policy())).isFalse();
    }
}
