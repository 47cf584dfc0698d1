/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CpfValidatorTest {
    private final CpfValidator v = new CpfValidator();

    @ParameterizedTest
    @ValueSource(strings = {"123.456.789-09", "529.982.247-25", "11144477735", "390.533.447-05", "000.000.001-91"})
    void acceptsValidCheckDigits(String cpf) {
        var out = v.validate(cpf);
        assertThat(out.valid()).isTrue();
        assertThat(out.normalizedValue()).matches("\\d{3}\\.\\d{3}\\.\\d{3}-\\d{2}");
    }

    @ParameterizedTest
    @ValueSource(strings = {"123.456.789-00", "529.982.247-26", "111.111.111-11", "000.000.000-00", "1234567890", ""})
    void rejectsBadCheckDigitsRepeatedDigitsAndWrongLength(String cpf) {
        assertThat(v.validate(cpf).valid()).isFalse();
    }

    @Test
    void normalizesBareDigits() {
        assertThat(v.validate("52998224725").normalizedValue()).isEqualTo("529.982.247-25");
    }

    @Test
    void neverThrowsOnGarbage() {
        assertThat(v.validate(null).valid()).isFalse();
        assertThat(v.validate("abc.def.ghi-jk").valid()).isFalse();
    }

    @Test
    @DisplayName("agrees with a straightforward mod-11 reference on random bodies")
    void matchesReferenceAlgorithm() {
        Random rnd = new Random(20251019L);
        for (int n = 0; n < 500; n++) {
            int[] d = new int[11];
            for (int i = 0; i < 9; i++) d[i] = rnd.nextInt(10);
            d[9] = reference(d, 9);
            d[10] = reference(d, 10);
            StringBuilder sb = new StringBuilder();
            for (int x : d) sb.append(x);
            String cpf = sb.toString();
            if (Validator.allSameDigit(cpf)) continue;

            assertThat(v.validate(cpf).valid()).as(cpf).isTrue();
            String broken = cpf.substring(0, 10) + ((d[10] + 1) % 10);
            assertThat(v.validate(broken).valid()).as(broken).isFalse();
        }
    }

    private static int reference(int[] d, int count) {
        int sum = 0;
        for (int i = 0; i < count; i++) sum += d[i] * (count + 1 - i);
        int r = sum % 11;
        return r < 2 ? 0 : 11 - r;
    }
}
