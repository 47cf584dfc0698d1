/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.preset;

import static io.lgpd4j.core.api.model.RegexAggressiveness.OFF;
import static io.lgpd4j.core.api.model.RegexAggressiveness.ON;
import static io.lgpd4j.core.api.model.RegexAggressiveness.PARTIAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.RegexAggressiveness;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PatternLibraryTest {
    private final PatternLibrary lib = PatternLibrary.standard();

    @Nested
    class Formatted {
        @Test
        void cpf() {
            assertThat(lib.extract("Meu CPF é 123.456.789-09", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue, RawCandidate::start, RawCandidate::end)
                    .containsExactly(tuple(PiiType.CPF, "123.456.789-09", 10, 24));
        }

        @Test
        void cnpjRgAndCard() {
            assertThat(lib.extract("CNPJ 11.222.333/0001-81", OFF))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.CNPJ);
            assertThat(lib.extract("RG 12.345.678-9 e cartão 4111 1111 1111 1111", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(
                            tuple(PiiType.RG, "12.345.678-9"),
                            tuple(PiiType.CREDIT_CARD, "4111 1111 1111 1111"));
        }

        @Test
        void phoneWithCountryCode() {
            assertThat(lib.extract("+55 61 99999-8888", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(tuple(PiiType.PHONE, "+55 61 99999-8888"));
        }

        @Test
        void cnhAfterKeyword() {
            assertThat(lib.extract("CNH: 12345678900", OFF))
                    .extracting(RawCandidate::type, RawCandidate::start, RawCandidate::end)
                    .containsExactly(tuple(PiiType.CNH, 5, 16));
        }
    }

    @Nested
    class OtherDocuments {
        @Test
        void voterIdAfterKeyword() {
            assertThat(lib.extract("Título de eleitor nº 0043 2167 0175", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(tuple(PiiType.VOTER_ID, "0043 2167 0175"));
        }

        @Test
        void spacedVoterIdIsNotCutOutOfACardNumber() {
            assertThat(lib.extract("cartão 4111 1111 1111 1111", PARTIAL))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.CREDIT_CARD);
        }

        @Test
        void pisKeywordAndFormatted() {
            assertThat(lib.extract("NIT 12012345672", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(tuple(PiiType.PIS, "12012345672"));
            assertThat(lib.extract("inscrição 170.05687.32-7", OFF))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.PIS);
        }

        @Test
        void platesByTier() {
            assertThat(lib.extract("veículo ABC1D23", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(tuple(PiiType.VEHICLE_PLATE, "ABC1D23"));
            assertThat(lib.extract("norma ISO-9001", OFF)).isEmpty();
            assertThat(lib.extract("norma ISO-9001", PARTIAL))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.VEHICLE_PLATE);
            assertThat(lib.extract("placa: abc-1234", OFF))
                    .extracting(RawCandidate::rawValue)
                    .containsExactly("abc-1234");
        }

        @Test
        void passportNeedsKeywordUntilPartial() {
            assertThat(lib.extract("Passaporte: FA123456", OFF))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(tuple(PiiType.PASSPORT, "FA123456"));
            assertThat(lib.extract("documento FA123456", OFF)).isEmpty();
            assertThat(lib.extract("documento FA123456", PARTIAL))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.PASSPORT);
        }
    }

    @Nested
    class Tiers {
        private final String text =
                "Contato: joao.silva@email.com, tel (61) 99999-8888, CPF 52998224725, CEP 70000-000";

        @Test
        void offSkipsBareDigitRuns() {
            assertThat(lib.extract(text, OFF))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.EMAIL, PiiType.PHONE, PiiType.CEP);
        }

        @Test
        void partialAddsBareCpfWithOverlappingReadings() {
            List<RawCandidate> out = lib.extract(text, PARTIAL);
            assertThat(out)
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.EMAIL, PiiType.PHONE, PiiType.CPF, PiiType.PHONE, PiiType.CEP);
            assertThat(out.get(2).start()).isEqualTo(out.get(3).start());
        }

        @Test
        void onAddsLocalPhoneAndBareCnh() {
            assertThat(lib.extract(text, ON))
                    .extracting(RawCandidate::type)
                    .contains(PiiType.CNH)
                    .hasSize(7);
        }

        @Test
        void cepKeywordNeedsPartial() {
            assertThat(lib.extract("CEP 70000000", OFF)).isEmpty();
            assertThat(lib.extract("CEP 70000000", PARTIAL))
                    .extracting(RawCandidate::type, RawCandidate::rawValue)
                    .containsExactly(tuple(PiiType.CEP, "70000000"));
        }

        @Test
        void spacedEmailNeedsOn() {
            assertThat(lib.extract("joao @ email.com", PARTIAL)).isEmpty();
            assertThat(lib.extract("joao @ email.com", ON))
                    .extracting(RawCandidate::type)
                    .containsExactly(PiiType.EMAIL);
        }
    }

    @ParameterizedTest
    @EnumSource(RegexAggressiveness.class)
    @DisplayName("masked values never match")
    void maskedValuesAreIgnored(RegexAggressiveness level) {
        assertThat(lib.extract("CPF: ***.456.789-**", level)).isEmpty();
        assertThat(lib.extract("cartão #### #### #### 1111", level)).isEmpty();
    }

    @Test
    void digitsGluedToLettersAreNotMatched() {
        assertThat(lib.extract("protocolo ABC52998224725XYZ", ON)).isEmpty();
    }

    @Test
    void outputIsOrderedAndDeterministic() {
        String text = "CNPJ 11.222.333/0001-81, CPF 123.456.789-09, e-mail ana@x.com.br";
        List<RawCandidate> a = lib.extract(text, ON);
        assertThat(a).isEqualTo(lib.extract(text, ON));
        assertThat(a).extracting(RawCandidate::start).isSorted();
    }

    @Test
    void emptyInput() {
        assertThat(lib.extract("", ON)).isEmpty();
        assertThat(lib.extract(null, ON)).isEmpty();
    }

    @Test
    void longAdversarialInputStaysFast() {
        String digits = "1".repeat(50_000);
        String letters = "a".repeat(50_000) + "@";
        Assertions.assertTimeout(Duration.ofSeconds(10), () -> {
            lib.extract(digits, ON);
            lib.extract(letters, ON);
        });
    }

    @Test
    void rejectsDuplicateDetectors() {
        assertThatThrownBy(() -> new PatternLibrary(List.of(BuiltInPatterns.cpf(), BuiltInPatterns.cpf())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CPF");
    }
}
