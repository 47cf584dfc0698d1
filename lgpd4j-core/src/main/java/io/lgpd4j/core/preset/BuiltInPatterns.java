/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.preset;

import static io.lgpd4j.core.api.model.RegexAggressiveness.OFF;
import static io.lgpd4j.core.api.model.RegexAggressiveness.ON;
import static io.lgpd4j.core.api.model.RegexAggressiveness.PARTIAL;
import static io.lgpd4j.core.detect.PatternRule.LEFT;
import static io.lgpd4j.core.detect.PatternRule.RIGHT;

import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.detect.CreditCardDetector;
import io.lgpd4j.core.detect.Detector;
import io.lgpd4j.core.detect.PatternRule;
import io.lgpd4j.core.detect.RegexDetector;
import java.util.List;

/**
 * Built-in Brazilian identifier patterns. Quantifiers are bounded everywhere so matching stays
 * linear in the input length.
 *
 * <p>Values in the keyword-anchored rules (CEP, RG, CNH, voter id, PIS, plate, passport) are capture
 * group 1; the keyword itself is not part of the span.
 */
public final class BuiltInPatterns {
    private BuiltInPatterns() {}

    /** Optional "nº"/"no." between a keyword and its value. */
    private static final String NUMERO = "(?:n[ºo°]\\.?[ ]?)?";
    private static final String KEY_SEP = "[ \\t]{0,3}[:\\-]?[ \\t]{0,3}";

    public static Detector cpf() {
        return new RegexDetector(PiiType.CPF, List.of(
                PatternRule.of("cpf-formatted", LEFT + "(\\d{3}\\.\\d{3}\\.\\d{3}[-./]\\d{2})" + RIGHT, 0.90, OFF),
                PatternRule.of("cpf-bare", LEFT + "(\\d{11})" + RIGHT, 0.85, PARTIAL),
                PatternRule.of("cpf-dash", LEFT + "(\\d{9}-\\d{2})" + RIGHT, 0.85, PARTIAL),
                PatternRule.of("cpf-spaced", LEFT + "(\\d{3} \\d{3} \\d{3}[ -]\\d{2})" + RIGHT, 0.85, PARTIAL)));
    }

    public static Detector cnpj() {
        return new RegexDetector(PiiType.CNPJ, List.of(
                PatternRule.of(
                        "cnpj-formatted", LEFT + "(\\d{2}\\.\\d{3}\\.\\d{3}/\\d{4}[-.]\\d{2})" + RIGHT, 0.90, OFF),
                PatternRule.of("cnpj-bare", LEFT + "(\\d{14})" + RIGHT, 0.85, PARTIAL),
                PatternRule.of("cnpj-slash", LEFT + "(\\d{8}/\\d{4}-\\d{2})" + RIGHT, 0.85, PARTIAL)));
    }

    public static Detector phone() {
        return new RegexDetector(PiiType.PHONE, List.of(
                PatternRule.of(
                        "phone-parenthesized",
                        "(?<![\\p{L}\\d*#\\u2022+])((?:\\+55[ ]?)?\\(\\d{2}\\)[ ]?9?\\d{4}[-. ]?\\d{4})" + RIGHT,
                        0.90,
                        OFF),
                PatternRule.of(
                        "phone-ddd",
                        "(?<![\\p{L}\\d*#\\u2022+])((?:\\+55[ ]?)?\\d{2}[ ]9?\\d{4}[- ]\\d{4})" + RIGHT,
                        0.90,
                        OFF),
                PatternRule.of("phone-bare", LEFT + "(\\d{2}9?\\d{8})" + RIGHT, 0.80, PARTIAL),
                PatternRule.of("phone-local", LEFT + "(9?\\d{4}-\\d{4})" + RIGHT, 0.70, ON)));
    }

    public static Detector email() {
        return new RegexDetector(PiiType.EMAIL, List.of(
                PatternRule.caseInsensitive(
                        "email",
                        "(?<![a-z0-9._%+\\-*#\\u2022])([a-z0-9._%+-]{1,64}@[a-z0-9-]{1,63}(?:\\.[a-z0-9-]{1,63}){0,8}"
                                + "\\.[a-z]{2,24})(?![a-z0-9\\-*#\\u2022])",
                        0.90,
                        OFF),
                PatternRule.caseInsensitive(
                        "email-spaced",
                        "(?<![a-z0-9._%+\\-*#\\u2022])([a-z0-9._%+-]{1,64}[ ]{1,2}@[ ]{0,2}[a-z0-9-]{1,63}"
                                + "(?:\\.[a-z0-9-]{1,63}){0,8}\\.[a-z]{2,24}|[a-z0-9._%+-]{1,64}@[ ]{1,2}"
                                + "[a-z0-9-]{1,63}(?:\\.[a-z0-9-]{1,63}){0,8}\\.[a-z]{2,24})(?![a-z0-9\\-*#\\u2022])",
                        0.75,
                        ON)));
    }

    public static Detector cep() {
        return new RegexDetector(PiiType.CEP, List.of(
                PatternRule.of("cep-formatted", LEFT + "(\\d{5}-\\d{3})" + RIGHT, 0.90, OFF),
                PatternRule.of("cep-dotted", LEFT + "(\\d{2}\\.\\d{3}-\\d{3})" + RIGHT, 0.85, OFF),
                PatternRule.caseInsensitive("cep-keyword", "\\bcep" + KEY_SEP + "(\\d{8})" + RIGHT, 0.85, PARTIAL)));
    }

    public static Detector rg() {
        return new RegexDetector(PiiType.RG, List.of(
                PatternRule.of("rg-dotted", LEFT + "(\\d{1,2}\\.\\d{3}\\.\\d{3}-?[\\dxX])" + RIGHT, 0.85, OFF),
                PatternRule.caseInsensitive(
                        "rg-keyword",
                        "\\b(?:rg|identidade)" + KEY_SEP + NUMERO + "(\\d{5,9}-?[\\dx]?)" + RIGHT,
                        0.80,
                        PARTIAL)));
    }

    public static Detector cnh() {
        return new RegexDetector(PiiType.CNH, List.of(
                PatternRule.caseInsensitive(
                        "cnh-keyword", "\\bcnh" + KEY_SEP + NUMERO + "(\\d{11})" + RIGHT, 0.90, OFF),
                PatternRule.of("cnh-formatted", LEFT + "(\\d{4} \\d{3} \\d{4})" + RIGHT, 0.70, PARTIAL),
                // below an invalid bare CPF (0.425) so the CPF reading wins the tie
                PatternRule.of("cnh-bare", LEFT + "(\\d{11})" + RIGHT, 0.40, ON)));
    }

    public static Detector creditCard() {
        return new CreditCardDetector();
    }

    public static Detector voterId() {
        // a fourth group right after the value belongs to a longer number (card, bank account)
        String right = RIGHT + "(?![ ]\\d)";
        return new RegexDetector(PiiType.VOTER_ID, List.of(
                PatternRule.caseInsensitive(
                        "voter-keyword",
                        "\\bt[íi]tulo(?: de)? eleitor(?:al)?" + KEY_SEP + NUMERO + "(\\d{4}[ ]?\\d{4}[ ]?\\d{4})" + right,
                        0.85,
                        OFF),
                PatternRule.of("voter-spaced", "(?<!\\d[ ])" + LEFT + "(\\d{4} \\d{4} \\d{4})" + right, 0.65, PARTIAL),
                PatternRule.of("voter-bare", LEFT + "(\\d{12})" + RIGHT, 0.60, ON)));
    }

    public static Detector pis() {
        return new RegexDetector(PiiType.PIS, List.of(
                PatternRule.caseInsensitive(
                        "pis-keyword",
                        "\\b(?:pis(?:/pasep)?|pasep|nit)" + KEY_SEP + NUMERO + "(\\d{3}\\.?\\d{5}\\.?\\d{2}-?\\d)" + RIGHT,
                        0.85,
                        OFF),
                PatternRule.of("pis-formatted", LEFT + "(\\d{3}\\.\\d{5}\\.\\d{2}-\\d)" + RIGHT, 0.80, OFF)));
    }

    public static Detector vehiclePlate() {
        return new RegexDetector(PiiType.VEHICLE_PLATE, List.of(
                PatternRule.caseInsensitive(
                        "plate-keyword",
                        "\\bplaca" + KEY_SEP + "([a-z]{3}-?\\d[a-z\\d]\\d{2})" + RIGHT,
                        0.90,
                        OFF),
                PatternRule.of("plate-mercosul", LEFT + "([A-Z]{3}-?\\d[A-Z]\\d{2})" + RIGHT, 0.85, OFF),
                // standards and model codes look like old plates (ISO-9001), hence the lower tiers
                PatternRule.of("plate-old", LEFT + "([A-Z]{3}-\\d{4})" + RIGHT, 0.75, PARTIAL),
                PatternRule.of("plate-old-bare", LEFT + "([A-Z]{3}\\d{4})" + RIGHT, 0.60, ON)));
    }

    public static Detector passport() {
        return new RegexDetector(PiiType.PASSPORT, List.of(
                PatternRule.caseInsensitive(
                        "passport-keyword", "\\bpassaporte" + KEY_SEP + NUMERO + "([a-z]{2}\\d{6})" + RIGHT, 0.85, OFF),
                PatternRule.of("passport-bare", LEFT + "([A-Z]{2}\\d{6})" + RIGHT, 0.70, PARTIAL)));
    }

    /** One detector per pattern type, in type declaration order. */
    public static List<Detector> all() {
        return List.of(
                cpf(), cnpj(), phone(), email(), cep(), rg(), cnh(), creditCard(), voterId(), pis(), vehiclePlate(),
                passport());
    }
}
