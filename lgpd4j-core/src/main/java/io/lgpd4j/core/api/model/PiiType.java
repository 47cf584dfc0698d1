/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.api.model;

/**
 * Fixed set of personal-data categories. Declaration order is the tie-break order used when two
 * pattern candidates start at the same offset.
 */
public enum PiiType {
    CPF(Origin.PATTERN, true), // Cadastro de Pessoas Físicas, mod-11
    CNPJ(Origin.PATTERN, true), // Cadastro Nacional da Pessoa Jurídica, mod-11
    PHONE(Origin.PATTERN, true), // DDD + 8/9 digits
    EMAIL(Origin.PATTERN, false),
    CEP(Origin.PATTERN, true), // postal code
    RG(Origin.PATTERN, false),
    CNH(Origin.PATTERN, false), // driver licence
    CREDIT_CARD(Origin.PATTERN, false), // Luhn
    VOTER_ID(Origin.PATTERN, false), // título de eleitor, 12 digits
    PIS(Origin.PATTERN, false), // PIS/PASEP/NIT, mod-11
    VEHICLE_PLATE(Origin.PATTERN, false), // AAA-1234 or Mercosul AAA1A23
    PASSPORT(Origin.PATTERN, false),
    NAME(Origin.CONTEXTUAL, false),
    ADDRESS(Origin.CONTEXTUAL, false),
    BIRTH_DATE(Origin.CONTEXTUAL, false),
    ORG(Origin.CONTEXTUAL, false);

    /** Which stage is allowed to produce the type. */
    public enum Origin {
        PATTERN,
        CONTEXTUAL
    }

    private final Origin origin;
    private final boolean validationBonus;

    PiiType(Origin origin, boolean validationBonus) {
        this.origin = origin;
        this.validationBonus = validationBonus;
    }

    public Origin origin() {
        return origin;
    }

    public boolean isContextual() {
        return origin == Origin.CONTEXTUAL;
    }

    /** Types whose successful validation earns a scoring bonus. */
    public boolean hasValidationBonus() {
        return validationBonus;
    }

    /** Taxpayer ids; the only types kept on a failed checksum when the policy allows it. */
    public boolean isTaxId() {
        return this == CPF || this == CNPJ;
    }
}
