/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.PiiType;
import io.lgpd4j.core.api.model.RawCandidate;
import io.lgpd4j.core.api.model.Source;
import io.lgpd4j.core.api.model.ValidationStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Type → validator table. Shared and read-only after construction.
 *
 * <p>Also annotates raw pattern matches: the validation verdict becomes the entity's status and a
 * failed check lowers the base confidence (halved for CPF/CNPJ, a quarter off for the rest).
 */
public final class Validators {
    static final double TAX_ID_INVALID_FACTOR = 0.5;
    static final double OTHER_INVALID_FACTOR = 0.75;

    private static final Validators STANDARD = new Validators(defaultTable());

    private final Map<PiiType, Validator> table;

    public Validators(Map<PiiType, Validator> table) {
        Map<PiiType, Validator> copy = new EnumMap<>(PiiType.class);
        copy.putAll(table);
        this.table = Collections.unmodifiableMap(copy);
    }

    public static Validators standard() {
        return STANDARD;
    }

    private static Map<PiiType, Validator> defaultTable() {
        Map<PiiType, Validator> m = new EnumMap<>(PiiType.class);
        m.put(PiiType.CPF, new CpfValidator());
        m.put(PiiType.CNPJ, new CnpjValidator());
        m.put(PiiType.PHONE, new PhoneValidator());
        m.put(PiiType.CEP, new CepValidator());
        m.put(PiiType.EMAIL, new EmailValidator());
        m.put(PiiType.CREDIT_CARD, new CardValidator());
        m.put(PiiType.VOTER_ID, new VoterIdValidator());
        m.put(PiiType.PIS, new PisValidator());
        return m;
    }

    public Optional<Validator> forType(PiiType type) {
        return Optional.ofNullable(table.get(type));
    }

    /** Empty when the type has no validator (NOT_APPLICABLE). */
    public Optional<ValidationOutcome> validate(PiiType type, String raw) {
        return forType(type).map(v -> v.validate(raw));
    }

    /** Converts a pattern match into an entity carrying its validation verdict. */
    public Entity annotate(RawCandidate c, Source source) {
        Optional<ValidationOutcome> outcome = validate(c.type(), c.rawValue());
        if (outcome.isEmpty()) {
            return Entity.of(
                    c.type(), c.rawValue(), c.rawValue().strip(), c.start(), c.end(), c.baseConfidence(),
                    ValidationStatus.NOT_APPLICABLE, source, "pattern match");
        }
        ValidationOutcome o = outcome.get();
        if (o.valid()) {
            return Entity.of(
                    c.type(), c.rawValue(), o.normalizedValue(), c.start(), c.end(), c.baseConfidence(),
                    ValidationStatus.VALID, source, o.message());
        }
        double factor = c.type().isTaxId() ? TAX_ID_INVALID_FACTOR : OTHER_INVALID_FACTOR;
        return Entity.of(
                c.type(), c.rawValue(), o.normalizedValue(), c.start(), c.end(), c.baseConfidence() * factor,
                ValidationStatus.INVALID, source, o.message());
    }
}
