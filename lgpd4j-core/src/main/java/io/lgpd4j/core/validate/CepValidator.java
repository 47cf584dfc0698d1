/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

import java.util.List;

/** CEP: 8 digits inside one of the postal ranges assigned to a state. */
public final class CepValidator implements Validator {

    private record Range(int from, int to, String region) {
        boolean contains(int cep) {
            return cep >= from && cep <= to;
        }
    }

    private static final List<Range> RANGES = List.of(
            new Range(1000000, 19999999, "SP"),
            new Range(20000000, 28999999, "RJ"),
            new Range(29000000, 29999999, "ES"),
            new Range(30000000, 39999999, "MG"),
            new Range(40000000, 48999999, "BA"),
            new Range(49000000, 49999999, "SE"),
            new Range(50000000, 56999999, "PE"),
            new Range(57000000, 57999999, "AL"),
            new Range(58000000, 58999999, "PB"),
            new Range(59000000, 59999999, "RN"),
            new Range(60000000, 63999999, "CE"),
            new Range(64000000, 64999999, "PI"),
            new Range(65000000, 65999999, "MA"),
            new Range(66000000, 68899999, "PA"),
            new Range(68900000, 68999999, "AP"),
            new Range(69000000, 69299999, "AM"),
            new Range(69300000, 69399999, "RR"),
            new Range(69400000, 69899999, "AM"),
            new Range(69900000, 69999999, "AC"),
            new Range(70000000, 72799999, "DF"),
            new Range(72800000, 72999999, "GO"),
            new Range(73000000, 73699999, "DF"),
            new Range(73700000, 76799999, "GO"),
            new Range(76800000, 76999999, "RO"),
            new Range(77000000, 77999999, "TO"),
            new Range(78000000, 78899999, "MT"),
            new Range(79000000, 79999999, "MS"),
            new Range(80000000, 87999999, "PR"),
            new Range(88000000, 89999999, "SC"),
            new Range(90000000, 99999999, "RS"));

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.length() != 8) return ValidationOutcome.invalid(d, "CEP must have 8 digits, found " + d.length());
        if (Validator.allSameDigit(d)) return ValidationOutcome.invalid(format(d), "CEP with repeated digits");

        int value = Integer.parseInt(d);
        for (Range r : RANGES) {
            if (r.contains(value)) return ValidationOutcome.valid(format(d), "CEP in " + r.region());
        }
        return ValidationOutcome.invalid(format(d), "CEP outside any postal range");
    }

    public static String format(String d) {
        return d.length() == 8 ? d.substring(0, 5) + "-" + d.substring(5) : d;
    }
}
