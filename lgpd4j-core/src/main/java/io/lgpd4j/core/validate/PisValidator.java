/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

/** PIS/PASEP/NIT: 11 digits, the last one a mod-11 check digit over weights 3,2,9..2. */
public final class PisValidator implements Validator {
    private static final int[] WEIGHTS = {3, 2, 9, 8, 7, 6, 5, 4, 3, 2};

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.length() != 11) return ValidationOutcome.invalid(d, "PIS must have 11 digits, found " + d.length());
        if (Validator.allSameDigit(d)) return ValidationOutcome.invalid(d, "PIS with repeated digits");

        int sum = 0;
        for (int i = 0; i < WEIGHTS.length; i++) sum += (d.charAt(i) - '0') * WEIGHTS[i];
        int check = 11 - sum % 11;
        if (check >= 10) check = 0;
        if (check != d.charAt(10) - '0') return ValidationOutcome.invalid(format(d), "PIS check digit does not match");
        return ValidationOutcome.valid(format(d), "PIS check digit matches");
    }

    /** Formats 11 digits as ddd.ddddd.dd-d. */
    public static String format(String d) {
        if (d.length() != 11) return d;
        return d.substring(0, 3) + "." + d.substring(3, 8) + "." + d.substring(8, 10) + "-" + d.substring(10);
    }
}
