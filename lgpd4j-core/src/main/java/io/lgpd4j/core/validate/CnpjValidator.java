/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

/** CNPJ: 14 digits with two mod-11 check digits over fixed weight sequences. */
public final class CnpjValidator implements Validator {
    private static final int[] WEIGHTS_FIRST = {5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] WEIGHTS_SECOND = {6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.length() != 14) return ValidationOutcome.invalid(d, "CNPJ must have 14 digits, found " + d.length());
        if (Validator.allSameDigit(d)) return ValidationOutcome.invalid(d, "CNPJ with repeated digits");

        int first = checkDigit(d, WEIGHTS_FIRST);
        int second = checkDigit(d, WEIGHTS_SECOND);
        if (first != d.charAt(12) - '0' || second != d.charAt(13) - '0') {
            return ValidationOutcome.invalid(format(d), "CNPJ check digits do not match");
        }
        return ValidationOutcome.valid(format(d), "CNPJ check digits match");
    }

    private static int checkDigit(String d, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) sum += (d.charAt(i) - '0') * weights[i];
        int rem = sum % 11;
        return rem < 2 ? 0 : 11 - rem;
    }

    /** Formats 14 digits as dd.ddd.ddd/dddd-dd. */
    public static String format(String d) {
        if (d.length() != 14) return d;
        return d.substring(0, 2) + "." + d.substring(2, 5) + "." + d.substring(5, 8) + "/" + d.substring(8, 12) + "-"
                + d.substring(12);
    }
}
