/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

/**
 * CPF: 11 digits, the last two are mod-11 check digits over weights 10..2 and 11..2. A remainder
 * below 2 maps to 0, otherwise to {@code 11 - remainder}.
 */
public final class CpfValidator implements Validator {

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.length() != 11) return ValidationOutcome.invalid(d, "CPF must have 11 digits, found " + d.length());
        if (Validator.allSameDigit(d)) return ValidationOutcome.invalid(d, "CPF with repeated digits");

        int first = checkDigit(d, 9, 10);
        int second = checkDigit(d, 10, 11);
        if (first != d.charAt(9) - '0' || second != d.charAt(10) - '0') {
            return ValidationOutcome.invalid(format(d), "CPF check digits do not match");
        }
        return ValidationOutcome.valid(format(d), "CPF check digits match");
    }

    /** Check digit over the first {@code count} digits with weights starting at {@code firstWeight}. */
    static int checkDigit(String digits, int count, int firstWeight) {
        int sum = 0;
        for (int i = 0; i < count; i++) {
            sum += (digits.charAt(i) - '0') * (firstWeight - i);
        }
        int rem = sum % 11;
        return rem < 2 ? 0 : 11 - rem;
    }

    /** Formats 11 digits as ddd.ddd.ddd-dd. */
    public static String format(String d) {
        if (d.length() != 11) return d;
        return d.substring(0, 3) + "." + d.substring(3, 6) + "." + d.substring(6, 9) + "-" + d.substring(9);
    }
}
