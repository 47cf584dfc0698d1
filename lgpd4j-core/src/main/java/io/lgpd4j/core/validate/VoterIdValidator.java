/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

/**
 * Título de eleitor: 8-digit sequence, 2-digit state code (01 to 28) and two mod-11 check digits.
 * The first check digit covers the sequence, the second covers the state code and the first digit.
 */
public final class VoterIdValidator implements Validator {
    private static final int MAX_STATE = 28;

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.length() != 12) {
            return ValidationOutcome.invalid(d, "Voter id must have 12 digits, found " + d.length());
        }
        if (Validator.allSameDigit(d)) return ValidationOutcome.invalid(d, "Voter id with repeated digits");

        int state = Integer.parseInt(d.substring(8, 10));
        if (state < 1 || state > MAX_STATE) {
            return ValidationOutcome.invalid(format(d), "Unknown voter id state code " + d.substring(8, 10));
        }
        // SP (01) and MG (02) turn a zero remainder into 1
        boolean spOrMg = state <= 2;

        int sum = 0;
        for (int i = 0; i < 8; i++) sum += (d.charAt(i) - '0') * (i + 2);
        int first = checkDigit(sum % 11, spOrMg);
        int second = checkDigit(((d.charAt(8) - '0') * 7 + (d.charAt(9) - '0') * 8 + first * 9) % 11, spOrMg);
        if (first != d.charAt(10) - '0' || second != d.charAt(11) - '0') {
            return ValidationOutcome.invalid(format(d), "Voter id check digits do not match");
        }
        return ValidationOutcome.valid(format(d), "Voter id check digits match");
    }

    private static int checkDigit(int rem, boolean spOrMg) {
        if (rem == 10) return 0;
        if (rem == 0 && spOrMg) return 1;
        return rem;
    }

    /** Formats 12 digits as dddd dddd dddd. */
    public static String format(String d) {
        if (d.length() != 12) return d;
        return d.substring(0, 4) + " " + d.substring(4, 8) + " " + d.substring(8);
    }
}
