/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

/** Card numbers: 13–19 digits validated via Luhn. */
public final class CardValidator implements Validator {

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.length() < 13 || d.length() > 19) {
            return ValidationOutcome.invalid(d, "Card numbers have 13 to 19 digits, found " + d.length());
        }
        if (!luhn(d)) return ValidationOutcome.invalid(d, "Luhn check failed");
        return ValidationOutcome.valid(d, "Luhn check passed");
    }

    static boolean luhn(String s) {
        int sum = 0;
        boolean dbl = false;
        for (int i = s.length() - 1; i >= 0; i--) {
            int d = s.charAt(i) - '0';
            if (dbl) {
                d += d;
                if (d > 9) d -= 9;
            }
            sum += d;
            dbl = !dbl;
        }
        return sum % 10 == 0;
    }
}
