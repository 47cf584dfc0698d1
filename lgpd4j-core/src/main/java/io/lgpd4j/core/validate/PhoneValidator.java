/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

import java.util.Set;

/**
 * Brazilian phone numbers: optional +55, a DDD (area code) from the national plan, then 8 digits
 * (landline) or 9 digits starting with 9 (mobile).
 */
public final class PhoneValidator implements Validator {

    // Area codes in use (Anatel); every entry lies in [11,99]
    private static final Set<Integer> DDD = Set.of(
            11, 12, 13, 14, 15, 16, 17, 18, 19,
            21, 22, 24, 27, 28,
            31, 32, 33, 34, 35, 37, 38,
            41, 42, 43, 44, 45, 46, 47, 48, 49,
            51, 53, 54, 55,
            61, 62, 63, 64, 65, 66, 67, 68, 69,
            71, 73, 74, 75, 77, 79,
            81, 82, 83, 84, 85, 86, 87, 88, 89,
            91, 92, 93, 94, 95, 96, 97, 98, 99);

    @Override
    public ValidationOutcome validate(String raw) {
        String d = Validator.digits(raw);
        if (d.startsWith("55") && d.length() > 11) d = d.substring(2);
        if (d.length() != 10 && d.length() != 11) {
            return ValidationOutcome.invalid(d, "Phone must have 10 or 11 digits with DDD, found " + d.length());
        }
        int ddd = Integer.parseInt(d.substring(0, 2));
        if (!DDD.contains(ddd)) return ValidationOutcome.invalid(d, "Unknown DDD " + ddd);

        String local = d.substring(2);
        if (local.length() == 9 && local.charAt(0) != '9') {
            return ValidationOutcome.invalid(d, "Mobile numbers must start with 9");
        }
        if (Validator.allSameDigit(local)) return ValidationOutcome.invalid(d, "Phone with repeated digits");
        return ValidationOutcome.valid(d, (local.length() == 9 ? "Mobile" : "Landline") + " with DDD " + ddd);
    }

    public static boolean isKnownDdd(int ddd) {
        return DDD.contains(ddd);
    }
}
