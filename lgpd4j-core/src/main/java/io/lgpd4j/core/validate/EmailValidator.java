/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.validate;

import java.util.Locale;
import java.util.regex.Pattern;

/** Structural e-mail check (local@domain.tld). No DNS or mailbox verification. */
public final class EmailValidator implements Validator {
    private static final Pattern SHAPE =
            Pattern.compile("[a-z0-9._%+-]{1,64}@[a-z0-9-]{1,63}(?:\\.[a-z0-9-]{1,63}){0,8}\\.[a-z]{2,24}");

    @Override
    public ValidationOutcome validate(String raw) {
        if (raw == null) return ValidationOutcome.invalid("", "Empty e-mail");
        // spaced variants ("joao @ mail . com") collapse to the plain form
        String e = raw.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        int at = e.lastIndexOf('@');
        if (at <= 0 || at != e.indexOf('@')) return ValidationOutcome.invalid(e, "E-mail needs exactly one @");
        String domain = e.substring(at + 1);
        if (domain.length() > 255) return ValidationOutcome.invalid(e, "E-mail domain too long");
        if (domain.startsWith(".") || domain.contains("..")) return ValidationOutcome.invalid(e, "Malformed domain");
        if (!SHAPE.matcher(e).matches()) return ValidationOutcome.invalid(e, "Malformed e-mail");
        return ValidationOutcome.valid(e, "E-mail shape is valid");
    }
}
