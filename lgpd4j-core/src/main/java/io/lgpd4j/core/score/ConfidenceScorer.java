/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.score;

import io.lgpd4j.core.api.model.Entity;
import io.lgpd4j.core.api.model.ValidationStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Additive confidence adjustment. Always starts from {@link Entity#baseConfidence()}, so scoring
 * an already scored entity gives the same result.
 */
public final class ConfidenceScorer {
    public static final double VALIDATION_BONUS = 0.05;
    public static final double KEYWORD_BONUS = 0.03;
    public static final double CORROBORATION_BONUS = 0.02;

    /** Lowercase indicator words; matched as substrings. */
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "cpf", "cnpj", "documento", "nascimento", "nascid", "endereço", "endereco", "residente", "telefone",
            "celular", "fone", "whatsapp", "nome", "e-mail", "email", "cep", "rg", "identidade", "cnh",
            "cartão", "cartao", "rua", "avenida", "pasep", "eleitor", "placa", "passaporte");

    private static final ConfidenceScorer STANDARD = new ConfidenceScorer(DEFAULT_KEYWORDS);

    private final List<String> keywords;

    public ConfidenceScorer(List<String> keywords) {
        List<String> lower = new ArrayList<>(keywords.size());
        for (String k : keywords) {
            if (k == null || k.isBlank()) throw new IllegalArgumentException("Blank keyword");
            lower.add(k.toLowerCase(Locale.ROOT));
        }
        this.keywords = List.copyOf(lower);
    }

    public static ConfidenceScorer standard() {
        return STANDARD;
    }

    public Entity score(Entity e, String text, int window) {
        double c = e.baseConfidence();
        if (e.validationStatus() == ValidationStatus.VALID && e.type().hasValidationBonus()) c += VALIDATION_BONUS;
        if (keywordNear(e, text, window)) c += KEYWORD_BONUS;
        if (e.isCorroborated()) c += CORROBORATION_BONUS;
        return e.withConfidence(Math.min(1.0, c));
    }

    public List<Entity> scoreAll(List<Entity> entities, String text, int window) {
        List<Entity> out = new ArrayList<>(entities.size());
        for (Entity e : entities) out.add(score(e, text, window));
        return List.copyOf(out);
    }

    /** Looks at up to {@code window} chars on each side; the span itself is not searched. */
    public boolean keywordNear(Entity e, String text, int window) {
        int from = Math.max(0, e.start() - window);
        int to = Math.min(text.length(), e.end() + window);
        if (e.start() > text.length()) return false;
        String before = text.substring(from, Math.min(e.start(), text.length())).toLowerCase(Locale.ROOT);
        String after = e.end() < to ? text.substring(e.end(), to).toLowerCase(Locale.ROOT) : "";
        for (String k : keywords) {
            if (before.contains(k) || after.contains(k)) return true;
        }
        return false;
    }
}
