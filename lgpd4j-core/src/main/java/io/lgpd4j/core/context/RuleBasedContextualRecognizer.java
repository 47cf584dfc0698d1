/*
 * Copyright (c) 2025 Lgpd4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.lgpd4j.core.context;

import io.lgpd4j.core.api.model.ContextualCandidate;
import io.lgpd4j.core.api.model.PiiType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-free recognizer built from keyword-anchored Portuguese phrases. Useful as a default when no
 * NER backend is wired, and as a deterministic stand-in in tests.
 *
 * <ul>
 *   <li>NAME: capitalised words after an honorific or "meu nome é", "solicitante", ...; or a common
 *       first name followed by a surname</li>
 *   <li>ADDRESS: street word (rua, avenida, ...) up to the house number</li>
 *   <li>BIRTH_DATE: a date near "nascimento", "nascido(a)", "nasci"</li>
 *   <li>ORG: capitalised words ending in a company suffix (Ltda, S.A., ME, EIRELI)</li>
 * </ul>
 */
public final class RuleBasedContextualRecognizer implements ContextualRecognizer {
    private static final String CAP_WORD = "\\p{Lu}[\\p{Ll}'\\-]{1,20}";
    private static final String FULL_NAME =
            CAP_WORD + "(?:[ ]{1,2}(?:(?:da|de|do|das|dos|e)[ ]{1,2})?" + CAP_WORD + "){0,5}";
    private static final String FIRST_NAMES = "Maria|José|Jose|João|Joao|Ana|Antônio|Antonio|Francisco|Carlos|Paulo"
            + "|Pedro|Lucas|Luiz|Luis|Marcos|Gabriel|Rafael|Daniel|Marcelo|Bruno|Eduardo|Felipe|Rodrigo|Juliana"
            + "|Fernanda|Patrícia|Patricia|Aline|Camila|Amanda|Bruna|Jéssica|Jessica|Letícia|Leticia|Beatriz"
            + "|Larissa|Mariana|Gabriela|Adriana|Márcia|Marcia|Sandra|Luciana|Vanessa|Fernando|Ricardo|Roberto";

    private static final List<Rule> RULES = List.of(
            new Rule(PiiType.NAME, Pattern.compile(
                    "(?iu:\\b(?:sr\\.?|sra\\.?|srta\\.?|senhor|senhora|dr\\.?|dra\\.?|meu nome é|meu nome e|me chamo"
                            + "|solicitante|requerente|interessad[oa]|servidor[a]?|cidadã[o]?)[:,]?[ ]{1,3})("
                            + FULL_NAME + ")"), 0.85),
            new Rule(PiiType.NAME, Pattern.compile(
                    "(?<![\\p{L}])((?:" + FIRST_NAMES + ")(?:[ ]{1,2}(?:(?:da|de|do|das|dos|e)[ ]{1,2})?"
                            + CAP_WORD + "){1,5})"), 0.75),
            new Rule(PiiType.ADDRESS, Pattern.compile(
                    "(?iu)\\b((?:rua|r\\.|avenida|av\\.|travessa|alameda|estrada|rodovia|praça|praca|largo)"
                            + "[ ]{1,3}[\\p{L}\\d .'\\-]{2,60}?,?[ ]{0,2}(?:n[ºo°]\\.?[ ]{0,2})?\\d{1,6})(?!\\d)"),
                    0.80),
            new Rule(PiiType.BIRTH_DATE, Pattern.compile(
                    "(?iu:(?:nascid[oa]|nascimento|nasci|data de nasc\\.?)[^\\d\\n]{0,20})"
                            + "(\\d{1,2}/\\d{1,2}/\\d{2,4}|\\d{1,2}[ ]de[ ]\\p{L}{3,9}[ ]de[ ]\\d{4})(?!\\d)"),
                    0.75),
            new Rule(PiiType.ORG, Pattern.compile(
                    "((?:\\p{Lu}[\\p{L}&]{1,30}[ ]){1,5}(?:Ltda|LTDA|S\\.A\\.|S/A|ME|EIRELI)\\.?)(?![\\p{L}])"),
                    0.70));

    private record Rule(PiiType type, Pattern pattern, double confidence) {}

    @Override
    public List<ContextualCandidate> recognize(ContextualRequest request) {
        String text = request.text();
        if (text.length() > request.maxLength()) text = ContextualGateway.truncate(text, request.maxLength());
        List<ContextualCandidate> out = new ArrayList<>();
        for (Rule r : RULES) {
            if (r.confidence() < request.minConfidence()) continue;
            Matcher m = r.pattern().matcher(text);
            while (m.find()) {
                int s = m.start(1);
                int e = trimTrailing(text, s, m.end(1));
                if (e > s) out.add(new ContextualCandidate(r.type(), s, e, r.confidence()));
            }
        }
        out.sort(Comparator.comparingInt(ContextualCandidate::start)
                .thenComparing(Comparator.comparingInt(ContextualCandidate::end).reversed()));
        return List.copyOf(out);
    }

    private static int trimTrailing(String text, int start, int end) {
        while (end > start && (Character.isWhitespace(text.charAt(end - 1)) || text.charAt(end - 1) == ',')) end--;
        return end;
    }
}
