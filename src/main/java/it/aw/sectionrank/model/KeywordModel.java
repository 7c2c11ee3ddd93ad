package it.aw.sectionrank.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Modello di rilevanza derivato da persona e job-to-be-done.
 * <p>
 * Costruito una sola volta per esecuzione e condiviso in sola lettura da tutti
 * i componenti a valle: i pattern sono già compilati e non vanno ricompilati
 * per span.
 *
 * @param terms           termine → peso (più alto = più specifico)
 * @param termPatterns    termine → pattern case-insensitive che riconosce il termine nel testo
 * @param headingPatterns forme tipiche di un titolo di sezione, indipendenti dalla persona
 */
public record KeywordModel(
        Map<String, Double>  terms,
        Map<String, Pattern> termPatterns,
        List<Pattern>        headingPatterns
) {

    public KeywordModel {
        terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
        termPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(termPatterns));
        headingPatterns = List.copyOf(headingPatterns);
        if (!terms.keySet().equals(termPatterns.keySet())) {
            throw new IllegalArgumentException("terms e termPatterns devono avere le stesse chiavi");
        }
    }

    /** Modello senza termini: il punteggio si basa solo su euristiche strutturali. */
    public static KeywordModel structuralOnly(List<Pattern> headingPatterns) {
        return new KeywordModel(Map.of(), Map.of(), headingPatterns);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /** Peso del termine più specifico, 0 se il modello è vuoto. */
    public double maxWeight() {
        return terms.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    /** True se il testo contiene almeno un termine del modello. */
    public boolean matchesAny(String text) {
        for (Pattern p : termPatterns.values()) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    /**
     * Somma dei pesi dei termini distinti presenti nel testo, normalizzata
     * sul peso massimo e limitata a 1.
     *
     * @return valore in [0, 1]; 0 per modello vuoto
     */
    public double matchScore(String text) {
        double max = maxWeight();
        if (max <= 0) return 0.0;
        double sum = 0.0;
        for (Map.Entry<String, Pattern> e : termPatterns.entrySet()) {
            if (e.getValue().matcher(text).find()) {
                sum += terms.get(e.getKey());
            }
        }
        return Math.min(1.0, sum / max);
    }

    /**
     * Occorrenze dei termini nel testo, ciascuna pesata con il peso normalizzato
     * del termine (peso / peso massimo).
     */
    public double weightedOccurrences(String text) {
        double max = maxWeight();
        if (max <= 0) return 0.0;
        double total = 0.0;
        for (Map.Entry<String, Pattern> e : termPatterns.entrySet()) {
            Matcher m = e.getValue().matcher(text);
            int count = 0;
            while (m.find()) count++;
            total += count * terms.get(e.getKey()) / max;
        }
        return total;
    }

    /** True se il testo ha la forma di un titolo di sezione. */
    public boolean looksLikeHeading(String text) {
        String trimmed = text.trim();
        for (Pattern p : headingPatterns) {
            if (p.matcher(trimmed).matches()) return true;
        }
        return false;
    }
}
