package it.aw.sectionrank.service;

import it.aw.sectionrank.model.KeywordModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deriva il {@link KeywordModel} da persona e job-to-be-done.
 * <p>
 * Algoritmo:
 * <ol>
 *   <li>Tokenizzazione in minuscolo su caratteri non alfanumerici</li>
 *   <li>Scarto di stop-word, token corti (&lt; 3 caratteri) e numeri puri</li>
 *   <li>Peso = frequenza nei due testi × lunghezza (limitata a {@value #MAX_WEIGHTED_LENGTH});
 *       i termini generici (verbi di task, quantità) valgono la metà</li>
 *   <li>Un pattern per termine, su una radice approssimata, per riconoscere
 *       anche plurali e derivati</li>
 * </ol>
 * I pattern di forma dei titoli sono indipendenti dalla persona e sempre inclusi.
 * Funzione pura: stessi input, stesso modello.
 */
@Service
public class KeywordModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(KeywordModelBuilder.class);

    static final int MAX_WEIGHTED_LENGTH = 12;
    private static final int MIN_TERM_LENGTH = 3;
    private static final int MIN_STEM_LENGTH = 4;
    private static final double GENERIC_FACTOR = 0.5;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern DIGITS = Pattern.compile("\\p{N}+");
    private static final List<String> STEM_SUFFIXES = List.of("ies", "ing", "es", "s", "y", "e");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "also", "am", "an", "and",
            "any", "are", "as", "at", "be", "because", "been", "before", "being", "below",
            "between", "both", "but", "by", "can", "could", "did", "do", "does", "doing", "down",
            "during", "each", "etc", "few", "for", "from", "further", "had", "has", "have",
            "having", "he", "her", "here", "hers", "herself", "him", "himself", "his", "how",
            "i", "if", "in", "into", "is", "it", "its", "itself", "just", "me", "more", "most",
            "my", "myself", "no", "nor", "not", "now", "of", "off", "on", "once", "only", "or",
            "other", "our", "ours", "ourselves", "out", "over", "own", "same", "she", "should",
            "so", "some", "such", "than", "that", "the", "their", "theirs", "them", "themselves",
            "then", "there", "these", "they", "this", "those", "through", "to", "too", "under",
            "until", "up", "very", "was", "we", "were", "what", "when", "where", "which",
            "while", "who", "whom", "why", "will", "with", "would", "you", "your", "yours",
            "yourself", "yourselves", "using", "based", "within", "without", "per", "via");

    /** Termini frequenti nei job ma poco discriminanti: contano la metà. */
    private static final Set<String> GENERIC_TERMS = Set.of(
            "plan", "prepare", "need", "needs", "make", "create", "help", "find", "get", "give",
            "provide", "want", "like", "use", "list", "new", "good", "best", "day", "days",
            "group", "people", "person", "task", "job", "work", "various", "several", "many",
            "one", "two", "three", "four", "five", "ten");

    // Forme di titolo: numerazioni ("1.", "1.2", "1.2.3") e keyword esplicite
    private static final Pattern NUMBERED_HEADING = Pattern.compile(
            "^(\\d+(\\.\\d+){0,3})\\.?\\s+\\p{Lu}.*");
    private static final Pattern KEYWORD_HEADING = Pattern.compile(
            "^(Chapter|Section|Part|Appendix|Article)\\s+([\\dIVXLC]+|[A-Z])\\b.*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_CASE = Pattern.compile(
            "^\\p{Lu}[\\p{L}\\p{N}\\s\\-:&',/()]*$");
    private static final Pattern ALL_CAPS = Pattern.compile(
            "^[\\p{Lu}\\p{N}\\s\\-:&',/()]+$");

    static final List<Pattern> HEADING_PATTERNS =
            List.of(NUMBERED_HEADING, KEYWORD_HEADING, TITLE_CASE, ALL_CAPS);

    /**
     * Costruisce il modello. Input null o vuoti producono un modello
     * senza termini che lascia il punteggio alle sole euristiche strutturali.
     */
    public KeywordModel build(String persona, String job) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        countTerms(persona, frequencies);
        countTerms(job, frequencies);

        if (frequencies.isEmpty()) {
            log.info("KeywordModel: persona e job senza termini utili, scoring solo strutturale");
            return KeywordModel.structuralOnly(HEADING_PATTERNS);
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : frequencies.entrySet()) {
            String term = e.getKey();
            double weight = e.getValue() * (double) Math.min(term.length(), MAX_WEIGHTED_LENGTH);
            if (GENERIC_TERMS.contains(term)) weight *= GENERIC_FACTOR;
            weights.put(term, weight);
            patterns.put(term, Pattern.compile("\\b" + Pattern.quote(stem(term)),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        log.info("KeywordModel: {} termini rilevanti {}", weights.size(), weights.keySet());
        return new KeywordModel(weights, patterns, HEADING_PATTERNS);
    }

    private static void countTerms(String text, Map<String, Integer> frequencies) {
        if (text == null || text.isBlank()) return;
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() < MIN_TERM_LENGTH) continue;
            if (STOP_WORDS.contains(token)) continue;
            if (DIGITS.matcher(token).matches()) continue;
            frequencies.merge(token, 1, Integer::sum);
        }
    }

    /** Radice approssimata: toglie un suffisso comune se restano almeno 4 caratteri. */
    static String stem(String term) {
        for (String suffix : STEM_SUFFIXES) {
            if (term.endsWith(suffix) && term.length() - suffix.length() >= MIN_STEM_LENGTH) {
                return term.substring(0, term.length() - suffix.length());
            }
        }
        return term;
    }
}
