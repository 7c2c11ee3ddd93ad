package it.aw.sectionrank.service;

import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.KeywordModel;
import it.aw.sectionrank.model.PageRecord;
import it.aw.sectionrank.model.ScoringParams;
import it.aw.sectionrank.model.ScoringParams.ScoreWeights;
import it.aw.sectionrank.model.SectionCandidate;
import it.aw.sectionrank.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Individua gli span che fungono da titolo di sezione e assegna a ciascuno
 * un punteggio composito.
 * <p>
 * Uno span è candidato solo se supera tutti i filtri strutturali:
 * <ul>
 *   <li>font grande rispetto al corpo della pagina, oppure grassetto</li>
 *   <li>in cima alla pagina oppure allineato a sinistra</li>
 *   <li>lunghezza limitata: né una frase lunga né un paragrafo; una parola
 *       singola passa solo se ha la forma di un titolo</li>
 * </ul>
 * Le keyword non bastano mai da sole a qualificare uno span: entrano solo
 * nel punteggio, come spinta tra candidati strutturalmente validi.
 */
@Service
public class SectionCandidateScorer {

    private static final Logger log = LoggerFactory.getLogger(SectionCandidateScorer.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");
    private static final double TOP_BONUS_MIN = 0.6;
    private static final double LEFT_BONUS = 0.4;
    private static final double SINGLE_WORD_PENALTY = -0.25;

    private final ScoringParams params;

    public SectionCandidateScorer(ScoringParams params) {
        this.params = params;
    }

    /**
     * Calcola i candidati di un documento, ordinati secondo {@link SectionCandidate#RANKING}.
     *
     * @return lista vuota se il documento non contiene heading plausibili
     */
    public List<SectionCandidate> score(Document document, KeywordModel model) {
        float docMaxSize = (float) document.spans()
                .mapToDouble(TextSpan::fontSize).max().orElse(0.0);
        List<SectionCandidate> candidates = new ArrayList<>();
        if (docMaxSize <= 0f) {
            return candidates;
        }

        for (PageRecord page : document.pages()) {
            float bodySize = bodyFontSize(page);
            for (TextSpan span : page.spans()) {
                String title = normalize(span.text());
                if (!passesGates(span, title, bodySize, model)) continue;
                double score = compositeScore(span, title, bodySize, docMaxSize, model);
                candidates.add(new SectionCandidate(document.filename(), span.pageNumber(), title, score, span));
            }
        }
        candidates.sort(SectionCandidate.RANKING);
        log.debug("SectionCandidateScorer: {} — {} candidati", document.filename(), candidates.size());
        return candidates;
    }

    /**
     * Dimensione del font del corpo della pagina: la dimensione più frequente,
     * pesata per numero di caratteri. 0 per pagina vuota.
     */
    static float bodyFontSize(PageRecord page) {
        Map<Float, Integer> chars = new LinkedHashMap<>();
        for (TextSpan span : page.spans()) {
            float rounded = Math.round(span.fontSize() * 2f) / 2f;
            chars.merge(rounded, span.text().length(), Integer::sum);
        }
        float best = 0f;
        int bestCount = -1;
        for (Map.Entry<Float, Integer> e : chars.entrySet()) {
            // a parità di caratteri vince il font più piccolo
            if (e.getValue() > bestCount || (e.getValue() == bestCount && e.getKey() < best)) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    boolean passesGates(TextSpan span, String title, float bodySize, KeywordModel model) {
        boolean large = bodySize > 0f && span.fontSize() >= bodySize * params.largeFontRatio();
        if (!large && !span.bold()) return false;

        double relX = span.position().relativeX();
        double relY = span.position().relativeY();
        if (relY >= params.topZone() && relX >= params.leftZone()) return false;

        int length = title.length();
        if (length < params.minHeadingChars() || length > params.maxHeadingChars()) return false;
        if (!HAS_LETTER.matcher(title).find()) return false;
        if (looksLikeSentence(title)) return false;

        int words = wordCount(title);
        if (words > params.maxHeadingWords()) return false;
        return words > 1 || model.looksLikeHeading(title);
    }

    double compositeScore(TextSpan span, String title, float bodySize, float docMaxSize, KeywordModel model) {
        ScoreWeights w = params.weights();
        return w.fontSize() * normalizeFontSize(span.fontSize(), bodySize, docMaxSize)
                + w.bold() * (span.bold() ? 1.0 : 0.0)
                + w.position() * positionBonus(span)
                + w.keyword() * model.matchScore(title)
                + w.length() * lengthPenalty(title);
    }

    /**
     * Metà rapporto con il font più grande del documento, metà eccedenza
     * rispetto al corpo della pagina (satura al doppio del corpo).
     */
    static double normalizeFontSize(float size, float bodySize, float docMaxSize) {
        double docRelative = docMaxSize > 0 ? size / docMaxSize : 0.0;
        double pageExcess = bodySize > 0 ? (size - bodySize) / bodySize : 0.0;
        pageExcess = Math.max(0.0, Math.min(1.0, pageExcess));
        return 0.5 * docRelative + 0.5 * pageExcess;
    }

    /** In cima alla pagina (0.6..1.0, più in alto è meglio) &gt; allineato a sinistra (0.4) &gt; altro (0). */
    double positionBonus(TextSpan span) {
        double relY = span.position().relativeY();
        if (relY < params.topZone()) {
            return TOP_BONUS_MIN + (1.0 - TOP_BONUS_MIN) * (1.0 - relY / params.topZone());
        }
        if (span.position().relativeX() < params.leftZone()) {
            return LEFT_BONUS;
        }
        return 0.0;
    }

    /** 0 nell'intervallo ideale di parole, negativo per parola singola o titoli troppo lunghi. */
    double lengthPenalty(String title) {
        int words = wordCount(title);
        if (words <= 1) return SINGLE_WORD_PENALTY;
        if (words <= params.idealMaxWords()) return 0.0;
        int span = Math.max(1, params.maxHeadingWords() - params.idealMaxWords());
        return -Math.min(1.0, (words - params.idealMaxWords()) / (double) span);
    }

    private static boolean looksLikeSentence(String text) {
        if (text.endsWith("...")) return false;
        char last = text.charAt(text.length() - 1);
        return last == '.' || last == ',' || last == ';' || last == '!' || last == '?';
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static int wordCount(String text) {
        return text.isEmpty() ? 0 : WHITESPACE.split(text).length;
    }
}
