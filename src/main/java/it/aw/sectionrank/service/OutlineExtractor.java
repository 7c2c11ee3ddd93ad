package it.aw.sectionrank.service;

import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.DocumentOutline;
import it.aw.sectionrank.model.KeywordModel;
import it.aw.sectionrank.model.OutlineEntry;
import it.aw.sectionrank.model.PageRecord;
import it.aw.sectionrank.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ricostruisce titolo e outline (H1/H2/H3) di un documento dalle statistiche
 * dei font, senza persona né job.
 * <p>
 * Le dimensioni "da heading" sono quelle sensibilmente più grandi della mediana
 * (oltre {@value #SIZE_MARGIN} pt), presenti più di una volta ma in meno del 10%
 * degli span; le tre più grandi diventano H1, H2 e H3.
 */
@Service
public class OutlineExtractor {

    private static final Logger log = LoggerFactory.getLogger(OutlineExtractor.class);

    static final float SIZE_MARGIN = 2f;
    private static final double MAX_HEADING_SHARE = 0.1;
    private static final int MAX_LEVELS = 3;
    private static final double TITLE_ZONE = 0.3;
    private static final double LEFT_ZONE = 0.2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ONLY_NUMBERS = Pattern.compile("^[\\d\\s.\\-()]+$");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");
    private static final Set<String> GENERIC_WORDS =
            Set.of("page", "chapter", "section", "figure", "table", "appendix");

    private final KeywordModel structural = KeywordModel.structuralOnly(KeywordModelBuilder.HEADING_PATTERNS);

    public DocumentOutline extract(Document document) {
        List<TextSpan> spans = document.spans().toList();
        String title = extractTitle(document);
        if (spans.isEmpty()) {
            return new DocumentOutline(title, List.of());
        }

        List<Float> significant = significantSizes(spans);
        float body = mostFrequentSize(spans);

        List<OutlineEntry> outline = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (TextSpan span : spans) {
            String text = normalize(span.text());
            if (!isHeadingCandidate(span, text, significant, body)) continue;
            if (text.equals(title)) continue;
            String level = levelOf(span.fontSize(), significant);
            if (seen.add(level + '\u0000' + text)) {
                outline.add(new OutlineEntry(level, text, span.pageNumber()));
            }
        }
        log.debug("OutlineExtractor: {} — titolo '{}', {} heading", document.filename(), title, outline.size());
        return new DocumentOutline(title, outline);
    }

    /**
     * Titolo dal dizionario Info del PDF; in mancanza il miglior candidato
     * della prima pagina; in ultima istanza il nome del file.
     */
    String extractTitle(Document document) {
        if (document.title() != null && document.title().trim().length() > 3) {
            return document.title().trim();
        }
        if (!document.pages().isEmpty()) {
            PageRecord first = document.pages().get(0);
            String best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (TextSpan span : first.spans()) {
                String text = normalize(span.text());
                if (text.length() < 5 || text.length() > 150) continue;
                if (span.position().relativeY() > TITLE_ZONE) continue;
                if (text.endsWith(".") && !text.endsWith("...")) continue;
                double score = span.fontSize()
                        + (1.0 - span.position().relativeY()) * 10.0
                        + (span.bold() ? 5.0 : 0.0);
                if (score > bestScore) {
                    bestScore = score;
                    best = text;
                }
            }
            if (best != null) return best;
        }
        return fallbackTitle(document.filename());
    }

    static String fallbackTitle(String filename) {
        String stem = filename.replaceFirst("(?i)\\.pdf$", "");
        String[] words = stem.replace('_', ' ').replace('-', ' ').trim().split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (w.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /** Dimensioni da heading, dalla più grande, al più tre. */
    static List<Float> significantSizes(List<TextSpan> spans) {
        float median = median(spans);
        Map<Float, Integer> counts = new LinkedHashMap<>();
        for (TextSpan s : spans) counts.merge(s.fontSize(), 1, Integer::sum);

        List<Float> sizes = new ArrayList<>();
        for (Map.Entry<Float, Integer> e : counts.entrySet()) {
            int count = e.getValue();
            if (e.getKey() > median + SIZE_MARGIN && count > 1 && count < spans.size() * MAX_HEADING_SHARE) {
                sizes.add(e.getKey());
            }
        }
        sizes.sort((a, b) -> Float.compare(b, a));
        return sizes.size() > MAX_LEVELS ? new ArrayList<>(sizes.subList(0, MAX_LEVELS)) : sizes;
    }

    boolean isHeadingCandidate(TextSpan span, String text, List<Float> significant, float body) {
        if (text.length() < 3 || text.length() > 200) return false;
        boolean significantSize = significant.contains(span.fontSize());
        boolean boldAndLarge = span.bold() && span.fontSize() > body;
        if (!significantSize && !boldAndLarge) return false;
        if (ONLY_NUMBERS.matcher(text).matches()) return false;
        if (!HAS_LETTER.matcher(text).find()) return false;
        if (GENERIC_WORDS.contains(text.toLowerCase(Locale.ROOT))) return false;
        return structural.looksLikeHeading(text) || span.position().relativeX() < LEFT_ZONE;
    }

    /** Livello della dimensione significativa più vicina; senza dimensioni significative H3. */
    static String levelOf(float size, List<Float> significant) {
        if (significant.isEmpty()) return "H" + MAX_LEVELS;
        int best = 0;
        for (int i = 1; i < significant.size(); i++) {
            if (Math.abs(significant.get(i) - size) < Math.abs(significant.get(best) - size)) best = i;
        }
        return "H" + (best + 1);
    }

    private static float median(List<TextSpan> spans) {
        float[] sizes = new float[spans.size()];
        for (int i = 0; i < sizes.length; i++) sizes[i] = spans.get(i).fontSize();
        Arrays.sort(sizes);
        int mid = sizes.length / 2;
        return sizes.length % 2 == 1 ? sizes[mid] : (sizes[mid - 1] + sizes[mid]) / 2f;
    }

    private static float mostFrequentSize(List<TextSpan> spans) {
        Map<Float, Integer> counts = new LinkedHashMap<>();
        for (TextSpan s : spans) counts.merge(s.fontSize(), 1, Integer::sum);
        float best = 0f;
        int bestCount = 0;
        for (Map.Entry<Float, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
