package it.aw.sectionrank.service;

import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.KeywordModel;
import it.aw.sectionrank.model.PageRecord;
import it.aw.sectionrank.model.ScoringParams;
import it.aw.sectionrank.model.SubsectionEntry;
import it.aw.sectionrank.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estrae da ogni documento brevi estratti rilevanti per la persona.
 * <p>
 * Pipeline per documento:
 * <ol>
 *   <li>Raggruppamento degli span non-heading in blocchi contigui (vicinanza
 *       verticale e font simile)</li>
 *   <li>Scarto dei blocchi corti o senza keyword; punteggio per densità di
 *       keyword e lunghezza</li>
 *   <li>Per i blocchi migliori: la sequenza contigua di frasi con keyword più
 *       rilevante, troncata con "..." oltre la lunghezza massima</li>
 * </ol>
 * Il testo prodotto è sempre una sottostringa del contenuto del blocco: nessuna
 * parafrasi. I blocchi senza frasi qualificanti non producono estratti vuoti.
 */
@Service
public class SubsectionRefiner {

    private static final Logger log = LoggerFactory.getLogger(SubsectionRefiner.class);

    private static final String ELLIPSIS = "...";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    /** Frase: dal primo carattere non spazio fino a punteggiatura terminale seguita da spazio, o fine testo. */
    private static final Pattern SENTENCE = Pattern.compile(
            "\\S.*?(?:[.!?]+[\"')\\]]*(?=\\s|$)|$)", Pattern.DOTALL);

    private final ScoringParams params;

    public SubsectionRefiner(ScoringParams params) {
        this.params = params;
    }

    /** Blocco di contenuto: span contigui della stessa pagina. */
    record ContentBlock(int page, float top, String text, double score) {}

    /**
     * Estratti di un documento, dal più rilevante, al più
     * {@link ScoringParams#subsectionsPerDocument()}.
     *
     * @param headings span già classificati come heading: interrompono i blocchi
     *                 e non ne fanno parte
     */
    public List<SubsectionEntry> refine(Document document, KeywordModel model, Set<TextSpan> headings) {
        if (model.isEmpty() || params.subsectionsPerDocument() == 0) {
            return List.of();
        }

        List<ContentBlock> blocks = new ArrayList<>();
        for (PageRecord page : document.pages()) {
            for (List<TextSpan> group : groupBlocks(page, headings)) {
                String text = joinText(group);
                if (text.length() < params.minBlockChars() || !model.matchesAny(text)) continue;
                blocks.add(new ContentBlock(page.pageNumber(), group.get(0).position().y(),
                        text, blockScore(text, model)));
            }
        }
        blocks.sort(Comparator.comparingDouble(ContentBlock::score).reversed()
                .thenComparingInt(ContentBlock::page)
                .thenComparingDouble(ContentBlock::top));

        List<SubsectionEntry> entries = new ArrayList<>();
        for (ContentBlock block : blocks) {
            if (entries.size() >= params.subsectionsPerDocument()) break;
            String refined = refineText(block.text(), model);
            if (refined != null) {
                entries.add(new SubsectionEntry(document.filename(), block.page(), refined));
            }
        }
        log.debug("SubsectionRefiner: {} — {} blocchi rilevanti, {} estratti",
                document.filename(), blocks.size(), entries.size());
        return entries;
    }

    /**
     * Unisce gli estratti dei documenti a turno (il migliore di ogni documento,
     * poi il secondo, ...) nell'ordine dei documenti, fino a
     * {@link ScoringParams#maxSubsections()}.
     */
    public List<SubsectionEntry> merge(List<List<SubsectionEntry>> perDocument) {
        List<SubsectionEntry> merged = new ArrayList<>();
        int limit = params.maxSubsections();
        for (int round = 0; merged.size() < limit; round++) {
            boolean any = false;
            for (List<SubsectionEntry> entries : perDocument) {
                if (round < entries.size() && merged.size() < limit) {
                    merged.add(entries.get(round));
                    any = true;
                }
            }
            if (!any) break;
        }
        return merged;
    }

    List<List<TextSpan>> groupBlocks(PageRecord page, Set<TextSpan> headings) {
        List<List<TextSpan>> groups = new ArrayList<>();
        List<TextSpan> current = new ArrayList<>();
        TextSpan previous = null;
        for (TextSpan span : page.spans()) {
            if (headings.contains(span)) {
                closeGroup(groups, current);
                current = new ArrayList<>();
                previous = null;
                continue;
            }
            if (previous != null && startsNewBlock(previous, span)) {
                closeGroup(groups, current);
                current = new ArrayList<>();
            }
            current.add(span);
            previous = span;
        }
        closeGroup(groups, current);
        return groups;
    }

    private boolean startsNewBlock(TextSpan previous, TextSpan span) {
        float dy = span.position().y() - previous.position().y();
        float lineHeight = Math.max(previous.fontSize(), 1f);
        if (dy > lineHeight * params.blockGapFactor()) return true;  // salto verticale
        if (dy < -lineHeight) return true;                           // nuova colonna
        return Math.abs(span.fontSize() - previous.fontSize()) > params.blockFontTolerance();
    }

    private static void closeGroup(List<List<TextSpan>> groups, List<TextSpan> current) {
        if (!current.isEmpty()) groups.add(current);
    }

    private static String joinText(List<TextSpan> spans) {
        StringBuilder sb = new StringBuilder();
        for (TextSpan span : spans) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(span.text());
        }
        return WHITESPACE.matcher(sb).replaceAll(" ").trim();
    }

    double blockScore(String text, KeywordModel model) {
        int words = Math.max(1, WHITESPACE.split(text).length);
        double density = model.weightedOccurrences(text) / words;
        double length = Math.min(1.0, text.length() / (double) params.idealBlockChars());
        return params.densityWeight() * density + params.lengthWeight() * length;
    }

    /**
     * Sequenza contigua di frasi qualificanti con più occorrenze pesate di
     * keyword (a parità, la prima). Una frase non qualificante interrompe la
     * sequenza, quindi non finisce mai nell'estratto.
     *
     * @return null se nessuna frase contiene keyword
     */
    String refineText(String text, KeywordModel model) {
        int bestStart = -1;
        int bestEnd = -1;
        double bestWeight = -1.0;
        int runStart = -1;
        int runEnd = -1;
        double runWeight = 0.0;
        Matcher m = SENTENCE.matcher(text);
        while (m.find()) {
            String sentence = m.group();
            boolean qualifies = sentence.length() >= params.minSentenceChars() && model.matchesAny(sentence);
            if (!qualifies) {
                if (runStart >= 0 && runWeight > bestWeight) {
                    bestStart = runStart;
                    bestEnd = runEnd;
                    bestWeight = runWeight;
                }
                runStart = -1;
                runWeight = 0.0;
                continue;
            }
            if (runStart < 0) runStart = m.start();
            runEnd = m.end();
            runWeight += model.weightedOccurrences(sentence);
        }
        if (runStart >= 0 && runWeight > bestWeight) {
            bestStart = runStart;
            bestEnd = runEnd;
        }
        if (bestStart < 0) return null;
        String window = text.substring(bestStart, bestEnd).trim();
        return window.isEmpty() ? null : truncate(window, params.maxRefinedLength());
    }

    /** Tronca al confine di parola perché il risultato, ellissi inclusa, stia in maxLength. */
    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) return text;
        int limit = maxLength - ELLIPSIS.length();
        int cut = text.lastIndexOf(' ', limit);
        if (cut <= 0) cut = limit;
        return text.substring(0, cut).trim() + ELLIPSIS;
    }
}
