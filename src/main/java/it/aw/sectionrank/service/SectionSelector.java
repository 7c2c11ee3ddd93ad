package it.aw.sectionrank.service;

import it.aw.sectionrank.model.ScoringParams;
import it.aw.sectionrank.model.SectionCandidate;
import it.aw.sectionrank.model.SelectedSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Seleziona le K sezioni finali tra i candidati di tutta la collezione,
 * imponendo un tetto per documento per evitare che un solo documento domini.
 * <p>
 * Due fasi sulla lista ordinata per punteggio:
 * <ol>
 *   <li>selezione greedy con al più {@code ceil(K / documenti)} sezioni per documento</li>
 *   <li>i posti rimasti liberi si riempiono in puro ordine di punteggio</li>
 * </ol>
 * Il rank assegnato segue l'ordine di selezione, non il punteggio grezzo.
 * Titoli ripetuti nello stesso documento (es. intestazioni di pagina) contano una volta sola.
 */
@Service
public class SectionSelector {

    private static final Logger log = LoggerFactory.getLogger(SectionSelector.class);

    private final ScoringParams params;

    public SectionSelector(ScoringParams params) {
        this.params = params;
    }

    /**
     * @param candidates    candidati di tutti i documenti, nell'ordine di iterazione
     *                      dei documenti (usato come ultimo criterio di spareggio)
     * @param documentCount numero di documenti letti; se &lt;= 0 si usa il numero
     *                      di documenti distinti tra i candidati
     * @return sezioni con rank contiguo 1..n, n &lt;= K
     */
    public List<SelectedSection> select(List<SectionCandidate> candidates, int documentCount) {
        int k = params.maxSections();
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<SectionCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(SectionCandidate.RANKING); // stabile: a parità resta l'ordine dei documenti
        List<SectionCandidate> distinct = dropDuplicateTitles(sorted);

        int documents = documentCount > 0 ? documentCount : distinctDocuments(distinct);
        int cap = (int) Math.ceil(k / (double) documents);

        Set<SectionCandidate> chosen = new LinkedHashSet<>();
        Map<String, Integer> perDocument = new HashMap<>();

        // Fase 1: tetto per documento
        for (SectionCandidate c : distinct) {
            if (chosen.size() >= k) break;
            int taken = perDocument.getOrDefault(c.document(), 0);
            if (taken < cap) {
                chosen.add(c);
                perDocument.put(c.document(), taken + 1);
            }
        }

        // Fase 2: riempimento per punteggio
        for (SectionCandidate c : distinct) {
            if (chosen.size() >= k) break;
            chosen.add(c);
        }

        List<SelectedSection> result = new ArrayList<>(chosen.size());
        int rank = 1;
        for (SectionCandidate c : chosen) {
            result.add(new SelectedSection(c.document(), c.page(), c.title(), rank++));
        }
        log.info("SectionSelector: {} sezioni selezionate su {} candidati (tetto per documento {})",
                result.size(), candidates.size(), cap);
        return result;
    }

    private static List<SectionCandidate> dropDuplicateTitles(List<SectionCandidate> sorted) {
        Set<String> seen = new HashSet<>();
        List<SectionCandidate> distinct = new ArrayList<>(sorted.size());
        for (SectionCandidate c : sorted) {
            String key = c.document() + '\u0000' + c.title().toLowerCase(Locale.ROOT);
            if (seen.add(key)) distinct.add(c);
        }
        return distinct;
    }

    private static int distinctDocuments(List<SectionCandidate> candidates) {
        Set<String> docs = new HashSet<>();
        for (SectionCandidate c : candidates) docs.add(c.document());
        return Math.max(1, docs.size());
    }
}
