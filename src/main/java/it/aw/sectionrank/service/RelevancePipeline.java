package it.aw.sectionrank.service;

import it.aw.sectionrank.exception.CollectionProcessingException;
import it.aw.sectionrank.exception.DocumentReadException;
import it.aw.sectionrank.model.CollectionSettings;
import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.DocumentFailure;
import it.aw.sectionrank.model.InputSpec;
import it.aw.sectionrank.model.KeywordModel;
import it.aw.sectionrank.model.OutputResult;
import it.aw.sectionrank.model.SectionCandidate;
import it.aw.sectionrank.model.SelectedSection;
import it.aw.sectionrank.model.SubsectionEntry;
import it.aw.sectionrank.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestra l'elaborazione di una collezione.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Keyword model: costruito una volta da persona e job</li>
 *   <li>Per documento: span collection → candidati heading → estratti rifiniti</li>
 *   <li>Selezione diversificata delle sezioni su tutta la collezione</li>
 *   <li>Assemblaggio del risultato</li>
 * </ol>
 * I documenti possono essere elaborati in parallelo, ma i risultati sono
 * consumati nell'ordine della specifica: l'ordine di spareggio del selettore
 * non dipende dall'ordine di completamento. Un documento bloccato scade da solo
 * e non consuma il tempo massimo dei documenti successivi.
 * <p>
 * Un errore su un documento (file illeggibile, timeout, eccezione imprevista)
 * scarta solo quel documento. Se nessun documento è leggibile l'esecuzione fallisce.
 */
@Service
public class RelevancePipeline {

    private static final Logger log = LoggerFactory.getLogger(RelevancePipeline.class);
    private static final String MDC_DOCUMENT = "document";

    private final KeywordModelBuilder keywordModelBuilder;
    private final SectionCandidateScorer scorer;
    private final SectionSelector selector;
    private final SubsectionRefiner refiner;
    private final OutputAssembler assembler;

    public RelevancePipeline(KeywordModelBuilder keywordModelBuilder,
                             SectionCandidateScorer scorer,
                             SectionSelector selector,
                             SubsectionRefiner refiner,
                             OutputAssembler assembler) {
        this.keywordModelBuilder = keywordModelBuilder;
        this.scorer = scorer;
        this.selector = selector;
        this.refiner = refiner;
        this.assembler = assembler;
    }

    /** Risultato dell'esecuzione con i documenti scartati. */
    public record PipelineResult(OutputResult output, List<DocumentFailure> failures) {
        public PipelineResult {
            failures = List.copyOf(failures);
        }
    }

    /** Analisi di un singolo documento, prodotta da un worker. */
    record DocumentAnalysis(List<SectionCandidate> candidates, List<SubsectionEntry> subsections) {}

    /** Esito di un documento: l'analisi oppure il motivo dello scarto. */
    record DocumentOutcome(DocumentAnalysis analysis, DocumentReadException failure) {

        static DocumentOutcome ok(DocumentAnalysis analysis) {
            return new DocumentOutcome(analysis, null);
        }

        static DocumentOutcome failed(DocumentReadException failure) {
            return new DocumentOutcome(null, failure);
        }
    }

    /**
     * Elabora la collezione.
     *
     * @param spec      documenti, persona e job
     * @param settings  directory della collezione, parallelismo, tempo massimo per documento
     * @param timestamp istante di generazione da riportare nei metadati
     * @throws CollectionProcessingException se nessun documento è leggibile
     */
    public PipelineResult run(InputSpec spec, CollectionSettings settings, String timestamp) {
        KeywordModel model = keywordModelBuilder.build(spec.persona(), spec.job());
        Path pdfDir = settings.pdfDir();
        log.info("Inizio elaborazione: {} documenti da {} (parallelism={})",
                spec.documents().size(), pdfDir.toAbsolutePath(), settings.parallelism());

        List<String> documents = spec.documents();
        DocumentOutcome[] outcomes = analyzeAll(documents, pdfDir, model, settings);

        List<DocumentAnalysis> analyses = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            DocumentOutcome outcome = outcomes[i];
            if (outcome.failure() == null) {
                analyses.add(outcome.analysis());
            } else {
                DocumentReadException e = outcome.failure();
                log.warn("Documento scartato: {} — {}", documents.get(i), e.getMessage());
                failures.add(new DocumentFailure(documents.get(i), e.getMessage()));
            }
        }

        if (analyses.isEmpty()) {
            throw new CollectionProcessingException(
                    "Nessun documento leggibile nella collezione (" + failures.size() + " scartati)");
        }

        List<SectionCandidate> candidates = new ArrayList<>();
        List<List<SubsectionEntry>> perDocument = new ArrayList<>();
        for (DocumentAnalysis analysis : analyses) {
            candidates.addAll(analysis.candidates());
            perDocument.add(analysis.subsections());
        }
        List<SelectedSection> sections = selector.select(candidates, analyses.size());
        List<SubsectionEntry> subsections = refiner.merge(perDocument);

        OutputResult output = assembler.assemble(spec, timestamp, sections, subsections);
        log.info("Elaborazione completata: {} sezioni, {} estratti, {} documenti scartati",
                sections.size(), subsections.size(), failures.size());
        return new PipelineResult(output, failures);
    }

    DocumentAnalysis analyze(Path path, String filename, KeywordModel model) {
        MDC.put(MDC_DOCUMENT, filename);
        try {
            Document document = PdfSpanCollector.collect(path, filename);
            List<SectionCandidate> candidates = scorer.score(document, model);
            Set<TextSpan> headings = new HashSet<>();
            for (SectionCandidate c : candidates) headings.add(c.span());
            List<SubsectionEntry> subsections = refiner.refine(document, model, headings);
            if (candidates.isEmpty() && subsections.isEmpty()) {
                log.info("Nessun contenuto qualificante in {}", filename);
            }
            return new DocumentAnalysis(candidates, subsections);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    /**
     * Elabora i documenti con al più {@code parallelism} worker attivi.
     * <p>
     * Ogni documento parte su un thread libero del pool, mai su uno ancora occupato,
     * e il suo tempo massimo decorre dal momento in cui parte. Un worker oltre il
     * tempo massimo viene interrotto e abbandonato: il suo posto passa subito al
     * documento successivo, anche se il parsing PDFBox ignora l'interruzione.
     *
     * @return esiti nell'ordine dei documenti
     */
    private DocumentOutcome[] analyzeAll(List<String> documents, Path pdfDir, KeywordModel model, CollectionSettings settings) {
        DocumentOutcome[] outcomes = new DocumentOutcome[documents.size()];
        long timeoutNanos = settings.documentTimeout().toNanos();
        ExecutorService executor = Executors.newCachedThreadPool(workerThreadFactory());
        CompletionService<DocumentAnalysis> completion = new ExecutorCompletionService<>(executor);
        Map<Future<DocumentAnalysis>, Integer> running = new HashMap<>();
        Map<Future<DocumentAnalysis>, Long> deadlines = new HashMap<>();
        int next = 0;
        try {
            while (next < documents.size() || !running.isEmpty()) {
                while (next < documents.size() && running.size() < settings.parallelism()) {
                    String filename = documents.get(next);
                    Path path = pdfDir.resolve(filename);
                    Future<DocumentAnalysis> future = completion.submit(() -> analyze(path, filename, model));
                    running.put(future, next);
                    deadlines.put(future, System.nanoTime() + timeoutNanos);
                    next++;
                }

                long wait = Math.max(0L, Collections.min(deadlines.values()) - System.nanoTime());
                Future<DocumentAnalysis> done = completion.poll(wait, TimeUnit.NANOSECONDS);
                if (done != null) {
                    // un worker già abbandonato può completare più tardi: si ignora
                    Integer index = running.remove(done);
                    if (index != null) {
                        deadlines.remove(done);
                        outcomes[index] = outcomeOf(done, documents.get(index));
                    }
                }
                expireOverdue(running, deadlines, outcomes, documents, settings.documentTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionProcessingException("Elaborazione interrotta", e);
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }

    private static void expireOverdue(Map<Future<DocumentAnalysis>, Integer> running,
                                      Map<Future<DocumentAnalysis>, Long> deadlines,
                                      DocumentOutcome[] outcomes,
                                      List<String> documents,
                                      long timeoutMillis) {
        long now = System.nanoTime();
        Iterator<Map.Entry<Future<DocumentAnalysis>, Long>> it = deadlines.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Future<DocumentAnalysis>, Long> entry = it.next();
            if (entry.getValue() - now > 0) continue;
            Future<DocumentAnalysis> future = entry.getKey();
            int index = running.remove(future);
            it.remove();
            future.cancel(true);
            outcomes[index] = DocumentOutcome.failed(new DocumentReadException(documents.get(index),
                    "Tempo massimo di elaborazione superato (" + timeoutMillis + " ms)"));
        }
    }

    /** Esito di un worker completato; ogni errore diventa una {@link DocumentReadException}. */
    private static DocumentOutcome outcomeOf(Future<DocumentAnalysis> future, String filename) {
        try {
            return DocumentOutcome.ok(future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DocumentReadException) return DocumentOutcome.failed((DocumentReadException) cause);
            return DocumentOutcome.failed(
                    new DocumentReadException(filename, "Errore durante l'elaborazione: " + cause, cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionProcessingException("Elaborazione interrotta", e);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pdf-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
