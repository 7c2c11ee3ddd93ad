package it.aw.sectionrank.runner;

import it.aw.sectionrank.exception.CollectionProcessingException;
import it.aw.sectionrank.exception.DocumentReadException;
import it.aw.sectionrank.exception.InputSpecException;
import it.aw.sectionrank.exception.ResultWriteException;
import it.aw.sectionrank.model.CollectionSettings;
import it.aw.sectionrank.model.DocumentFailure;
import it.aw.sectionrank.model.DocumentOutline;
import it.aw.sectionrank.model.InputSpec;
import it.aw.sectionrank.model.SelectedSection;
import it.aw.sectionrank.service.InputSpecReader;
import it.aw.sectionrank.service.OutlineExtractor;
import it.aw.sectionrank.service.PdfSpanCollector;
import it.aw.sectionrank.service.RelevancePipeline;
import it.aw.sectionrank.service.RelevancePipeline.PipelineResult;
import it.aw.sectionrank.service.ResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Esegue l'elaborazione della collezione configurata all'avvio dell'applicazione.
 *
 * Modalità:
 *   rank    — legge la specifica, esegue la pipeline e scrive predicted_output.json
 *   outline — scrive titolo e outline di ogni PDF della collezione in &lt;outline-dir&gt;/&lt;nome&gt;.json
 *
 * Exit code:
 *   0 — completato, anche con documenti scartati
 *   1 — specifica di input mancante o malformata
 *   2 — nessun documento leggibile o risultato non scrivibile
 *
 * Esempio:
 *   java -jar sectionrank.jar --pipeline.collection-dir="input/Collection 2"
 */
@Component
public class CollectionRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CollectionRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_SPEC = 1;
    static final int EXIT_PROCESSING = 2;

    private final RelevancePipeline pipeline;
    private final InputSpecReader inputSpecReader;
    private final ResultWriter resultWriter;
    private final OutlineExtractor outlineExtractor;
    private final CollectionSettings settings;
    private final Clock clock;
    private final boolean enabled;

    private int exitCode = EXIT_OK;

    public CollectionRunner(RelevancePipeline pipeline,
                            InputSpecReader inputSpecReader,
                            ResultWriter resultWriter,
                            OutlineExtractor outlineExtractor,
                            CollectionSettings settings,
                            Clock clock,
                            @Value("${pipeline.enabled:true}") boolean enabled) {
        this.pipeline = pipeline;
        this.inputSpecReader = inputSpecReader;
        this.resultWriter = resultWriter;
        this.outlineExtractor = outlineExtractor;
        this.settings = settings;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("pipeline.enabled=false: nessuna elaborazione");
            return;
        }
        long start = System.currentTimeMillis();
        try {
            if (settings.mode() == CollectionSettings.Mode.OUTLINE) {
                runOutline();
            } else {
                runRank();
            }
            log.info("Elaborazione terminata in {} ms", System.currentTimeMillis() - start);
        } catch (InputSpecException e) {
            log.error("Specifica di input non utilizzabile: {}", e.getMessage(), e);
            exitCode = EXIT_INPUT_SPEC;
        } catch (CollectionProcessingException | ResultWriteException e) {
            log.error("Elaborazione fallita: {}", e.getMessage(), e);
            exitCode = EXIT_PROCESSING;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runRank() {
        log.info("Collezione: {}", settings.collectionDir().toAbsolutePath());
        InputSpec spec = inputSpecReader.read(settings.inputPath());
        String timestamp = OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);

        PipelineResult result = pipeline.run(spec, settings, timestamp);
        for (DocumentFailure failure : result.failures()) {
            log.warn("Documento omesso dal risultato: {} ({})", failure.document(), failure.reason());
        }
        resultWriter.write(result.output(), settings.outputPath());

        for (SelectedSection s : result.output().extractedSections()) {
            log.info("  {}. {} ({}, p{})", s.importanceRank(), s.title(), s.document(), s.page());
        }
    }

    private void runOutline() {
        Path pdfDir = settings.pdfDir();
        List<Path> pdfs;
        try (Stream<Path> files = Files.list(pdfDir)) {
            pdfs = files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CollectionProcessingException("Impossibile elencare i PDF in " + pdfDir.toAbsolutePath(), e);
        }

        int written = 0;
        for (Path pdf : pdfs) {
            String filename = pdf.getFileName().toString();
            DocumentOutline outline;
            try {
                outline = outlineExtractor.extract(PdfSpanCollector.collect(pdf, filename));
            } catch (DocumentReadException e) {
                log.warn("Documento scartato: {} — {}", filename, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                // PDFBox può lanciare eccezioni unchecked su file malformati
                log.warn("Documento scartato: {} — errore imprevisto: {}", filename, e.toString(), e);
                continue;
            }
            String stem = filename.substring(0, filename.length() - ".pdf".length());
            resultWriter.write(outline, settings.outlinePath().resolve(stem + ".json"));
            written++;
        }
        if (written == 0) {
            throw new CollectionProcessingException("Nessun PDF leggibile in " + pdfDir.toAbsolutePath());
        }
        log.info("Outline scritti: {} su {} PDF", written, pdfs.size());
    }
}
