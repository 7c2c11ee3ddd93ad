package it.aw.sectionrank.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.sectionrank.TestPdfs;
import it.aw.sectionrank.model.CollectionSettings;
import it.aw.sectionrank.model.Document;
import it.aw.sectionrank.model.DocumentOutline;
import it.aw.sectionrank.model.ScoringParams;
import it.aw.sectionrank.service.InputSpecReader;
import it.aw.sectionrank.service.KeywordModelBuilder;
import it.aw.sectionrank.service.OutlineExtractor;
import it.aw.sectionrank.service.OutputAssembler;
import it.aw.sectionrank.service.RelevancePipeline;
import it.aw.sectionrank.service.ResultWriter;
import it.aw.sectionrank.service.SectionCandidateScorer;
import it.aw.sectionrank.service.SectionSelector;
import it.aw.sectionrank.service.SubsectionRefiner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static it.aw.sectionrank.TestPdfs.heading;
import static it.aw.sectionrank.TestPdfs.page;
import static it.aw.sectionrank.TestPdfs.paragraph;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CollectionRunner")
class CollectionRunnerTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-01-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path collectionDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private CollectionRunner runner(CollectionSettings.Mode mode, boolean enabled) {
        return runner(mode, enabled, new OutlineExtractor());
    }

    private CollectionRunner runner(CollectionSettings.Mode mode, boolean enabled, OutlineExtractor outlineExtractor) {
        ScoringParams params = ScoringParams.defaults();
        RelevancePipeline pipeline = new RelevancePipeline(
                new KeywordModelBuilder(),
                new SectionCandidateScorer(params),
                new SectionSelector(params),
                new SubsectionRefiner(params),
                new OutputAssembler());
        CollectionSettings settings = new CollectionSettings(collectionDir, "challenge1b_input.json", "PDFs",
                "predicted_output.json", "outline", mode, 2, Duration.ofSeconds(30));
        return new CollectionRunner(pipeline, new InputSpecReader(mapper), new ResultWriter(mapper),
                outlineExtractor, settings, FIXED_CLOCK, enabled);
    }

    private void writeInput(String... documents) throws Exception {
        StringBuilder docs = new StringBuilder();
        for (String d : documents) {
            if (docs.length() > 0) docs.append(", ");
            docs.append("{\"filename\": \"").append(d).append("\"}");
        }
        Files.writeString(collectionDir.resolve("challenge1b_input.json"),
                "{\"documents\": [" + docs + "], \"persona\": {\"role\": \"Travel Planner\"},"
                        + " \"job_to_be_done\": {\"task\": \"Plan nightlife for college friends\"}}");
    }

    private void writeGuide(String filename) throws Exception {
        TestPdfs.write(collectionDir.resolve("PDFs"), filename, List.of(
                page(List.of(heading("Nightlife Highlights", 80f)),
                        paragraph(120f,
                                "The nightlife in the old town suits college friends",
                                "who want live music and late opening bars.")),
                page(List.of(heading("Getting Around", 80f)),
                        paragraph(120f,
                                "Regional trains connect the coastal towns every hour",
                                "and tickets can be bought at the station."))));
    }

    @Test
    @DisplayName("modalità rank: scrive predicted_output.json ed esce con 0")
    void shouldWriteOutputAndExitZero() throws Exception {
        writeGuide("guide.pdf");
        writeInput("guide.pdf");
        CollectionRunner runner = runner(CollectionSettings.Mode.RANK, true);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_OK);
        JsonNode root = mapper.readTree(collectionDir.resolve("predicted_output.json").toFile());
        assertThat(root.path("metadata").path("timestamp").asText()).isEqualTo("2025-01-01T10:00:00Z");
        assertThat(root.path("metadata").path("persona").asText()).isEqualTo("Travel Planner");
        assertThat(root.path("extracted_sections").get(0).path("title").asText()).isEqualTo("Nightlife Highlights");
        assertThat(root.path("extracted_sections").get(0).path("importance_rank").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("documenti parzialmente illeggibili: esce comunque con 0")
    void shouldExitZero_whenSomeDocumentsFail() throws Exception {
        writeGuide("guide.pdf");
        TestPdfs.writeCorrupt(collectionDir.resolve("PDFs"), "broken.pdf");
        writeInput("guide.pdf", "broken.pdf");
        CollectionRunner runner = runner(CollectionSettings.Mode.RANK, true);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_OK);
        assertThat(collectionDir.resolve("predicted_output.json")).exists();
    }

    @Test
    @DisplayName("specifica di input mancante: esce con 1 senza scrivere output")
    void shouldExitOne_whenInputSpecIsMissing() {
        CollectionRunner runner = runner(CollectionSettings.Mode.RANK, true);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_INPUT_SPEC);
        assertThat(collectionDir.resolve("predicted_output.json")).doesNotExist();
    }

    @Test
    @DisplayName("nessun documento leggibile: esce con 2")
    void shouldExitTwo_whenNoDocumentIsReadable() throws Exception {
        TestPdfs.writeCorrupt(collectionDir.resolve("PDFs"), "broken.pdf");
        writeInput("broken.pdf");
        CollectionRunner runner = runner(CollectionSettings.Mode.RANK, true);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_PROCESSING);
        assertThat(collectionDir.resolve("predicted_output.json")).doesNotExist();
    }

    @Test
    @DisplayName("modalità outline: un JSON per PDF leggibile")
    void shouldWriteOneOutlinePerPdf() throws Exception {
        writeGuide("guide.pdf");
        TestPdfs.writeCorrupt(collectionDir.resolve("PDFs"), "broken.pdf");
        CollectionRunner runner = runner(CollectionSettings.Mode.OUTLINE, true);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_OK);
        Path outline = collectionDir.resolve("outline/guide.json");
        assertThat(outline).exists();
        assertThat(collectionDir.resolve("outline/broken.json")).doesNotExist();
        JsonNode root = mapper.readTree(outline.toFile());
        assertThat(root.path("title").asText()).isNotBlank();
        assertThat(root.path("outline").isArray()).isTrue();
    }

    @Test
    @DisplayName("modalità outline: un errore imprevisto su un PDF non ferma gli altri")
    void shouldContinueOutline_whenOnePdfFailsUnexpectedly() throws Exception {
        writeGuide("a-bad.pdf");
        writeGuide("guide.pdf");
        OutlineExtractor failingOnBad = new OutlineExtractor() {
            @Override
            public DocumentOutline extract(Document document) {
                if (document.filename().equals("a-bad.pdf")) {
                    throw new IllegalStateException("struttura PDF inattesa");
                }
                return super.extract(document);
            }
        };
        CollectionRunner runner = runner(CollectionSettings.Mode.OUTLINE, true, failingOnBad);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_OK);
        assertThat(collectionDir.resolve("outline/guide.json")).exists();
        assertThat(collectionDir.resolve("outline/a-bad.json")).doesNotExist();
    }

    @Test
    @DisplayName("disabilitato: nessuna elaborazione")
    void shouldDoNothing_whenDisabled() throws Exception {
        writeGuide("guide.pdf");
        writeInput("guide.pdf");
        CollectionRunner runner = runner(CollectionSettings.Mode.RANK, false);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(CollectionRunner.EXIT_OK);
        assertThat(collectionDir.resolve("predicted_output.json")).doesNotExist();
    }
}
