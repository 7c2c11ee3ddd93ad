package it.aw.sectionrank.config;

import it.aw.sectionrank.model.CollectionSettings;
import it.aw.sectionrank.model.ScoringParams;
import it.aw.sectionrank.model.ScoringParams.ScoreWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Costruisce la configurazione immutabile della pipeline a partire dalle property.
 *
 * ScoringParams:      costanti euristiche (K, pesi w1..w5, soglie); i default
 *                     stanno in {@link ScoringParams}, le property li sovrascrivono.
 * CollectionSettings: directory della collezione e parametri di esecuzione,
 *                     fissati all'avvio e mai modificati durante l'esecuzione.
 * Clock:              sorgente del timestamp dei metadati, sostituibile nei test.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public ScoringParams scoringParams(
            @Value("${scoring.max-sections:" + ScoringParams.DEFAULT_MAX_SECTIONS + "}") int maxSections,
            @Value("${scoring.weight.font-size:" + ScoreWeights.DEFAULT_FONT_SIZE + "}") double wFontSize,
            @Value("${scoring.weight.bold:" + ScoreWeights.DEFAULT_BOLD + "}") double wBold,
            @Value("${scoring.weight.position:" + ScoreWeights.DEFAULT_POSITION + "}") double wPosition,
            @Value("${scoring.weight.keyword:" + ScoreWeights.DEFAULT_KEYWORD + "}") double wKeyword,
            @Value("${scoring.weight.length:" + ScoreWeights.DEFAULT_LENGTH + "}") double wLength,
            @Value("${scoring.large-font-ratio:" + ScoringParams.DEFAULT_LARGE_FONT_RATIO + "}") double largeFontRatio,
            @Value("${scoring.top-zone:" + ScoringParams.DEFAULT_TOP_ZONE + "}") double topZone,
            @Value("${scoring.left-zone:" + ScoringParams.DEFAULT_LEFT_ZONE + "}") double leftZone,
            @Value("${scoring.max-heading-words:" + ScoringParams.DEFAULT_MAX_HEADING_WORDS + "}") int maxHeadingWords,
            @Value("${scoring.subsections-per-document:" + ScoringParams.DEFAULT_SUBSECTIONS_PER_DOCUMENT + "}") int perDocument,
            @Value("${scoring.max-subsections:" + ScoringParams.DEFAULT_MAX_SUBSECTIONS + "}") int maxSubsections,
            @Value("${scoring.max-refined-length:" + ScoringParams.DEFAULT_MAX_REFINED_LENGTH + "}") int maxRefinedLength) {
        ScoringParams params = ScoringParams.builder()
                .maxSections(maxSections)
                .weights(new ScoreWeights(wFontSize, wBold, wPosition, wKeyword, wLength))
                .largeFontRatio(largeFontRatio)
                .topZone(topZone)
                .leftZone(leftZone)
                .maxHeadingWords(maxHeadingWords)
                .subsectionsPerDocument(perDocument)
                .maxSubsections(maxSubsections)
                .maxRefinedLength(maxRefinedLength)
                .build();
        log.info("ScoringParams: K={}, pesi={}", params.maxSections(), params.weights());
        return params;
    }

    @Bean
    public CollectionSettings collectionSettings(
            @Value("${pipeline.collection-dir}") String collectionDir,
            @Value("${pipeline.input-file}") String inputFile,
            @Value("${pipeline.pdf-subdir}") String pdfSubdir,
            @Value("${pipeline.output-file}") String outputFile,
            @Value("${pipeline.outline-dir}") String outlineDir,
            @Value("${pipeline.mode}") String mode,
            @Value("${pipeline.parallelism}") int parallelism,
            @Value("${pipeline.document-timeout}") Duration documentTimeout) {
        CollectionSettings.Mode parsedMode;
        try {
            parsedMode = CollectionSettings.Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("pipeline.mode non valido: '" + mode + "' (attesi: rank, outline)", e);
        }
        return new CollectionSettings(Paths.get(collectionDir), inputFile, pdfSubdir, outputFile,
                outlineDir, parsedMode, parallelism, documentTimeout);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
