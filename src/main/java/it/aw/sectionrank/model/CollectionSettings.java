package it.aw.sectionrank.model;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configurazione di un'esecuzione: dove leggere la collezione e dove scrivere
 * il risultato. Costruita una volta all'avvio e mai modificata durante l'esecuzione.
 */
public record CollectionSettings(
        Path     collectionDir,
        String   inputFile,
        String   pdfSubdir,
        String   outputFile,
        String   outlineDir,
        Mode     mode,
        int      parallelism,
        Duration documentTimeout
) {

    public enum Mode { RANK, OUTLINE }

    public CollectionSettings {
        if (collectionDir == null) {
            throw new IllegalArgumentException("collectionDir obbligatoria");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism deve essere >= 1 (ricevuto: " + parallelism + ")");
        }
        if (documentTimeout == null || documentTimeout.isNegative() || documentTimeout.isZero()) {
            throw new IllegalArgumentException("documentTimeout deve essere positivo");
        }
        if (mode == null) mode = Mode.RANK;
    }

    public Path inputPath() {
        return collectionDir.resolve(inputFile);
    }

    public Path outputPath() {
        return collectionDir.resolve(outputFile);
    }

    public Path outlinePath() {
        return collectionDir.resolve(outlineDir);
    }

    /**
     * Directory dei PDF: la sottodirectory configurata se esiste,
     * altrimenti la directory della collezione.
     */
    public Path pdfDir() {
        if (pdfSubdir != null && !pdfSubdir.isBlank()) {
            Path sub = collectionDir.resolve(pdfSubdir);
            if (Files.isDirectory(sub)) return sub;
        }
        return collectionDir;
    }
}
