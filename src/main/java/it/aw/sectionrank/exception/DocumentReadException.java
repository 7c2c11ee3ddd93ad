package it.aw.sectionrank.exception;

/**
 * Un documento della collezione non può essere letto (file mancante, corrotto,
 * cifrato, senza pagine o oltre il tempo massimo di elaborazione).
 * <p>
 * Errore locale al documento: la pipeline lo scarta e prosegue con gli altri.
 */
public class DocumentReadException extends RuntimeException {

    private final String filename;

    public DocumentReadException(String filename, String message) {
        super(message);
        this.filename = filename;
    }

    public DocumentReadException(String filename, String message, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
