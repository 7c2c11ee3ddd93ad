package it.aw.sectionrank.exception;

/**
 * Errore fatale a livello di collezione, ad esempio nessun documento leggibile:
 * in questo caso non viene prodotto alcun risultato.
 */
public class CollectionProcessingException extends RuntimeException {

    public CollectionProcessingException(String message) {
        super(message);
    }

    public CollectionProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
