package it.aw.sectionrank.exception;

/** Specifica di input mancante o malformata: interrompe l'esecuzione. */
public class InputSpecException extends RuntimeException {

    public InputSpecException(String message) {
        super(message);
    }

    public InputSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
