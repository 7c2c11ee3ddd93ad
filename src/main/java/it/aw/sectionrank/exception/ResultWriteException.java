package it.aw.sectionrank.exception;

/** Il risultato non può essere scritto su disco. */
public class ResultWriteException extends RuntimeException {

    public ResultWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
