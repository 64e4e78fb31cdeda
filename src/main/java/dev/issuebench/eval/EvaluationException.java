package dev.issuebench.eval;

/** Exception thrown when an evaluation's external process cannot be run. */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
