package dev.pekelund.ezexpense.reconciliation;

/**
 * A confidence scorer call failed or timed out. Callers degrade the confidence to unknown.
 */
public class ScoringUnavailableException extends RuntimeException {

    public ScoringUnavailableException(String message) {
        super(message);
    }

    public ScoringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
