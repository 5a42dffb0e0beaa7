package dev.pekelund.ezexpense.reconciliation;

/**
 * A bulk matching round failed outright. The reconciliation state is left untouched and the
 * request can be retried.
 */
public class MatchingServiceException extends RuntimeException {

    public MatchingServiceException(String message) {
        super(message);
    }

    public MatchingServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
