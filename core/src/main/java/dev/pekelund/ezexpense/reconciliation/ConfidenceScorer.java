package dev.pekelund.ezexpense.reconciliation;

import java.util.OptionalDouble;

/**
 * Scores how well one receipt matches one expense.
 */
@FunctionalInterface
public interface ConfidenceScorer {

    /**
     * @return a score in {@code [0, 1]}, or empty when the scorer has no opinion. An empty score
     *     means unknown, never zero.
     * @throws ScoringUnavailableException when the scorer could not be reached
     */
    OptionalDouble score(ExpenseSnapshot expense, ReceiptSnapshot receipt);
}
