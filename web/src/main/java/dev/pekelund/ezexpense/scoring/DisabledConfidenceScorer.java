package dev.pekelund.ezexpense.scoring;

import dev.pekelund.ezexpense.reconciliation.ConfidenceScorer;
import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import dev.pekelund.ezexpense.reconciliation.ScoringUnavailableException;
import java.util.OptionalDouble;

/**
 * Used when no scoring service is configured. Every call is unavailable, so confidences stay unknown.
 */
public class DisabledConfidenceScorer implements ConfidenceScorer {

    @Override
    public OptionalDouble score(ExpenseSnapshot expense, ReceiptSnapshot receipt) {
        throw new ScoringUnavailableException("Confidence scoring is not configured");
    }
}
