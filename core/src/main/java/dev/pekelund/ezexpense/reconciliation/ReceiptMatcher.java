package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * Computes a bulk assignment of pool receipts to expenses.
 */
public interface ReceiptMatcher {

    /**
     * @param pool the pool in its current order
     * @param expenses every expense with its existing attachments
     * @throws MatchingServiceException when the round fails as a whole
     */
    MatchPlan match(List<ReceiptSnapshot> pool, List<ExpenseSnapshot> expenses);
}
