package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * Result of one bulk matching round, applied in a single step by {@link ReconciliationAggregate#applyMatch}.
 *
 * @param assignments receipts to attach, at most one assignment per receipt
 * @param unmatched pool receipts that stay in the pool
 */
public record MatchPlan(List<MatchAssignment> assignments, List<String> unmatched) {

    public MatchPlan {
        assignments = List.copyOf(assignments);
        unmatched = List.copyOf(unmatched);
    }
}
