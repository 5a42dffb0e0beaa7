package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * @param applied assignments now reflected in the attachment lists
 * @param unmatched receipts left in the pool
 * @param skipped assignments whose receipt or expense disappeared while matching ran
 */
public record MatchOutcome(List<MatchAssignment> applied, List<String> unmatched, List<MatchAssignment> skipped) {

    public MatchOutcome {
        applied = List.copyOf(applied);
        unmatched = List.copyOf(unmatched);
        skipped = List.copyOf(skipped);
    }
}
