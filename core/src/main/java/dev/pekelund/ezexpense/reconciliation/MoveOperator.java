package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * Relocates one receipt between two containers. The caller supplies the destination confidence,
 * computed before the move; it is ignored when the destination is the pool.
 */
final class MoveOperator {

    private final ReconciliationState state;
    private final DuplicateGuard duplicateGuard;

    MoveOperator(ReconciliationState state, DuplicateGuard duplicateGuard) {
        this.state = state;
        this.duplicateGuard = duplicateGuard;
    }

    MoveResult move(String name, ContainerRef from, ContainerRef to, Integer confidence) {
        if (from.equals(to)) {
            return MoveResult.sameContainer(name);
        }
        List<Receipt> source = state.container(from);
        List<Receipt> destination = state.container(to);
        if (source == null || destination == null) {
            return MoveResult.stale(name);
        }
        int index = ReconciliationState.indexOf(source, name);
        if (index < 0) {
            return MoveResult.stale(name);
        }

        Receipt receipt = source.remove(index);
        DuplicateRemoval duplicates = duplicateGuard.removeDuplicates(duplicateGuard.findDuplicatesIn(to, name));
        if (to.isPool()) {
            receipt.clearConfidence();
        } else {
            receipt.setConfidence(confidence);
        }
        destination.add(receipt);
        return new MoveResult(MoveOutcome.MOVED, name, receipt.snapshot(), duplicates);
    }
}
