package dev.pekelund.ezexpense.reconciliation;

public record MoveResult(MoveOutcome outcome, String name, ReceiptSnapshot receipt, DuplicateRemoval duplicates) {

    static MoveResult sameContainer(String name) {
        return new MoveResult(MoveOutcome.SAME_CONTAINER, name, null, DuplicateRemoval.none());
    }

    static MoveResult stale(String name) {
        return new MoveResult(MoveOutcome.STALE, name, null, DuplicateRemoval.none());
    }

    public boolean moved() {
        return outcome == MoveOutcome.MOVED;
    }
}
