package dev.pekelund.ezexpense.reconciliation;

public enum MoveOutcome {
    /** The receipt left the source and sits in the destination. */
    MOVED,
    /** Source and destination are the same container; nothing changed. */
    SAME_CONTAINER,
    /** The receipt or the destination changed since the move was requested; nothing changed. */
    STALE
}
