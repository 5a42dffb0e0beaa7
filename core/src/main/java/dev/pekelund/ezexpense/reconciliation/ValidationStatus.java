package dev.pekelund.ezexpense.reconciliation;

public enum ValidationStatus {
    VALID,
    INVALID,
    /** Not subject to a rule: not editable, unrecognized, or the rule could not be evaluated. */
    NEUTRAL
}
