package dev.pekelund.ezexpense.reconciliation;

/**
 * Match the whole pool against every expense in one round.
 */
public record RunBulkMatch() {
}
