package dev.pekelund.ezexpense.reconciliation;

/**
 * Attach receipt {@code receiptName} to expense {@code expenseId} with {@code confidence} (0-100 or {@code null}).
 */
public record MatchAssignment(String receiptName, long expenseId, Integer confidence) {
}
