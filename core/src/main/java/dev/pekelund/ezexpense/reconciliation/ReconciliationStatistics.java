package dev.pekelund.ezexpense.reconciliation;

/**
 * Progress figures for the reconciliation session.
 *
 * @param totalExpenses number of expenses
 * @param attachedReceipts receipts sitting in any attachment list
 * @param expensesWithReceipts expenses with at least one attachment
 * @param poolSize receipts still waiting in the pool
 * @param completionRate percentage of expenses with at least one attachment, 0 without expenses
 */
public record ReconciliationStatistics(
    int totalExpenses,
    int attachedReceipts,
    int expensesWithReceipts,
    int poolSize,
    int completionRate
) {

    static ReconciliationStatistics of(ReconciliationSnapshot snapshot) {
        int totalExpenses = snapshot.expenses().size();
        int attached = 0;
        int withReceipts = 0;
        for (ExpenseSnapshot expense : snapshot.expenses()) {
            attached += expense.attachmentCount();
            if (expense.attachmentCount() > 0) {
                withReceipts++;
            }
        }
        int rate = totalExpenses == 0 ? 0 : (int) Math.round(100.0 * withReceipts / totalExpenses);
        return new ReconciliationStatistics(totalExpenses, attached, withReceipts, snapshot.pool().size(), rate);
    }
}
