package dev.pekelund.ezexpense.reconciliation;

public class ExpenseNotFoundException extends RuntimeException {

    private final long expenseId;

    public ExpenseNotFoundException(long expenseId) {
        super("No expense with id " + expenseId);
        this.expenseId = expenseId;
    }

    public long getExpenseId() {
        return expenseId;
    }
}
