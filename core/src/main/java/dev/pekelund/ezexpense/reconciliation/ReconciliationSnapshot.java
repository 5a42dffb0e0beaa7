package dev.pekelund.ezexpense.reconciliation;

import java.util.List;
import java.util.Optional;

public record ReconciliationSnapshot(List<ReceiptSnapshot> pool, List<ExpenseSnapshot> expenses) {

    public ReconciliationSnapshot {
        pool = List.copyOf(pool);
        expenses = List.copyOf(expenses);
    }

    public Optional<ExpenseSnapshot> expense(long id) {
        return expenses.stream().filter(expense -> expense.id() == id).findFirst();
    }

    public int totalReceipts() {
        return pool.size() + expenses.stream().mapToInt(ExpenseSnapshot::attachmentCount).sum();
    }
}
