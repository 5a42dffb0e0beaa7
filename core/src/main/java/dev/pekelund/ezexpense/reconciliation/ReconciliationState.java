package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The pool and every attachment list. Not thread-safe; {@link ReconciliationAggregate} serializes access.
 */
final class ReconciliationState {

    private final List<Receipt> pool = new ArrayList<>();
    private final Map<Long, Expense> expenses = new LinkedHashMap<>();

    List<Receipt> pool() {
        return pool;
    }

    Collection<Expense> expenses() {
        return expenses.values();
    }

    Optional<Expense> expense(long id) {
        return Optional.ofNullable(expenses.get(id));
    }

    void addExpense(Expense expense) {
        expenses.put(expense.id(), expense);
    }

    Expense removeExpense(long id) {
        return expenses.remove(id);
    }

    /**
     * Returns the live list behind {@code ref}, or {@code null} when it names an expense that no longer exists.
     */
    List<Receipt> container(ContainerRef ref) {
        if (ref.isPool()) {
            return pool;
        }
        Expense expense = expenses.get(ref.expenseId());
        return expense != null ? expense.attachments() : null;
    }

    Optional<ContainerRef> locate(String name) {
        if (indexOf(pool, name) >= 0) {
            return Optional.of(ContainerRef.pool());
        }
        for (Expense expense : expenses.values()) {
            if (indexOf(expense.attachments(), name) >= 0) {
                return Optional.of(ContainerRef.expense(expense.id()));
            }
        }
        return Optional.empty();
    }

    Optional<Receipt> find(String name) {
        return locate(name).map(ref -> {
            List<Receipt> receipts = container(ref);
            return receipts.get(indexOf(receipts, name));
        });
    }

    int totalReceipts() {
        int total = pool.size();
        for (Expense expense : expenses.values()) {
            total += expense.attachments().size();
        }
        return total;
    }

    ReconciliationSnapshot snapshot() {
        return new ReconciliationSnapshot(
            pool.stream().map(Receipt::snapshot).toList(),
            expenses.values().stream().map(Expense::snapshot).toList());
    }

    static int indexOf(List<Receipt> receipts, String name) {
        for (int i = 0; i < receipts.size(); i++) {
            if (receipts.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
