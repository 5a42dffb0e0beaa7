package dev.pekelund.ezexpense.reconciliation;

/**
 * Names one container: the pool when {@code expenseId} is {@code null}, otherwise the attachment
 * list of that expense.
 */
public record ContainerRef(Long expenseId) {

    private static final ContainerRef POOL = new ContainerRef(null);

    public static ContainerRef pool() {
        return POOL;
    }

    public static ContainerRef expense(long expenseId) {
        return new ContainerRef(expenseId);
    }

    public static ContainerRef of(Long expenseId) {
        return expenseId == null ? POOL : new ContainerRef(expenseId);
    }

    public boolean isPool() {
        return expenseId == null;
    }

    @Override
    public String toString() {
        return isPool() ? "pool" : "expense " + expenseId;
    }
}
