package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.List;

/**
 * Receipts removed by the duplicate guard, reported to the user as an informational notice.
 */
public record DuplicateRemoval(List<ReceiptSnapshot> removed) {

    private static final DuplicateRemoval NONE = new DuplicateRemoval(List.of());

    public DuplicateRemoval {
        removed = List.copyOf(removed);
    }

    public static DuplicateRemoval none() {
        return NONE;
    }

    public int count() {
        return removed.size();
    }

    public List<String> names() {
        return removed.stream().map(ReceiptSnapshot::name).toList();
    }

    public DuplicateRemoval merge(DuplicateRemoval other) {
        if (other == null || other.count() == 0) {
            return this;
        }
        if (removed.isEmpty()) {
            return other;
        }
        List<ReceiptSnapshot> merged = new ArrayList<>(removed);
        merged.addAll(other.removed());
        return new DuplicateRemoval(merged);
    }
}
