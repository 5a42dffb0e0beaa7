package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

public record ExportSnapshot(List<ExportRow> expenses) {

    public ExportSnapshot {
        expenses = List.copyOf(expenses);
    }

    static ExportSnapshot of(ReconciliationSnapshot snapshot) {
        return new ExportSnapshot(snapshot.expenses().stream().map(ExportRow::of).toList());
    }
}
