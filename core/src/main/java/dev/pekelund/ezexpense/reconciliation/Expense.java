package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Expense {

    private final long id;
    private final Map<String, String> fields = new LinkedHashMap<>();
    private final List<Receipt> attachments = new ArrayList<>();

    Expense(long id, Map<String, String> fields) {
        this.id = id;
        fields.forEach(this::put);
    }

    long id() {
        return id;
    }

    void put(String name, String value) {
        fields.put(name, value != null ? value : "");
    }

    List<Receipt> attachments() {
        return attachments;
    }

    ExpenseSnapshot snapshot() {
        return new ExpenseSnapshot(id, fields, attachments.stream().map(Receipt::snapshot).toList());
    }
}
