package dev.pekelund.ezexpense.reconciliation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of one expense: its stable identifier, fields in import order and current
 * attachment list.
 */
public record ExpenseSnapshot(long id, Map<String, String> fields, List<ReceiptSnapshot> attachments) {

    public ExpenseSnapshot {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        attachments = List.copyOf(attachments);
    }

    public int attachmentCount() {
        return attachments.size();
    }
}
