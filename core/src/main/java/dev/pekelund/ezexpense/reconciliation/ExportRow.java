package dev.pekelund.ezexpense.reconciliation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One expense as handed to the export collaborator, with the derived receipt columns.
 *
 * @param receiptNames attachment names joined with {@code "; "}
 * @param receiptCount number of attachments
 * @param receiptConfidence rounded mean of the known confidences, {@code null} when none is known
 */
public record ExportRow(
    long id,
    Map<String, String> fields,
    List<ReceiptSnapshot> attachments,
    String receiptNames,
    int receiptCount,
    Integer receiptConfidence
) {

    static final String NAME_SEPARATOR = "; ";

    public ExportRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        attachments = List.copyOf(attachments);
    }

    static ExportRow of(ExpenseSnapshot expense) {
        List<ReceiptSnapshot> attachments = expense.attachments();
        String names = String.join(NAME_SEPARATOR, attachments.stream().map(ReceiptSnapshot::name).toList());
        Integer confidence = Confidence.average(attachments.stream().map(ReceiptSnapshot::confidence).toList());
        return new ExportRow(expense.id(), expense.fields(), attachments, names, attachments.size(), confidence);
    }
}
