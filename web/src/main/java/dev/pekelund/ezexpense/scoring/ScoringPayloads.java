package dev.pekelund.ezexpense.scoring;

import dev.pekelund.ezexpense.reconciliation.ExpenseSnapshot;
import dev.pekelund.ezexpense.reconciliation.ReceiptSnapshot;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * JSON shapes shared by the scoring and bulk matching requests.
 */
final class ScoringPayloads {

    private ScoringPayloads() {
    }

    static Map<String, Object> receipt(ReceiptSnapshot receipt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", receipt.name());
        payload.put("storageRef", receipt.reference().location());
        payload.put("kind", receipt.kind().name().toLowerCase(Locale.ROOT));
        payload.put("contentType", receipt.contentType());
        if (receipt.details() != null) {
            payload.put("extractedDetails", receipt.details());
        }
        if (receipt.confidence() != null) {
            payload.put("confidence", receipt.confidence());
        }
        return payload;
    }

    static Map<String, Object> expense(ExpenseSnapshot expense) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", expense.id());
        payload.put("fields", expense.fields());
        payload.put("attachments", expense.attachments().stream().map(ScoringPayloads::receipt).toList());
        return payload;
    }
}
