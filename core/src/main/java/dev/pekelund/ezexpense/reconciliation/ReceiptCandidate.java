package dev.pekelund.ezexpense.reconciliation;

import dev.pekelund.ezexpense.storage.StoredReceiptReference;
import java.util.Objects;

/**
 * A stored upload waiting to be admitted. {@code confidence} only applies when the target is an expense.
 */
public record ReceiptCandidate(
    String name,
    String contentType,
    long size,
    StoredReceiptReference reference,
    InvoiceDetails details,
    Integer confidence
) {

    public ReceiptCandidate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reference, "reference");
    }

    public ReceiptCandidate withConfidence(Integer value) {
        return new ReceiptCandidate(name, contentType, size, reference, details, value);
    }

    /**
     * The receipt as the scorer sees it before admission.
     */
    public ReceiptSnapshot preview() {
        return new ReceiptSnapshot(name, ReceiptKind.fromContentType(contentType), contentType, size, reference,
            details, null);
    }
}
