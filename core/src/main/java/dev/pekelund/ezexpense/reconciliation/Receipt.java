package dev.pekelund.ezexpense.reconciliation;

import dev.pekelund.ezexpense.storage.StoredReceiptReference;

/**
 * Live receipt owned by exactly one container of a {@link ReconciliationState}.
 */
final class Receipt {

    private final String name;
    private final ReceiptKind kind;
    private final String contentType;
    private final long size;
    private final StoredReceiptReference reference;
    private InvoiceDetails details;
    private Integer confidence;

    Receipt(ReceiptCandidate candidate) {
        this.name = candidate.name();
        this.kind = ReceiptKind.fromContentType(candidate.contentType());
        this.contentType = candidate.contentType();
        this.size = candidate.size();
        this.reference = candidate.reference();
        this.details = candidate.details();
    }

    String name() {
        return name;
    }

    StoredReceiptReference reference() {
        return reference;
    }

    Integer confidence() {
        return confidence;
    }

    void setConfidence(Integer confidence) {
        this.confidence = confidence;
    }

    void clearConfidence() {
        this.confidence = null;
    }

    void setDetails(InvoiceDetails details) {
        this.details = details;
    }

    ReceiptSnapshot snapshot() {
        return new ReceiptSnapshot(name, kind, contentType, size, reference, details, confidence);
    }
}
