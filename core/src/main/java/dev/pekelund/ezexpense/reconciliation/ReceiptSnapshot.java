package dev.pekelund.ezexpense.reconciliation;

import dev.pekelund.ezexpense.storage.StoredReceiptReference;

/**
 * Immutable view of one receipt. {@code confidence} is {@code null} for pool receipts and for
 * attached receipts whose score is unknown.
 */
public record ReceiptSnapshot(
    String name,
    ReceiptKind kind,
    String contentType,
    long size,
    StoredReceiptReference reference,
    InvoiceDetails details,
    Integer confidence
) {
}
