package dev.pekelund.ezexpense.reconciliation;

import dev.pekelund.ezexpense.storage.ReceiptUpload;
import java.util.List;

/**
 * Upload one or more files into the pool ({@code expenseId == null}) or onto one expense.
 * Files are listed in upload order; for repeated names the last one wins.
 */
public record UploadReceipts(List<ReceiptUpload> files, Long expenseId) {

    public UploadReceipts {
        files = List.copyOf(files);
    }

    public ContainerRef target() {
        return ContainerRef.of(expenseId);
    }
}
