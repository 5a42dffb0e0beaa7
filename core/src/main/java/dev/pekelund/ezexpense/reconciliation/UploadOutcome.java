package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * @param admitted receipts now in the target container
 * @param rejected files refused by a local rule or by storage
 * @param duplicates names of existing receipts removed in favour of the new uploads
 * @param supersededInBatch names repeated within the batch, of which only the last upload was kept
 * @param discarded names dropped because the target expense was deleted during the upload
 */
public record UploadOutcome(
    List<ReceiptSnapshot> admitted,
    List<UploadRejection> rejected,
    List<String> duplicates,
    List<String> supersededInBatch,
    List<String> discarded
) {

    public UploadOutcome {
        admitted = List.copyOf(admitted);
        rejected = List.copyOf(rejected);
        duplicates = List.copyOf(duplicates);
        supersededInBatch = List.copyOf(supersededInBatch);
        discarded = List.copyOf(discarded);
    }
}
