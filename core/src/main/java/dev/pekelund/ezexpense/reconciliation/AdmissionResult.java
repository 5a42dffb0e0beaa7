package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * @param admitted receipts now present in the target container
 * @param duplicates receipts removed to make room for the admitted ones
 * @param discarded candidates dropped because the target expense no longer exists
 */
public record AdmissionResult(
    List<ReceiptSnapshot> admitted,
    DuplicateRemoval duplicates,
    List<ReceiptCandidate> discarded
) {

    public AdmissionResult {
        admitted = List.copyOf(admitted);
        discarded = List.copyOf(discarded);
    }
}
