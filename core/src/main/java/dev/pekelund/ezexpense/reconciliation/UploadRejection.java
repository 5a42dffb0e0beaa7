package dev.pekelund.ezexpense.reconciliation;

/**
 * One file of a batch that was not admitted. Its siblings are unaffected.
 */
public record UploadRejection(String filename, String reason) {
}
