package dev.pekelund.ezexpense.reconciliation;

public record ReceiptContent(ReceiptSnapshot receipt, byte[] bytes) {
}
