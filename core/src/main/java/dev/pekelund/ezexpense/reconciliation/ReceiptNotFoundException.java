package dev.pekelund.ezexpense.reconciliation;

public class ReceiptNotFoundException extends RuntimeException {

    private final String receiptName;

    public ReceiptNotFoundException(String receiptName) {
        super("No receipt named '" + receiptName + "'");
        this.receiptName = receiptName;
    }

    public ReceiptNotFoundException(String receiptName, ContainerRef container) {
        super("No receipt named '" + receiptName + "' in " + container);
        this.receiptName = receiptName;
    }

    public String getReceiptName() {
        return receiptName;
    }
}
