package dev.pekelund.ezexpense.reconciliation;

import java.math.BigDecimal;

/**
 * Details extracted from a receipt by the content-extraction service. Every value is optional.
 *
 * @param amount total amount printed on the receipt
 * @param currency ISO currency code, when the extractor found one
 * @param date invoice date as printed, normally {@code yyyy-MM-dd}
 * @param category expense category suggested by the extractor
 * @param merchant merchant or vendor name
 * @param description free-text additional information
 * @param refund whether the document is a refund rather than a purchase
 */
public record InvoiceDetails(
    BigDecimal amount,
    String currency,
    String date,
    String category,
    String merchant,
    String description,
    boolean refund
) {
}
