package dev.pekelund.ezexpense.reconciliation;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum ReceiptKind {
    IMAGE,
    DOCUMENT;

    public static ReceiptKind fromContentType(String contentType) {
        if (StringUtils.hasText(contentType) && contentType.trim().toLowerCase(Locale.ROOT).startsWith("image/")) {
            return IMAGE;
        }
        return DOCUMENT;
    }
}
