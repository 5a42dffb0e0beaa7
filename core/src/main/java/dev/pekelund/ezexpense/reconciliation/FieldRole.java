package dev.pekelund.ezexpense.reconciliation;

import java.util.List;
import java.util.Locale;

/**
 * Semantic role of an expense field, inferred from its name.
 */
public enum FieldRole {
    DATE,
    CATEGORY,
    AMOUNT,
    REQUIRED_TEXT,
    ATTACHMENT_FLAG,
    UNRECOGNIZED;

    private static final List<String> REQUIRED_TEXT_MARKERS =
        List.of("merchant", "description", "additional information", "purpose");

    public static FieldRole of(String fieldName) {
        if (fieldName == null) {
            return UNRECOGNIZED;
        }
        String name = fieldName.trim().toLowerCase(Locale.ROOT);
        if (name.contains("receipt") && name.contains("attached")) {
            return ATTACHMENT_FLAG;
        }
        if (name.contains("date")) {
            return DATE;
        }
        if (name.contains("category")) {
            return CATEGORY;
        }
        if (name.contains("amount")) {
            return AMOUNT;
        }
        for (String marker : REQUIRED_TEXT_MARKERS) {
            if (name.contains(marker)) {
                return REQUIRED_TEXT;
            }
        }
        return UNRECOGNIZED;
    }
}
