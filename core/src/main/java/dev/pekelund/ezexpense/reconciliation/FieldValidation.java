package dev.pekelund.ezexpense.reconciliation;

/**
 * Outcome of one rule for one field of one expense. {@code message} explains an invalid or
 * neutral result and is {@code null} for valid fields.
 */
public record FieldValidation(long expenseId, String field, FieldRole role, ValidationStatus status,
    String message) {

    static FieldValidation valid(long expenseId, String field, FieldRole role) {
        return new FieldValidation(expenseId, field, role, ValidationStatus.VALID, null);
    }

    static FieldValidation invalid(long expenseId, String field, FieldRole role, String message) {
        return new FieldValidation(expenseId, field, role, ValidationStatus.INVALID, message);
    }

    static FieldValidation neutral(long expenseId, String field, FieldRole role, String message) {
        return new FieldValidation(expenseId, field, role, ValidationStatus.NEUTRAL, message);
    }
}
