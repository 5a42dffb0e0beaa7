package dev.pekelund.ezexpense.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.ezexpense.storage.StoredReceiptReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ExpenseValidatorTest {

    private final ExpenseValidator validator = new ExpenseValidator(() -> List.of("Meals", "Travel"));

    @Test
    void datesMustExistInTheCalendar() {
        assertThat(ExpenseValidator.isCalendarDate("2024-02-29")).isTrue();
        assertThat(ExpenseValidator.isCalendarDate("2023-02-29")).isFalse();
        assertThat(ExpenseValidator.isCalendarDate("2024-02-30")).isFalse();
        assertThat(ExpenseValidator.isCalendarDate("2024-2-03")).isFalse();
        assertThat(ExpenseValidator.isCalendarDate("03/02/2024")).isFalse();
        assertThat(ExpenseValidator.isCalendarDate("")).isFalse();
    }

    @Test
    void amountsMustBeFiniteNumbers() {
        assertThat(ExpenseValidator.isFiniteNumber("12.50")).isTrue();
        assertThat(ExpenseValidator.isFiniteNumber("-3")).isTrue();
        assertThat(ExpenseValidator.isFiniteNumber(" 1e3 ")).isTrue();
        assertThat(ExpenseValidator.isFiniteNumber("1e999")).isFalse();
        assertThat(ExpenseValidator.isFiniteNumber("Infinity")).isFalse();
        assertThat(ExpenseValidator.isFiniteNumber("12,50")).isFalse();
        assertThat(ExpenseValidator.isFiniteNumber("")).isFalse();
    }

    @Test
    void validatesEachRecognizedRole() {
        ReconciliationSnapshot snapshot = snapshot(expense(1, fields(
            "Date", "2024-02-30",
            "Amount", "abc",
            "Expense category", "meals",
            "Merchant", "   ",
            "Additional information", "Team lunch",
            "Import batch", "x")));

        ValidationReport report = validator.validate(snapshot, null);

        assertThat(status(report, "Date")).isEqualTo(ValidationStatus.INVALID);
        assertThat(status(report, "Amount")).isEqualTo(ValidationStatus.INVALID);
        assertThat(status(report, "Expense category")).isEqualTo(ValidationStatus.VALID);
        assertThat(status(report, "Merchant")).isEqualTo(ValidationStatus.INVALID);
        assertThat(status(report, "Additional information")).isEqualTo(ValidationStatus.VALID);
        assertThat(status(report, "Import batch")).isEqualTo(ValidationStatus.NEUTRAL);
        assertThat(report.isExpenseValid(1)).isFalse();
        assertThat(report.invalidExpenseIds()).containsExactly(1L);
    }

    @Test
    void categoryIsCaseInsensitiveAndRequired() {
        ValidationReport report = validator.validate(snapshot(
            expense(1, fields("Expense category", "TRAVEL")),
            expense(2, fields("Expense category", "")),
            expense(3, fields("Expense category", "Hotel"))), null);

        assertThat(report.resultsFor(1).get(0).status()).isEqualTo(ValidationStatus.VALID);
        assertThat(report.resultsFor(2).get(0).status()).isEqualTo(ValidationStatus.INVALID);
        assertThat(report.resultsFor(3).get(0).status()).isEqualTo(ValidationStatus.INVALID);
    }

    @Test
    void nonEditableFieldsAreNeutral() {
        ReconciliationSnapshot snapshot = snapshot(expense(1, fields("Date", "nope", "Amount", "5")));

        ValidationReport report = validator.validate(snapshot, Set.of("Amount"));

        assertThat(status(report, "Date")).isEqualTo(ValidationStatus.NEUTRAL);
        assertThat(status(report, "Amount")).isEqualTo(ValidationStatus.VALID);
        assertThat(report.isExpenseValid(1)).isTrue();
    }

    @Test
    void declaredYesIsValidOnlyWithoutTrackedAttachments() {
        ValidationReport report = validator.validate(snapshot(
            expense(1, fields("Receipts attached", "Yes")),
            expenseWithAttachments(2, fields("Receipts attached", "Yes"), 1)), Set.of());

        assertThat(report.resultsFor(1).get(0).status()).isEqualTo(ValidationStatus.VALID);
        assertThat(report.resultsFor(2).get(0).status()).isEqualTo(ValidationStatus.INVALID);
    }

    @Test
    void declaredNoIsValidOnlyWithTrackedAttachments() {
        ValidationReport report = validator.validate(snapshot(
            expense(1, fields("Receipts attached", "no")),
            expenseWithAttachments(2, fields("Receipts attached", "No"), 2),
            expense(3, fields("Receipts attached", "")),
            expense(4, fields("Receipts attached", "maybe"))), null);

        assertThat(report.resultsFor(1).get(0).status()).isEqualTo(ValidationStatus.INVALID);
        assertThat(report.resultsFor(2).get(0).status()).isEqualTo(ValidationStatus.VALID);
        assertThat(report.resultsFor(3).get(0).status()).isEqualTo(ValidationStatus.NEUTRAL);
        assertThat(report.resultsFor(4).get(0).status()).isEqualTo(ValidationStatus.INVALID);
    }

    @Test
    void summaryGroupsCountsByRuleKind() {
        ValidationReport report = validator.validate(snapshot(
            expense(1, fields("Date", "2024-01-01", "Merchant", "Cafe")),
            expense(2, fields("Date", "2024-13-01", "Merchant", ""))), null);

        ValidationSummary summary = report.summary();

        assertThat(summary.counts(FieldRole.DATE)).isEqualTo(new ValidationSummary.RuleCounts(1, 1, 0));
        assertThat(summary.counts(FieldRole.REQUIRED_TEXT)).isEqualTo(new ValidationSummary.RuleCounts(1, 1, 0));
        assertThat(summary.counts(FieldRole.AMOUNT)).isEqualTo(new ValidationSummary.RuleCounts(0, 0, 0));
        assertThat(summary.totalInvalid()).isEqualTo(2);
    }

    @Test
    void categoriesAreFetchedOnce() {
        AtomicInteger calls = new AtomicInteger();
        ExpenseValidator cachingValidator = new ExpenseValidator(() -> {
            calls.incrementAndGet();
            return List.of("Meals");
        });
        ReconciliationSnapshot snapshot = snapshot(expense(1, fields("Expense category", "Meals")));

        cachingValidator.validate(snapshot, null);
        cachingValidator.validate(snapshot, null);

        assertThat(calls).hasValue(1);
    }

    @Test
    void unavailableCategoriesAreReportedNeutralAndRetried() {
        AtomicInteger calls = new AtomicInteger();
        ExpenseValidator flakyValidator = new ExpenseValidator(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("catalog down");
            }
            return List.of("Meals");
        });
        ReconciliationSnapshot snapshot = snapshot(expense(1, fields("Expense category", "Meals")));

        assertThat(status(flakyValidator.validate(snapshot, null), "Expense category"))
            .isEqualTo(ValidationStatus.NEUTRAL);
        assertThat(status(flakyValidator.validate(snapshot, null), "Expense category"))
            .isEqualTo(ValidationStatus.VALID);
    }

    @Test
    void fieldRolesAreResolvedFromNames() {
        assertThat(FieldRole.of("Date")).isEqualTo(FieldRole.DATE);
        assertThat(FieldRole.of("Expense category")).isEqualTo(FieldRole.CATEGORY);
        assertThat(FieldRole.of("Amount")).isEqualTo(FieldRole.AMOUNT);
        assertThat(FieldRole.of("Merchant")).isEqualTo(FieldRole.REQUIRED_TEXT);
        assertThat(FieldRole.of("Receipts attached")).isEqualTo(FieldRole.ATTACHMENT_FLAG);
        assertThat(FieldRole.of("Payment method")).isEqualTo(FieldRole.UNRECOGNIZED);
    }

    private static ValidationStatus status(ValidationReport report, String field) {
        return report.results().stream()
            .filter(result -> result.field().equals(field))
            .findFirst()
            .orElseThrow()
            .status();
    }

    private static Map<String, String> fields(String... pairs) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            fields.put(pairs[i], pairs[i + 1]);
        }
        return fields;
    }

    private static ExpenseSnapshot expense(long id, Map<String, String> fields) {
        return new ExpenseSnapshot(id, fields, List.of());
    }

    private static ExpenseSnapshot expenseWithAttachments(long id, Map<String, String> fields, int count) {
        List<ReceiptSnapshot> attachments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            attachments.add(new ReceiptSnapshot("r" + id + "-" + i + ".pdf", ReceiptKind.DOCUMENT, "application/pdf",
                1, new StoredReceiptReference("local", "r" + i), null, 50));
        }
        return new ExpenseSnapshot(id, fields, attachments);
    }

    private static ReconciliationSnapshot snapshot(ExpenseSnapshot... expenses) {
        return new ReconciliationSnapshot(List.of(), List.of(expenses));
    }
}
