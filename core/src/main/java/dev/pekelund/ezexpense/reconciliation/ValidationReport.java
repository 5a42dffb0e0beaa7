package dev.pekelund.ezexpense.reconciliation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-field results for every expense plus their summary. Expense validity is derived here and
 * never stored on the expense.
 */
public record ValidationReport(List<FieldValidation> results, ValidationSummary summary) {

    public ValidationReport {
        results = List.copyOf(results);
    }

    static ValidationReport of(List<FieldValidation> results) {
        return new ValidationReport(results, ValidationSummary.of(results));
    }

    public List<FieldValidation> resultsFor(long expenseId) {
        return results.stream().filter(result -> result.expenseId() == expenseId).toList();
    }

    public boolean isExpenseValid(long expenseId) {
        return resultsFor(expenseId).stream().noneMatch(result -> result.status() == ValidationStatus.INVALID);
    }

    public Set<Long> invalidExpenseIds() {
        Set<Long> ids = new LinkedHashSet<>();
        for (FieldValidation result : results) {
            if (result.status() == ValidationStatus.INVALID) {
                ids.add(result.expenseId());
            }
        }
        return ids;
    }
}
