package dev.pekelund.ezexpense.reconciliation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result counts grouped by rule kind.
 */
public record ValidationSummary(Map<FieldRole, RuleCounts> byRole) {

    public ValidationSummary {
        byRole = Collections.unmodifiableMap(new EnumMap<>(byRole));
    }

    static ValidationSummary of(List<FieldValidation> results) {
        Map<FieldRole, RuleCounts> counts = new EnumMap<>(FieldRole.class);
        for (FieldValidation result : results) {
            counts.merge(result.role(), RuleCounts.of(result.status()), RuleCounts::plus);
        }
        return new ValidationSummary(counts);
    }

    public RuleCounts counts(FieldRole role) {
        return byRole.getOrDefault(role, RuleCounts.ZERO);
    }

    public int totalInvalid() {
        return byRole.values().stream().mapToInt(RuleCounts::invalid).sum();
    }

    public record RuleCounts(int valid, int invalid, int neutral) {

        static final RuleCounts ZERO = new RuleCounts(0, 0, 0);

        static RuleCounts of(ValidationStatus status) {
            return switch (status) {
                case VALID -> new RuleCounts(1, 0, 0);
                case INVALID -> new RuleCounts(0, 1, 0);
                case NEUTRAL -> new RuleCounts(0, 0, 1);
            };
        }

        RuleCounts plus(RuleCounts other) {
            return new RuleCounts(valid + other.valid, invalid + other.invalid, neutral + other.neutral);
        }
    }
}
