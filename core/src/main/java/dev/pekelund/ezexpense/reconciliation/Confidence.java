package dev.pekelund.ezexpense.reconciliation;

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Conversions between raw scorer output and the 0-100 confidence stored on attached receipts.
 * Scores at or below one are fractions, larger scores are already percentages.
 */
public final class Confidence {

    public static final int MIN = 0;
    public static final int MAX = 100;

    private Confidence() {
    }

    public static Integer fromScore(OptionalDouble score) {
        if (score == null || score.isEmpty()) {
            return null;
        }
        return fromScore(score.getAsDouble());
    }

    public static Integer fromScore(double score) {
        if (!Double.isFinite(score)) {
            return null;
        }
        double percentage = score <= 1.0 ? score * 100.0 : score;
        long rounded = Math.round(percentage);
        return (int) Math.max(MIN, Math.min(MAX, rounded));
    }

    /**
     * Returns the score as a fraction in {@code [0, 1]}, the scale the match threshold is expressed in.
     */
    public static double toFraction(double score) {
        double fraction = score <= 1.0 ? score : score / 100.0;
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    /**
     * Rounded mean of the defined confidences, or {@code null} when none is defined.
     */
    public static Integer average(Collection<Integer> confidences) {
        OptionalDouble mean = confidences.stream()
            .filter(Objects::nonNull)
            .mapToInt(Integer::intValue)
            .average();
        return mean.isPresent() ? (int) Math.round(mean.getAsDouble()) : null;
    }
}
