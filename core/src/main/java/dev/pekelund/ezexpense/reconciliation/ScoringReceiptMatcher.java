package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy bulk matcher. Every (expense, receipt) pair is scored in parallel; pairs at or above the
 * threshold are walked by descending score, ties broken by pool order and then expense order, and
 * each receipt is assigned to the first expense it reaches. An expense may receive several receipts.
 */
public class ScoringReceiptMatcher implements ReceiptMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScoringReceiptMatcher.class);

    private final ConfidenceScorer scorer;
    private final Executor executor;
    private final double threshold;

    public ScoringReceiptMatcher(ConfidenceScorer scorer, Executor executor, double threshold) {
        this.scorer = scorer;
        this.executor = executor;
        this.threshold = threshold;
    }

    @Override
    public MatchPlan match(List<ReceiptSnapshot> pool, List<ExpenseSnapshot> expenses) {
        if (pool.isEmpty() || expenses.isEmpty()) {
            return new MatchPlan(List.of(), pool.stream().map(ReceiptSnapshot::name).toList());
        }

        List<CompletableFuture<PairScore>> futures = new ArrayList<>(pool.size() * expenses.size());
        for (int receiptIndex = 0; receiptIndex < pool.size(); receiptIndex++) {
            for (int expenseIndex = 0; expenseIndex < expenses.size(); expenseIndex++) {
                int r = receiptIndex;
                int e = expenseIndex;
                futures.add(CompletableFuture.supplyAsync(() -> score(pool, expenses, r, e), executor));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<PairScore> scores = futures.stream().map(CompletableFuture::join).toList();

        long failures = scores.stream().filter(PairScore::failed).count();
        if (failures == scores.size()) {
            throw new MatchingServiceException(
                "Confidence scoring failed for all %d candidate pairs".formatted(scores.size()));
        }
        if (failures > 0) {
            LOGGER.warn("Confidence scoring failed for {} of {} candidate pairs", failures, scores.size());
        }

        List<PairScore> accepted = scores.stream()
            .filter(pair -> pair.score() != null && Confidence.toFraction(pair.score()) >= threshold)
            .sorted(Comparator.comparingDouble((PairScore pair) -> Confidence.toFraction(pair.score())).reversed()
                .thenComparingInt(PairScore::receiptIndex)
                .thenComparingInt(PairScore::expenseIndex))
            .toList();

        Set<Integer> assignedReceipts = new HashSet<>();
        List<MatchAssignment> assignments = new ArrayList<>();
        for (PairScore pair : accepted) {
            if (!assignedReceipts.add(pair.receiptIndex())) {
                continue;
            }
            assignments.add(new MatchAssignment(pool.get(pair.receiptIndex()).name(),
                expenses.get(pair.expenseIndex()).id(), Confidence.fromScore(pair.score())));
        }

        List<String> unmatched = new ArrayList<>();
        for (int i = 0; i < pool.size(); i++) {
            if (!assignedReceipts.contains(i)) {
                unmatched.add(pool.get(i).name());
            }
        }
        LOGGER.info("Matched {} of {} pool receipts against {} expenses", assignments.size(), pool.size(),
            expenses.size());
        return new MatchPlan(assignments, unmatched);
    }

    private PairScore score(List<ReceiptSnapshot> pool, List<ExpenseSnapshot> expenses, int receiptIndex,
        int expenseIndex) {
        ReceiptSnapshot receipt = pool.get(receiptIndex);
        ExpenseSnapshot expense = expenses.get(expenseIndex);
        try {
            OptionalDouble score = scorer.score(expense, receipt);
            Double value = score != null && score.isPresent() && Double.isFinite(score.getAsDouble())
                ? score.getAsDouble()
                : null;
            return new PairScore(receiptIndex, expenseIndex, value, false);
        } catch (RuntimeException ex) {
            LOGGER.debug("Scoring receipt '{}' against expense {} failed", receipt.name(), expense.id(), ex);
            return new PairScore(receiptIndex, expenseIndex, null, true);
        }
    }

    private record PairScore(int receiptIndex, int expenseIndex, Double score, boolean failed) {
    }
}
