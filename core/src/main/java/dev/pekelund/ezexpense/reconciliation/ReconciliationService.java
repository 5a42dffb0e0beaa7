package dev.pekelund.ezexpense.reconciliation;

import dev.pekelund.ezexpense.storage.ReceiptStorageException;
import dev.pekelund.ezexpense.storage.ReceiptStorageService;
import dev.pekelund.ezexpense.storage.ReceiptUpload;
import dev.pekelund.ezexpense.storage.StoredReceiptReference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Handles reconciliation commands. Calls to storage and to the confidence scorer happen outside the
 * aggregate monitor; batches fan out on the executor and their results are applied to the
 * aggregate in one step once every call has completed.
 */
public class ReconciliationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationService.class);

    private final ReconciliationAggregate aggregate;
    private final ReceiptStorageService storageService;
    private final ConfidenceScorer scorer;
    private final ReceiptMatcher matcher;
    private final ExpenseValidator validator;
    private final Executor executor;
    private final ReconciliationProperties properties;

    public ReconciliationService(ReconciliationAggregate aggregate, ReceiptStorageService storageService,
        ConfidenceScorer scorer, ReceiptMatcher matcher, ExpenseValidator validator, Executor executor,
        ReconciliationProperties properties) {
        this.aggregate = aggregate;
        this.storageService = storageService;
        this.scorer = scorer;
        this.matcher = matcher;
        this.validator = validator;
        this.executor = executor;
        this.properties = properties;
    }

    public List<ExpenseSnapshot> importExpenses(List<Map<String, String>> rows) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("import")) {
            return aggregate.importExpenses(rows);
        }
    }

    public ExpenseSnapshot addExpense(Map<String, String> fields) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("add-expense")) {
            ExpenseSnapshot expense = aggregate.addExpense(fields);
            LOGGER.info("Added expense {}", expense.id());
            return expense;
        }
    }

    public ExpenseSnapshot editFields(long expenseId, Map<String, String> changes) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("edit-expense")) {
            ReconciliationMdc.attachExpense(expenseId);
            return aggregate.editFields(expenseId, changes);
        }
    }

    public List<ExpenseSnapshot> deleteExpenses(Collection<Long> expenseIds) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("delete-expenses")) {
            List<ExpenseSnapshot> deleted = aggregate.deleteExpenses(expenseIds);
            deleted.forEach(expense -> expense.attachments().forEach(this::deleteStoredQuietly));
            return deleted;
        }
    }

    public UploadOutcome upload(UploadReceipts command) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("upload")) {
            ContainerRef target = command.target();
            ReconciliationMdc.attachContainer(target);
            if (!target.isPool() && !aggregate.hasExpense(target.expenseId())) {
                throw new ExpenseNotFoundException(target.expenseId());
            }

            List<UploadRejection> rejected = new ArrayList<>();
            List<String> superseded = new ArrayList<>();
            Map<String, ReceiptUpload> accepted = new LinkedHashMap<>();
            for (ReceiptUpload upload : command.files()) {
                String reason = rejectionReason(upload);
                if (reason != null) {
                    LOGGER.info("Rejected upload '{}': {}", upload.filename(), reason);
                    rejected.add(new UploadRejection(upload.filename(), reason));
                    continue;
                }
                if (accepted.remove(upload.filename()) != null) {
                    superseded.add(upload.filename());
                }
                accepted.put(upload.filename(), upload);
            }

            List<ReceiptCandidate> candidates = store(accepted.values(), rejected);

            // Same-named receipts go before any scoring call is issued for the batch.
            DuplicateRemoval duplicates =
                aggregate.removeDuplicates(candidates.stream().map(ReceiptCandidate::name).toList());

            if (!target.isPool()) {
                ExpenseSnapshot expense = aggregate.findExpense(target.expenseId()).orElse(null);
                if (expense != null) {
                    candidates = scoreAll(expense, candidates);
                }
            }

            AdmissionResult admission = aggregate.admit(candidates, target);
            duplicates = duplicates.merge(admission.duplicates());
            duplicates.removed().forEach(this::deleteStoredQuietly);
            admission.discarded().forEach(candidate -> deleteStoredQuietly(candidate.reference()));

            LOGGER.info("Upload to {} admitted {} receipts, rejected {}, removed {} duplicates", target,
                admission.admitted().size(), rejected.size(), duplicates.count());
            return new UploadOutcome(admission.admitted(), rejected, duplicates.names(), superseded,
                admission.discarded().stream().map(ReceiptCandidate::name).toList());
        }
    }

    public MoveResult move(MoveReceipt command) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("move")) {
            ReconciliationMdc.attachReceipt(command.name());
            ReconciliationMdc.attachContainer(command.to());
            if (command.from().equals(command.to())) {
                return MoveResult.sameContainer(command.name());
            }
            ContainerRef current = aggregate.locate(command.name())
                .orElseThrow(() -> new ReceiptNotFoundException(command.name()));
            if (!current.equals(command.from())) {
                throw new ReceiptNotFoundException(command.name(), command.from());
            }

            Integer confidence = null;
            if (!command.to().isPool()) {
                long expenseId = command.to().expenseId();
                ExpenseSnapshot destination = aggregate.findExpense(expenseId)
                    .orElseThrow(() -> new ExpenseNotFoundException(expenseId));
                ReceiptSnapshot receipt = aggregate.findReceipt(command.name())
                    .orElseThrow(() -> new ReceiptNotFoundException(command.name()));
                confidence = scoreQuietly(destination, receipt);
            }

            MoveResult result = aggregate.relocate(command.name(), command.from(), command.to(), confidence);
            if (result.outcome() == MoveOutcome.STALE) {
                LOGGER.warn("Discarding move of '{}' from {} to {}; the state changed while scoring",
                    command.name(), command.from(), command.to());
            } else {
                result.duplicates().removed().forEach(this::deleteStoredQuietly);
                LOGGER.info("Moved receipt '{}' from {} to {}", command.name(), command.from(), command.to());
            }
            return result;
        }
    }

    public ReceiptSnapshot remove(RemoveReceipt command) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("remove")) {
            ReconciliationMdc.attachReceipt(command.name());
            ReconciliationMdc.attachContainer(command.container());
            ReceiptSnapshot removed = aggregate.removeReceipt(command.name(), command.container());
            deleteStoredQuietly(removed);
            LOGGER.info("Removed receipt '{}' from {}", command.name(), command.container());
            return removed;
        }
    }

    /**
     * Runs one bulk matching round. When the matcher fails the state is left exactly as it was.
     */
    public MatchOutcome runBulkMatch(RunBulkMatch command) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("bulk-match")) {
            ReconciliationSnapshot snapshot = aggregate.snapshot();
            if (snapshot.pool().isEmpty() || snapshot.expenses().isEmpty()) {
                LOGGER.info("Nothing to match: {} pool receipts, {} expenses", snapshot.pool().size(),
                    snapshot.expenses().size());
                return new MatchOutcome(List.of(), snapshot.pool().stream().map(ReceiptSnapshot::name).toList(),
                    List.of());
            }
            MatchPlan plan;
            try {
                plan = matcher.match(snapshot.pool(), snapshot.expenses());
            } catch (MatchingServiceException ex) {
                LOGGER.error("Bulk matching failed; reconciliation state left unchanged", ex);
                throw ex;
            }
            MatchOutcome outcome = aggregate.applyMatch(plan);
            LOGGER.info("Bulk match attached {} receipts, {} left in the pool", outcome.applied().size(),
                outcome.unmatched().size());
            return outcome;
        }
    }

    public ReceiptSnapshot recordInvoiceDetails(String name, InvoiceDetails details) {
        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open("invoice-details")) {
            ReconciliationMdc.attachReceipt(name);
            return aggregate.recordInvoiceDetails(name, details);
        }
    }

    public ReceiptContent loadContent(String name) {
        ReceiptSnapshot receipt = aggregate.findReceipt(name).orElseThrow(() -> new ReceiptNotFoundException(name));
        return new ReceiptContent(receipt, storageService.load(receipt.reference()));
    }

    public ReconciliationSnapshot snapshot() {
        return aggregate.snapshot();
    }

    public ReconciliationStatistics statistics() {
        return aggregate.statistics();
    }

    public ValidationReport validate(Set<String> editableFields) {
        return validator.validate(aggregate.snapshot(), editableFields);
    }

    public ExportSnapshot export() {
        return ExportSnapshot.of(aggregate.snapshot());
    }

    private String rejectionReason(ReceiptUpload upload) {
        if (!StringUtils.hasText(upload.filename())) {
            return "File name is missing";
        }
        if (upload.isEmpty()) {
            return "File is empty";
        }
        if (!isAllowedContentType(upload.contentType())) {
            return "File type %s is not allowed".formatted(upload.contentType());
        }
        long maxBytes = properties.getMaxUploadSize().toBytes();
        if (upload.size() > maxBytes) {
            return "File exceeds the maximum size of %d bytes".formatted(maxBytes);
        }
        return null;
    }

    private boolean isAllowedContentType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return false;
        }
        String normalized = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return properties.getAllowedContentTypes().stream()
            .anyMatch(allowed -> allowed.trim().equalsIgnoreCase(normalized));
    }

    private List<ReceiptCandidate> store(Collection<ReceiptUpload> uploads, List<UploadRejection> rejected) {
        List<CompletableFuture<StoreAttempt>> futures = uploads.stream()
            .map(upload -> CompletableFuture.supplyAsync(() -> storeQuietly(upload), executor))
            .toList();
        List<ReceiptCandidate> candidates = new ArrayList<>(futures.size());
        for (CompletableFuture<StoreAttempt> future : futures) {
            StoreAttempt attempt = future.join();
            if (attempt.candidate() != null) {
                candidates.add(attempt.candidate());
            } else {
                rejected.add(attempt.rejection());
            }
        }
        return candidates;
    }

    private StoreAttempt storeQuietly(ReceiptUpload upload) {
        try {
            StoredReceiptReference reference = storageService.store(upload);
            return new StoreAttempt(new ReceiptCandidate(upload.filename(), upload.contentType(), upload.size(),
                reference, null, null), null);
        } catch (ReceiptStorageException ex) {
            LOGGER.warn("Storage rejected upload '{}'", upload.filename(), ex);
            return new StoreAttempt(null, new UploadRejection(upload.filename(), ex.getMessage()));
        }
    }

    private List<ReceiptCandidate> scoreAll(ExpenseSnapshot expense, List<ReceiptCandidate> candidates) {
        List<CompletableFuture<ReceiptCandidate>> futures = candidates.stream()
            .map(candidate -> CompletableFuture.supplyAsync(
                () -> candidate.withConfidence(scoreQuietly(expense, candidate.preview())), executor))
            .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Integer scoreQuietly(ExpenseSnapshot expense, ReceiptSnapshot receipt) {
        try {
            return Confidence.fromScore(scorer.score(expense, receipt));
        } catch (RuntimeException ex) {
            LOGGER.warn("Scoring receipt '{}' against expense {} failed; confidence is unknown", receipt.name(),
                expense.id(), ex);
            return null;
        }
    }

    private void deleteStoredQuietly(ReceiptSnapshot receipt) {
        deleteStoredQuietly(receipt.reference());
    }

    private void deleteStoredQuietly(StoredReceiptReference reference) {
        try {
            storageService.delete(reference);
        } catch (RuntimeException ex) {
            LOGGER.warn("Unable to delete stored receipt {}", reference.location(), ex);
        }
    }

    private record StoreAttempt(ReceiptCandidate candidate, UploadRejection rejection) {
    }
}
