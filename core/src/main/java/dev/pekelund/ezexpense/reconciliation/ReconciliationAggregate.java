package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the pool and every attachment list. All mutators run to completion on the aggregate
 * monitor, so callers only ever observe states in which receipt names are unique, pool receipts
 * carry no confidence and expense identifiers are stable. Work that has to wait for a collaborator
 * is done outside the monitor; its results are re-validated when they are applied.
 */
public class ReconciliationAggregate {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationAggregate.class);

    static final String ID_FIELD = "id";

    private final ReconciliationState state = new ReconciliationState();
    private final DuplicateGuard duplicateGuard = new DuplicateGuard(state);
    private final MoveOperator moveOperator = new MoveOperator(state, duplicateGuard);
    private long nextExpenseId = 1;

    public synchronized List<ExpenseSnapshot> importExpenses(List<Map<String, String>> rows) {
        List<ExpenseSnapshot> imported = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            imported.add(createExpense(row).snapshot());
        }
        LOGGER.info("Imported {} expenses", imported.size());
        return imported;
    }

    public synchronized ExpenseSnapshot addExpense(Map<String, String> fields) {
        return createExpense(fields).snapshot();
    }

    public synchronized ExpenseSnapshot editField(long expenseId, String name, String value) {
        return editFields(expenseId, Map.of(name, value != null ? value : ""));
    }

    public synchronized ExpenseSnapshot editFields(long expenseId, Map<String, String> changes) {
        Expense expense = requireExpense(expenseId);
        changes.forEach((name, value) -> {
            if (!ID_FIELD.equals(name)) {
                expense.put(name, value);
            }
        });
        return expense.snapshot();
    }

    /**
     * Deletes the expenses together with their attachment lists. Nothing is deleted when any id is unknown.
     */
    public synchronized List<ExpenseSnapshot> deleteExpenses(Collection<Long> expenseIds) {
        Set<Long> ids = new LinkedHashSet<>(expenseIds);
        for (Long id : ids) {
            requireExpense(id);
        }
        List<ExpenseSnapshot> deleted = new ArrayList<>(ids.size());
        for (Long id : ids) {
            deleted.add(state.removeExpense(id).snapshot());
        }
        LOGGER.info("Deleted expenses {}", ids);
        return deleted;
    }

    public synchronized List<DuplicateMatch> findAllDuplicates(String name) {
        return duplicateGuard.findAllDuplicates(name);
    }

    /**
     * Removes every receipt carrying one of {@code names}, wherever it lives.
     */
    public synchronized DuplicateRemoval removeDuplicates(Collection<String> names) {
        DuplicateRemoval removal = DuplicateRemoval.none();
        for (String name : new LinkedHashSet<>(names)) {
            removal = removal.merge(duplicateGuard.removeDuplicates(duplicateGuard.findAllDuplicates(name)));
        }
        return removal;
    }

    /**
     * Admits candidates into {@code target}. The duplicate guard runs again for each candidate, so a
     * same-named receipt that arrived while the candidate was being scored is superseded. When the
     * target expense was deleted in the meantime every candidate is discarded.
     */
    public synchronized AdmissionResult admit(List<ReceiptCandidate> candidates, ContainerRef target) {
        List<Receipt> container = state.container(target);
        if (container == null) {
            LOGGER.warn("Discarding {} receipts for {}, which no longer exists", candidates.size(), target);
            return new AdmissionResult(List.of(), DuplicateRemoval.none(), candidates);
        }
        DuplicateRemoval duplicates = DuplicateRemoval.none();
        List<ReceiptSnapshot> admitted = new ArrayList<>(candidates.size());
        for (ReceiptCandidate candidate : candidates) {
            duplicates = duplicates.merge(
                duplicateGuard.removeDuplicates(duplicateGuard.findAllDuplicates(candidate.name())));
            Receipt receipt = new Receipt(candidate);
            if (!target.isPool()) {
                receipt.setConfidence(candidate.confidence());
            }
            container.add(receipt);
            admitted.add(receipt.snapshot());
        }
        return new AdmissionResult(admitted, duplicates, List.of());
    }

    public synchronized MoveResult relocate(String name, ContainerRef from, ContainerRef to, Integer confidence) {
        return moveOperator.move(name, from, to, confidence);
    }

    public synchronized ReceiptSnapshot removeReceipt(String name, ContainerRef container) {
        List<Receipt> receipts = state.container(container);
        if (receipts == null) {
            throw new ExpenseNotFoundException(container.expenseId());
        }
        int index = ReconciliationState.indexOf(receipts, name);
        if (index < 0) {
            throw new ReceiptNotFoundException(name, container);
        }
        Receipt removed = receipts.remove(index);
        removed.clearConfidence();
        return removed.snapshot();
    }

    /**
     * Applies a bulk matching plan in one step. An assignment is skipped when its receipt no longer
     * exists or its expense was deleted; receipts not named by the plan stay where they are.
     */
    public synchronized MatchOutcome applyMatch(MatchPlan plan) {
        List<MatchAssignment> applied = new ArrayList<>();
        List<MatchAssignment> skipped = new ArrayList<>();
        for (MatchAssignment assignment : plan.assignments()) {
            Optional<ContainerRef> current = state.locate(assignment.receiptName());
            Optional<Expense> expense = state.expense(assignment.expenseId());
            if (current.isEmpty() || expense.isEmpty()) {
                skipped.add(assignment);
                continue;
            }
            ContainerRef destination = ContainerRef.expense(assignment.expenseId());
            if (current.get().equals(destination)) {
                state.find(assignment.receiptName()).ifPresent(receipt -> receipt.setConfidence(assignment.confidence()));
            } else {
                moveOperator.move(assignment.receiptName(), current.get(), destination, assignment.confidence());
            }
            applied.add(assignment);
        }
        List<String> unmatched = plan.unmatched().stream()
            .filter(name -> state.locate(name).filter(ContainerRef::isPool).isPresent())
            .toList();
        if (!skipped.isEmpty()) {
            LOGGER.warn("Skipped {} match assignments whose receipt or expense changed during matching", skipped.size());
        }
        return new MatchOutcome(applied, unmatched, skipped);
    }

    public synchronized ReceiptSnapshot recordInvoiceDetails(String name, InvoiceDetails details) {
        Receipt receipt = state.find(name).orElseThrow(() -> new ReceiptNotFoundException(name));
        receipt.setDetails(details);
        return receipt.snapshot();
    }

    public synchronized Optional<ContainerRef> locate(String name) {
        return state.locate(name);
    }

    public synchronized Optional<ReceiptSnapshot> findReceipt(String name) {
        return state.find(name).map(Receipt::snapshot);
    }

    public synchronized Optional<ExpenseSnapshot> findExpense(long expenseId) {
        return state.expense(expenseId).map(Expense::snapshot);
    }

    public synchronized boolean hasExpense(long expenseId) {
        return state.expense(expenseId).isPresent();
    }

    public synchronized int totalReceipts() {
        return state.totalReceipts();
    }

    public synchronized ReconciliationSnapshot snapshot() {
        return state.snapshot();
    }

    public synchronized ReconciliationStatistics statistics() {
        return ReconciliationStatistics.of(state.snapshot());
    }

    private Expense createExpense(Map<String, String> fields) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        copy.remove(ID_FIELD);
        Expense expense = new Expense(nextExpenseId++, copy);
        state.addExpense(expense);
        return expense;
    }

    private Expense requireExpense(long expenseId) {
        return state.expense(expenseId).orElseThrow(() -> new ExpenseNotFoundException(expenseId));
    }
}
