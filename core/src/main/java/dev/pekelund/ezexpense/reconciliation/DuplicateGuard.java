package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds and removes every receipt sharing a candidate's name, so the candidate can be admitted
 * without two receipts of the same name coexisting. Never fails; no duplicates yields an empty result.
 */
public final class DuplicateGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateGuard.class);

    private final ReconciliationState state;

    DuplicateGuard(ReconciliationState state) {
        this.state = state;
    }

    /**
     * Scans the pool, then every attachment list in expense order.
     */
    public List<DuplicateMatch> findAllDuplicates(String name) {
        List<DuplicateMatch> matches = new ArrayList<>(scan(ContainerRef.pool(), state.pool(), name));
        for (Expense expense : state.expenses()) {
            matches.addAll(scan(ContainerRef.expense(expense.id()), expense.attachments(), name));
        }
        return matches;
    }

    public List<DuplicateMatch> findDuplicatesIn(ContainerRef container, String name) {
        List<Receipt> receipts = state.container(container);
        return receipts == null ? List.of() : scan(container, receipts, name);
    }

    /**
     * Removes the matches, walking each container from its highest position down so earlier
     * positions stay valid. Matches that no longer point at a receipt of that name are ignored.
     */
    public DuplicateRemoval removeDuplicates(List<DuplicateMatch> matches) {
        if (matches.isEmpty()) {
            return DuplicateRemoval.none();
        }
        Map<ContainerRef, List<DuplicateMatch>> byContainer = new LinkedHashMap<>();
        for (DuplicateMatch match : matches) {
            byContainer.computeIfAbsent(match.container(), key -> new ArrayList<>()).add(match);
        }

        List<ReceiptSnapshot> removed = new ArrayList<>();
        byContainer.forEach((container, containerMatches) -> {
            List<Receipt> receipts = state.container(container);
            if (receipts == null) {
                return;
            }
            containerMatches.sort(Comparator.comparingInt(DuplicateMatch::position).reversed());
            for (DuplicateMatch match : containerMatches) {
                int position = match.position();
                if (position < 0 || position >= receipts.size()
                    || !receipts.get(position).name().equals(match.name())) {
                    continue;
                }
                Receipt receipt = receipts.remove(position);
                receipt.clearConfidence();
                removed.add(receipt.snapshot());
                LOGGER.info("Removed duplicate receipt '{}' from {}", match.name(), container);
            }
        });
        return new DuplicateRemoval(removed);
    }

    private static List<DuplicateMatch> scan(ContainerRef container, List<Receipt> receipts, String name) {
        List<DuplicateMatch> matches = new ArrayList<>();
        for (int i = 0; i < receipts.size(); i++) {
            if (receipts.get(i).name().equals(name)) {
                matches.add(new DuplicateMatch(container, i, name));
            }
        }
        return matches;
    }
}
