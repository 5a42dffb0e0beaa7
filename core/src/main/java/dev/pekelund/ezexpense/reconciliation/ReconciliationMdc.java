package dev.pekelund.ezexpense.reconciliation;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so log lines emitted while handling one command share the same identifiers
 * (operation, receipt, expense).
 */
final class ReconciliationMdc {

    static final String KEY_OPERATION = "reconciliation.operation";
    static final String KEY_RECEIPT = "reconciliation.receipt";
    static final String KEY_EXPENSE = "reconciliation.expense";

    private ReconciliationMdc() {
        // Utility class
    }

    static Context open(String operation) {
        return new Context(operation);
    }

    static void attachReceipt(String name) {
        putIfHasText(KEY_RECEIPT, name);
    }

    static void attachExpense(Long expenseId) {
        putIfHasText(KEY_EXPENSE, expenseId != null ? expenseId.toString() : null);
    }

    static void attachContainer(ContainerRef container) {
        attachExpense(container != null ? container.expenseId() : null);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String operation) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_OPERATION, operation);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
