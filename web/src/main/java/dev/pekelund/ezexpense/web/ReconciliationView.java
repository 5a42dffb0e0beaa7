package dev.pekelund.ezexpense.web;

import dev.pekelund.ezexpense.reconciliation.ReconciliationSnapshot;
import dev.pekelund.ezexpense.reconciliation.ReconciliationStatistics;

public record ReconciliationView(ReconciliationSnapshot snapshot, ReconciliationStatistics statistics) {
}
