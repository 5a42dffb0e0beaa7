package dev.pekelund.ezexpense.reconciliation;

import java.util.List;

/**
 * Source of the valid expense category names.
 */
@FunctionalInterface
public interface CategoryCatalog {

    List<String> categories();
}
