package dev.pekelund.ezexpense.reconciliation;

/**
 * A receipt named {@code name} found at {@code position} inside {@code container}.
 */
public record DuplicateMatch(ContainerRef container, int position, String name) {
}
