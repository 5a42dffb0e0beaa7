package dev.pekelund.ezexpense.web;

import jakarta.validation.constraints.NotBlank;

/**
 * Moves receipt {@code name}. A {@code null} expense id stands for the pool.
 */
public record MoveReceiptRequest(@NotBlank String name, Long fromExpenseId, Long toExpenseId) {
}
