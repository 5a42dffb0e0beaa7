package dev.pekelund.ezexpense.web;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record DeleteExpensesRequest(@NotEmpty List<@NotNull Long> ids) {
}
