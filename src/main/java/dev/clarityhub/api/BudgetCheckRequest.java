package dev.clarityhub.api;

import jakarta.validation.constraints.PositiveOrZero;

/** JSON body of {@code POST /api/budget/check}. */
public record BudgetCheckRequest(@PositiveOrZero int fileCount, @PositiveOrZero long totalBytes) {}
