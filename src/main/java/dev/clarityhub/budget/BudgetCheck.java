package dev.clarityhub.budget;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a budget check or reservation. A rejection is a normal result, never an exception.
 *
 * @param allowed whether the work fits today's remaining budget
 * @param reason user-facing explanation when rejected; null when allowed
 * @param remainingFiles files still available today (after the reservation, for a successful
 *     {@code reserve})
 * @param remainingBytes bytes still available today, same convention as {@code remainingFiles}
 * @param usage today's usage the decision was based on
 */
public record BudgetCheck(
    boolean allowed,
    @Nullable String reason,
    int remainingFiles,
    long remainingBytes,
    ProcessingUsage usage) {

  static BudgetCheck allowed(int remainingFiles, long remainingBytes, ProcessingUsage usage) {
    return new BudgetCheck(true, null, remainingFiles, remainingBytes, usage);
  }

  static BudgetCheck rejected(
      String reason, int remainingFiles, long remainingBytes, ProcessingUsage usage) {
    return new BudgetCheck(false, reason, remainingFiles, remainingBytes, usage);
  }
}
