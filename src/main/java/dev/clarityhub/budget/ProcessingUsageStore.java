package dev.clarityhub.budget;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Keyed counter store behind {@link ProcessingBudgetGovernor}: one usage record per tenant and
 * day. A record for an earlier day never counts toward today.
 */
public interface ProcessingUsageStore {

  /**
   * Returns a tenant's usage for {@code day}, or zero usage when nothing was reserved that day.
   */
  ProcessingUsage get(String tenantId, LocalDate day);

  /**
   * Atomically adds {@code files} and {@code bytes} to the tenant's usage for {@code day} if the
   * new totals stay within the caps. Concurrent calls for the same tenant and day must not both
   * succeed when only one fits.
   *
   * @return the updated usage, or empty when the caps would be exceeded and nothing was changed
   */
  Optional<ProcessingUsage> tryReserve(
      String tenantId, LocalDate day, int files, long bytes, int maxFiles, long maxBytes);
}
