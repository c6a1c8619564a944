package dev.clarityhub.budget;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Daily per-tenant gate in front of chunking and embedding.
 *
 * <p>{@link #checkBudget} only reads. {@link #reserve} re-checks and commits in one atomic store
 * operation, so two concurrent uploads for the same tenant cannot both take the last slot. Days
 * are UTC days from the injected {@link Clock}; usage from earlier days never counts.
 *
 * <p>Search is never gated.
 */
@Service
public class ProcessingBudgetGovernor {

  private static final Logger log = LoggerFactory.getLogger(ProcessingBudgetGovernor.class);

  private static final long MIB = 1024L * 1024L;

  private final ProcessingUsageStore store;
  private final BudgetProperties properties;
  private final Clock clock;

  public ProcessingBudgetGovernor(
      ProcessingUsageStore store, BudgetProperties properties, Clock clock) {
    this.store = store;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Checks whether a workload fits today's remaining budget without recording anything.
   *
   * @param tenantId the tenant
   * @param fileCount number of files in the workload
   * @param totalBytes combined size; use {@link FileType#billableBytes} for unknown sizes
   * @return the decision; remaining figures refer to usage before this workload
   * @throws IllegalArgumentException if a count is negative
   */
  public BudgetCheck checkBudget(String tenantId, int fileCount, long totalBytes) {
    validate(fileCount, totalBytes);
    return evaluate(store.get(tenantId, today()), fileCount, totalBytes);
  }

  /**
   * Re-checks and commits a workload against today's budget.
   *
   * @param tenantId the tenant
   * @param fileCount number of files
   * @param bytes combined size in bytes
   * @return an allowed check with the remaining figures after the reservation, or the rejection
   * @throws IllegalArgumentException if a count is negative
   */
  public BudgetCheck reserve(String tenantId, int fileCount, long bytes) {
    validate(fileCount, bytes);
    LocalDate today = today();
    BudgetCheck check = evaluate(store.get(tenantId, today), fileCount, bytes);
    if (!check.allowed()) {
      log.info("Budget rejected for tenant {}: {}", tenantId, check.reason());
      return check;
    }

    Optional<ProcessingUsage> reserved =
        store.tryReserve(
            tenantId,
            today,
            fileCount,
            bytes,
            properties.getMaxFilesPerDay(),
            properties.getMaxBytesPerDay());
    if (reserved.isEmpty()) {
      // another reservation for this tenant committed in between
      BudgetCheck recheck = evaluate(store.get(tenantId, today), fileCount, bytes);
      log.info("Budget rejected for tenant {} after concurrent reservation", tenantId);
      return recheck.allowed()
          ? BudgetCheck.rejected(
              "Daily processing budget changed concurrently, please retry.",
              recheck.remainingFiles(),
              recheck.remainingBytes(),
              recheck.usage())
          : recheck;
    }

    ProcessingUsage usage = reserved.get();
    log.debug(
        "Reserved {} files / {} bytes for tenant {} (today: {} files, {} bytes)",
        fileCount,
        bytes,
        tenantId,
        usage.filesProcessed(),
        usage.bytesProcessed());
    return BudgetCheck.allowed(remainingFiles(usage), remainingBytes(usage), usage);
  }

  /** Returns the tenant's usage for today; zero when nothing has been reserved yet. */
  public ProcessingUsage currentUsage(String tenantId) {
    return store.get(tenantId, today());
  }

  /**
   * Previews the processing cost of a file.
   *
   * @param sizeBytes reported size, or null when unknown
   * @param fileType type used to estimate an unknown size
   */
  public ProcessingEstimate estimate(@Nullable Long sizeBytes, FileType fileType) {
    return ProcessingEstimate.forBytes(fileType.billableBytes(sizeBytes));
  }

  private BudgetCheck evaluate(ProcessingUsage usage, int fileCount, long bytes) {
    int remainingFiles = remainingFiles(usage);
    long remainingBytes = remainingBytes(usage);

    if (!usage.fitsFiles(fileCount, properties.getMaxFilesPerDay())) {
      return BudgetCheck.rejected(
          "Daily file limit reached (%d/day).".formatted(properties.getMaxFilesPerDay()),
          remainingFiles,
          remainingBytes,
          usage);
    }
    if (!usage.fitsBytes(bytes, properties.getMaxBytesPerDay())) {
      return BudgetCheck.rejected(
          "Daily data limit reached (%s/day).".formatted(formatSize(properties.getMaxBytesPerDay())),
          remainingFiles,
          remainingBytes,
          usage);
    }
    return BudgetCheck.allowed(remainingFiles, remainingBytes, usage);
  }

  private int remainingFiles(ProcessingUsage usage) {
    return Math.max(0, properties.getMaxFilesPerDay() - usage.filesProcessed());
  }

  private long remainingBytes(ProcessingUsage usage) {
    return Math.max(0, properties.getMaxBytesPerDay() - usage.bytesProcessed());
  }

  private LocalDate today() {
    return LocalDate.now(clock);
  }

  private static void validate(int fileCount, long bytes) {
    if (fileCount < 0) {
      throw new IllegalArgumentException("fileCount must not be negative, got: " + fileCount);
    }
    if (bytes < 0) {
      throw new IllegalArgumentException("totalBytes must not be negative, got: " + bytes);
    }
  }

  static String formatSize(long bytes) {
    if (bytes % MIB == 0) {
      return (bytes / MIB) + " MB";
    }
    if (bytes >= MIB) {
      return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MIB);
    }
    return Math.max(1, bytes / 1024) + " KB";
  }
}
