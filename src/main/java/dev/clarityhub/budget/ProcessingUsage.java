package dev.clarityhub.budget;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A tenant's processing usage for one calendar day.
 *
 * @param tenantId the tenant
 * @param day the UTC day the counters belong to
 * @param filesProcessed files reserved so far that day
 * @param bytesProcessed bytes reserved so far that day
 */
public record ProcessingUsage(
    String tenantId, LocalDate day, int filesProcessed, long bytesProcessed) {

  public ProcessingUsage {
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(day, "day must not be null");
    if (filesProcessed < 0 || bytesProcessed < 0) {
      throw new IllegalArgumentException("Usage counters must not be negative");
    }
  }

  public static ProcessingUsage none(String tenantId, LocalDate day) {
    return new ProcessingUsage(tenantId, day, 0, 0);
  }

  // Compared as headroom so that huge requests cannot overflow past the cap.
  boolean fitsFiles(int files, int maxFiles) {
    return files <= maxFiles - filesProcessed;
  }

  boolean fitsBytes(long bytes, long maxBytes) {
    return bytes <= maxBytes - bytesProcessed;
  }

  boolean fits(int files, long bytes, int maxFiles, long maxBytes) {
    return fitsFiles(files, maxFiles) && fitsBytes(bytes, maxBytes);
  }

  ProcessingUsage plus(int files, long bytes) {
    return new ProcessingUsage(tenantId, day, filesProcessed + files, bytesProcessed + bytes);
  }
}
