package dev.clarityhub.budget;

import java.time.LocalDate;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Usage store shared by every application node, backed by the {@code processing_usage} table.
 * Enabled with {@code clarity.budget.store=database}.
 */
@Component
@ConditionalOnProperty(name = "clarity.budget.store", havingValue = "database")
public class DatabaseProcessingUsageStore implements ProcessingUsageStore {

  private final ProcessingUsageRepository repository;

  public DatabaseProcessingUsageStore(ProcessingUsageRepository repository) {
    this.repository = repository;
  }

  @Override
  public ProcessingUsage get(String tenantId, LocalDate day) {
    return repository
        .findById(new ProcessingUsageRecord.Key(tenantId, day))
        .map(ProcessingUsageRecord::toUsage)
        .orElseGet(() -> ProcessingUsage.none(tenantId, day));
  }

  @Override
  public Optional<ProcessingUsage> tryReserve(
      String tenantId, LocalDate day, int files, long bytes, int maxFiles, long maxBytes) {
    if (files > maxFiles || bytes > maxBytes) {
      return Optional.empty();
    }
    int updated = repository.reserveWithinCaps(tenantId, day, files, bytes, maxFiles, maxBytes);
    return updated == 1 ? Optional.of(get(tenantId, day)) : Optional.empty();
  }
}
