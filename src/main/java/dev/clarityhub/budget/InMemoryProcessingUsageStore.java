package dev.clarityhub.budget;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-node usage store. Holds the latest day's usage per tenant; a stored record for an
 * earlier day reads as zero and is replaced on the next reservation.
 *
 * <p>Uses {@link ConcurrentHashMap#compute} so the check and the increment happen under the
 * tenant's bin lock.
 */
@Component
@ConditionalOnProperty(name = "clarity.budget.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryProcessingUsageStore implements ProcessingUsageStore {

  private final ConcurrentMap<String, ProcessingUsage> usageByTenant = new ConcurrentHashMap<>();

  @Override
  public ProcessingUsage get(String tenantId, LocalDate day) {
    ProcessingUsage stored = usageByTenant.get(tenantId);
    return stored != null && stored.day().equals(day) ? stored : ProcessingUsage.none(tenantId, day);
  }

  @Override
  public Optional<ProcessingUsage> tryReserve(
      String tenantId, LocalDate day, int files, long bytes, int maxFiles, long maxBytes) {
    ProcessingUsage[] reserved = new ProcessingUsage[1];
    usageByTenant.compute(
        tenantId,
        (key, stored) -> {
          ProcessingUsage today =
              stored != null && stored.day().equals(day) ? stored : ProcessingUsage.none(key, day);
          if (!today.fits(files, bytes, maxFiles, maxBytes)) {
            return stored;
          }
          reserved[0] = today.plus(files, bytes);
          return reserved[0];
        });
    return Optional.ofNullable(reserved[0]);
  }
}
