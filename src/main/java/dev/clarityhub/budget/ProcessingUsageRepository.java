package dev.clarityhub.budget;

import java.time.LocalDate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link ProcessingUsageRecord} rows. */
public interface ProcessingUsageRepository
    extends JpaRepository<ProcessingUsageRecord, ProcessingUsageRecord.Key> {

  /**
   * Adds to a tenant's usage for one day, creating the row on first use. The update only applies
   * while the new totals stay within the caps; PostgreSQL locks the conflicting row, so concurrent
   * reservations for the same tenant and day are serialised.
   *
   * @return 1 when the usage was recorded, 0 when the caps would have been exceeded
   */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO processing_usage (tenant_id, usage_day, files_processed, bytes_processed, updated_at)
            VALUES (:tenantId, :day, :files, :bytes, now())
            ON CONFLICT (tenant_id, usage_day) DO UPDATE
            SET files_processed = processing_usage.files_processed + EXCLUDED.files_processed,
                bytes_processed = processing_usage.bytes_processed + EXCLUDED.bytes_processed,
                updated_at = now()
            WHERE processing_usage.files_processed <= :maxFiles - EXCLUDED.files_processed
              AND processing_usage.bytes_processed <= :maxBytes - EXCLUDED.bytes_processed
            """,
      nativeQuery = true)
  int reserveWithinCaps(
      @Param("tenantId") String tenantId,
      @Param("day") LocalDate day,
      @Param("files") int files,
      @Param("bytes") long bytes,
      @Param("maxFiles") int maxFiles,
      @Param("maxBytes") long maxBytes);
}
