package dev.clarityhub.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Persistent per-tenant, per-day usage row. Maps to the {@code processing_usage} table managed by
 * Flyway migrations. Rows are written only through the conditional upsert in {@link
 * ProcessingUsageRepository}.
 */
@Entity
@Table(name = "processing_usage")
public class ProcessingUsageRecord {

  @EmbeddedId private Key key;

  @Column(name = "files_processed", nullable = false)
  private int filesProcessed;

  @Column(name = "bytes_processed", nullable = false)
  private long bytesProcessed;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProcessingUsageRecord() {
    // JPA requires no-arg constructor
  }

  public ProcessingUsage toUsage() {
    return new ProcessingUsage(key.tenantId, key.usageDay, filesProcessed, bytesProcessed);
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Composite key: tenant and UTC day. */
  @Embeddable
  public static class Key implements Serializable {

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "usage_day", nullable = false)
    private LocalDate usageDay;

    protected Key() {
      // JPA requires no-arg constructor
    }

    public Key(String tenantId, LocalDate usageDay) {
      this.tenantId = tenantId;
      this.usageDay = usageDay;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key other)) {
        return false;
      }
      return tenantId.equals(other.tenantId) && usageDay.equals(other.usageDay);
    }

    @Override
    public int hashCode() {
      return Objects.hash(tenantId, usageDay);
    }
  }
}
