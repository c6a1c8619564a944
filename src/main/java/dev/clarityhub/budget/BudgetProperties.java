package dev.clarityhub.budget;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Daily processing caps, bound from {@code clarity.budget.*}.
 *
 * <ul>
 *   <li>{@code max-files-per-day} - files a tenant may process per UTC day (default 10)
 *   <li>{@code max-bytes-per-day} - bytes a tenant may process per UTC day (default 250 MiB)
 *   <li>{@code store} - {@code memory} (default, single node) or {@code database}
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "clarity.budget")
public class BudgetProperties {

  private int maxFilesPerDay = 10;
  private long maxBytesPerDay = 250L * 1024 * 1024;
  private String store = "memory";

  @PostConstruct
  void validate() {
    if (maxFilesPerDay < 1) {
      throw new IllegalStateException(
          "clarity.budget.max-files-per-day must be positive, got: " + maxFilesPerDay);
    }
    if (maxBytesPerDay < 1) {
      throw new IllegalStateException(
          "clarity.budget.max-bytes-per-day must be positive, got: " + maxBytesPerDay);
    }
    if (!"memory".equals(store) && !"database".equals(store)) {
      throw new IllegalStateException(
          "clarity.budget.store must be 'memory' or 'database', got: " + store);
    }
  }

  public int getMaxFilesPerDay() {
    return maxFilesPerDay;
  }

  public void setMaxFilesPerDay(int maxFilesPerDay) {
    this.maxFilesPerDay = maxFilesPerDay;
  }

  public long getMaxBytesPerDay() {
    return maxBytesPerDay;
  }

  public void setMaxBytesPerDay(long maxBytesPerDay) {
    this.maxBytesPerDay = maxBytesPerDay;
  }

  public String getStore() {
    return store;
  }

  public void setStore(String store) {
    this.store = store;
  }
}
