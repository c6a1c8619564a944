package dev.clarityhub.search;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Writes search analytics off the request thread. Failures are logged and dropped: analytics must
 * never fail or delay a search response.
 */
@Component
public class SearchAnalyticsRecorder {

  private static final Logger log = LoggerFactory.getLogger(SearchAnalyticsRecorder.class);

  private final SearchAnalyticsRepository repository;
  private final Executor executor;
  private final Clock clock;

  public SearchAnalyticsRecorder(
      SearchAnalyticsRepository repository,
      @Qualifier("analyticsExecutor") Executor executor,
      Clock clock) {
    this.repository = repository;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Queues one analytics row.
   *
   * @param request the executed request
   * @param response the response sent to the caller
   */
  public void record(SearchRequest request, SearchResponse response) {
    SearchAnalyticsEntry entry =
        new SearchAnalyticsEntry(
            request.tenantId(),
            request.query(),
            request.mode(),
            response.metadata().resultCount(),
            response.metadata().durationMs(),
            response.queryExpansion(),
            response.metadata().partial(),
            clock.instant());
    try {
      executor.execute(() -> save(entry));
    } catch (RejectedExecutionException e) {
      log.warn("Search analytics dropped, executor rejected the task: {}", e.getMessage());
    }
  }

  private void save(SearchAnalyticsEntry entry) {
    try {
      repository.save(entry);
    } catch (RuntimeException e) {
      log.warn("Failed to record search analytics: {}", e.getMessage());
    }
  }
}
