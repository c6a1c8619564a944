package dev.clarityhub.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded executors for work that leaves the request thread: the two branches of a hybrid search
 * and fire-and-forget analytics writes. Kept separate so slow analytics can never starve search.
 *
 * <p>Both queues are bounded and reject with {@link ThreadPoolExecutor.AbortPolicy}: a rejected
 * search branch counts as a failed branch, a rejected analytics write is logged and dropped.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "searchExecutor", destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(
      @Value("${clarity.search.branch-threads:8}") int threads,
      @Value("${clarity.search.branch-queue-capacity:64}") int queueCapacity) {
    return boundedPool(threads, queueCapacity, "search-branch-");
  }

  @Bean(name = "analyticsExecutor", destroyMethod = "shutdown")
  public ExecutorService analyticsExecutor(
      @Value("${clarity.search.analytics-queue-capacity:1000}") int queueCapacity) {
    return boundedPool(1, queueCapacity, "search-analytics-");
  }

  static ThreadPoolExecutor boundedPool(int threads, int queueCapacity, String threadPrefix) {
    if (threads < 1 || queueCapacity < 1) {
      throw new IllegalStateException(
          "Executor threads and queue capacity must be positive, got "
              + threads
              + " and "
              + queueCapacity);
    }
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        namedThreads(threadPrefix),
        new ThreadPoolExecutor.AbortPolicy());
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
