package io.b2mash.b2b.nexusengine.config;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.MDC;

/**
 * Bounded executor that runs each task with the submitting thread's MDC, so per-jurisdiction
 * log lines carry the analysis id.
 */
public class MdcPropagatingExecutor implements Executor, AutoCloseable {

  private final ExecutorService delegate;

  public MdcPropagatingExecutor(int parallelism) {
    if (parallelism <= 0) {
      throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
    }
    this.delegate = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
  }

  @Override
  public void execute(Runnable command) {
    // Captured on the submitting thread
    Map<String, String> parentMdc = MDC.getCopyOfContextMap();

    delegate.execute(
        () -> {
          if (parentMdc != null) {
            MDC.setContextMap(parentMdc);
          }
          try {
            command.run();
          } finally {
            MDC.clear();
          }
        });
  }

  @Override
  public void close() {
    delegate.shutdown();
    try {
      if (!delegate.awaitTermination(10, TimeUnit.SECONDS)) {
        delegate.shutdownNow();
      }
    } catch (InterruptedException e) {
      delegate.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      var thread = new Thread(runnable, "nexus-engine-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
