package com.pourrice.chat.infrastructure.exec;

import com.pourrice.chat.application.port.SchedulerPort;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SchedulerPort} backed by a single-threaded {@link ScheduledExecutorService}.
 * <p><strong>Why:</strong> Serializes every chat state mutation onto one thread.</p>
 * <p><strong>Failure handling:</strong> A task that throws is logged and the loop keeps running. Work submitted
 * after {@link #close()} is dropped with a DEBUG line.</p>
 *
 * @since 0.1.0
 */
public final class EventLoopScheduler implements SchedulerPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

  private final ScheduledExecutorService executor;

  public EventLoopScheduler(ScheduledExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Creates a scheduler with its own loop thread.
   *
   * @param name thread-name prefix
   * @return scheduler
   */
  public static EventLoopScheduler create(String name) {
    return new EventLoopScheduler(ExecutorFactories.newEventLoop(name,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
  }

  @Override
  public void execute(Runnable task) {
    Objects.requireNonNull(task, "task");
    try {
      executor.execute(guarded(task));
    } catch (RejectedExecutionException ex) {
      log.debug("Event loop closed; dropping task");
    }
  }

  @Override
  public ScheduledTask schedule(Runnable task, long delayMillis) {
    Objects.requireNonNull(task, "task");
    try {
      ScheduledFuture<?> future =
          executor.schedule(guarded(task), Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
      return () -> future.cancel(false);
    } catch (RejectedExecutionException ex) {
      log.debug("Event loop closed; dropping timer");
      return () -> {};
    }
  }

  @Override
  public long nowMillis() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
  }

  /**
   * Stops the loop, waiting briefly for the running task.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.error("Chat event loop task failed", ex);
      }
    };
  }
}
