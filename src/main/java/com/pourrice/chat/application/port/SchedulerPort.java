package com.pourrice.chat.application.port;

import java.util.concurrent.Executor;

/**
 * <strong>What:</strong> Single-threaded event loop with timers that owns all chat session state.
 * <p><strong>Why:</strong> Every state mutation (inbound events, timer expiries, user intents) runs one at a
 * time on this loop, so components need no locking.</p>
 * <p><strong>Thread-safety:</strong> {@link #execute(Runnable)} and {@link #schedule(Runnable, long)} may be
 * called from any thread; the submitted work always runs on the loop.</p>
 *
 * @since 0.1.0
 */
public interface SchedulerPort extends Executor {

  /**
   * Runs the task on the event loop after the delay.
   *
   * @param task work to run
   * @param delayMillis delay in milliseconds; {@code 0} runs on the next turn of the loop
   * @return handle that cancels the task if it has not started yet
   */
  ScheduledTask schedule(Runnable task, long delayMillis);

  /**
   * Returns the scheduler's notion of the current time.
   *
   * @return milliseconds; monotonic for virtual clocks, epoch for the real loop
   */
  long nowMillis();

  /**
   * Handle of a pending timer.
   */
  interface ScheduledTask {
    /**
     * Cancels the task. Has no effect once it ran or was already cancelled.
     */
    void cancel();
  }
}
