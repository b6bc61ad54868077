package com.pourrice.chat.application.util;

import java.util.function.Consumer;

/**
 * Read-only view of a value that notifies subscribers on every distinct change.
 *
 * @param <T> value type
 * @since 0.1.0
 */
public interface ObservableValue<T> {

  /**
   * Returns the current value.
   *
   * @return current value; safe to read from any thread
   */
  T get();

  /**
   * Registers a subscriber. The current value is not replayed.
   *
   * @param subscriber receives each new value, on the thread that changed it
   * @return handle that removes the subscriber
   */
  Subscription subscribe(Consumer<? super T> subscriber);

  /**
   * Handle returned by {@link #subscribe(Consumer)}.
   */
  interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
