package com.pourrice.chat.application.util;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable {@link ObservableValue} owned by a single component.
 *
 * <p>Writes happen on the event loop; reads are safe from any thread. Subscribers are notified in
 * registration order. A failing subscriber is logged and does not prevent the others from running.</p>
 *
 * @param <T> value type
 * @since 0.1.0
 */
public final class StateCell<T> implements ObservableValue<T> {
  private static final Logger log = LoggerFactory.getLogger(StateCell.class);

  private final String name;
  private final List<Consumer<? super T>> subscribers = new CopyOnWriteArrayList<>();
  private volatile T value;

  /**
   * Creates a cell.
   *
   * @param name label used in log lines
   * @param initial initial value; must not be {@code null}
   */
  public StateCell(String name, T initial) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(initial, "initial");
  }

  @Override
  public T get() {
    return value;
  }

  /**
   * Replaces the value and notifies subscribers when it changed.
   *
   * @param next new value; must not be {@code null}
   * @return {@code true} when the value changed
   */
  public boolean set(T next) {
    Objects.requireNonNull(next, "next");
    if (Objects.equals(value, next)) {
      return false;
    }
    value = next;
    for (Consumer<? super T> subscriber : subscribers) {
      try {
        subscriber.accept(next);
      } catch (RuntimeException ex) {
        log.error("Subscriber of {} failed on value {}", name, next, ex);
      }
    }
    return true;
  }

  @Override
  public Subscription subscribe(Consumer<? super T> subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
