package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.port.SchedulerPort;
import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.HistoryOutcome;
import com.pourrice.chat.domain.chat.HistorySnapshot;
import com.pourrice.chat.domain.chat.RoomId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Races each room's history snapshot against a timeout.
 * <p><strong>Why:</strong> The server pushes history after a join without correlating it to the request. Without a
 * bounded wait a lost snapshot would leave the room loading forever.</p>
 * <p><strong>Contract:</strong> {@link #arm(RoomId)} starts one wait per room and sets the room loading. The wait
 * ends exactly once: a snapshot replaces the timeline ({@link HistoryOutcome#RECEIVED}), the timer leaves it as is
 * ({@link HistoryOutcome#TIMED_OUT}) or the room is released ({@link HistoryOutcome#CANCELLED}). Snapshots that
 * arrive with no wait armed are ignored.</p>
 * <p><strong>Thread-safety:</strong> Confined to the event loop; {@link #isLoading(RoomId)} may be read anywhere.</p>
 * <p><strong>Observability:</strong> Emits {@code chat.history.received} and {@code chat.history.timeout}.</p>
 *
 * @since 0.1.0
 */
public final class HistoryReconciler {
  private static final Logger log = LoggerFactory.getLogger(HistoryReconciler.class);

  private final SchedulerPort scheduler;
  private final MessageChannel messages;
  private final ChatEventListener listener;
  private final MetricsPort metrics;
  private final long timeoutMillis;
  private final Map<RoomId, PendingHistory> pending = new ConcurrentHashMap<>();

  HistoryReconciler(
      SchedulerPort scheduler,
      MessageChannel messages,
      ChatEventListener listener,
      MetricsPort metrics,
      long timeoutMillis) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (timeoutMillis <= 0) {
      throw new IllegalArgumentException("timeoutMillis must be positive");
    }
    this.timeoutMillis = timeoutMillis;
  }

  /**
   * Starts waiting for a room's snapshot. A wait already armed for the room is cancelled first.
   *
   * @param roomId room whose join was just requested
   * @return future completed with the outcome of this wait
   */
  CompletableFuture<HistoryOutcome> arm(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    cancel(roomId);
    PendingHistory wait = new PendingHistory();
    pending.put(roomId, wait);
    wait.timer = scheduler.schedule(() -> expire(roomId, wait), timeoutMillis);
    listener.onHistoryLoading(roomId, true);
    return wait.outcome;
  }

  void onSnapshot(HistorySnapshot snapshot) {
    RoomId roomId = snapshot.roomId();
    PendingHistory wait = pending.remove(roomId);
    if (wait == null) {
      log.debug("Ignoring history snapshot for {} with no pending wait", roomId);
      return;
    }
    wait.timer.cancel();
    List<ChatMessage> timeline = messages.replaceTimeline(roomId, snapshot.messages());
    metrics.increment("chat.history.received");
    log.debug("Loaded {} history message(s) for {}", timeline.size(), roomId);
    finish(roomId, wait, HistoryOutcome.RECEIVED, timeline);
  }

  /**
   * Abandons the wait of a room, if any.
   *
   * @param roomId released room
   */
  void cancel(RoomId roomId) {
    PendingHistory wait = pending.remove(roomId);
    if (wait == null) {
      return;
    }
    wait.timer.cancel();
    finish(roomId, wait, HistoryOutcome.CANCELLED, messages.messages(roomId));
  }

  /**
   * Abandons every pending wait.
   */
  void cancelAll() {
    for (RoomId roomId : new ArrayList<>(pending.keySet())) {
      cancel(roomId);
    }
  }

  /**
   * Indicates whether the room is waiting for its snapshot.
   *
   * @param roomId room
   * @return {@code true} while loading
   */
  public boolean isLoading(RoomId roomId) {
    return pending.containsKey(roomId);
  }

  /**
   * Returns the outcome future of a pending wait.
   *
   * @param roomId room
   * @return pending outcome, or empty when the room is not loading
   */
  Optional<CompletableFuture<HistoryOutcome>> pendingOutcome(RoomId roomId) {
    PendingHistory wait = pending.get(roomId);
    return wait == null ? Optional.empty() : Optional.of(wait.outcome);
  }

  private void expire(RoomId roomId, PendingHistory wait) {
    if (!pending.remove(roomId, wait)) {
      return;
    }
    metrics.increment("chat.history.timeout");
    log.info("No history for {} after {} ms; showing the room without history", roomId, timeoutMillis);
    finish(roomId, wait, HistoryOutcome.TIMED_OUT, messages.messages(roomId));
  }

  private void finish(RoomId roomId, PendingHistory wait, HistoryOutcome outcome, List<ChatMessage> timeline) {
    listener.onHistoryLoading(roomId, false);
    listener.onHistoryLoaded(roomId, outcome, timeline);
    wait.outcome.complete(outcome);
  }

  private static final class PendingHistory {
    private final CompletableFuture<HistoryOutcome> outcome = new CompletableFuture<>();
    private SchedulerPort.ScheduledTask timer;
  }
}
