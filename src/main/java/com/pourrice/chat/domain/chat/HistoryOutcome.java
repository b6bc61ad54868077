package com.pourrice.chat.domain.chat;

/**
 * Result of waiting for a room's history snapshot.
 *
 * @since 0.1.0
 */
public enum HistoryOutcome {
  /** The snapshot arrived and replaced the room's timeline. */
  RECEIVED,
  /** No snapshot arrived in time; the room is treated as having no history. */
  TIMED_OUT,
  /** The wait was abandoned because the room was left or the connection dropped. */
  CANCELLED
}
