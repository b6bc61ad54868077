package com.pourrice.chat.domain.chat;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A chat message delivered live or replayed from history.
 * <p><strong>Why:</strong> The server assigns {@code messageId}; room timelines use it to keep at most one copy of
 * each message.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param messageId server-assigned unique identifier; never blank
 * @param roomId room the message belongs to
 * @param userId author identifier
 * @param displayName author display name; may be empty
 * @param body message text; may be empty for image-only messages
 * @param imageUrl optional image reference; {@code null} when absent
 * @param timestamp server timestamp exactly as received; never used for ordering
 * @param kind content kind
 * @since 0.1.0
 */
public record ChatMessage(
    String messageId,
    RoomId roomId,
    String userId,
    String displayName,
    String body,
    String imageUrl,
    String timestamp,
    MessageKind kind) {

  /**
   * Normalizes optional fields.
   */
  public ChatMessage {
    Objects.requireNonNull(messageId, "messageId");
    if (messageId.isBlank()) {
      throw new IllegalArgumentException("messageId must not be blank");
    }
    Objects.requireNonNull(roomId, "roomId");
    userId = Objects.requireNonNullElse(userId, "");
    displayName = Objects.requireNonNullElse(displayName, "");
    body = Objects.requireNonNullElse(body, "");
    imageUrl = imageUrl == null || imageUrl.isBlank() ? null : imageUrl;
    timestamp = Objects.requireNonNullElse(timestamp, "");
    kind = kind != null ? kind : (imageUrl != null ? MessageKind.IMAGE : MessageKind.TEXT);
  }

  /**
   * Returns the attached image reference, if any.
   *
   * @return optional image URL
   */
  public Optional<String> image() {
    return Optional.ofNullable(imageUrl);
  }

  /**
   * Indicates whether the message was authored by the given user.
   *
   * @param candidateUserId user to compare against; may be {@code null}
   * @return {@code true} when the author matches
   */
  public boolean isFrom(String candidateUserId) {
    return candidateUserId != null && candidateUserId.equals(userId);
  }
}
