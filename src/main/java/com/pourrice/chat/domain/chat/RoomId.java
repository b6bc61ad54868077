package com.pourrice.chat.domain.chat;

import java.util.Objects;

/**
 * <strong>What:</strong> Identifier of a chat room, e.g. {@code restaurant-42}.
 * <p><strong>Why:</strong> Room keys are derived locally from domain identifiers, so no server round trip is
 * needed before a join can be requested.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param value canonical room key; never blank
 * @since 0.1.0
 */
public record RoomId(String value) {
  private static final String RESTAURANT_PREFIX = "restaurant-";
  private static final String PRIVATE_PREFIX = "private-";

  /**
   * Trims and validates the room key.
   */
  public RoomId {
    Objects.requireNonNull(value, "value");
    value = value.trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("room id must not be blank");
    }
  }

  /**
   * Wraps a raw room key received over the wire.
   *
   * @param value room key
   * @return room id
   */
  public static RoomId of(String value) {
    return new RoomId(value);
  }

  /**
   * Derives the public room of a restaurant.
   *
   * @param restaurantId restaurant identifier; never blank
   * @return {@code restaurant-<restaurantId>}
   */
  public static RoomId forRestaurant(String restaurantId) {
    Objects.requireNonNull(restaurantId, "restaurantId");
    if (restaurantId.isBlank()) {
      throw new IllegalArgumentException("restaurantId must not be blank");
    }
    return new RoomId(RESTAURANT_PREFIX + restaurantId.trim());
  }

  /**
   * Derives the pseudo-room used to group direct messages exchanged with a peer.
   *
   * @param peerUserId the other participant
   * @return {@code private-<peerUserId>}
   */
  public static RoomId forPrivatePeer(String peerUserId) {
    Objects.requireNonNull(peerUserId, "peerUserId");
    if (peerUserId.isBlank()) {
      throw new IllegalArgumentException("peerUserId must not be blank");
    }
    return new RoomId(PRIVATE_PREFIX + peerUserId.trim());
  }

  /**
   * Indicates whether this room groups direct messages rather than a joinable channel.
   *
   * @return {@code true} for {@code private-} rooms
   */
  public boolean isPrivate() {
    return value.startsWith(PRIVATE_PREFIX);
  }

  @Override
  public String toString() {
    return value;
  }
}
