package com.pourrice.chat.domain.protocol;

import com.pourrice.chat.domain.chat.RoomId;
import java.util.Objects;

/**
 * Inbound {@code joined-room} acknowledgement.
 *
 * @param roomId joined room
 * @param success whether the join was accepted
 * @since 0.1.0
 */
public record JoinAck(RoomId roomId, boolean success) {

  public JoinAck {
    Objects.requireNonNull(roomId, "roomId");
  }
}
