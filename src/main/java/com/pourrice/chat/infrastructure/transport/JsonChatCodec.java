package com.pourrice.chat.infrastructure.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.HistorySnapshot;
import com.pourrice.chat.domain.chat.MessageKind;
import com.pourrice.chat.domain.chat.PresenceEvent;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.RoomMembershipEvent;
import com.pourrice.chat.domain.chat.TypingIndicator;
import com.pourrice.chat.domain.protocol.EventName;
import com.pourrice.chat.domain.protocol.InboundEvent;
import com.pourrice.chat.domain.protocol.JoinAck;
import com.pourrice.chat.domain.protocol.OutboundEvent;
import com.pourrice.chat.domain.protocol.PrivateMessage;
import com.pourrice.chat.domain.protocol.PrivateMessageRequest;
import com.pourrice.chat.domain.protocol.RegisterRequest;
import com.pourrice.chat.domain.protocol.RegistrationAck;
import com.pourrice.chat.domain.protocol.RoomRequest;
import com.pourrice.chat.domain.protocol.SendMessageRequest;
import com.pourrice.chat.domain.protocol.TypingSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Encodes and decodes chat frames of the form {@code {"event": name, "data": {...}}}.
 * <p><strong>Why:</strong> Keeps the JSON wire format out of the session components, which only see typed
 * records.</p>
 * <p><strong>Decoding:</strong> Unknown event names decode to empty. Frames that are not JSON objects, or that lack a
 * required field, raise {@link MalformedFrameException}. Optional fields that are absent or {@code null} are
 * omitted when encoding.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared, thread-safe {@link ObjectMapper}.</p>
 *
 * @since 0.1.0
 */
public final class JsonChatCodec {
  private static final String EVENT = "event";
  private static final String DATA = "data";

  private final ObjectMapper mapper;

  public JsonChatCodec() {
    this(new ObjectMapper());
  }

  public JsonChatCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Encodes an outbound event as a JSON text frame.
   *
   * @param event event to encode
   * @return JSON text
   */
  public String encode(OutboundEvent event) {
    Objects.requireNonNull(event, "event");
    ObjectNode frame = mapper.createObjectNode();
    frame.put(EVENT, event.name().wireName());
    ObjectNode data = frame.putObject(DATA);
    if (event instanceof RegisterRequest register) {
      data.put("userId", register.userId());
      data.put("displayName", register.displayName());
      data.put("authToken", register.authToken());
    } else if (event instanceof RoomRequest room) {
      data.put("roomId", room.roomId().value());
      data.put("userId", room.userId());
      data.put("authToken", room.authToken());
    } else if (event instanceof SendMessageRequest send) {
      data.put("roomId", send.roomId().value());
      data.put("userId", send.userId());
      data.put("displayName", send.displayName());
      data.put("message", send.message());
      putIfPresent(data, "imageUrl", send.imageUrl());
      data.put("authToken", send.authToken());
    } else if (event instanceof TypingSignal typing) {
      data.put("roomId", typing.roomId().value());
      data.put("userId", typing.userId());
      data.put("displayName", typing.displayName());
      data.put("isTyping", typing.typing());
    } else if (event instanceof PrivateMessageRequest direct) {
      data.put("toUserId", direct.toUserId());
      data.put("fromUserId", direct.fromUserId());
      data.put("fromDisplayName", direct.fromDisplayName());
      data.put("message", direct.message());
    } else {
      throw new IllegalArgumentException("Unsupported outbound event " + event.getClass().getName());
    }
    try {
      return mapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode " + event.name().wireName(), ex);
    }
  }

  /**
   * Decodes a JSON text frame.
   *
   * @param text raw frame
   * @return decoded event, or empty when the event name is unknown
   * @throws MalformedFrameException when the frame is not a valid chat event
   */
  public Optional<InboundEvent> decode(String text) throws MalformedFrameException {
    if (text == null || text.isBlank()) {
      throw new MalformedFrameException("empty frame");
    }
    JsonNode frame;
    try {
      frame = mapper.readTree(text);
    } catch (JsonProcessingException ex) {
      throw new MalformedFrameException("frame is not valid JSON", ex);
    }
    if (frame == null || !frame.isObject()) {
      throw new MalformedFrameException("frame is not a JSON object");
    }
    JsonNode eventNode = frame.get(EVENT);
    if (eventNode == null || !eventNode.isTextual()) {
      throw new MalformedFrameException("frame has no event name");
    }
    Optional<EventName> name = EventName.fromWire(eventNode.asText());
    if (name.isEmpty()) {
      return Optional.empty();
    }
    JsonNode data = frame.get(DATA);
    if (data == null || !data.isObject()) {
      throw new MalformedFrameException("event " + eventNode.asText() + " has no data object");
    }
    Object payload = switch (name.get()) {
      case REGISTERED -> new RegistrationAck(
          data.path("success").asBoolean(false), optionalText(data, "userId"), optionalText(data, "socketId"));
      case JOINED_ROOM -> new JoinAck(roomId(data, "roomId"), data.path("success").asBoolean(true));
      case NEW_MESSAGE -> message(data, null);
      case MESSAGE_HISTORY -> history(data);
      case USER_TYPING -> new TypingIndicator(
          roomId(data, "roomId"),
          requiredText(data, "userId"),
          optionalText(data, "displayName"),
          data.path("isTyping").asBoolean(false));
      case USER_ONLINE -> new PresenceEvent(
          requiredText(data, "userId"), optionalText(data, "displayName"), true, optionalText(data, "timestamp"));
      case USER_OFFLINE -> new PresenceEvent(
          requiredText(data, "userId"),
          optionalText(data, "displayName"),
          false,
          firstText(data, "lastSeen", "timestamp"));
      case USER_JOINED_ROOM, USER_LEFT_ROOM -> new RoomMembershipEvent(
          roomId(data, "roomId"),
          requiredText(data, "userId"),
          name.get() == EventName.USER_JOINED_ROOM,
          optionalText(data, "timestamp"));
      case PRIVATE_MESSAGE -> new PrivateMessage(
          requiredText(data, "fromUserId"),
          optionalText(data, "fromDisplayName"),
          optionalText(data, "message"),
          optionalText(data, "timestamp"),
          requiredText(data, "messageId"));
      default -> null;
    };
    if (payload == null) {
      // Client-to-server names echoed back carry nothing the session consumes.
      return Optional.empty();
    }
    return Optional.of(new InboundEvent(name.get(), payload));
  }

  private HistorySnapshot history(JsonNode data) throws MalformedFrameException {
    RoomId roomId = roomId(data, "roomId");
    JsonNode messages = data.get("messages");
    List<ChatMessage> decoded = new ArrayList<>();
    if (messages != null && !messages.isNull()) {
      if (!messages.isArray()) {
        throw new MalformedFrameException("history messages is not an array");
      }
      for (JsonNode message : messages) {
        decoded.add(message(message, roomId));
      }
    }
    return new HistorySnapshot(roomId, decoded);
  }

  private static ChatMessage message(JsonNode node, RoomId fallbackRoom) throws MalformedFrameException {
    if (node == null || !node.isObject()) {
      throw new MalformedFrameException("message is not a JSON object");
    }
    RoomId roomId = fallbackRoom != null && optionalText(node, "roomId").isBlank()
        ? fallbackRoom
        : roomId(node, "roomId");
    String imageUrl = optionalText(node, "imageUrl");
    return new ChatMessage(
        requiredText(node, "messageId"),
        roomId,
        optionalText(node, "userId"),
        optionalText(node, "displayName"),
        optionalText(node, "message"),
        imageUrl,
        optionalText(node, "timestamp"),
        MessageKind.fromWire(optionalText(node, "type"), !imageUrl.isBlank()));
  }

  private static RoomId roomId(JsonNode node, String field) throws MalformedFrameException {
    return RoomId.of(requiredText(node, field));
  }

  private static String requiredText(JsonNode node, String field) throws MalformedFrameException {
    String value = optionalText(node, field);
    if (value.isBlank()) {
      throw new MalformedFrameException("missing required field " + field);
    }
    return value;
  }

  private static String optionalText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return "";
    }
    return value.asText();
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      String value = optionalText(node, field);
      if (!value.isBlank()) {
        return value;
      }
    }
    return "";
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null && !value.isBlank()) {
      node.put(field, value);
    }
  }
}
