package com.pourrice.chat.config;

import com.pourrice.chat.application.chat.ChatSettings;
import com.pourrice.chat.application.chat.ReconnectPolicy;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened default configuration for the chat client.
 *
 * <p>The defaults are the single source of truth for optional YAML and CLI keys.</p>
 */
public final class ChatDefaults {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private ChatDefaults() {}

  /**
   * Returns the defaults as dotted keys.
   *
   * @return unmodifiable default key/value pairs
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    ReconnectPolicy reconnect = ReconnectPolicy.DEFAULT;
    Map<String, String> map = new LinkedHashMap<>();
    map.put("socketUrl", "ws://localhost:3000/chat");
    map.put("apiBaseUrl", "");
    map.put("uploadPath", "API/Images/upload");
    map.put("deletePath", "API/Images/delete");
    map.put("uploadFolder", "Chat");
    map.put("apiPasscode", "");
    map.put("userId", "");
    map.put("displayName", "");
    map.put("email", "");
    map.put("authToken", "");
    map.put("restaurantId", "");
    map.put("reconnect.initialDelayMillis", Long.toString(reconnect.initialDelayMillis()));
    map.put("reconnect.maxDelayMillis", Long.toString(reconnect.maxDelayMillis()));
    map.put("reconnect.maxAttempts", Integer.toString(reconnect.maxAttempts()));
    map.put("historyTimeoutMillis", Long.toString(ChatSettings.DEFAULT_HISTORY_TIMEOUT_MILLIS));
    map.put("typing.idleMillis", Long.toString(ChatSettings.DEFAULT_TYPING_IDLE_MILLIS));
    map.put("typing.expiryMillis", Long.toString(ChatSettings.DEFAULT_TYPING_EXPIRY_MILLIS));
    map.put("attachment.maxBytes", Long.toString(ChatSettings.DEFAULT_ATTACHMENT_MAX_BYTES));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
