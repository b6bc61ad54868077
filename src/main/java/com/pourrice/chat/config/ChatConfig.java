package com.pourrice.chat.config;

import com.pourrice.chat.application.chat.ChatSettings;
import com.pourrice.chat.application.chat.ReconnectPolicy;
import com.pourrice.chat.domain.chat.UserIdentity;
import com.pourrice.chat.infrastructure.metrics.TelemetrySettings;
import com.pourrice.chat.validation.Net;
import com.pourrice.chat.validation.Numbers;
import com.pourrice.chat.validation.Strings;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated configuration of a console chat client.
 * <p><strong>Role:</strong> Built by {@link #fromMap(Map)} from the merged defaults, YAML and CLI map, then handed to
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param session session tunables, including the socket endpoint
 * @param apiBaseUri image API base URL; empty disables image uploads
 * @param uploadPath upload path relative to the API base
 * @param deletePath delete path relative to the API base
 * @param uploadFolder storage folder for chat images
 * @param apiPasscode {@code x-api-passcode} header value; may be empty
 * @param identity signed-in user; empty when no {@code userId} is configured
 * @param authToken bearer token; may be empty
 * @param restaurantId restaurant whose room is opened on start; may be empty
 * @param telemetry metrics export settings
 * @param verbose whether DEBUG logging is enabled
 * @since 0.1.0
 */
public record ChatConfig(
    ChatSettings session,
    Optional<URI> apiBaseUri,
    String uploadPath,
    String deletePath,
    String uploadFolder,
    String apiPasscode,
    Optional<UserIdentity> identity,
    String authToken,
    Optional<String> restaurantId,
    TelemetrySettings telemetry,
    boolean verbose) {

  private static final int MAX_PASSCODE_LENGTH = 256;
  private static final int MAX_ATTRIBUTES_LENGTH = 1024;
  private static final long MAX_MILLIS = 600_000L;

  public ChatConfig {
    Objects.requireNonNull(session, "session");
    apiBaseUri = Objects.requireNonNullElse(apiBaseUri, Optional.empty());
    Objects.requireNonNull(uploadPath, "uploadPath");
    Objects.requireNonNull(deletePath, "deletePath");
    uploadFolder = Objects.requireNonNullElse(uploadFolder, "");
    apiPasscode = Objects.requireNonNullElse(apiPasscode, "");
    identity = Objects.requireNonNullElse(identity, Optional.empty());
    authToken = Objects.requireNonNullElse(authToken, "");
    restaurantId = Objects.requireNonNullElse(restaurantId, Optional.empty());
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Configuration with every default applied.
   *
   * @return default configuration
   */
  public static ChatConfig defaults() {
    return fromMap(ChatDefaults.asFlatMap());
  }

  /**
   * Validates a flattened key/value map. Missing keys fall back to {@link ChatDefaults}.
   *
   * @param values merged configuration
   * @return configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ChatConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> defaults = ChatDefaults.asFlatMap();

    URI socketUri = Net.requireSocketUri("socketUrl", value(values, defaults, "socketUrl"));
    ReconnectPolicy reconnect = new ReconnectPolicy(
        millis(values, defaults, "reconnect.initialDelayMillis"),
        millis(values, defaults, "reconnect.maxDelayMillis"),
        (int) Numbers.parseInRange(
            "reconnect.maxAttempts", value(values, defaults, "reconnect.maxAttempts"), 0, 100));
    ChatSettings session = new ChatSettings(
        socketUri,
        reconnect,
        millis(values, defaults, "historyTimeoutMillis"),
        millis(values, defaults, "typing.idleMillis"),
        millis(values, defaults, "typing.expiryMillis"),
        Numbers.parseInRange(
            "attachment.maxBytes", value(values, defaults, "attachment.maxBytes"), 1, 100L * 1024 * 1024));

    Optional<URI> apiBase = optional(values, "apiBaseUrl").map(raw -> Net.requireHttpUri("apiBaseUrl", raw));
    String passcode = optional(values, "apiPasscode")
        .map(raw -> Strings.requirePrintableAscii("apiPasscode", raw, MAX_PASSCODE_LENGTH))
        .orElse("");

    Optional<UserIdentity> identity = optional(values, "userId")
        .map(raw -> new UserIdentity(
            Strings.requireIdentifier("userId", raw),
            optional(values, "displayName").orElse(null),
            optional(values, "email").orElse(null)));
    Optional<String> restaurantId = optional(values, "restaurantId")
        .map(raw -> Strings.requireIdentifier("restaurantId", raw));

    TelemetrySettings telemetry = new TelemetrySettings(
        TelemetrySettings.Exporter.parse(value(values, defaults, "metricsExporter")),
        optional(values, "otelEndpoint").orElse(null),
        optional(values, "otelResourceAttributes")
            .map(raw -> Strings.requirePrintableAscii("otelResourceAttributes", raw, MAX_ATTRIBUTES_LENGTH))
            .orElse(""));

    return new ChatConfig(
        session,
        apiBase,
        Strings.requireNonBlank("uploadPath", value(values, defaults, "uploadPath")),
        Strings.requireNonBlank("deletePath", value(values, defaults, "deletePath")),
        optional(values, "uploadFolder").orElse(""),
        passcode,
        identity,
        optional(values, "authToken").orElse(""),
        restaurantId,
        telemetry,
        Boolean.parseBoolean(value(values, defaults, "verbose").trim()));
  }

  /**
   * Returns the socket endpoint.
   *
   * @return chat server URI
   */
  public URI socketUri() {
    return session.socketUri();
  }

  @Override
  public String toString() {
    return "ChatConfig[socketUri=" + session.socketUri()
        + ", apiBaseUri=" + apiBaseUri.map(URI::toString).orElse("<disabled>")
        + ", userId=" + identity.map(UserIdentity::userId).orElse("<none>")
        + ", restaurantId=" + restaurantId.orElse("<none>")
        + ", authToken=" + (authToken.isEmpty() ? "<none>" : "<redacted>")
        + ", exporter=" + telemetry.exporter()
        + "]";
  }

  private static long millis(Map<String, String> values, Map<String, String> defaults, String key) {
    return Numbers.parseInRange(key, value(values, defaults, key), 1, MAX_MILLIS);
  }

  private static String value(Map<String, String> values, Map<String, String> defaults, String key) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaults.get(key);
    }
    return raw;
  }

  private static Optional<String> optional(Map<String, String> values, String key) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(raw.trim());
  }
}
