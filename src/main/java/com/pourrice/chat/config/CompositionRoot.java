package com.pourrice.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pourrice.chat.application.chat.ChatSession;
import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.ImageStorePort;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.port.TokenProvider;
import com.pourrice.chat.application.port.TransportPort;
import com.pourrice.chat.infrastructure.auth.StaticIdentityProvider;
import com.pourrice.chat.infrastructure.auth.StaticTokenProvider;
import com.pourrice.chat.infrastructure.exec.EventLoopScheduler;
import com.pourrice.chat.infrastructure.imagestore.DisabledImageStore;
import com.pourrice.chat.infrastructure.imagestore.ImageStoreSettings;
import com.pourrice.chat.infrastructure.imagestore.OkHttpImageStoreClient;
import com.pourrice.chat.infrastructure.metrics.NoOpMetricsAdapter;
import com.pourrice.chat.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.pourrice.chat.infrastructure.metrics.TelemetrySettings;
import com.pourrice.chat.infrastructure.transport.JsonChatCodec;
import com.pourrice.chat.infrastructure.transport.OkHttpChatTransport;
import com.pourrice.chat.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link ChatSession} to concrete adapters from a {@link ChatConfig}.
 * <p><strong>Role:</strong> The only place that knows about OkHttp, Jackson and OpenTelemetry together.</p>
 * <p><strong>Thread-safety:</strong> Construct and use from a single thread during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration PING_INTERVAL = Duration.ofSeconds(25);
  private static final Duration UPLOAD_TIMEOUT = Duration.ofSeconds(60);

  private final ChatConfig config;
  private final MetricsPort metrics;
  private final ObjectMapper mapper = new ObjectMapper();

  /**
   * Creates a root whose metrics adapter follows {@link ChatConfig#telemetry()}.
   *
   * @param config validated configuration
   */
  public CompositionRoot(ChatConfig config) {
    this(config, metricsFor(Objects.requireNonNull(config, "config").telemetry()));
  }

  /**
   * Creates a root with an explicit metrics adapter.
   *
   * @param config validated configuration
   * @param metrics metrics adapter
   */
  public CompositionRoot(ChatConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the metrics adapter used by every built component.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the token source.
   *
   * @return token provider backed by {@code authToken}
   */
  public TokenProvider tokenProvider() {
    log.debug("Using configured auth token {}", Logs.maskToken(config.authToken()));
    return new StaticTokenProvider(config.authToken());
  }

  /**
   * Builds the identity source.
   *
   * @return provider for the configured user, or a signed-out provider
   */
  public IdentityProvider identityProvider() {
    return config.identity().map(StaticIdentityProvider::of).orElseGet(StaticIdentityProvider::signedOut);
  }

  /**
   * Builds the image store, or a disabled one when no API base URL is configured.
   *
   * @param client HTTP client
   * @param tokens bearer token source
   * @return image store
   */
  public ImageStorePort imageStore(OkHttpClient client, TokenProvider tokens) {
    if (config.apiBaseUri().isEmpty()) {
      log.info("apiBaseUrl not configured; image attachments disabled");
      return new DisabledImageStore();
    }
    ImageStoreSettings settings = ImageStoreSettings.of(
        config.apiBaseUri().get().toString(),
        config.uploadPath(),
        config.deletePath(),
        config.uploadFolder(),
        config.apiPasscode());
    OkHttpClient uploads = client.newBuilder().writeTimeout(UPLOAD_TIMEOUT).build();
    return new OkHttpImageStoreClient(uploads, mapper, tokens, settings);
  }

  /**
   * Builds the WebSocket transport.
   *
   * @param client HTTP client
   * @return transport
   */
  public TransportPort transport(OkHttpClient client) {
    return new OkHttpChatTransport(client, new JsonChatCodec(mapper), metrics);
  }

  /**
   * Builds a session and the resources it runs on.
   *
   * @param listener UI callbacks
   * @return runtime owning the session; close it to release everything
   */
  public ChatRuntime chatRuntime(ChatEventListener listener) {
    OkHttpClient client = new OkHttpClient.Builder()
        .connectTimeout(CONNECT_TIMEOUT)
        .pingInterval(PING_INTERVAL)
        .build();
    EventLoopScheduler scheduler = EventLoopScheduler.create("chat-session");
    TokenProvider tokens = tokenProvider();
    ChatSession session = new ChatSession(
        transport(client),
        scheduler,
        tokens,
        identityProvider(),
        imageStore(client, tokens),
        listener,
        metrics,
        config.session());
    log.info("Chat runtime ready: {}", config);
    return new ChatRuntime(session, scheduler, client, metrics instanceof AutoCloseable closeable ? closeable : null);
  }

  private static MetricsPort metricsFor(TelemetrySettings telemetry) {
    if (telemetry.exporter() == TelemetrySettings.Exporter.NONE) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(telemetry);
  }
}
