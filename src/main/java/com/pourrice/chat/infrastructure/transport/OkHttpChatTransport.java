package com.pourrice.chat.infrastructure.transport;

import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.port.TransportListener;
import com.pourrice.chat.application.port.TransportPort;
import com.pourrice.chat.domain.protocol.InboundEvent;
import com.pourrice.chat.domain.protocol.OutboundEvent;
import com.pourrice.chat.logging.Logs;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TransportPort} backed by an OkHttp WebSocket.
 * <p><strong>Role:</strong> Adapter between the session's connection manager and the network. Reconnection is the
 * connection manager's job; this adapter only reports opens, closes and failures.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Listener callbacks arrive on OkHttp's reader thread.
 * Callbacks of a socket replaced by {@link #open} or ended by {@link #close()} are suppressed.</p>
 * <p><strong>Observability:</strong> Malformed frames are logged at WARN (truncated) and counted as
 * {@code chat.frame.malformed}; the connection stays open.</p>
 *
 * @since 0.1.0
 */
public final class OkHttpChatTransport implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpChatTransport.class);
  private static final int NORMAL_CLOSURE = 1000;
  private static final int LOG_FRAME_BYTES = 256;

  private final OkHttpClient client;
  private final JsonChatCodec codec;
  private final MetricsPort metrics;
  private WebSocket socket;

  /**
   * Creates a transport.
   *
   * @param client shared OkHttp client
   * @param codec frame codec
   * @param metrics metrics sink
   */
  public OkHttpChatTransport(OkHttpClient client, JsonChatCodec codec, MetricsPort metrics) {
    this.client = Objects.requireNonNull(client, "client");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public synchronized void open(URI endpoint, TransportListener listener) {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(listener, "listener");
    closeCurrent("replaced");
    Request request = new Request.Builder().url(endpoint.toString()).build();
    socket = client.newWebSocket(request, new SocketListener(listener));
  }

  @Override
  public boolean send(OutboundEvent event) {
    WebSocket current;
    synchronized (this) {
      current = socket;
    }
    if (current == null) {
      return false;
    }
    String frame = codec.encode(event);
    boolean queued = current.send(frame);
    if (!queued) {
      log.debug("WebSocket rejected {} frame", event.name().wireName());
    }
    return queued;
  }

  @Override
  public synchronized void close() {
    closeCurrent("client closed");
  }

  private void closeCurrent(String reason) {
    if (socket != null) {
      WebSocket previous = socket;
      socket = null;
      if (!previous.close(NORMAL_CLOSURE, reason)) {
        previous.cancel();
      }
    }
  }

  private synchronized boolean isCurrent(WebSocket webSocket) {
    return socket == webSocket;
  }

  private synchronized boolean release(WebSocket webSocket) {
    if (socket == webSocket) {
      socket = null;
      return true;
    }
    return false;
  }

  /**
   * Decodes one text frame and forwards it. Exposed for listener-level tests.
   *
   * @param text raw frame
   * @param listener receiver of decoded events
   */
  void dispatch(String text, TransportListener listener) {
    Optional<InboundEvent> event;
    try {
      event = codec.decode(text);
    } catch (MalformedFrameException ex) {
      metrics.increment("chat.frame.malformed");
      log.warn("Dropping malformed chat frame ({}): {}", ex.getMessage(), Logs.truncate(text, LOG_FRAME_BYTES));
      return;
    }
    if (event.isEmpty()) {
      log.debug("Ignoring unknown chat frame: {}", Logs.truncate(text, LOG_FRAME_BYTES));
      return;
    }
    listener.onEvent(event.get());
  }

  private final class SocketListener extends WebSocketListener {
    private final TransportListener listener;

    SocketListener(TransportListener listener) {
      this.listener = listener;
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
      if (isCurrent(webSocket)) {
        listener.onOpen();
      }
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
      if (isCurrent(webSocket)) {
        dispatch(text, listener);
      }
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
      webSocket.close(NORMAL_CLOSURE, null);
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
      if (release(webSocket)) {
        listener.onClosed(code + (reason == null || reason.isEmpty() ? "" : " " + reason));
      }
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
      if (release(webSocket)) {
        listener.onFailure(t);
      }
    }
  }
}
