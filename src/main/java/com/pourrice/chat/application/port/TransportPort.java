package com.pourrice.chat.application.port;

import com.pourrice.chat.domain.protocol.OutboundEvent;
import java.net.URI;

/**
 * <strong>What:</strong> Port for the single persistent chat connection.
 * <p><strong>Why:</strong> Decouples the session from the WebSocket library and lets tests drive inbound events
 * directly.</p>
 * <p><strong>Role:</strong> Only the connection manager opens and closes it; other components send through it.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept {@link #send(OutboundEvent)} from any thread.</p>
 *
 * @since 0.1.0
 */
public interface TransportPort {

  /**
   * Opens a connection, replacing any previous one. Outcomes are reported through the listener.
   *
   * @param endpoint server endpoint
   * @param listener callbacks for this connection only
   */
  void open(URI endpoint, TransportListener listener);

  /**
   * Queues an event for sending. Best effort.
   *
   * @param event event to encode and send
   * @return {@code false} when no open connection accepted the event
   */
  boolean send(OutboundEvent event);

  /**
   * Closes the current connection, if any. The listener of that connection is not notified.
   */
  void close();
}
