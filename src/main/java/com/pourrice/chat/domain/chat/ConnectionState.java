package com.pourrice.chat.domain.chat;

/**
 * Physical connection state. Owned by the connection manager; everything else only observes it.
 *
 * @since 0.1.0
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
