package com.pourrice.chat.testutil;

import com.pourrice.chat.application.port.TransportListener;
import com.pourrice.chat.application.port.TransportPort;
import com.pourrice.chat.domain.protocol.EventName;
import com.pourrice.chat.domain.protocol.InboundEvent;
import com.pourrice.chat.domain.protocol.OutboundEvent;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** In-memory {@link TransportPort} that records frames and lets the test play the server. */
public final class FakeTransport implements TransportPort {
  private final List<OutboundEvent> sent = new ArrayList<>();
  private TransportListener listener;
  private URI endpoint;
  private boolean open;
  private int openCount;
  private int closeCount;

  @Override
  public void open(URI endpoint, TransportListener listener) {
    this.endpoint = endpoint;
    this.listener = listener;
    this.open = false;
    openCount++;
  }

  @Override
  public boolean send(OutboundEvent event) {
    if (!open) {
      return false;
    }
    sent.add(event);
    return true;
  }

  @Override
  public void close() {
    open = false;
    closeCount++;
  }

  public void simulateOpen() {
    open = true;
    listener.onOpen();
  }

  public void deliver(EventName name, Object payload) {
    listener.onEvent(new InboundEvent(name, payload));
  }

  public void simulateClose(String reason) {
    open = false;
    listener.onClosed(reason);
  }

  public void simulateFailure(Throwable error) {
    open = false;
    listener.onFailure(error);
  }

  public TransportListener listener() {
    return listener;
  }

  public URI endpoint() {
    return endpoint;
  }

  public int openCount() {
    return openCount;
  }

  public int closeCount() {
    return closeCount;
  }

  public List<OutboundEvent> sent() {
    return List.copyOf(sent);
  }

  public <T extends OutboundEvent> List<T> sent(Class<T> type) {
    List<T> matches = new ArrayList<>();
    for (OutboundEvent event : sent) {
      if (type.isInstance(event)) {
        matches.add(type.cast(event));
      }
    }
    return matches;
  }

  public void clearSent() {
    sent.clear();
  }
}
