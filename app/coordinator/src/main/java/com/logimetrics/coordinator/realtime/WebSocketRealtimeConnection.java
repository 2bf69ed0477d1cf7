package com.logimetrics.coordinator.realtime;

import java.io.IOException;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/** Adapts a WebSocket session; sends are serialised and bounded by the decorator limits. */
final class WebSocketRealtimeConnection implements RealtimeConnection {

  private final WebSocketSession session;
  private final RealtimePrincipal principal;

  WebSocketRealtimeConnection(
      WebSocketSession session, RealtimePrincipal principal, int sendTimeMs, int bufferSize) {
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeMs, bufferSize);
    this.principal = principal;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public RealtimePrincipal principal() {
    return principal;
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(String text) throws IOException {
    session.sendMessage(new TextMessage(text));
  }
}
