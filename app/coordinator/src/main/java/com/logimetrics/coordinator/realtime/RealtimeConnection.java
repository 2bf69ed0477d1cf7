package com.logimetrics.coordinator.realtime;

import java.io.IOException;

/** A live client connection as seen by the bus. */
public interface RealtimeConnection {

  String id();

  RealtimePrincipal principal();

  boolean isOpen();

  void send(String text) throws IOException;
}
