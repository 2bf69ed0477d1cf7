package com.logimetrics.coordinator.realtime;

public class RealtimeAccessDeniedException extends RuntimeException {

  private final RoomKey room;

  public RealtimeAccessDeniedException(RoomKey room, String message) {
    super(message + " room=" + room.value());
    this.room = room;
  }

  public RoomKey room() {
    return room;
  }
}
