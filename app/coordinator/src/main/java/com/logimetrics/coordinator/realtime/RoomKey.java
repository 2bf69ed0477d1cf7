package com.logimetrics.coordinator.realtime;

import java.util.Objects;

public record RoomKey(RoomScope scope, String id) {

  public RoomKey {
    Objects.requireNonNull(scope, "scope");
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("room id is required");
    }
  }

  public static RoomKey of(RoomScope scope, Object id) {
    return new RoomKey(scope, String.valueOf(id));
  }

  /** Parses "scope:id"; the longest matching scope prefix wins. */
  public static RoomKey parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("room is required");
    }
    RoomScope match = null;
    for (RoomScope scope : RoomScope.values()) {
      final String prefix = scope.prefix() + ":";
      if (raw.startsWith(prefix)
          && raw.length() > prefix.length()
          && (match == null || scope.prefix().length() > match.prefix().length())) {
        match = scope;
      }
    }
    if (match == null) {
      throw new IllegalArgumentException("unknown room: " + raw);
    }
    return new RoomKey(match, raw.substring(match.prefix().length() + 1));
  }

  public String value() {
    return scope.prefix() + ":" + id;
  }

  @Override
  public String toString() {
    return value();
  }
}
