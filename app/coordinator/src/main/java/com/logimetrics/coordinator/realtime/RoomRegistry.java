/*
 * Where: Realtime bus
 * What: Room membership as connection slot indices
 * Why: Rooms reference connections by index so removing a connection clears every membership at once
 */
package com.logimetrics.coordinator.realtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Not thread-safe. Only the bus dispatcher thread touches it. */
final class RoomRegistry {

  private final List<RealtimeConnection> slots = new ArrayList<>();
  private final List<Set<RoomKey>> memberships = new ArrayList<>();
  private final Deque<Integer> freeSlots = new ArrayDeque<>();
  private final Map<String, Integer> indexById = new HashMap<>();
  private final Map<RoomKey, Set<Integer>> rooms = new HashMap<>();

  int register(RealtimeConnection connection) {
    final Integer existing = indexById.get(connection.id());
    if (existing != null) {
      return existing;
    }
    final int index;
    if (freeSlots.isEmpty()) {
      index = slots.size();
      slots.add(connection);
      memberships.add(new LinkedHashSet<>());
    } else {
      index = freeSlots.pop();
      slots.set(index, connection);
      memberships.set(index, new LinkedHashSet<>());
    }
    indexById.put(connection.id(), index);
    return index;
  }

  boolean join(String connectionId, RoomKey room) {
    final Integer index = indexById.get(connectionId);
    if (index == null) {
      return false;
    }
    memberships.get(index).add(room);
    return rooms.computeIfAbsent(room, ignored -> new LinkedHashSet<>()).add(index);
  }

  boolean leave(String connectionId, RoomKey room) {
    final Integer index = indexById.get(connectionId);
    if (index == null) {
      return false;
    }
    memberships.get(index).remove(room);
    return removeMember(room, index);
  }

  /** Drops the connection and every membership it held. */
  Set<RoomKey> remove(String connectionId) {
    final Integer index = indexById.remove(connectionId);
    if (index == null) {
      return Set.of();
    }
    final Set<RoomKey> held = memberships.get(index);
    for (RoomKey room : held) {
      removeMember(room, index);
    }
    slots.set(index, null);
    memberships.set(index, null);
    freeSlots.push(index);
    return held;
  }

  List<RealtimeConnection> members(RoomKey room) {
    final Set<Integer> indices = rooms.get(room);
    if (indices == null) {
      return List.of();
    }
    final List<RealtimeConnection> result = new ArrayList<>(indices.size());
    for (Integer index : indices) {
      result.add(slots.get(index));
    }
    return result;
  }

  List<RoomKey> rooms(RoomScope scope) {
    final List<RoomKey> result = new ArrayList<>();
    for (RoomKey room : rooms.keySet()) {
      if (room.scope() == scope) {
        result.add(room);
      }
    }
    return result;
  }

  List<RealtimeConnection> connections() {
    final List<RealtimeConnection> result = new ArrayList<>(indexById.size());
    for (Integer index : indexById.values()) {
      result.add(slots.get(index));
    }
    return result;
  }

  Set<RoomKey> roomsOf(String connectionId) {
    final Integer index = indexById.get(connectionId);
    return index == null ? Set.of() : Set.copyOf(memberships.get(index));
  }

  int connectionCount() {
    return indexById.size();
  }

  private boolean removeMember(RoomKey room, int index) {
    final Set<Integer> members = rooms.get(room);
    if (members == null) {
      return false;
    }
    final boolean removed = members.remove(index);
    if (members.isEmpty()) {
      rooms.remove(room);
    }
    return removed;
  }
}
