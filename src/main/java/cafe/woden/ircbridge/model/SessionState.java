package cafe.woden.ircbridge.model;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one bridged session knows about the source side.
 *
 * <p>Rooms, room membership, user presence, the assigned IRC channel names and the recent message
 * window. Not thread-safe: a session mutates it from its own scheduler only.
 */
public final class SessionState {

  private final RecentMessageCache recentMessages;

  private final Map<String, Room> roomsById = new LinkedHashMap<>();
  private final Map<String, Map<String, ChatUser>> membersByRoomId = new HashMap<>();
  private final Map<String, Boolean> onlineByUserId = new HashMap<>();

  private final Map<String, String> channelByRoomId = new HashMap<>();
  private final Map<String, String> roomIdByChannelKey = new HashMap<>();
  private final Map<String, String> baseByRoomId = new HashMap<>();

  private ChatUser self;

  public SessionState(int messageCacheSize) {
    this.recentMessages = new RecentMessageCache(messageCacheSize);
  }

  public RecentMessageCache recentMessages() {
    return recentMessages;
  }

  public Optional<ChatUser> self() {
    return Optional.ofNullable(self);
  }

  public void setSelf(ChatUser self) {
    this.self = self;
  }

  // ---- rooms ----

  /** Insert or replace a room. Rooms are never removed during a session. */
  public void putRoom(Room room) {
    Objects.requireNonNull(room, "room");
    roomsById.put(room.id(), room);
  }

  public Optional<Room> room(String roomId) {
    if (roomId == null) return Optional.empty();
    return Optional.ofNullable(roomsById.get(roomId));
  }

  public Collection<Room> rooms() {
    return List.copyOf(roomsById.values());
  }

  // ---- membership ----

  /** Replace the membership snapshot of a room, keyed by user id. */
  public void replaceMembers(String roomId, Collection<ChatUser> members) {
    Map<String, ChatUser> byId = new LinkedHashMap<>();
    if (members != null) {
      for (ChatUser u : members) {
        if (u != null) byId.put(u.id(), u);
      }
    }
    membersByRoomId.put(roomId, byId);
  }

  public List<ChatUser> members(String roomId) {
    Map<String, ChatUser> byId = membersByRoomId.get(roomId);
    return byId == null ? List.of() : List.copyOf(byId.values());
  }

  // ---- presence ----

  public void setOnline(String userId, boolean online) {
    if (userId == null || userId.isBlank()) return;
    onlineByUserId.put(userId, online);
  }

  /** Unknown users are reported as offline. */
  public boolean isOnline(String userId) {
    if (userId == null) return false;
    return Boolean.TRUE.equals(onlineByUserId.get(userId));
  }

  // ---- channel names ----

  /**
   * Assign an IRC channel name to a room.
   *
   * <p>The first room to claim {@code baseName} keeps it. A different room whose base name is
   * already taken gets {@code baseName-<id prefix>}, or {@code baseName-<id>} if that is taken
   * too, then {@code baseName-<id>-2}, {@code -3}, ... A name is never handed to two rooms.
   * Re-assigning the same base name to the same room is a no-op.
   *
   * @return the channel name now assigned to the room
   */
  public String assignChannel(String roomId, String baseName) {
    Objects.requireNonNull(roomId, "roomId");
    String base = Objects.toString(baseName, "");

    String current = channelByRoomId.get(roomId);
    if (current != null) {
      if (base.equals(baseByRoomId.get(roomId))) return current;
      roomIdByChannelKey.remove(channelKey(current), roomId);
    }

    String chosen = firstFreeName(roomId, base);
    channelByRoomId.put(roomId, chosen);
    baseByRoomId.put(roomId, base);
    roomIdByChannelKey.put(channelKey(chosen), roomId);
    return chosen;
  }

  private String firstFreeName(String roomId, String base) {
    for (String candidate : List.of(base, base + "-" + idPrefix(roomId), base + "-" + roomId)) {
      if (isFreeFor(candidate, roomId)) return candidate;
    }
    for (int n = 2; ; n++) {
      String candidate = base + "-" + roomId + "-" + n;
      if (isFreeFor(candidate, roomId)) return candidate;
    }
  }

  private boolean isFreeFor(String channel, String roomId) {
    String owner = roomIdByChannelKey.get(channelKey(channel));
    return owner == null || owner.equals(roomId);
  }

  public Optional<String> channelOf(String roomId) {
    if (roomId == null) return Optional.empty();
    return Optional.ofNullable(channelByRoomId.get(roomId));
  }

  /** Case-insensitive, as IRC channel and nick names are. */
  public Optional<Room> roomByChannel(String channel) {
    String roomId = roomIdByChannelKey.get(channelKey(channel));
    return room(roomId);
  }

  private static String idPrefix(String roomId) {
    return roomId.length() <= 6 ? roomId : roomId.substring(0, 6);
  }

  private static String channelKey(String channel) {
    return Objects.toString(channel, "").trim().toLowerCase(Locale.ROOT);
  }
}
