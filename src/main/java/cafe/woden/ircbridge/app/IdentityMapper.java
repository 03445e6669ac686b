package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.model.ChatUser;
import cafe.woden.ircbridge.model.Room;
import cafe.woden.ircbridge.model.RoomType;
import cafe.woden.ircbridge.model.SessionState;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates between source rooms and IRC channel names.
 *
 * <ul>
 *   <li>public room {@code general} &rarr; {@code #general}
 *   <li>private room {@code staff} &rarr; {@code ##staff}
 *   <li>direct room with {@code bob} &rarr; {@code bob}
 * </ul>
 *
 * <p>The names actually handed out are recorded in {@link SessionState}, which disambiguates two
 * rooms that would otherwise map to the same channel.
 */
public final class IdentityMapper {

  static final String PUBLIC_PREFIX = "#";
  static final String PRIVATE_PREFIX = "##";

  private final SessionState state;

  public IdentityMapper(SessionState state) {
    this.state = Objects.requireNonNull(state, "state");
  }

  /** Store a room and claim its channel name. Returns the assigned name. */
  public String register(Room room) {
    state.putRoom(room);
    return state.assignChannel(room.id(), baseChannelName(room));
  }

  /** The channel a room is bridged to, claiming one if it has none yet. */
  public String channelName(Room room) {
    return state.channelOf(room.id())
        .orElseGet(() -> state.assignChannel(room.id(), baseChannelName(room)));
  }

  /** The undisambiguated channel name for a room. */
  public String baseChannelName(Room room) {
    return switch (room.type()) {
      case PUBLIC -> PUBLIC_PREFIX + room.name();
      case PRIVATE -> PRIVATE_PREFIX + room.name();
      case DIRECT -> counterpart(room);
    };
  }

  /**
   * Resolve a channel name the IRC client used.
   *
   * <p>Assigned names are matched first. Otherwise the prefix selects the room type and the rest
   * is matched against room names (or direct-room counterparts).
   */
  public Optional<Room> roomFromChannel(String channel) {
    if (channel == null || channel.isBlank()) return Optional.empty();

    Optional<Room> assigned = state.roomByChannel(channel);
    if (assigned.isPresent()) return assigned;

    RoomType type = typeOf(channel);
    String name = stripPrefix(channel);
    for (Room room : state.rooms()) {
      if (room.type() != type) continue;
      String candidate = type == RoomType.DIRECT ? counterpart(room) : room.name();
      if (name.equals(candidate)) return Optional.of(room);
    }
    return Optional.empty();
  }

  static RoomType typeOf(String channel) {
    if (channel.startsWith(PRIVATE_PREFIX)) return RoomType.PRIVATE;
    if (channel.startsWith(PUBLIC_PREFIX)) return RoomType.PUBLIC;
    return RoomType.DIRECT;
  }

  static String stripPrefix(String channel) {
    if (channel.startsWith(PRIVATE_PREFIX)) return channel.substring(2);
    if (channel.startsWith(PUBLIC_PREFIX)) return channel.substring(1);
    return channel;
  }

  private String counterpart(Room room) {
    String me = state.self().map(ChatUser::username).orElse("");
    for (String username : room.usernames()) {
      if (username != null && !username.isEmpty() && !username.equals(me)) return username;
    }
    return room.name();
  }
}
