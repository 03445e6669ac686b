package cafe.woden.ircbridge.model;

import java.util.List;
import java.util.Objects;

/**
 * A source-side room.
 *
 * <p>{@code usernames} is only populated for direct rooms, where it lists both participants.
 * Membership is tracked by {@link SessionState}, not here.
 */
public record Room(String id, String name, RoomType type, String topic, List<String> usernames) {
  public Room {
    id = Objects.requireNonNull(id, "id");
    name = Objects.toString(name, "");
    type = type == null ? RoomType.PUBLIC : type;
    if (topic != null && topic.isBlank()) topic = null;
    usernames = usernames == null ? List.of() : List.copyOf(usernames);
  }

  public Room(String id, String name, RoomType type) {
    this(id, name, type, null, List.of());
  }

  public boolean isDirect() {
    return type == RoomType.DIRECT;
  }
}
