package cafe.woden.ircbridge.source;

import cafe.woden.ircbridge.model.ChatUser;
import cafe.woden.ircbridge.model.Room;
import cafe.woden.ircbridge.model.RoomType;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Maps Rocket.Chat documents and method results onto bridge model types. */
public final class RocketChatRecords {

  private RocketChatRecords() {}

  /** A room document ({@code _id}, {@code name}, {@code t}, {@code topic}, {@code usernames}). */
  public static Optional<Room> room(JsonNode doc) {
    if (doc == null || !doc.isObject()) return Optional.empty();
    String id = text(doc, "_id");
    if (id.isEmpty()) return Optional.empty();

    RoomType type = RoomType.fromCode(text(doc, "t")).orElse(null);
    if (type == null) return Optional.empty();

    JsonNode topic = doc.get("topic");
    return Optional.of(new Room(
        id,
        text(doc, "name"),
        type,
        topic == null || topic.isNull() ? null : topic.asText(),
        strings(doc.get("usernames"))));
  }

  /**
   * Rooms from a {@code rooms/get} result.
   *
   * <p>Without a date the server answers with a plain array; with one it answers
   * {@code {"update": [...], "remove": [...]}}. Both are accepted; removals are ignored since
   * rooms are never dropped during a session.
   */
  public static List<Room> rooms(JsonNode result) {
    JsonNode list = result;
    if (result != null && result.isObject()) list = result.get("update");
    List<Room> out = new ArrayList<>();
    if (list == null || !list.isArray()) return out;
    for (JsonNode doc : list) {
      room(doc).ifPresent(out::add);
    }
    return out;
  }

  /** A user document ({@code _id}, {@code username}, {@code name}). */
  public static Optional<ChatUser> user(JsonNode doc) {
    if (doc == null || !doc.isObject()) return Optional.empty();
    String id = text(doc, "_id");
    if (id.isEmpty()) return Optional.empty();
    return Optional.of(new ChatUser(id, text(doc, "username"), text(doc, "name")));
  }

  /** Users from a {@code getUsersOfRoom} result ({@code {"records": [...], "total": n}}). */
  public static List<ChatUser> roomMembers(JsonNode result) {
    List<ChatUser> out = new ArrayList<>();
    if (result == null) return out;
    JsonNode records = result.isArray() ? result : result.get("records");
    if (records == null || !records.isArray()) return out;
    for (JsonNode doc : records) {
      user(doc).ifPresent(out::add);
    }
    return out;
  }

  /** A streamed message ({@code _id}, {@code rid}, {@code msg}, {@code u.username}). */
  public static Optional<IncomingMessage> message(JsonNode doc) {
    if (doc == null || !doc.isObject()) return Optional.empty();
    String id = text(doc, "_id");
    if (id.isEmpty()) return Optional.empty();

    JsonNode u = doc.get("u");
    String username = "";
    if (u != null && u.isObject()) {
      username = text(u, "username");
      if (username.isEmpty()) username = text(u, "name");
    }
    return Optional.of(new IncomingMessage(id, text(doc, "rid"), text(doc, "msg"), username));
  }

  private static String text(JsonNode doc, String field) {
    JsonNode n = doc.get(field);
    return n == null || n.isNull() ? "" : n.asText("");
  }

  private static List<String> strings(JsonNode arr) {
    List<String> out = new ArrayList<>();
    if (arr == null || !arr.isArray()) return out;
    for (JsonNode n : arr) {
      if (n != null && n.isTextual()) out.add(n.asText());
    }
    return out;
  }
}
