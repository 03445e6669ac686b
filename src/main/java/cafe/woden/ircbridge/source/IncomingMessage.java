package cafe.woden.ircbridge.source;

import java.util.Objects;

/** A message payload as carried by the {@code stream-room-messages} stream. */
public record IncomingMessage(String id, String roomId, String text, String username) {
  public IncomingMessage {
    id = Objects.requireNonNull(id, "id");
    roomId = Objects.toString(roomId, "");
    text = Objects.toString(text, "");
    username = Objects.toString(username, "");
  }
}
