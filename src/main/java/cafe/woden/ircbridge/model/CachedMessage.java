package cafe.woden.ircbridge.model;

import java.util.Objects;

public record CachedMessage(String id, String roomId, String text) {
  public CachedMessage {
    id = Objects.requireNonNull(id, "id");
    roomId = Objects.toString(roomId, "");
    text = Objects.toString(text, "");
  }

  public CachedMessage withText(String newText) {
    return new CachedMessage(id, roomId, newText);
  }
}
