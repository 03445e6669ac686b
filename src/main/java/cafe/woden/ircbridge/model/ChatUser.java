package cafe.woden.ircbridge.model;

import java.util.Objects;

/** A source-side user. {@code name} is the display name and falls back to the username. */
public record ChatUser(String id, String username, String name) {
  public ChatUser {
    id = Objects.requireNonNull(id, "id");
    username = Objects.toString(username, "");
    if (name == null || name.isBlank()) name = username;
  }
}
