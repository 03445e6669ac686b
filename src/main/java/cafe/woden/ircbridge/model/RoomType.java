package cafe.woden.ircbridge.model;

import java.util.Locale;
import java.util.Optional;

/** Rocket.Chat room kinds, keyed by the single-letter {@code t} field. */
public enum RoomType {
  PUBLIC("c"),
  PRIVATE("p"),
  DIRECT("d");

  private final String code;

  RoomType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Optional<RoomType> fromCode(String code) {
    if (code == null) return Optional.empty();
    String c = code.trim().toLowerCase(Locale.ROOT);
    for (RoomType t : values()) {
      if (t.code.equals(c)) return Optional.of(t);
    }
    return Optional.empty();
  }
}
