package cafe.woden.ircbridge.source;

import java.util.Objects;

public record LoginResult(String userId, String token) {
  public LoginResult {
    userId = Objects.requireNonNull(userId, "userId");
    token = Objects.toString(token, "");
  }
}
