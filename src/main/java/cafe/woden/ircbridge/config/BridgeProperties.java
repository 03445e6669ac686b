package cafe.woden.ircbridge.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bridge configuration.
 *
 * <p>Example YAML:
 * <pre>
 * bridge:
 *   source:
 *     host: chat.example.org
 *     port: 443
 *     secure: true
 *   login-attempts: 5
 * </pre>
 *
 * <p>Credentials are not configured here; the embedding caller passes them when creating a
 * session.
 */
@ConfigurationProperties(prefix = "bridge")
public record BridgeProperties(
    Source source,
    int loginAttempts,
    int messageCacheSize,
    List<String> highlightTerms,
    List<String> debugCollections
) {

  public static final int DEFAULT_LOGIN_ATTEMPTS = 5;
  public static final int DEFAULT_MESSAGE_CACHE_SIZE = 50;
  public static final List<String> DEFAULT_HIGHLIGHT_TERMS =
      List.of("@here", "@channel", "@everyone", "@all");

  /** Where the Rocket.Chat (DDP) service lives. */
  public record Source(String host, int port, Boolean secure) {
    public Source {
      host = host == null ? "" : host.trim();
      if (port <= 0) port = 443;
      if (port > 65535) {
        throw new IllegalArgumentException("bridge.source.port is invalid: " + port);
      }
      if (secure == null) secure = Boolean.TRUE;
    }

    public boolean hasHost() {
      return !host.isBlank();
    }

    /** @throws IllegalStateException if no host is configured */
    public String requireHost() {
      if (!hasHost()) {
        throw new IllegalStateException("bridge.source.host (ROCKETCHAT_HOST) is required");
      }
      return host;
    }
  }

  public BridgeProperties {
    if (source == null) source = new Source(null, 0, null);
    if (loginAttempts <= 0) loginAttempts = DEFAULT_LOGIN_ATTEMPTS;
    if (messageCacheSize <= 0) messageCacheSize = DEFAULT_MESSAGE_CACHE_SIZE;
    if (highlightTerms == null || highlightTerms.isEmpty()) {
      highlightTerms = DEFAULT_HIGHLIGHT_TERMS;
    } else {
      highlightTerms = highlightTerms.stream()
          .filter(t -> t != null && !t.isEmpty())
          .toList();
    }
    debugCollections = debugCollections == null ? List.of() : List.copyOf(debugCollections);
  }

  /** Defaults for everything, with the given host. */
  public static BridgeProperties forHost(String host) {
    return new BridgeProperties(new Source(host, 0, null), 0, 0, null, null);
  }
}
