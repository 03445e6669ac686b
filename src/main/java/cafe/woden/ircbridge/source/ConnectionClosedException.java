package cafe.woden.ircbridge.source;

/** Raised for work issued against, or still pending on, a closed transport. */
public class ConnectionClosedException extends RuntimeException {
  public ConnectionClosedException(String message) {
    super(message);
  }
}
