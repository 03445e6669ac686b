package cafe.woden.ircbridge.app;

/** A bootstrap stage that must succeed did not. */
public class BridgeConnectException extends RuntimeException {

  private final String stage;

  public BridgeConnectException(String stage, Throwable cause) {
    super("Bridge bootstrap failed at stage '" + stage + "': "
        + (cause == null ? "unknown error" : cause.getMessage()), cause);
    this.stage = stage;
  }

  public String stage() {
    return stage;
  }
}
