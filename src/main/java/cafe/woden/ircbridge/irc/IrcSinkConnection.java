package cafe.woden.ircbridge.irc;

/**
 * The IRC client connection the bridge republishes into.
 *
 * <p>Implementations own the wire format; the bridge only speaks in channels, nicks and
 * {@link IrcReply}s.
 */
public interface IrcSinkConnection {

  /** Open (or re-open) {@code channel} for the client, announcing {@code topic} if non-null. */
  void joinChannel(String channel, String topic);

  void send(IrcReply reply);

  /** Nick the IRC client registered with; used when calling the user's attention. */
  String loginNick();
}
