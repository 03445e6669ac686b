package cafe.woden.ircbridge.irc;

import java.util.Objects;

/**
 * Replies the bridge asks the IRC side to deliver to the connected client.
 *
 * <p>Numeric names follow RFC 2812: {@code RPL_NAMREPLY} (353), {@code RPL_ENDOFNAMES} (366),
 * {@code RPL_WHOREPLY} (352), {@code RPL_ENDOFWHO} (315) and {@code ERR_NOSUCHCHANNEL} (403).
 */
public sealed interface IrcReply permits
    IrcReply.NamesReply,
    IrcReply.NamesEnd,
    IrcReply.WhoReply,
    IrcReply.WhoEnd,
    IrcReply.PrivMsg,
    IrcReply.NoSuchChannel {

  /** Channel the reply concerns, or the target of a message. */
  String target();

  /** RPL_NAMREPLY. {@code names} is space-separated. */
  record NamesReply(String channel, String names) implements IrcReply {
    public NamesReply {
      names = Objects.toString(names, "");
    }

    @Override
    public String target() {
      return channel;
    }
  }

  /** RPL_ENDOFNAMES. */
  record NamesEnd(String channel) implements IrcReply {
    @Override
    public String target() {
      return channel;
    }
  }

  /** RPL_WHOREPLY for one member; {@code online == false} is reported as gone/away. */
  record WhoReply(String nick, String channel, String user, boolean online) implements IrcReply {
    @Override
    public String target() {
      return channel;
    }
  }

  /** RPL_ENDOFWHO. */
  record WhoEnd(String channel) implements IrcReply {
    @Override
    public String target() {
      return channel;
    }
  }

  /** PRIVMSG from {@code fromNick} to a channel or nick. */
  record PrivMsg(String target, String fromNick, String text) implements IrcReply {
    public PrivMsg {
      text = Objects.toString(text, "");
    }
  }

  /** ERR_NOSUCHCHANNEL. */
  record NoSuchChannel(String channel) implements IrcReply {
    @Override
    public String target() {
      return channel;
    }
  }
}
