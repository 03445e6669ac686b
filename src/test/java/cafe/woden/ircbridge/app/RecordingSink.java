package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.irc.IrcReply;
import cafe.woden.ircbridge.irc.IrcSinkConnection;
import java.util.ArrayList;
import java.util.List;

/** Collects everything the bridge writes to IRC, in order. */
final class RecordingSink implements IrcSinkConnection {

  record Join(String channel, String topic) {}

  final List<Object> events = new ArrayList<>();
  private final String nick;

  RecordingSink(String nick) {
    this.nick = nick;
  }

  @Override
  public void joinChannel(String channel, String topic) {
    events.add(new Join(channel, topic));
  }

  @Override
  public void send(IrcReply reply) {
    events.add(reply);
  }

  @Override
  public String loginNick() {
    return nick;
  }

  List<IrcReply.PrivMsg> privmsgs() {
    return events.stream()
        .filter(IrcReply.PrivMsg.class::isInstance)
        .map(IrcReply.PrivMsg.class::cast)
        .toList();
  }

  List<String> privmsgTexts() {
    return privmsgs().stream().map(IrcReply.PrivMsg::text).toList();
  }
}
