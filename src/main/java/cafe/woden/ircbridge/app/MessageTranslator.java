package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.irc.IrcFormatting;
import cafe.woden.ircbridge.irc.IrcReply;
import cafe.woden.ircbridge.irc.IrcSinkConnection;
import cafe.woden.ircbridge.model.CachedMessage;
import cafe.woden.ircbridge.model.RecentMessageCache.Revision;
import cafe.woden.ircbridge.model.Room;
import cafe.woden.ircbridge.model.SessionState;
import cafe.woden.ircbridge.source.DdpFrame;
import cafe.woden.ircbridge.source.DdpTransport;
import cafe.woden.ircbridge.source.IncomingMessage;
import cafe.woden.ircbridge.source.RocketChatRecords;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@code stream-room-messages} traffic into channel PRIVMSGs, and sends outbound messages.
 *
 * <p>Re-delivered messages with unchanged text produce nothing. A known id with new text is an
 * edit and is re-emitted with an {@code [EDIT]} marker. Only the last
 * {@link cafe.woden.ircbridge.model.RecentMessageCache#capacity()} messages are known.
 */
public final class MessageTranslator {

  private static final Logger log = LoggerFactory.getLogger(MessageTranslator.class);

  static final String ROOM_MESSAGES_COLLECTION = "stream-room-messages";
  static final String SEND_MESSAGE_METHOD = "sendMessage";

  static final String EDIT_MARKER = IrcFormatting.colored("[EDIT] ", IrcFormatting.Color.LIGHT_GREY);

  private final SessionState state;
  private final IdentityMapper identities;
  private final HighlightDetector highlights;
  private final IrcSinkConnection sink;
  private final DdpTransport transport;
  private final MessageIds ids;

  public MessageTranslator(
      SessionState state,
      IdentityMapper identities,
      HighlightDetector highlights,
      IrcSinkConnection sink,
      DdpTransport transport
  ) {
    this(state, identities, highlights, sink, transport, new MessageIds());
  }

  MessageTranslator(
      SessionState state,
      IdentityMapper identities,
      HighlightDetector highlights,
      IrcSinkConnection sink,
      DdpTransport transport,
      MessageIds ids
  ) {
    this.state = Objects.requireNonNull(state, "state");
    this.identities = Objects.requireNonNull(identities, "identities");
    this.highlights = Objects.requireNonNull(highlights, "highlights");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  /**
   * Handle one decoded frame. Anything but a {@code changed} frame on the room message stream is
   * ignored.
   */
  public void onFrame(DdpFrame frame) {
    if (frame == null || !frame.is(DdpFrame.CHANGED, ROOM_MESSAGES_COLLECTION)) return;

    JsonNode args = frame.fields().get("args");
    if (args == null || !args.isArray()) return;

    try {
      for (JsonNode payload : args) {
        RocketChatRecords.message(payload).ifPresent(this::onMessage);
      }
    } catch (Exception e) {
      log.error("Failed to translate room message frame {}", frame.id(), e);
    }
  }

  /** Dedup, edit-detect and emit one message. */
  public void onMessage(IncomingMessage message) {
    String channel = channelFor(message.roomId());

    Revision revision = state.recentMessages()
        .record(new CachedMessage(message.id(), message.roomId(), message.text()));
    if (revision == Revision.UNCHANGED) return;

    for (String line : render(message.text(), revision == Revision.EDITED)) {
      sink.send(new IrcReply.PrivMsg(channel, message.username(), line));
    }
  }

  /** The lines a message body becomes on IRC, with edit marker and mention suffix applied. */
  List<String> render(String text, boolean edit) {
    String prefix = edit ? EDIT_MARKER : "";
    String suffix = IrcFormatting.colored(
        " (cc: " + sink.loginNick() + ")", IrcFormatting.Color.RED);

    return Objects.toString(text, "").lines()
        .map(line -> prefix + line + (highlights.isHighlight(line) ? suffix : ""))
        .toList();
  }

  /**
   * Send a message to a room.
   *
   * <p>The message is cached under a locally generated id before the call goes out, so the
   * server's echo (which keeps that id) is recognized as unchanged and not shown twice. The call
   * is fire-and-forget; nothing is written to IRC here.
   *
   * @return the id the message was sent with
   */
  public String sendMessage(Room room, String text) {
    String id = ids.next();
    String body = Objects.toString(text, "");
    state.recentMessages().add(new CachedMessage(id, room.id(), body));

    ObjectNode msg = JsonNodeFactory.instance.objectNode();
    msg.put("_id", id);
    msg.put("rid", room.id());
    msg.put("msg", body);

    // Pending calls fail with ConnectionClosedException once the transport is closed.
    transport.call(SEND_MESSAGE_METHOD, List.of(msg))
        .subscribe(
            result -> log.debug("Sent message {} to room {}", id, room.id()),
            err -> log.warn("Failed to send message {} to room {}", id, room.id(), err));
    return id;
  }

  private String channelFor(String roomId) {
    Optional<Room> room = state.room(roomId);
    if (room.isPresent()) return identities.channelName(room.get());

    log.warn("Message for unknown room {}; using the room id as channel", roomId);
    return roomId;
  }
}
