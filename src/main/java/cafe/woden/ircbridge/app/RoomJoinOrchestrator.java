package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.irc.IrcReply;
import cafe.woden.ircbridge.irc.IrcSinkConnection;
import cafe.woden.ircbridge.model.ChatUser;
import cafe.woden.ircbridge.model.Room;
import cafe.woden.ircbridge.model.SessionState;
import cafe.woden.ircbridge.source.DdpTransport;
import cafe.woden.ircbridge.source.RocketChatRecords;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a room onto IRC: opens the channel, fetches membership, subscribes to the room's
 * messages and replays NAMES and WHO for the client.
 */
public final class RoomJoinOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RoomJoinOrchestrator.class);

  static final String GET_USERS_OF_ROOM_METHOD = "getUsersOfRoom";

  private final SessionState state;
  private final IdentityMapper identities;
  private final SubscriptionManager subscriptions;
  private final IrcSinkConnection sink;
  private final DdpTransport transport;
  private final Scheduler sessionScheduler;

  public RoomJoinOrchestrator(
      SessionState state,
      IdentityMapper identities,
      SubscriptionManager subscriptions,
      IrcSinkConnection sink,
      DdpTransport transport,
      Scheduler sessionScheduler
  ) {
    this.state = Objects.requireNonNull(state, "state");
    this.identities = Objects.requireNonNull(identities, "identities");
    this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.sessionScheduler = Objects.requireNonNull(sessionScheduler, "sessionScheduler");
  }

  /**
   * Join one room.
   *
   * <p>A failed membership fetch fails the join. A failed message subscription does not; the
   * channel then simply stays quiet.
   */
  public Completable joinRoom(Room room) {
    return Completable.defer(() -> {
      String channel = identities.channelName(room);
      sink.joinChannel(channel, room.topic());

      return fetchMembers(room)
          .andThen(subscriptions.subscribeRoomMessages(room.id()))
          .observeOn(sessionScheduler)
          .andThen(Completable.fromAction(() -> {
            sendNames(room, channel);
            sendWho(room, channel);
            log.info("Joined {} ({} members)", channel, state.members(room.id()).size());
          }));
    });
  }

  /** Join every non-direct room, one after another. A room that fails to join is logged and skipped. */
  public Completable joinDefaultRooms() {
    return Flowable.defer(() -> Flowable.fromIterable(state.rooms()))
        .filter(room -> !room.isDirect())
        .concatMapCompletable(room -> joinRoom(room)
            .doOnError(err -> log.error("Failed to join room {} ({})", room.name(), room.id(), err))
            .onErrorComplete());
  }

  /** Replace the room's membership with the server's current list. */
  Completable fetchMembers(Room room) {
    return transport.call(GET_USERS_OF_ROOM_METHOD, List.of(room.id(), true))
        .observeOn(sessionScheduler)
        .doOnSuccess(result -> state.replaceMembers(room.id(), RocketChatRecords.roomMembers(result)))
        .ignoreElement();
  }

  void sendNames(Room room, String channel) {
    String names = state.members(room.id()).stream()
        .map(ChatUser::username)
        .collect(Collectors.joining(" "));
    sink.send(new IrcReply.NamesReply(channel, names));
    sink.send(new IrcReply.NamesEnd(channel));
  }

  void sendWho(Room room, String channel) {
    for (ChatUser user : state.members(room.id())) {
      sink.send(new IrcReply.WhoReply(user.name(), channel, user.name(), state.isOnline(user.id())));
    }
    sink.send(new IrcReply.WhoEnd(channel));
  }
}
