package cafe.woden.ircbridge.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.ircbridge.irc.IrcReply;
import cafe.woden.ircbridge.model.ChatUser;
import cafe.woden.ircbridge.model.Room;
import cafe.woden.ircbridge.model.RoomType;
import cafe.woden.ircbridge.model.SessionState;
import cafe.woden.ircbridge.source.DdpTransport;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RoomJoinOrchestratorTest {

  private SessionState state;
  private IdentityMapper identities;
  private RecordingSink sink;
  private DdpTransport transport;
  private RoomJoinOrchestrator joiner;

  @BeforeEach
  void setUp() {
    state = new SessionState(50);
    state.setSelf(new ChatUser("me", "alice", "Alice"));
    identities = new IdentityMapper(state);
    sink = new RecordingSink("alice");
    transport = mock(DdpTransport.class);
    when(transport.subscribe(anyString(), anyList())).thenReturn(Completable.complete());
    joiner = new RoomJoinOrchestrator(
        state,
        identities,
        new SubscriptionManager(transport),
        sink,
        transport,
        Schedulers.trampoline());
  }

  @Test
  void joinOpensChannelThenReplaysNamesAndWho() {
    Room room = new Room("r1", "general", RoomType.PUBLIC, "Be nice", List.of());
    identities.register(room);
    when(transport.call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r1", true)))
        .thenReturn(Single.just(Frames.members("alice", "bob")));
    state.setOnline("uid-bob", true);

    joiner.joinRoom(room).test().assertComplete();

    assertEquals(
        List.of(
            new RecordingSink.Join("#general", "Be nice"),
            new IrcReply.NamesReply("#general", "alice bob"),
            new IrcReply.NamesEnd("#general"),
            new IrcReply.WhoReply("alice", "#general", "alice", false),
            new IrcReply.WhoReply("bob", "#general", "bob", true),
            new IrcReply.WhoEnd("#general")),
        sink.events);
    verify(transport).subscribe("stream-room-messages", List.of("r1", false));
    assertEquals(2, state.members("r1").size());
  }

  @Test
  void rejoinReplacesMembership() {
    Room room = new Room("r1", "general", RoomType.PUBLIC);
    identities.register(room);
    when(transport.call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r1", true)))
        .thenReturn(Single.just(Frames.members("alice", "bob")))
        .thenReturn(Single.just(Frames.members("carol")));

    joiner.joinRoom(room).test().assertComplete();
    joiner.joinRoom(room).test().assertComplete();

    assertEquals(List.of("carol"), state.members("r1").stream().map(ChatUser::username).toList());
  }

  @Test
  void failedMessageSubscriptionStillCompletesJoin() {
    Room room = new Room("r1", "general", RoomType.PUBLIC);
    identities.register(room);
    when(transport.call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r1", true)))
        .thenReturn(Single.just(Frames.members("alice")));
    when(transport.subscribe(eq("stream-room-messages"), anyList()))
        .thenReturn(Completable.error(new IllegalStateException("nosub")));

    joiner.joinRoom(room).test().assertComplete();

    assertEquals(new IrcReply.WhoEnd("#general"), sink.events.get(sink.events.size() - 1));
  }

  @Test
  void failedMembershipFetchFailsJoin() {
    Room room = new Room("r1", "general", RoomType.PUBLIC);
    identities.register(room);
    when(transport.call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r1", true)))
        .thenReturn(Single.error(new IllegalStateException("forbidden")));

    joiner.joinRoom(room).test().assertError(IllegalStateException.class);

    verify(transport, never()).subscribe(anyString(), anyList());
  }

  @Test
  void defaultJoinSkipsDirectRoomsAndSurvivesFailures() {
    identities.register(new Room("r1", "general", RoomType.PUBLIC));
    identities.register(new Room("r2", "staff", RoomType.PRIVATE));
    identities.register(new Room("r3", "", RoomType.DIRECT, null, List.of("alice", "bob")));
    when(transport.call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r1", true)))
        .thenReturn(Single.error(new IllegalStateException("forbidden")));
    when(transport.call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r2", true)))
        .thenReturn(Single.just(Frames.members("alice")));

    joiner.joinDefaultRooms().test().assertComplete();

    verify(transport, never())
        .call(RoomJoinOrchestrator.GET_USERS_OF_ROOM_METHOD, List.of("r3", true));
    assertEquals(new IrcReply.WhoEnd("##staff"), sink.events.get(sink.events.size() - 1));
  }
}
