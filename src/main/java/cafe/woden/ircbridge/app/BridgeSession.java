package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.config.BridgeProperties;
import cafe.woden.ircbridge.irc.IrcReply;
import cafe.woden.ircbridge.irc.IrcSinkConnection;
import cafe.woden.ircbridge.model.ChatUser;
import cafe.woden.ircbridge.model.Room;
import cafe.woden.ircbridge.model.SessionState;
import cafe.woden.ircbridge.source.ConnectionClosedException;
import cafe.woden.ircbridge.source.DatedCallTracker;
import cafe.woden.ircbridge.source.DdpFrame;
import cafe.woden.ircbridge.source.DdpTransport;
import cafe.woden.ircbridge.source.DdpTransportFactory;
import cafe.woden.ircbridge.source.Ejson;
import cafe.woden.ircbridge.source.FrameDecoder;
import cafe.woden.ircbridge.source.LoginResult;
import cafe.woden.ircbridge.source.ObserverRegistry;
import cafe.woden.ircbridge.source.RocketChatRecords;
import com.fasterxml.jackson.databind.JsonNode;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One Rocket.Chat session bridged onto one IRC client connection.
 *
 * <p>{@link #connect()} runs the bootstrap: transport connect, login, own user record, default
 * subscriptions, default observers, room fetch, then joining every non-direct room. Afterwards
 * frames from the transport drive presence and message translation.
 *
 * <p>All state is touched on the session scheduler only.
 */
public final class BridgeSession {

  private static final Logger log = LoggerFactory.getLogger(BridgeSession.class);

  static final String ROOMS_GET_METHOD = "rooms/get";

  public enum Status {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
  }

  private final BridgeProperties props;
  private final DdpTransportFactory transportFactory;
  private final IrcSinkConnection sink;
  private final String username;
  private final String password;
  private final Scheduler scheduler;

  private final SessionState state;
  private final IdentityMapper identities;
  private final HighlightDetector highlights;
  private final DatedCallTracker datedCalls;
  private final FrameDecoder frameDecoder = new FrameDecoder();

  private final Object lock = new Object();
  private Status status = Status.DISCONNECTED;
  private Connection current;
  private Completable inFlight;

  public BridgeSession(
      BridgeProperties props,
      DdpTransportFactory transportFactory,
      IrcSinkConnection sink,
      String username,
      String password,
      Scheduler scheduler
  ) {
    this(props, transportFactory, sink, username, password, scheduler, new DatedCallTracker());
  }

  BridgeSession(
      BridgeProperties props,
      DdpTransportFactory transportFactory,
      IrcSinkConnection sink,
      String username,
      String password,
      Scheduler scheduler,
      DatedCallTracker datedCalls
  ) {
    this.props = Objects.requireNonNull(props, "props");
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.username = Objects.requireNonNull(username, "username");
    this.password = Objects.toString(password, "");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.datedCalls = Objects.requireNonNull(datedCalls, "datedCalls");

    this.state = new SessionState(props.messageCacheSize());
    this.identities = new IdentityMapper(state);
    this.highlights = new HighlightDetector(props.highlightTerms());
  }

  public SessionState state() {
    return state;
  }

  public IdentityMapper identities() {
    return identities;
  }

  public Status status() {
    synchronized (lock) {
      return status;
    }
  }

  public boolean isConnected() {
    return status() == Status.CONNECTED;
  }

  /**
   * Connect and bootstrap.
   *
   * <p>No-op when already connected. While a connect is in flight, further calls share it rather
   * than starting another. If a fatal stage fails the transport is closed and the error is
   * delivered as a {@link BridgeConnectException}.
   */
  public Completable connect() {
    return Completable.defer(() -> {
      synchronized (lock) {
        if (status == Status.CONNECTED) return Completable.complete();
        if (status == Status.CONNECTING && inFlight != null) return inFlight;

        BridgeProperties.Source source = props.source();
        DdpTransport transport =
            transportFactory.create(source.requireHost(), source.port(), source.secure());
        Connection c = new Connection(transport);
        current = c;
        status = Status.CONNECTING;

        log.info("Connecting to {}:{} as {}", source.host(), source.port(), username);
        inFlight = bootstrap(c)
            .subscribeOn(scheduler)
            .doOnComplete(() -> onBootstrapped(c))
            .doOnError(err -> onBootstrapFailed(c, err))
            .cache();
        return inFlight;
      }
    });
  }

  /** Close the transport if open. Safe to call repeatedly. */
  public Completable disconnect() {
    return Completable.fromAction(() -> {
      Connection c;
      synchronized (lock) {
        c = current;
        current = null;
        inFlight = null;
        status = Status.DISCONNECTED;
      }
      if (c == null) return;
      c.close();
      log.info("Disconnected from {}", props.source().host());
    });
  }

  /** Fetch rooms changed since the last fetch and register them. */
  public Completable refreshRooms() {
    return withConnection(this::fetchRooms);
  }

  /**
   * Join the room behind {@code channel}, including direct rooms.
   *
   * <p>An unknown channel is answered with {@link IrcReply.NoSuchChannel}.
   */
  public Completable joinChannel(String channel) {
    return withConnection(c -> {
      Optional<Room> room = identities.roomFromChannel(channel);
      if (room.isEmpty()) {
        sink.send(new IrcReply.NoSuchChannel(channel));
        return Completable.complete();
      }
      return c.joiner.joinRoom(room.get());
    });
  }

  /**
   * Send a line typed into {@code channel} to its room.
   *
   * <p>An unknown channel is answered with {@link IrcReply.NoSuchChannel}.
   */
  public Completable sendToChannel(String channel, String text) {
    return withConnection(c -> Completable.fromAction(() -> {
      Optional<Room> room = identities.roomFromChannel(channel);
      if (room.isEmpty()) {
        sink.send(new IrcReply.NoSuchChannel(channel));
        return;
      }
      c.translator.sendMessage(room.get(), text);
    }));
  }

  public Optional<Room> roomForChannel(String channel) {
    return identities.roomFromChannel(channel);
  }

  public Optional<String> channelFor(String roomId) {
    return state.room(roomId).map(identities::channelName);
  }

  /** Subscriptions that failed on the current connection. */
  public List<SubscriptionManager.SubscriptionAttempt> subscriptionFailures() {
    Connection c;
    synchronized (lock) {
      c = current;
    }
    return c == null ? List.of() : c.subscriptions.failures();
  }

  // ---- bootstrap ----

  BootstrapPipeline pipeline(Connection c) {
    return new BootstrapPipeline(List.of(
        BootstrapStage.fatal("transport-connect", () -> connectTransport(c)),
        BootstrapStage.fatal("login", () -> login(c)),
        BootstrapStage.fatal("fetch-self", () -> Completable.fromAction(() -> updateSelf(c))),
        BootstrapStage.tolerant("subscribe-defaults",
            () -> c.subscriptions.subscribeDefaults(c.login.userId()).observeOn(scheduler)),
        BootstrapStage.fatal("observe-defaults", () -> Completable.fromAction(() -> observeDefaults(c))),
        BootstrapStage.fatal("fetch-rooms", () -> fetchRooms(c)),
        BootstrapStage.tolerant("join-rooms", () -> c.joiner.joinDefaultRooms())));
  }

  private Completable bootstrap(Connection c) {
    return pipeline(c).run();
  }

  private Completable connectTransport(Connection c) {
    c.disposables.add(c.transport.frames()
        .observeOn(scheduler)
        .subscribe(
            raw -> onRawFrame(c, raw),
            err -> {
              if (err instanceof ConnectionClosedException) {
                log.debug("Frame stream closed");
              } else {
                log.warn("Frame stream failed", err);
              }
            }));
    return c.transport.connect().observeOn(scheduler);
  }

  private Completable login(Connection c) {
    int attempts = props.loginAttempts();
    return Single.defer(() -> c.transport.login(username, password))
        .doOnError(err -> log.warn("Login as {} failed: {}", username, err.toString()))
        .retry(attempts - 1L, err -> !(err instanceof ConnectionClosedException))
        .observeOn(scheduler)
        .doOnSuccess(result -> {
          c.login = result;
          log.info("Logged in as {} ({})", username, result.userId());
        })
        .ignoreElement();
  }

  private void updateSelf(Connection c) {
    ChatUser self = null;
    for (JsonNode doc : c.transport.collection(PresenceTracker.USERS_COLLECTION).values()) {
      JsonNode u = doc.get("username");
      if (u != null && username.equals(u.asText())) {
        self = RocketChatRecords.user(doc).orElse(null);
        break;
      }
    }
    if (self == null) {
      self = new ChatUser(c.login.userId(), username, username);
    }
    state.setSelf(self);
  }

  private void observeDefaults(Connection c) {
    c.observers.register(PresenceTracker.USERS_COLLECTION, new PresenceTracker(state));
    for (String collection : props.debugCollections()) {
      c.observers.register(collection, new CollectionDebugLogger(collection));
      log.debug("Now observing {}", collection);
    }
  }

  private Completable fetchRooms(Connection c) {
    return Completable.defer(() -> {
      Instant since = datedCalls.lastCall(ROOMS_GET_METHOD);
      Instant now = datedCalls.now();
      return c.transport.call(ROOMS_GET_METHOD, List.of(Ejson.date(since)))
          .observeOn(scheduler)
          .doOnSuccess(result -> {
            List<Room> rooms = RocketChatRecords.rooms(result);
            rooms.forEach(identities::register);
            datedCalls.record(ROOMS_GET_METHOD, now);
            log.info("Fetched {} room(s) changed since {}", rooms.size(), since);
          })
          .ignoreElement();
    });
  }

  private void onBootstrapped(Connection c) {
    synchronized (lock) {
      if (current != c) return;
      status = Status.CONNECTED;
      inFlight = null;
    }
    log.info("Bridge session ready: {} room(s), {} subscription failure(s)",
        state.rooms().size(), c.subscriptions.failures().size());
  }

  private void onBootstrapFailed(Connection c, Throwable err) {
    synchronized (lock) {
      if (current == c) {
        current = null;
        inFlight = null;
        status = Status.DISCONNECTED;
      }
    }
    log.error("Bridge connect failed", err);
    c.close();
  }

  // ---- frames ----

  void onRawFrame(Connection c, String raw) {
    log.trace("<< {}", raw);
    Optional<DdpFrame> decoded = frameDecoder.decode(raw);
    if (decoded.isEmpty()) return;

    DdpFrame frame = decoded.get();
    try {
      c.observers.dispatch(frame);
      c.translator.onFrame(frame);
    } catch (Exception e) {
      log.error("Failed to handle {} frame for {}", frame.msg(), frame.collection(), e);
    }
  }

  private Completable withConnection(Function<Connection, Completable> work) {
    return Completable.defer(() -> {
      Connection c;
      synchronized (lock) {
        c = status == Status.CONNECTED ? current : null;
      }
      if (c == null) {
        return Completable.error(new IllegalStateException("Bridge session is not connected"));
      }
      return work.apply(c);
    }).subscribeOn(scheduler);
  }

  /** Everything tied to one transport. */
  final class Connection {
    final DdpTransport transport;
    final ObserverRegistry observers = new ObserverRegistry();
    final SubscriptionManager subscriptions;
    final MessageTranslator translator;
    final RoomJoinOrchestrator joiner;
    final CompositeDisposable disposables = new CompositeDisposable();
    LoginResult login;

    Connection(DdpTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      this.subscriptions = new SubscriptionManager(transport);
      this.translator = new MessageTranslator(state, identities, highlights, sink, transport);
      this.joiner = new RoomJoinOrchestrator(
          state, identities, subscriptions, sink, transport, scheduler);
    }

    void close() {
      disposables.dispose();
      observers.clear();
      if (transport.isOpen()) {
        try {
          transport.close();
        } catch (Exception e) {
          log.warn("Error closing transport", e);
        }
      }
    }
  }
}
