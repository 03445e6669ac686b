package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.source.DdpTransport;
import io.reactivex.rxjava3.core.Completable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers subscriptions with the source.
 *
 * <p>Remembers which subscriptions were attempted and how they went; nothing more. Liveness after
 * a successful subscribe is not tracked.
 */
public final class SubscriptionManager {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

  static final String STREAM_NOTIFY_USER = "stream-notify-user";
  static final String STREAM_NOTIFY_ALL = "stream-notify-all";
  static final String ACTIVE_USERS = "activeUsers";
  static final String USER_DATA = "userData";
  static final String STREAM_ROOM_MESSAGES = "stream-room-messages";

  public enum Outcome {
    SUCCEEDED,
    FAILED
  }

  public record SubscriptionAttempt(String name, List<Object> params, Outcome outcome) {}

  private final DdpTransport transport;
  private final List<SubscriptionAttempt> attempts = new ArrayList<>();

  public SubscriptionManager(DdpTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /** One attempt; errors propagate. */
  public Completable subscribe(String name, Object... params) {
    List<Object> p = List.copyOf(Arrays.asList(params));
    return Completable.defer(() -> transport.subscribe(name, p))
        .doOnComplete(() -> record(name, p, Outcome.SUCCEEDED))
        .doOnError(err -> record(name, p, Outcome.FAILED));
  }

  /** Like {@link #subscribe} but never errors; failures are logged. */
  public Completable trySubscribe(String name, Object... params) {
    return subscribe(name, params)
        .doOnError(err -> log.error("Failed to subscribe to {} {}", name, Arrays.toString(params), err))
        .onErrorComplete();
  }

  /** The fixed set of per-user and global streams a session needs after login. */
  public Completable subscribeDefaults(String userId) {
    return Completable.concatArray(
        trySubscribe(STREAM_NOTIFY_USER, userId + "/message", false),
        trySubscribe(STREAM_NOTIFY_USER, userId + "/rooms-changed", false),
        trySubscribe(STREAM_NOTIFY_USER, userId + "/subscriptions-changed", false),
        trySubscribe(STREAM_NOTIFY_ALL, userId + "/public-settings-changed", false),
        trySubscribe(ACTIVE_USERS),
        trySubscribe(USER_DATA));
  }

  public Completable subscribeRoomMessages(String roomId) {
    return trySubscribe(STREAM_ROOM_MESSAGES, roomId, false);
  }

  public List<SubscriptionAttempt> attempts() {
    synchronized (attempts) {
      return List.copyOf(attempts);
    }
  }

  public List<SubscriptionAttempt> failures() {
    return attempts().stream().filter(a -> a.outcome() == Outcome.FAILED).toList();
  }

  private void record(String name, List<Object> params, Outcome outcome) {
    synchronized (attempts) {
      attempts.add(new SubscriptionAttempt(name, params, outcome));
    }
  }
}
