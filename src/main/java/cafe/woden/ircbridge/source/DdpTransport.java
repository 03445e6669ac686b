package cafe.woden.ircbridge.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;

/**
 * Client side of a DDP (Meteor distributed data protocol) connection.
 *
 * <p>Implementations own the wire: the WebSocket, message framing, method ids, the subscription
 * handshake and the login handshake. Once {@link #close()} has been called, pending and future
 * operations must fail with {@link ConnectionClosedException}.
 */
public interface DdpTransport {

  Completable connect();

  /** Password login. Emits the logged-in user's id and resume token. */
  Single<LoginResult> login(String account, String password);

  /** A single remote method invocation. */
  Single<JsonNode> call(String method, List<Object> params);

  /** Completes once the server marks the subscription ready; errors on {@code nosub}. */
  Completable subscribe(String name, List<Object> params);

  /**
   * Snapshot of a locally maintained collection, keyed by document id.
   *
   * <p>Empty if the collection is unknown.
   */
  Map<String, JsonNode> collection(String name);

  /** Every raw text frame received, before any interpretation. */
  Flowable<String> frames();

  boolean isOpen();

  void close();
}
