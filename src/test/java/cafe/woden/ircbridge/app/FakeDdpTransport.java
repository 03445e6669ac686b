package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.source.ConnectionClosedException;
import cafe.woden.ircbridge.source.DdpTransport;
import cafe.woden.ircbridge.source.LoginResult;
import com.fasterxml.jackson.databind.JsonNode;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** In-memory transport that records what the session asked of it. */
final class FakeDdpTransport implements DdpTransport {

  private static final String ROOMS_GET = "rooms/get";

  final PublishProcessor<String> frames = PublishProcessor.create();
  final List<String> ops = new ArrayList<>();
  final List<List<Object>> roomsGetParams = new ArrayList<>();
  final Map<String, Function<List<Object>, JsonNode>> methods = new HashMap<>();
  final Set<String> failingSubscriptions = new HashSet<>();
  final Map<String, Map<String, JsonNode>> collections = new HashMap<>();

  Completable connectResult = Completable.complete();
  int loginFailures;
  int connectCount;
  int loginCount;
  int closeCount;
  private boolean open;
  private boolean closed;

  @Override
  public Completable connect() {
    return Completable.fromAction(() -> {
      ops.add("connect");
      connectCount++;
      open = true;
    }).andThen(Completable.defer(() -> connectResult));
  }

  @Override
  public Single<LoginResult> login(String account, String password) {
    return Single.defer(() -> {
      ops.add("login");
      loginCount++;
      if (loginFailures > 0) {
        loginFailures--;
        return Single.error(new IllegalStateException("incorrect password"));
      }
      return Single.just(new LoginResult("me-id", "token"));
    });
  }

  @Override
  public Single<JsonNode> call(String method, List<Object> params) {
    return Single.defer(() -> {
      if (closed) return Single.error(new ConnectionClosedException("closed"));
      ops.add("call:" + method);
      if (ROOMS_GET.equals(method)) roomsGetParams.add(params);
      Function<List<Object>, JsonNode> handler = methods.get(method);
      if (handler == null) return Single.error(new IllegalStateException("no such method " + method));
      return Single.just(handler.apply(params));
    });
  }

  @Override
  public Completable subscribe(String name, List<Object> params) {
    return Completable.defer(() -> {
      if (closed) return Completable.error(new ConnectionClosedException("closed"));
      ops.add("subscribe:" + name);
      if (failingSubscriptions.contains(name)) {
        return Completable.error(new IllegalStateException("nosub " + name));
      }
      return Completable.complete();
    });
  }

  @Override
  public Map<String, JsonNode> collection(String name) {
    return collections.getOrDefault(name, Map.of());
  }

  @Override
  public Flowable<String> frames() {
    return frames;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    closeCount++;
    open = false;
    closed = true;
    frames.onComplete();
  }
}
