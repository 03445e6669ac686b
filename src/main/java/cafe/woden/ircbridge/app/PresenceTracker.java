package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.model.SessionState;
import cafe.woden.ircbridge.source.CollectionObserver;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Derives online/offline status from the {@code users} collection.
 *
 * <p>The server publishes a user into the collection while they are active and removes them when
 * they go away. Field changes carry no presence information.
 */
public final class PresenceTracker implements CollectionObserver {

  public static final String USERS_COLLECTION = "users";

  private final SessionState state;

  public PresenceTracker(SessionState state) {
    this.state = Objects.requireNonNull(state, "state");
  }

  @Override
  public void onAdded(String id, JsonNode fields) {
    state.setOnline(id, true);
  }

  @Override
  public void onRemoved(String id) {
    state.setOnline(id, false);
  }
}
