package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.source.CollectionObserver;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs every change seen on one collection at DEBUG. Enabled via {@code bridge.debug-collections}. */
final class CollectionDebugLogger implements CollectionObserver {

  private static final Logger log = LoggerFactory.getLogger(CollectionDebugLogger.class);

  private final String collection;

  CollectionDebugLogger(String collection) {
    this.collection = collection;
  }

  @Override
  public void onAdded(String id, JsonNode fields) {
    log.debug("{} added {}", collection, id);
  }

  @Override
  public void onChanged(String id, JsonNode fields) {
    log.debug("{} changed {}", collection, id);
  }

  @Override
  public void onRemoved(String id) {
    log.debug("{} removed {}", collection, id);
  }
}
