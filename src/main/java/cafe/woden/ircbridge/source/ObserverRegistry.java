package cafe.woden.ircbridge.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-collection lists of {@link CollectionObserver}s.
 *
 * <p>Observers for a collection are invoked in registration order. An observer that throws is
 * logged and does not prevent the remaining observers from seeing the event.
 */
public final class ObserverRegistry {

  private static final Logger log = LoggerFactory.getLogger(ObserverRegistry.class);

  private final Map<String, List<CollectionObserver>> byCollection = new ConcurrentHashMap<>();

  public void register(String collection, CollectionObserver observer) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(observer, "observer");
    byCollection.computeIfAbsent(collection, k -> new CopyOnWriteArrayList<>()).add(observer);
  }

  boolean unregister(String collection, CollectionObserver observer) {
    List<CollectionObserver> list = byCollection.get(collection);
    return list != null && list.remove(observer);
  }

  public List<CollectionObserver> observers(String collection) {
    List<CollectionObserver> list = byCollection.get(collection);
    return list == null ? List.of() : new ArrayList<>(list);
  }

  public void clear() {
    byCollection.clear();
  }

  /** Route a collection data frame to the observers of its collection. Other frames are ignored. */
  public void dispatch(DdpFrame frame) {
    if (frame == null || !frame.isCollectionData()) return;
    List<CollectionObserver> list = byCollection.get(frame.collection());
    if (list == null) return;

    for (CollectionObserver observer : list) {
      try {
        switch (frame.msg()) {
          case DdpFrame.ADDED -> observer.onAdded(frame.id(), frame.fields());
          case DdpFrame.CHANGED -> observer.onChanged(frame.id(), frame.fields());
          case DdpFrame.REMOVED -> observer.onRemoved(frame.id());
          default -> {
          }
        }
      } catch (Exception e) {
        log.error("Observer for {} failed on {} {}", frame.collection(), frame.msg(), frame.id(), e);
      }
    }
  }
}
