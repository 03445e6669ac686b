package cafe.woden.ircbridge.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-capacity FIFO window of the most recently observed messages.
 *
 * <p>Used for dedup and edit detection only. Lookups are a linear scan for the first entry with a
 * given id, so an id whose entry was evicted is unknown again. Eviction is strictly by arrival
 * order; edits do not refresh an entry's position.
 */
public final class RecentMessageCache {

  /** How an observed message relates to what the cache already holds. */
  public enum Revision {
    /** Not in the window; it was appended. */
    NEW,
    /** In the window with different text; the entry's text was replaced. */
    EDITED,
    /** In the window with identical text; nothing changed. */
    UNCHANGED
  }

  private final int capacity;
  private final List<CachedMessage> entries;

  public RecentMessageCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.entries = new ArrayList<>(capacity + 1);
  }

  public int capacity() {
    return capacity;
  }

  public int size() {
    return entries.size();
  }

  public Optional<CachedMessage> find(String id) {
    int idx = indexOf(id);
    return idx < 0 ? Optional.empty() : Optional.of(entries.get(idx));
  }

  /**
   * Append an entry, evicting the oldest one if the window is full.
   *
   * @return the evicted entry, if any
   */
  public Optional<CachedMessage> add(CachedMessage message) {
    Objects.requireNonNull(message, "message");
    entries.add(message);
    if (entries.size() > capacity) {
      return Optional.of(entries.remove(0));
    }
    return Optional.empty();
  }

  /** Classify {@code message} against the window and record it. */
  public Revision record(CachedMessage message) {
    Objects.requireNonNull(message, "message");
    int idx = indexOf(message.id());
    if (idx < 0) {
      add(message);
      return Revision.NEW;
    }
    CachedMessage existing = entries.get(idx);
    if (existing.text().equals(message.text())) {
      return Revision.UNCHANGED;
    }
    entries.set(idx, existing.withText(message.text()));
    return Revision.EDITED;
  }

  /** Oldest first. */
  List<CachedMessage> snapshot() {
    return List.copyOf(entries);
  }

  private int indexOf(String id) {
    if (id == null) return -1;
    for (int i = 0; i < entries.size(); i++) {
      if (id.equals(entries.get(i).id())) return i;
    }
    return -1;
  }
}
