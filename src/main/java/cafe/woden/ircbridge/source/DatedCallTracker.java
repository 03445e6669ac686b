package cafe.woden.ircbridge.source;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Remembers when each "since" style method last succeeded.
 *
 * <p>Methods like {@code rooms/get} take the time of the previous fetch and return only what
 * changed since. Before the first successful call the epoch is used, i.e. everything.
 */
public final class DatedCallTracker {

  private final Clock clock;
  private final Map<String, Instant> lastCallByMethod = new HashMap<>();

  public DatedCallTracker() {
    this(Clock.systemUTC());
  }

  public DatedCallTracker(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Instant now() {
    return clock.instant();
  }

  public Instant lastCall(String method) {
    return lastCallByMethod.getOrDefault(method, Instant.EPOCH);
  }

  /** Record that {@code method} was called at {@code at} and its result applied. */
  public void record(String method, Instant at) {
    lastCallByMethod.put(method, at);
  }
}
