package cafe.woden.ircbridge.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors on named daemon threads. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return runnable -> {
      Thread t = new Thread(runnable, base + "-" + seq.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "ircbridge-thread" : s;
  }
}
