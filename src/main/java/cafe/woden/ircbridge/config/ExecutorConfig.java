package cafe.woden.ircbridge.config;

import cafe.woden.ircbridge.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * App-owned executors.
 *
 * <p>All bridge session state is mutated from a single thread; the session scheduler wraps that
 * thread so Rx pipelines can hop onto it.
 */
@Configuration
public class ExecutorConfig {
  public static final String BRIDGE_SESSION_EXECUTOR = "bridgeSessionExecutor";
  public static final String BRIDGE_SESSION_SCHEDULER = "bridgeSessionScheduler";

  @Bean(name = BRIDGE_SESSION_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService bridgeSessionExecutor() {
    return NamedThreads.newSingleThreadExecutor("ircbridge-session");
  }

  @Bean(name = BRIDGE_SESSION_SCHEDULER)
  public Scheduler bridgeSessionScheduler(
      @Qualifier(BRIDGE_SESSION_EXECUTOR) ExecutorService executor) {
    return Schedulers.from(executor);
  }
}
