package cafe.woden.ircbridge.app;

import cafe.woden.ircbridge.config.BridgeProperties;
import cafe.woden.ircbridge.config.ExecutorConfig;
import cafe.woden.ircbridge.irc.IrcSinkConnection;
import cafe.woden.ircbridge.source.DdpTransportFactory;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.Objects;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Creates {@link BridgeSession}s for IRC client connections.
 *
 * <p>The embedding application provides the {@link DdpTransportFactory} bean and calls
 * {@link #create} once per IRC client that has registered with a username and password.
 */
@Component
public class BridgeSessionFactory {

  private final BridgeProperties props;
  private final ObjectProvider<DdpTransportFactory> transportFactories;
  private final Scheduler sessionScheduler;

  public BridgeSessionFactory(
      BridgeProperties props,
      ObjectProvider<DdpTransportFactory> transportFactories,
      @Qualifier(ExecutorConfig.BRIDGE_SESSION_SCHEDULER) Scheduler sessionScheduler
  ) {
    this.props = props;
    this.transportFactories = transportFactories;
    this.sessionScheduler = sessionScheduler;
  }

  /**
   * @throws IllegalStateException if no source host is configured or no transport factory is
   *     available
   */
  public BridgeSession create(IrcSinkConnection sink, String username, String password) {
    Objects.requireNonNull(sink, "sink");
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
    props.source().requireHost();

    DdpTransportFactory factory = transportFactories.getIfAvailable();
    if (factory == null) {
      throw new IllegalStateException("No DdpTransportFactory bean is configured");
    }
    return new BridgeSession(props, factory, sink, username.trim(), password, sessionScheduler);
  }
}
