package cafe.woden.ircbridge;

import cafe.woden.ircbridge.config.BridgeProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot entry point.
 *
 * <p>Wires the session factory, configuration and the session executor. The IRC listener and the
 * DDP transport are contributed by the embedding application as beans.
 */
@SpringBootApplication
@EnableConfigurationProperties(BridgeProperties.class)
public class IrcBridgeApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(IrcBridgeApp.class).headless(true).run(args);
  }
}
