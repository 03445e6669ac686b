package cafe.woden.ircbridge.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cafe.woden.ircbridge.config.BridgeProperties;
import cafe.woden.ircbridge.config.ExecutorConfig;
import cafe.woden.ircbridge.source.DdpTransportFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class BridgeSessionFactoryTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(FactoryTestConfig.class, ExecutorConfig.class, BridgeSessionFactory.class);

  @Test
  void createsDisconnectedSessionWhenHostAndTransportAreAvailable() {
    runner
        .withUserConfiguration(TransportConfig.class)
        .withPropertyValues("bridge.source.host=chat.example.org")
        .run(ctx -> {
          BridgeSession session =
              ctx.getBean(BridgeSessionFactory.class).create(new RecordingSink("alice"), " alice ", "pw");
          assertNotNull(session);
          assertEquals(BridgeSession.Status.DISCONNECTED, session.status());
        });
  }

  @Test
  void refusesWithoutConfiguredHost() {
    runner
        .withUserConfiguration(TransportConfig.class)
        .run(ctx -> assertThrows(
            IllegalStateException.class,
            () -> ctx.getBean(BridgeSessionFactory.class).create(new RecordingSink("alice"), "alice", "pw")));
  }

  @Test
  void refusesWithoutTransportFactory() {
    runner
        .withPropertyValues("bridge.source.host=chat.example.org")
        .run(ctx -> assertThrows(
            IllegalStateException.class,
            () -> ctx.getBean(BridgeSessionFactory.class).create(new RecordingSink("alice"), "alice", "pw")));
  }

  @Test
  void refusesBlankUsername() {
    runner
        .withUserConfiguration(TransportConfig.class)
        .withPropertyValues("bridge.source.host=chat.example.org")
        .run(ctx -> assertThrows(
            IllegalArgumentException.class,
            () -> ctx.getBean(BridgeSessionFactory.class).create(new RecordingSink("alice"), " ", "pw")));
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(BridgeProperties.class)
  static class FactoryTestConfig {}

  @Configuration(proxyBeanMethods = false)
  static class TransportConfig {
    @Bean
    DdpTransportFactory ddpTransportFactory() {
      return (host, port, secure) -> new FakeDdpTransport();
    }
  }
}
