package cafe.woden.ircbridge.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import cafe.woden.ircbridge.app.SubscriptionManager.Outcome;
import cafe.woden.ircbridge.app.SubscriptionManager.SubscriptionAttempt;
import cafe.woden.ircbridge.source.DdpTransport;
import io.reactivex.rxjava3.core.Completable;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class SubscriptionManagerTest {

  private DdpTransport transport;
  private SubscriptionManager subscriptions;

  @BeforeEach
  void setUp() {
    transport = mock(DdpTransport.class);
    when(transport.subscribe(anyString(), anyList())).thenReturn(Completable.complete());
    subscriptions = new SubscriptionManager(transport);
  }

  @Test
  void defaultsAreTheSixUserAndGlobalStreamsInOrder() {
    subscriptions.subscribeDefaults("u1").test().assertComplete();

    InOrder order = inOrder(transport);
    order.verify(transport).subscribe("stream-notify-user", List.of("u1/message", false));
    order.verify(transport).subscribe("stream-notify-user", List.of("u1/rooms-changed", false));
    order.verify(transport).subscribe("stream-notify-user", List.of("u1/subscriptions-changed", false));
    order.verify(transport).subscribe("stream-notify-all", List.of("u1/public-settings-changed", false));
    order.verify(transport).subscribe("activeUsers", List.of());
    order.verify(transport).subscribe("userData", List.of());
    order.verifyNoMoreInteractions();

    assertEquals(6, subscriptions.attempts().size());
    assertEquals(List.of(), subscriptions.failures());
  }

  @Test
  void oneFailingSubscriptionDoesNotStopTheOthers() {
    when(transport.subscribe(eq("activeUsers"), anyList()))
        .thenReturn(Completable.error(new IllegalStateException("nosub")));

    subscriptions.subscribeDefaults("u1").test().assertComplete();

    assertEquals(6, subscriptions.attempts().size());
    assertEquals(
        List.of(new SubscriptionAttempt("activeUsers", List.of(), Outcome.FAILED)),
        subscriptions.failures());
  }

  @Test
  void subscribePropagatesFailure() {
    when(transport.subscribe(eq("userData"), anyList()))
        .thenReturn(Completable.error(new IllegalStateException("nosub")));

    subscriptions.subscribe("userData").test().assertError(IllegalStateException.class);
    subscriptions.trySubscribe("userData").test().assertComplete();
  }

  @Test
  void roomMessagesSubscriptionIsPerRoom() {
    subscriptions.subscribeRoomMessages("r1").test().assertComplete();

    assertEquals(
        List.of(new SubscriptionAttempt("stream-room-messages", List.of("r1", false), Outcome.SUCCEEDED)),
        subscriptions.attempts());
  }
}
