package ca.gc.cra.meshgate.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshgate.application.port.ConnectionStateListener;
import ca.gc.cra.meshgate.application.port.InvalidNodeIdException;
import ca.gc.cra.meshgate.domain.mesh.ConnectionPhase;
import ca.gc.cra.meshgate.domain.mesh.ConnectionState;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import ca.gc.cra.meshgate.testutil.Eventually;
import ca.gc.cra.meshgate.testutil.FakeRadioTransport;
import ca.gc.cra.meshgate.testutil.FakeRadioTransport.FakeRadioLink;
import ca.gc.cra.meshgate.testutil.ManualClock;
import ca.gc.cra.meshgate.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {
  private static final String ADDRESS = "gateway.local:4403";
  private static final ConnectionSettings FAST =
      new ConnectionSettings(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofSeconds(5));

  private final FakeRadioTransport transport = new FakeRadioTransport();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ManualClock clock = new ManualClock(1_700_000_000_000L);
  private final List<PacketEvent> forwarded = new CopyOnWriteArrayList<>();
  private final List<ConnectionPhase> phases = new CopyOnWriteArrayList<>();
  private final ConnectionStateListener recorder = state -> phases.add(state.phase());
  private ConnectionManager manager;

  @AfterEach
  void stop() {
    if (manager != null) {
      manager.shutdown();
    }
  }

  @Test
  void retriesUntilGatewayAccepts() {
    transport.failNext(3);
    transport.succeedWith(0x1234L);
    manager = newManager(FAST);

    manager.start();
    Eventually.await("connection", () -> metrics.count("mesh.connect.success") == 1);

    ConnectionState state = manager.status();
    assertEquals(1, state.connectionAttempts());
    assertEquals(3, state.failedAttempts());
    assertEquals(0x1234L, state.localNodeNum());
    assertEquals(clock.nowMillis(), state.lastConnectedAtMillis());
    assertEquals(List.of(
        ConnectionPhase.CONNECTING, ConnectionPhase.DISCONNECTED,
        ConnectionPhase.CONNECTING, ConnectionPhase.DISCONNECTED,
        ConnectionPhase.CONNECTING, ConnectionPhase.DISCONNECTED,
        ConnectionPhase.CONNECTING, ConnectionPhase.CONNECTED), phases);
    assertEquals(3, metrics.count("mesh.connect.failure"));
    assertEquals(1, metrics.count("mesh.connect.success"));
  }

  @Test
  void forwardsPacketsInArrivalOrder() {
    FakeRadioLink link = transport.succeedWith(1L);
    manager = newManager(FAST);
    manager.start();
    Eventually.await("connection", () -> manager.status().connected());

    PacketEvent first = new PacketEvent(2L, null, "TEXT_MESSAGE_APP", null, "one");
    PacketEvent second = new PacketEvent(3L, null, "TEXT_MESSAGE_APP", null, "two");
    link.push(first);
    link.push(second);

    Eventually.await("two forwarded packets", () -> forwarded.size() == 2);
    assertEquals(List.of(first, second), forwarded);
  }

  @Test
  void reconnectsAfterLinkLoss() {
    FakeRadioLink first = transport.succeedWith(1L);
    transport.failNext(1);
    transport.succeedWith(1L);
    manager = newManager(FAST);
    manager.start();
    Eventually.await("first connection", () -> manager.status().connected());

    first.drop();

    Eventually.await("second connection",
        () -> manager.status().connected() && manager.status().connectionAttempts() == 2);
    assertTrue(first.closed());
    assertEquals(1, manager.status().failedAttempts());
    assertEquals(1, metrics.count("mesh.link.lost"));
  }

  @Test
  void sinkFailureDoesNotDropTheLink() {
    FakeRadioLink link = transport.succeedWith(1L);
    List<PacketEvent> seen = new CopyOnWriteArrayList<>();
    manager = new ConnectionManager(transport, ADDRESS, event -> {
      seen.add(event);
      if ("boom".equals(event.text())) {
        throw new IllegalStateException("scripted sink failure");
      }
    }, FAST, clock, metrics, recorder);
    manager.start();
    Eventually.await("connection", () -> manager.status().connected());

    link.push(new PacketEvent(2L, null, null, null, "boom"));
    link.push(new PacketEvent(2L, null, null, null, "after"));

    Eventually.await("both packets", () -> seen.size() == 2);
    assertTrue(manager.status().connected());
    assertEquals(1, manager.status().connectionAttempts());
  }

  @Test
  void shutdownClosesLinkAndStopsLoop() {
    FakeRadioLink link = transport.succeedWith(1L);
    manager = newManager(FAST);
    manager.start();
    Eventually.await("connection", () -> manager.status().connected());

    manager.shutdown();

    assertTrue(link.closed());
    assertEquals(ConnectionPhase.DISCONNECTED, manager.status().phase());
    assertEquals(1, transport.connectCalls());
    assertThrows(LinkUnavailableException.class, () -> manager.send("late", null));
  }

  @Test
  void shutdownInterruptsLongBackoff() {
    manager = newManager(new ConnectionSettings(Duration.ofMinutes(5), Duration.ofMillis(20), Duration.ofSeconds(5)));
    manager.start();
    Eventually.await("first failure", () -> manager.status().failedAttempts() == 1);

    long started = System.nanoTime();
    manager.shutdown();

    assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);
    assertEquals(1, transport.connectCalls());
  }

  @Test
  void sendRequiresAnActiveLink() {
    manager = newManager(FAST);

    LinkUnavailableException ex =
        assertThrows(LinkUnavailableException.class, () -> manager.send("hi", null));
    assertEquals("Mesh interface not initialized", ex.getMessage());
  }

  @Test
  void sendGoesThroughTheActiveLink() throws Exception {
    FakeRadioLink link = transport.succeedWith(1L);
    manager = newManager(FAST);
    manager.start();
    Eventually.await("connection", () -> manager.status().connected());

    manager.send("hi", "!0000002a");
    manager.send("all", null);

    assertEquals(List.of("!0000002a:hi", "!ffffffff:all"), link.sent());
    assertEquals(2, metrics.observed("mesh.send.latencyNanos").size());
    assertThrows(InvalidNodeIdException.class, () -> manager.send("hi", "bogus"));
  }

  @Test
  void startTwiceIsRejected() {
    manager = newManager(FAST);
    manager.start();

    assertThrows(IllegalStateException.class, manager::start);
  }

  private ConnectionManager newManager(ConnectionSettings settings) {
    return new ConnectionManager(transport, ADDRESS, forwarded::add, settings, clock, metrics, recorder);
  }
}
