package ca.gc.cra.meshgate.application.pipeline;

import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.port.PacketEventSink;
import ca.gc.cra.meshgate.application.store.MessageStore;
import ca.gc.cra.meshgate.application.store.NodeRegistry;
import ca.gc.cra.meshgate.application.store.TelemetryStore;
import ca.gc.cra.meshgate.domain.mesh.Message;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import ca.gc.cra.meshgate.domain.mesh.Telemetry;
import ca.gc.cra.meshgate.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each decoded packet to every store it concerns. A packet may match several rules at once; packets
 * matching none (position reports, routing chatter, packets without a sender) are dropped without error.
 *
 * <p>Runs on the connection thread and performs no I/O.</p>
 *
 * @since 0.1.0
 */
public final class EventDispatcher implements PacketEventSink {
  private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
  private static final int LOG_TEXT_BYTES = 64;

  private final TelemetryStore telemetry;
  private final MessageStore messages;
  private final NodeRegistry nodes;
  private final MetricsPort metrics;

  /**
   * Creates a dispatcher writing into the given stores.
   *
   * @param telemetry telemetry caches
   * @param messages message cache
   * @param nodes node registry
   * @param metrics metrics sink for routing counters
   */
  public EventDispatcher(
      TelemetryStore telemetry, MessageStore messages, NodeRegistry nodes, MetricsPort metrics) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.nodes = Objects.requireNonNull(nodes, "nodes");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void onPacket(PacketEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment("mesh.packet.received");
    Long from = event.from();
    if (from == null) {
      metrics.increment("mesh.packet.ignored");
      log.debug("Ignoring packet without sender (portnum={})", event.portNum());
      return;
    }

    boolean routed = false;
    Telemetry reading = event.telemetry();
    if (reading != null && reading.hasDeviceMetrics()) {
      telemetry.upsertDevice(from, reading.time(), reading.deviceMetrics());
      metrics.increment("mesh.packet.telemetry.device");
      routed = true;
    }
    if (reading != null && reading.hasEnvironmentMetrics()) {
      telemetry.upsertEnvironment(from, reading.time(), reading.environmentMetrics());
      metrics.increment("mesh.packet.telemetry.environment");
      routed = true;
    }
    if (event.hasText()) {
      Message stored = messages.insert(from, event.text());
      metrics.increment("mesh.packet.text");
      log.debug("Cached message {} from node {}: {}", stored.id(), from, Logs.truncate(event.text(), LOG_TEXT_BYTES));
      routed = true;
    }
    if (event.fromId() != null) {
      if (nodes.registerIfAbsent(from, event.fromId())) {
        metrics.increment("mesh.node.registered");
        log.info("Discovered node {} ({})", from, event.fromId());
      }
      routed = true;
    }

    if (!routed) {
      metrics.increment("mesh.packet.ignored");
      log.debug("Ignoring packet from {} with portnum={}", from, event.portNum());
    }
  }
}
