package ca.gc.cra.meshgate.infrastructure.radio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshgate.application.pipeline.EventDispatcher;
import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.store.MessageStore;
import ca.gc.cra.meshgate.application.store.NodeRegistry;
import ca.gc.cra.meshgate.application.store.TelemetryStore;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import ca.gc.cra.meshgate.domain.mesh.Telemetry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PacketJsonCodecTest {
  private final PacketJsonCodec codec = new PacketJsonCodec();

  @Test
  void decodesTextPacket() {
    PacketEvent event = codec.decodePacket(
        "{\"from\":2712847316,\"fromId\":\"!a1b2c3d4\",\"decoded\":{\"portnum\":\"TEXT_MESSAGE_APP\",\"text\":\"hi\"}}")
        .orElseThrow();

    assertEquals(2_712_847_316L, event.from());
    assertEquals("!a1b2c3d4", event.fromId());
    assertEquals("TEXT_MESSAGE_APP", event.portNum());
    assertEquals("hi", event.text());
    assertFalse(event.hasTelemetry());
  }

  @Test
  void decodesTelemetrySectionsIndependently() {
    PacketEvent event = codec.decodePacket("{\"from\":7,\"decoded\":{\"portnum\":\"TELEMETRY_APP\",\"telemetry\":{"
        + "\"time\":1700000000,"
        + "\"deviceMetrics\":{\"batteryLevel\":87,\"voltage\":4.02,\"airUtilTx\":0.5},"
        + "\"environmentMetrics\":{\"temperature\":21.5,\"relativeHumidity\":44}}}}")
        .orElseThrow();

    Telemetry telemetry = event.telemetry();
    assertEquals(1_700_000_000L, telemetry.time());
    assertEquals(87, telemetry.deviceMetrics().batteryLevel());
    assertEquals(4.02, telemetry.deviceMetrics().voltage());
    assertNull(telemetry.deviceMetrics().channelUtilization());
    assertEquals(44.0, telemetry.environmentMetrics().relativeHumidity());
    assertNull(telemetry.environmentMetrics().barometricPressure());
    assertNull(event.fromId());
  }

  @Test
  void toleratesMissingSections() {
    PacketEvent event = codec.decodePacket("{\"decoded\":{\"portnum\":\"POSITION_APP\"}}").orElseThrow();

    assertNull(event.from());
    assertFalse(event.hasText());
    assertFalse(event.hasTelemetry());
  }

  @Test
  void telemetryWithoutTimeIsDroppedButRestOfPacketSurvives() {
    PacketEvent event = codec.decodePacket("{\"from\":5,\"fromId\":\"!00000005\",\"decoded\":{"
        + "\"portnum\":\"TELEMETRY_APP\",\"text\":\"low battery\","
        + "\"telemetry\":{\"deviceMetrics\":{\"batteryLevel\":50}}}}")
        .orElseThrow();

    assertFalse(event.hasTelemetry());
    assertEquals(5L, event.from());
    assertEquals("!00000005", event.fromId());
    assertEquals("low battery", event.text());

    TelemetryStore telemetry = new TelemetryStore();
    MessageStore messages = new MessageStore();
    NodeRegistry nodes = new NodeRegistry();
    new EventDispatcher(telemetry, messages, nodes, MetricsPort.NO_OP).onPacket(event);

    assertTrue(telemetry.snapshotDevice().isEmpty());
    assertEquals(1, messages.size());
    assertEquals("!00000005", nodes.snapshot().get(5L).longId());
  }

  @Test
  void telemetryWithNonNumericTimeIsDropped() {
    PacketEvent event = codec.decodePacket("{\"from\":5,\"decoded\":{\"telemetry\":{"
        + "\"time\":\"yesterday\",\"environmentMetrics\":{\"temperature\":20.0}}}}")
        .orElseThrow();

    assertFalse(event.hasTelemetry());
    assertEquals(5L, event.from());
  }

  @Test
  void rejectsNonObjectLines() {
    assertTrue(codec.decodePacket("not json").isEmpty());
    assertTrue(codec.decodePacket("[1,2]").isEmpty());
    assertTrue(codec.decodePacket("").isEmpty());
    assertTrue(codec.decodePacket(null).isEmpty());
  }

  @Test
  void readsHandshakeNodeNumber() {
    assertEquals(305_419_896L, codec.decodeMyNodeNum("{\"myInfo\":{\"myNodeNum\":305419896}}").getAsLong());
    assertTrue(codec.decodeMyNodeNum("{\"from\":1}").isEmpty());
    assertTrue(codec.decodeMyNodeNum("{\"myInfo\":{\"myNodeNum\":\"12\"}}").isEmpty());
  }

  @Test
  void encodesCommands() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    assertEquals("wantConfig", mapper.readTree(codec.encodeWantConfig()).get("type").asText());
    JsonNode send = mapper.readTree(codec.encodeSendText("hello \"mesh\"", NodeTargets.BROADCAST));
    assertEquals("sendText", send.get("type").asText());
    assertEquals("hello \"mesh\"", send.get("text").asText());
    assertEquals(4_294_967_295L, send.get("to").asLong());
  }
}
