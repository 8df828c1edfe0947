package ca.gc.cra.meshgate.infrastructure.radio;

import ca.gc.cra.meshgate.domain.mesh.DeviceMetrics;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentMetrics;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import ca.gc.cra.meshgate.domain.mesh.Telemetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Translates gateway JSON lines to and from domain types.
 * <p>Decoding is lenient about missing sections: absent fields become {@code null} on the event, and the
 * dispatcher decides what to ignore. A telemetry section without an integral {@code time} is malformed and
 * decodes as no telemetry. Lines that are not JSON objects decode to empty.</p>
 */
public final class PacketJsonCodec {
  private final ObjectMapper mapper;

  /** Creates a codec with a default {@link ObjectMapper}. */
  public PacketJsonCodec() {
    this(new ObjectMapper());
  }

  PacketJsonCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Decodes one inbound packet line.
   *
   * @param line raw line without terminator
   * @return decoded event, or empty if the line is not a JSON object
   */
  public Optional<PacketEvent> decodePacket(String line) {
    JsonNode root = parseObject(line);
    if (root == null) {
      return Optional.empty();
    }
    JsonNode decoded = root.path("decoded");
    String portNum = text(decoded.get("portnum"));
    String body = text(decoded.get("text"));
    Telemetry telemetry = telemetry(decoded.get("telemetry"));
    return Optional.of(new PacketEvent(number(root.get("from")), text(root.get("fromId")), portNum, telemetry, body));
  }

  /**
   * Extracts the local node number from a handshake line.
   *
   * @param line raw line
   * @return {@code myInfo.myNodeNum} when present
   */
  public OptionalLong decodeMyNodeNum(String line) {
    JsonNode root = parseObject(line);
    if (root == null) {
      return OptionalLong.empty();
    }
    Long nodeNum = number(root.path("myInfo").get("myNodeNum"));
    return nodeNum == null ? OptionalLong.empty() : OptionalLong.of(nodeNum);
  }

  /**
   * Encodes the configuration request sent right after connecting.
   *
   * @return single JSON line without terminator
   */
  public String encodeWantConfig() {
    ObjectNode node = mapper.createObjectNode();
    node.put("type", "wantConfig");
    return node.toString();
  }

  /**
   * Encodes a text send request.
   *
   * @param text message body
   * @param destination resolved node number
   * @return single JSON line without terminator
   */
  public String encodeSendText(String text, long destination) {
    ObjectNode node = mapper.createObjectNode();
    node.put("type", "sendText");
    node.put("text", text);
    node.put("to", destination);
    return node.toString();
  }

  private JsonNode parseObject(String line) {
    if (line == null || line.isBlank()) {
      return null;
    }
    try {
      JsonNode root = mapper.readTree(line);
      return root != null && root.isObject() ? root : null;
    } catch (JsonProcessingException ex) {
      return null;
    }
  }

  private static Telemetry telemetry(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    Long time = number(node.get("time"));
    if (time == null) {
      return null;
    }
    JsonNode device = node.get("deviceMetrics");
    JsonNode environment = node.get("environmentMetrics");
    DeviceMetrics deviceMetrics = device != null && device.isObject()
        ? new DeviceMetrics(
            integer(device.get("batteryLevel")),
            decimal(device.get("voltage")),
            decimal(device.get("channelUtilization")),
            decimal(device.get("airUtilTx")))
        : null;
    EnvironmentMetrics environmentMetrics = environment != null && environment.isObject()
        ? new EnvironmentMetrics(
            decimal(environment.get("temperature")),
            decimal(environment.get("relativeHumidity")),
            decimal(environment.get("barometricPressure")))
        : null;
    return new Telemetry(time, deviceMetrics, environmentMetrics);
  }

  private static String text(JsonNode node) {
    return node != null && node.isTextual() ? node.asText() : null;
  }

  private static Long number(JsonNode node) {
    return node != null && node.canConvertToLong() && node.isIntegralNumber() ? node.asLong() : null;
  }

  private static Integer integer(JsonNode node) {
    return node != null && node.isNumber() ? node.asInt() : null;
  }

  private static Double decimal(JsonNode node) {
    return node != null && node.isNumber() ? node.asDouble() : null;
  }
}
