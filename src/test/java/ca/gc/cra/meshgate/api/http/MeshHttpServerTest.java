package ca.gc.cra.meshgate.api.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshgate.config.CompositionRoot;
import ca.gc.cra.meshgate.config.ServeConfig;
import ca.gc.cra.meshgate.domain.mesh.ConnectionPhase;
import ca.gc.cra.meshgate.domain.mesh.DeviceMetrics;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentMetrics;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import ca.gc.cra.meshgate.domain.mesh.Telemetry;
import ca.gc.cra.meshgate.testutil.Eventually;
import ca.gc.cra.meshgate.testutil.FakeRadioTransport;
import ca.gc.cra.meshgate.testutil.FakeRadioTransport.FakeRadioLink;
import ca.gc.cra.meshgate.testutil.ManualClock;
import ca.gc.cra.meshgate.testutil.RecordingMetricsPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MeshHttpServerTest {
  private static final long NOW_MILLIS = 1_700_000_000_500L;

  private final ObjectMapper mapper = new ObjectMapper();
  private final HttpClient client = HttpClient.newBuilder()
      .version(HttpClient.Version.HTTP_1_1)
      .connectTimeout(Duration.ofSeconds(5))
      .build();
  private final FakeRadioTransport transport = new FakeRadioTransport();
  private CompositionRoot root;
  private String base;

  @BeforeEach
  void startServer() throws IOException {
    ServeConfig config = ServeConfig.fromMap(Map.of(
        "radio", "gateway.local",
        "httpPort", "0",
        "httpWorkers", "2",
        "reconnectBackoffMillis", "10",
        "pollTimeoutMillis", "20"));
    root = new CompositionRoot(config, new RecordingMetricsPort(), new ManualClock(NOW_MILLIS), transport);
    root.httpServer().start();
    base = "http://127.0.0.1:" + root.httpServer().port();
  }

  @AfterEach
  void stopServer() {
    root.close();
  }

  @Test
  void indexPageListsEndpoints() throws Exception {
    HttpResponse<String> response = get("/api/mesh/");

    assertEquals(200, response.statusCode());
    assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/html"));
    assertTrue(response.body().contains("/api/mesh/send_message"));
    assertEquals(200, get("/").statusCode());
  }

  @Test
  void unknownPathIsNotFound() throws Exception {
    HttpResponse<String> response = get("/api/mesh/reboot");

    assertEquals(404, response.statusCode());
    assertEquals("Not found: /api/mesh/reboot", json(response).get("error").asText());
  }

  @Test
  void sendWithoutMessageIsMissingParameter() throws Exception {
    HttpResponse<String> response = postForm("/api/mesh/send_message", "node_id=%21a1b2c3d4");

    assertEquals(404, response.statusCode());
    assertEquals("Missing parameters: message", json(response).get("error").asText());
  }

  @Test
  void sendWhileDisconnectedReportsErrorOutcome() throws Exception {
    HttpResponse<String> response = postForm("/api/mesh/send_message", "message=hello");

    assertEquals(200, response.statusCode());
    JsonNode body = json(response);
    assertEquals("error", body.get("status").asText());
    assertEquals("Mesh interface not initialized", body.get("message").asText());
  }

  @Test
  void sendWhileConnected() throws Exception {
    FakeRadioLink link = connect();

    HttpResponse<String> invalid = postForm("/api/mesh/send_message", "message=hi&node_id=bogus");
    assertEquals(400, invalid.statusCode());
    assertEquals("Invalid node ID", json(invalid).get("error").asText());

    HttpResponse<String> sent = postForm("/api/mesh/send_message", "message=hello+mesh&node_id=%21a1b2c3d4");
    assertEquals(200, sent.statusCode());
    assertEquals("success", json(sent).get("status").asText());

    HttpResponse<String> viaQuery = get("/api/mesh/send_message?message=ping");
    assertEquals(200, viaQuery.statusCode());

    assertEquals(List.of("!a1b2c3d4:hello mesh", "!ffffffff:ping"), link.sent());
  }

  @Test
  void emptyMessageIsSent() throws Exception {
    FakeRadioLink link = connect();

    HttpResponse<String> response = postForm("/api/mesh/send_message", "message=&node_id=%2100000001");

    assertEquals(200, response.statusCode());
    assertEquals("success", json(response).get("status").asText());
    assertEquals(List.of("!00000001:"), link.sent());
  }

  @Test
  void radioWriteFailureIsReportedAsErrorOutcome() throws Exception {
    FakeRadioLink link = connect();
    link.failSends("radio busy");

    HttpResponse<String> response = postForm("/api/mesh/send_message", "message=hello");

    assertEquals(200, response.statusCode());
    JsonNode body = json(response);
    assertEquals("error", body.get("status").asText());
    assertEquals("radio busy", body.get("message").asText());
    assertEquals(ConnectionPhase.CONNECTED, root.connectionManager().status().phase());
    assertTrue(json(get("/api/mesh/status")).get("connected").asBoolean());
  }

  @Test
  void messagesCanBeListedAndDeleted() throws Exception {
    root.dispatcher().onPacket(new PacketEvent(1L, null, "TEXT_MESSAGE_APP", null, "hello"));
    root.dispatcher().onPacket(new PacketEvent(1L, null, "TEXT_MESSAGE_APP", null, "world"));

    JsonNode listed = json(get("/api/mesh/get_last_messages"));
    Iterator<String> ids = listed.fieldNames();
    String helloId = ids.next();
    String worldId = ids.next();
    assertEquals("hello", listed.get(helloId).get("message").asText());
    assertEquals(1L, listed.get(helloId).get("node_id").asLong());

    HttpResponse<String> deleted = postForm("/api/mesh/delete_message", "message_id=" + helloId);
    assertEquals(200, deleted.statusCode());
    assertEquals("success", json(deleted).get("status").asText());

    JsonNode after = json(get("/api/mesh/get_last_messages"));
    assertEquals(1, after.size());
    assertTrue(after.has(worldId));

    HttpResponse<String> again = postForm("/api/mesh/delete_message", "message_id=" + helloId);
    assertEquals(400, again.statusCode());
    assertEquals("Invalid message ID", json(again).get("error").asText());

    HttpResponse<String> empty = postForm("/api/mesh/delete_message", "message_id=");
    assertEquals(400, empty.statusCode());
    assertEquals("Invalid message ID", json(empty).get("error").asText());
    assertEquals(1, json(get("/api/mesh/get_last_messages")).size());

    HttpResponse<String> missing = postForm("/api/mesh/delete_message", "");
    assertEquals(404, missing.statusCode());
    assertEquals("Missing parameters: message_id", json(missing).get("error").asText());
  }

  @Test
  void telemetryAndNodesAreKeyedByNodeNumber() throws Exception {
    root.dispatcher().onPacket(new PacketEvent(7L, "!00000007", "TELEMETRY_APP",
        new Telemetry(1_700_000_000L, new DeviceMetrics(88, 4.0, null, null), new EnvironmentMetrics(19.5, null, null)),
        null));

    JsonNode device = json(get("/api/mesh/get_device_telemetry")).get("7");
    assertEquals(1_700_000_000L, device.get("time").asLong());
    assertEquals(88, device.get("deviceMetrics").get("batteryLevel").asInt());
    assertTrue(device.get("deviceMetrics").get("channelUtilization").isNull());

    JsonNode environment = json(get("/api/mesh/get_environment_telemetry")).get("7");
    assertEquals(19.5, environment.get("environmentMetrics").get("temperature").asDouble());

    JsonNode nodes = json(get("/api/mesh/nodes"));
    assertEquals("!00000007", nodes.get("7").get("long_id").asText());
  }

  @Test
  void statusReflectsConnection() throws Exception {
    JsonNode idle = json(get("/api/mesh/status"));
    assertFalse(idle.get("connected").asBoolean());
    assertTrue(idle.get("nodeid").isNull());
    assertTrue(idle.get("last_connection_time").isNull());

    connect();

    JsonNode live = json(get("/api/mesh/status"));
    assertTrue(live.get("connected").asBoolean());
    assertEquals("CONNECTED", live.get("phase").asText());
    assertEquals("4660", live.get("nodeid").asText());
    assertEquals(NOW_MILLIS / 1000.0d, live.get("last_connection_time").asDouble());
    assertEquals(1, live.get("total_connection_attempts").asInt());
    assertEquals(0, live.get("failed_connection_attempts").asInt());
  }

  @Test
  void parseQueryStringDecodesPairs() {
    Map<String, String> params = MeshHttpServer.parseQueryString("message=hello+there&node_id=%21abc&flag");

    assertEquals("hello there", params.get("message"));
    assertEquals("!abc", params.get("node_id"));
    assertEquals("", params.get("flag"));
  }

  private FakeRadioLink connect() {
    FakeRadioLink link = transport.succeedWith(0x1234L);
    root.connectionManager().start();
    Eventually.await("connection", () -> root.connectionManager().status().connected());
    return link;
  }

  private HttpResponse<String> get(String path) throws Exception {
    HttpRequest request = HttpRequest.newBuilder(URI.create(base + path)).timeout(Duration.ofSeconds(5)).GET().build();
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> postForm(String path, String form) throws Exception {
    HttpRequest request = HttpRequest.newBuilder(URI.create(base + path))
        .timeout(Duration.ofSeconds(5))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form))
        .build();
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private JsonNode json(HttpResponse<String> response) throws IOException {
    return mapper.readTree(response.body());
  }
}
