package ca.gc.cra.meshgate.api.http;

import ca.gc.cra.meshgate.application.query.MeshStatus;
import ca.gc.cra.meshgate.domain.mesh.DeviceMetrics;
import ca.gc.cra.meshgate.domain.mesh.DeviceTelemetrySample;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentMetrics;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentTelemetrySample;
import ca.gc.cra.meshgate.domain.mesh.MeshNode;
import ca.gc.cra.meshgate.domain.mesh.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders query results in the JSON shapes clients of the gateway expect.
 * <p>Maps keyed by node number use the decimal node number as the property name. Metric fields that
 * the radio did not report are written as {@code null}.</p>
 */
final class MeshJson {
  private final ObjectMapper mapper;

  MeshJson(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  ObjectNode deviceTelemetry(Map<Long, DeviceTelemetrySample> samples) {
    ObjectNode root = mapper.createObjectNode();
    samples.forEach((nodeNum, sample) -> {
      ObjectNode entry = root.putObject(Long.toString(nodeNum));
      entry.put("time", sample.time());
      DeviceMetrics metrics = sample.deviceMetrics();
      ObjectNode body = entry.putObject("deviceMetrics");
      body.put("batteryLevel", metrics.batteryLevel());
      body.put("voltage", metrics.voltage());
      body.put("channelUtilization", metrics.channelUtilization());
      body.put("airUtilTx", metrics.airUtilTx());
    });
    return root;
  }

  ObjectNode environmentTelemetry(Map<Long, EnvironmentTelemetrySample> samples) {
    ObjectNode root = mapper.createObjectNode();
    samples.forEach((nodeNum, sample) -> {
      ObjectNode entry = root.putObject(Long.toString(nodeNum));
      entry.put("time", sample.time());
      EnvironmentMetrics metrics = sample.environmentMetrics();
      ObjectNode body = entry.putObject("environmentMetrics");
      body.put("temperature", metrics.temperature());
      body.put("relativeHumidity", metrics.relativeHumidity());
      body.put("barometricPressure", metrics.barometricPressure());
    });
    return root;
  }

  ObjectNode messages(Map<String, Message> messages) {
    ObjectNode root = mapper.createObjectNode();
    messages.forEach((id, message) -> {
      ObjectNode entry = root.putObject(id);
      entry.put("node_id", message.nodeNum());
      entry.put("message", message.text());
    });
    return root;
  }

  ObjectNode nodes(Map<Long, MeshNode> nodes) {
    ObjectNode root = mapper.createObjectNode();
    nodes.forEach((nodeNum, node) -> root.putObject(Long.toString(nodeNum)).put("long_id", node.longId()));
    return root;
  }

  ObjectNode status(MeshStatus status) {
    ObjectNode root = mapper.createObjectNode();
    root.put("connected", status.connected());
    root.put("phase", status.phase().name());
    if (status.localNodeNum() == null) {
      root.putNull("nodeid");
    } else {
      root.put("nodeid", Long.toString(status.localNodeNum()));
    }
    if (status.lastConnectedAtMillis() == null) {
      root.putNull("last_connection_time");
    } else {
      root.put("last_connection_time", status.lastConnectedAtMillis() / 1000.0d);
    }
    root.put("total_connection_attempts", status.connectionAttempts());
    root.put("failed_connection_attempts", status.failedAttempts());
    return root;
  }

  ObjectNode outcome(String status, String message) {
    ObjectNode root = mapper.createObjectNode();
    root.put("status", status);
    root.put("message", message);
    return root;
  }

  ObjectNode error(String message) {
    ObjectNode root = mapper.createObjectNode();
    root.put("error", message);
    return root;
  }

  byte[] toBytes(Object body) {
    try {
      return mapper.writeValueAsBytes(body);
    } catch (JsonProcessingException ex) {
      throw new UncheckedIOException("Failed to serialize JSON", ex);
    }
  }
}
