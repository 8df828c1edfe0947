package ca.gc.cra.meshgate.application.query;

import ca.gc.cra.meshgate.application.pipeline.ConnectionManager;
import ca.gc.cra.meshgate.application.pipeline.LinkUnavailableException;
import ca.gc.cra.meshgate.application.port.InvalidNodeIdException;
import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.store.MessageStore;
import ca.gc.cra.meshgate.application.store.NodeRegistry;
import ca.gc.cra.meshgate.application.store.TelemetryStore;
import ca.gc.cra.meshgate.domain.mesh.DeviceTelemetrySample;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentTelemetrySample;
import ca.gc.cra.meshgate.domain.mesh.MeshNode;
import ca.gc.cra.meshgate.domain.mesh.Message;
import ca.gc.cra.meshgate.logging.Logs;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single entry point the HTTP layer calls for every mesh query and command.
 * <p><strong>Why:</strong> Keeps parameter checks and error mapping in one place so adapters stay thin.</p>
 * <p><strong>Role:</strong> Application service over the stores and the connection manager.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for any number of request threads. Reads return copies.</p>
 * <p><strong>Observability:</strong> Counts {@code mesh.send.success} and {@code mesh.send.failure}.</p>
 *
 * @since 0.1.0
 */
public final class QueryFacade {
  private static final Logger log = LoggerFactory.getLogger(QueryFacade.class);
  private static final int LOG_TEXT_BYTES = 64;

  private final ConnectionManager connection;
  private final TelemetryStore telemetry;
  private final MessageStore messages;
  private final NodeRegistry nodes;
  private final MetricsPort metrics;

  /**
   * Creates the facade.
   *
   * @param connection owner of the radio link
   * @param telemetry telemetry caches
   * @param messages message cache
   * @param nodes node registry
   * @param metrics metrics sink for send outcomes
   */
  public QueryFacade(
      ConnectionManager connection,
      TelemetryStore telemetry,
      MessageStore messages,
      NodeRegistry nodes,
      MetricsPort metrics) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.nodes = Objects.requireNonNull(nodes, "nodes");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Sends a text message to one node or to the whole mesh.
   *
   * @param text message body; required, may be empty
   * @param targetNodeId destination node reference, or {@code null}/blank to broadcast
   * @throws QueryException with {@link QueryError#MISSING_PARAMETER} when {@code text} is absent,
   *     {@link QueryError#INVALID_NODE_ID} when the target is rejected, {@link QueryError#NOT_CONNECTED} when no
   *     link is up, or {@link QueryError#SEND_FAILED} when the write fails
   */
  public void sendMessage(String text, String targetNodeId) throws QueryException {
    if (text == null) {
      throw new QueryException(QueryError.MISSING_PARAMETER, "Missing parameters: message");
    }
    String target = (targetNodeId == null || targetNodeId.isBlank()) ? null : targetNodeId.trim();
    try {
      connection.send(text, target);
      metrics.increment("mesh.send.success");
      log.debug("Sent message to {}: {}", target == null ? "broadcast" : target, Logs.truncate(text, LOG_TEXT_BYTES));
    } catch (InvalidNodeIdException ex) {
      metrics.increment("mesh.send.failure");
      throw new QueryException(QueryError.INVALID_NODE_ID, "Invalid node ID", ex);
    } catch (LinkUnavailableException ex) {
      metrics.increment("mesh.send.failure");
      throw new QueryException(QueryError.NOT_CONNECTED, ex.getMessage(), ex);
    } catch (IOException ex) {
      metrics.increment("mesh.send.failure");
      log.warn("Failed to send message to {}: {}", target == null ? "broadcast" : target, ex.getMessage());
      throw new QueryException(QueryError.SEND_FAILED, String.valueOf(ex.getMessage()), ex);
    }
  }

  /**
   * Returns the latest device telemetry per node.
   *
   * @return copy ordered by node number
   */
  public Map<Long, DeviceTelemetrySample> deviceTelemetry() {
    return telemetry.snapshotDevice();
  }

  /**
   * Returns the latest environment telemetry per node.
   *
   * @return copy ordered by node number
   */
  public Map<Long, EnvironmentTelemetrySample> environmentTelemetry() {
    return telemetry.snapshotEnvironment();
  }

  /**
   * Returns the cached messages.
   *
   * @return copy in arrival order, oldest first
   */
  public Map<String, Message> lastMessages() {
    return messages.snapshot();
  }

  /**
   * Removes a cached message.
   *
   * @param messageId id returned by {@link #lastMessages()}; required
   * @throws QueryException with {@link QueryError#MISSING_PARAMETER} when the id is absent or
   *     {@link QueryError#NOT_FOUND} when no message has that id, including an empty id
   */
  public void deleteMessage(String messageId) throws QueryException {
    if (messageId == null) {
      throw new QueryException(QueryError.MISSING_PARAMETER, "Missing parameters: message_id");
    }
    if (messages.delete(messageId).isEmpty()) {
      throw new QueryException(QueryError.NOT_FOUND, "Invalid message ID");
    }
  }

  /**
   * Returns every node observed since start.
   *
   * @return copy ordered by node number
   */
  public Map<Long, MeshNode> nodes() {
    return nodes.snapshot();
  }

  /**
   * Returns the connection status.
   *
   * @return current status snapshot
   */
  public MeshStatus status() {
    return MeshStatus.of(connection.status());
  }
}
