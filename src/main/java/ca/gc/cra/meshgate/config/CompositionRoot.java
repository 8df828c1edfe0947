package ca.gc.cra.meshgate.config;

import ca.gc.cra.meshgate.api.http.MeshHttpServer;
import ca.gc.cra.meshgate.application.pipeline.ConnectionManager;
import ca.gc.cra.meshgate.application.pipeline.EventDispatcher;
import ca.gc.cra.meshgate.application.port.ClockPort;
import ca.gc.cra.meshgate.application.port.ConnectionStateListener;
import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.port.RadioTransport;
import ca.gc.cra.meshgate.application.query.QueryFacade;
import ca.gc.cra.meshgate.application.store.Md5MessageIdGenerator;
import ca.gc.cra.meshgate.application.store.MessageStore;
import ca.gc.cra.meshgate.application.store.NodeRegistry;
import ca.gc.cra.meshgate.application.store.TelemetryStore;
import ca.gc.cra.meshgate.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.meshgate.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.meshgate.infrastructure.radio.TcpRadioTransport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the stores, dispatcher, connection manager, query facade, and HTTP server for
 * one gateway process.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI and tests share the same graph.</p>
 * <p><strong>Role:</strong> Composition root; every collaborator is created once and shared.</p>
 * <p><strong>Thread-safety:</strong> Construct and close from a single thread. The components it hands out
 * are thread-safe.</p>
 * <p><strong>Observability:</strong> Passes the single {@link MetricsPort} to every component and closes it on
 * {@link #close()} when it is closeable.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int REQUEST_QUEUE_PER_WORKER = 16;

  private final ServeConfig config;
  private final MetricsPort metrics;
  private final TelemetryStore telemetryStore;
  private final MessageStore messageStore;
  private final NodeRegistry nodeRegistry;
  private final EventDispatcher dispatcher;
  private final ConnectionManager connectionManager;
  private final QueryFacade queryFacade;
  private MeshHttpServer httpServer;
  private boolean closed;

  /**
   * Creates the production graph: TCP gateway transport and OpenTelemetry metrics.
   *
   * @param config validated serve configuration
   */
  public CompositionRoot(ServeConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), ClockPort.SYSTEM, null);
  }

  /**
   * Creates a graph with explicit collaborators.
   *
   * @param config validated serve configuration
   * @param metrics metrics sink shared by all components
   * @param clock clock for receive and connect timestamps
   * @param transport radio transport; {@code null} selects the TCP gateway transport
   */
  public CompositionRoot(ServeConfig config, MetricsPort metrics, ClockPort clock, RadioTransport transport) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");
    RadioTransport radio = transport != null
        ? transport
        : new TcpRadioTransport(
            config.handshakeTimeout(),
            config.handshakeTimeout(),
            TcpRadioTransport.DEFAULT_QUEUE_CAPACITY,
            metrics);

    this.telemetryStore = new TelemetryStore();
    this.messageStore = new MessageStore(config.messageCapacity(), new Md5MessageIdGenerator(), clock, metrics);
    this.nodeRegistry = new NodeRegistry(clock);
    this.dispatcher = new EventDispatcher(telemetryStore, messageStore, nodeRegistry, metrics);
    ConnectionStateListener stateLogger =
        state -> log.debug("Connection state now {} (attempts={}, failed={})",
            state.phase(), state.connectionAttempts(), state.failedAttempts());
    this.connectionManager = new ConnectionManager(
        radio, config.radioAddress(), dispatcher, config.connectionSettings(), clock, metrics, stateLogger);
    this.queryFacade =
        new QueryFacade(connectionManager, telemetryStore, messageStore, nodeRegistry, metrics);
  }

  /**
   * Returns the connection manager; callers start it.
   *
   * @return connection manager
   */
  public ConnectionManager connectionManager() {
    return connectionManager;
  }

  /**
   * Returns the query facade.
   *
   * @return facade over the stores and connection
   */
  public QueryFacade queryFacade() {
    return queryFacade;
  }

  /**
   * Returns the packet dispatcher.
   *
   * @return dispatcher fed by the connection manager
   */
  public EventDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Returns the HTTP server, creating it on first use. The server is not started.
   *
   * @return HTTP server bound to the configured host and port once started
   */
  public synchronized MeshHttpServer httpServer() {
    if (httpServer == null) {
      httpServer = new MeshHttpServer(
          queryFacade,
          config.httpHost(),
          config.httpPort(),
          ExecutorFactories.newRequestPool(
              config.httpWorkers(),
              config.httpWorkers() * REQUEST_QUEUE_PER_WORKER,
              "mesh-http",
              (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
    }
    return httpServer;
  }

  /**
   * Stops the HTTP server, then the connection manager, then flushes metrics. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (httpServer != null) {
      httpServer.close();
    }
    connectionManager.shutdown();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
