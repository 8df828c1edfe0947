package ca.gc.cra.meshgate.application.pipeline;

import ca.gc.cra.meshgate.application.port.ClockPort;
import ca.gc.cra.meshgate.application.port.ConnectionStateListener;
import ca.gc.cra.meshgate.application.port.InvalidNodeIdException;
import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.port.PacketEventSink;
import ca.gc.cra.meshgate.application.port.RadioLink;
import ca.gc.cra.meshgate.application.port.RadioTransport;
import ca.gc.cra.meshgate.domain.mesh.ConnectionPhase;
import ca.gc.cra.meshgate.domain.mesh.ConnectionState;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Owns the single link to the mesh gateway for the life of the process.
 * <p>The connection thread loops DISCONNECTED → CONNECTING → CONNECTED, retrying failed connects after a fixed
 * backoff and never giving up. While connected it polls the link and forwards every packet to the
 * {@link PacketEventSink}. Any poll failure drops the link and restarts the loop.</p>
 * <p>The manager is the only writer of {@link ConnectionState} and the only component holding the
 * {@link RadioLink}; request threads read {@link #status()} and send through {@link #send(String, String)}.
 * Instances are not reusable once {@link #shutdown()} has been called.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);
  private static final String THREAD_NAME = "mesh-connection";

  private final RadioTransport transport;
  private final String address;
  private final PacketEventSink sink;
  private final ConnectionSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ConnectionStateListener listener;

  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.initial());
  private final AtomicReference<RadioLink> activeLink = new AtomicReference<>();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final CountDownLatch shutdownSignal = new CountDownLatch(1);

  /**
   * Creates a manager with default timings and no state listener.
   *
   * @param transport gateway transport used to open links
   * @param address gateway address passed to {@link RadioTransport#connect(String)}
   * @param sink receiver of forwarded packets
   * @param clock clock stamping connection times
   * @param metrics metrics sink for connection counters
   */
  public ConnectionManager(
      RadioTransport transport, String address, PacketEventSink sink, ClockPort clock, MetricsPort metrics) {
    this(transport, address, sink, ConnectionSettings.defaults(), clock, metrics, ConnectionStateListener.NO_OP);
  }

  /**
   * Creates a manager with explicit timings.
   *
   * @param transport gateway transport used to open links
   * @param address gateway address passed to {@link RadioTransport#connect(String)}
   * @param sink receiver of forwarded packets
   * @param settings backoff, poll, and shutdown timings
   * @param clock clock stamping connection times
   * @param metrics metrics sink for connection counters
   * @param listener observer notified after each state change
   */
  public ConnectionManager(
      RadioTransport transport,
      String address,
      PacketEventSink sink,
      ConnectionSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      ConnectionStateListener listener) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.address = Objects.requireNonNull(address, "address");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Launches the connection loop on a dedicated non-daemon thread.
   *
   * @throws IllegalStateException if the loop was already started
   */
  public void start() {
    Thread thread = new Thread(this::run, THREAD_NAME);
    thread.setDaemon(false);
    if (!runThread.compareAndSet(null, thread)) {
      throw new IllegalStateException("Connection manager already started");
    }
    thread.start();
  }

  /**
   * Runs the connect/forward loop on the calling thread until {@link #shutdown()} is called or the thread is
   * interrupted. Most callers use {@link #start()} instead.
   */
  public void run() {
    runThread.compareAndSet(null, Thread.currentThread());
    MDC.put("component", "connection");
    try {
      log.info("Connection loop started for mesh gateway {}", address);
      while (!stopping()) {
        RadioLink link = connectOnce();
        if (link == null) {
          if (!awaitBackoff()) {
            break;
          }
          continue;
        }
        try {
          forward(link);
        } finally {
          release(link);
        }
      }
    } finally {
      if (state.get().phase() != ConnectionPhase.DISCONNECTED) {
        publish(state.get().transition(ConnectionPhase.DISCONNECTED));
      }
      log.info("Connection loop stopped for mesh gateway {}", address);
      MDC.remove("component");
    }
  }

  /**
   * Returns the latest connection snapshot without blocking.
   *
   * @return current state
   */
  public ConnectionState status() {
    return state.get();
  }

  /**
   * Sends text over the active link.
   *
   * @param text message body
   * @param target destination node reference, or {@code null} to broadcast
   * @throws LinkUnavailableException if no link is established
   * @throws InvalidNodeIdException if the link rejects {@code target}
   * @throws IOException if the write fails
   */
  public void send(String text, String target)
      throws LinkUnavailableException, InvalidNodeIdException, IOException {
    RadioLink link = activeLink.get();
    if (link == null || !state.get().connected() || !link.isOpen()) {
      throw new LinkUnavailableException("Mesh interface not initialized");
    }
    long startNanos = System.nanoTime();
    link.sendText(text, target);
    metrics.observe("mesh.send.latencyNanos", System.nanoTime() - startNanos);
  }

  /**
   * Stops the loop, closes the live link, and waits for the connection thread to exit. Idempotent.
   */
  public void shutdown() {
    shutdownSignal.countDown();
    RadioLink link = activeLink.getAndSet(null);
    if (link != null) {
      closeLink(link);
    }
    Thread thread = runThread.get();
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    try {
      thread.join(settings.shutdownTimeout().toMillis());
      if (thread.isAlive()) {
        log.warn("Connection thread still running after {}; interrupting", settings.shutdownTimeout());
        thread.interrupt();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private RadioLink connectOnce() {
    publish(state.get().transition(ConnectionPhase.CONNECTING));
    RadioLink link;
    try {
      link = transport.connect(address);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      publish(state.get().transition(ConnectionPhase.DISCONNECTED));
      return null;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("mesh.connect.failure");
      log.warn("Could not connect to mesh gateway {}: {}", address, ex.getMessage());
      log.debug("Connect failure detail", ex);
      publish(state.get().connectFailed());
      return null;
    }

    activeLink.set(link);
    if (stopping()) {
      release(link);
      return null;
    }
    publish(state.get().connectedTo(link.localNodeNum(), clock.nowMillis()));
    metrics.increment("mesh.connect.success");
    log.info("Connected to mesh gateway {} as node {}", address, link.localNodeNum());
    return link;
  }

  private void forward(RadioLink link) {
    while (!stopping()) {
      Optional<PacketEvent> next;
      try {
        next = link.poll(settings.pollTimeout());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      } catch (IOException ex) {
        if (!stopping()) {
          metrics.increment("mesh.link.lost");
          log.warn("Lost link to mesh gateway {}: {}", address, ex.getMessage());
        }
        return;
      }
      if (next.isEmpty()) {
        continue;
      }
      try {
        sink.onPacket(next.get());
      } catch (RuntimeException ex) {
        log.error("Failed to dispatch packet from node {}", next.get().from(), ex);
      }
    }
  }

  private boolean awaitBackoff() {
    try {
      return !shutdownSignal.await(settings.reconnectBackoff().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void release(RadioLink link) {
    activeLink.compareAndSet(link, null);
    closeLink(link);
    if (state.get().phase() != ConnectionPhase.DISCONNECTED) {
      publish(state.get().transition(ConnectionPhase.DISCONNECTED));
      log.info("Disconnected from mesh gateway {}", address);
    }
  }

  private void closeLink(RadioLink link) {
    try {
      link.close();
    } catch (IOException ex) {
      log.debug("Failed to close link to {}", address, ex);
    }
  }

  private boolean stopping() {
    return shutdownSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
  }

  private void publish(ConnectionState next) {
    state.set(next);
    try {
      listener.onStateChanged(next);
    } catch (RuntimeException ex) {
      log.warn("Connection state listener failed on {}", next.phase(), ex);
    }
  }
}
