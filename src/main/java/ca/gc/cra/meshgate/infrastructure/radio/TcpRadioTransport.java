package ca.gc.cra.meshgate.infrastructure.radio;

import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.port.RadioLink;
import ca.gc.cra.meshgate.application.port.RadioTransport;
import ca.gc.cra.meshgate.validation.Net;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link TcpRadioLink}s to a gateway bridge.
 * <p>Connecting performs the configuration handshake: the adapter requests the gateway config and waits
 * for the line carrying {@code myInfo.myNodeNum}. Lines before it are skipped.</p>
 *
 * @since 0.1.0
 */
public final class TcpRadioTransport implements RadioTransport {
  private static final Logger log = LoggerFactory.getLogger(TcpRadioTransport.class);

  /** Gateway port used when the address omits one. */
  public static final int DEFAULT_PORT = 4403;
  /** Default bound on the per-link inbound queue. */
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;

  private final PacketJsonCodec codec;
  private final Duration connectTimeout;
  private final Duration handshakeTimeout;
  private final int queueCapacity;
  private final MetricsPort metrics;

  /**
   * Creates a transport.
   *
   * @param connectTimeout TCP connect timeout
   * @param handshakeTimeout maximum wait for the node-number handshake line
   * @param queueCapacity bound on buffered inbound packets per link
   * @param metrics metrics sink for decode and queue drops
   */
  public TcpRadioTransport(
      Duration connectTimeout, Duration handshakeTimeout, int queueCapacity, MetricsPort metrics) {
    this(new PacketJsonCodec(), connectTimeout, handshakeTimeout, queueCapacity, metrics);
  }

  TcpRadioTransport(
      PacketJsonCodec codec,
      Duration connectTimeout,
      Duration handshakeTimeout,
      int queueCapacity,
      MetricsPort metrics) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
    this.handshakeTimeout = requirePositive(handshakeTimeout, "handshakeTimeout");
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.queueCapacity = queueCapacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public RadioLink connect(String address) throws IOException, InterruptedException {
    InetSocketAddress endpoint = resolve(address);
    Socket socket = new Socket();
    try {
      socket.connect(endpoint, (int) connectTimeout.toMillis());
      socket.setTcpNoDelay(true);
      BufferedReader reader =
          new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
      BufferedWriter writer =
          new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
      writer.write(codec.encodeWantConfig());
      writer.write('\n');
      writer.flush();

      long localNodeNum = awaitNodeNum(socket, reader, address);
      socket.setSoTimeout(0);
      TcpRadioLink link =
          new TcpRadioLink(address, socket, reader, writer, localNodeNum, codec, queueCapacity, metrics);
      link.start();
      log.debug("Handshake with {} complete; local node {}", address, NodeTargets.format(localNodeNum));
      return link;
    } catch (IOException | RuntimeException ex) {
      closeQuietly(socket);
      throw ex;
    }
  }

  private long awaitNodeNum(Socket socket, BufferedReader reader, String address)
      throws IOException, InterruptedException {
    long deadline = System.nanoTime() + handshakeTimeout.toNanos();
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Interrupted during handshake with " + address);
      }
      long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMillis <= 0) {
        throw new SocketTimeoutException("No node info from " + address + " within " + handshakeTimeout);
      }
      socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remainingMillis));
      String line;
      try {
        line = reader.readLine();
      } catch (SocketTimeoutException ex) {
        throw new SocketTimeoutException("No node info from " + address + " within " + handshakeTimeout);
      }
      if (line == null) {
        throw new EOFException("Gateway " + address + " closed the connection during handshake");
      }
      OptionalLong nodeNum = codec.decodeMyNodeNum(line);
      if (nodeNum.isPresent()) {
        return nodeNum.getAsLong();
      }
    }
  }

  static InetSocketAddress resolve(String address) {
    String normalized = Net.validateHostPort(address, DEFAULT_PORT);
    int colon = normalized.lastIndexOf(':');
    String host = normalized.substring(0, colon);
    if (host.startsWith("[")) {
      host = host.substring(1, host.length() - 1);
    }
    int port = Integer.parseInt(normalized.substring(colon + 1));
    return new InetSocketAddress(host, port);
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Failed to close socket after connect failure", ex);
    }
  }
}
