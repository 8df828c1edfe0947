package ca.gc.cra.meshgate.infrastructure.radio;

import ca.gc.cra.meshgate.application.port.InvalidNodeIdException;
import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.application.port.RadioLink;
import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import ca.gc.cra.meshgate.logging.Logs;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One established connection to a gateway bridge.
 * <p>A reader thread decodes inbound lines into a bounded queue; when the queue is full the oldest event
 * is discarded. After the reader stops (EOF, socket error, or {@link #close()}), {@link #poll(Duration)}
 * drains what is left and then throws {@link IOException}.</p>
 */
final class TcpRadioLink implements RadioLink {
  private static final Logger log = LoggerFactory.getLogger(TcpRadioLink.class);

  private final String address;
  private final Socket socket;
  private final BufferedReader reader;
  private final BufferedWriter writer;
  private final long localNodeNum;
  private final PacketJsonCodec codec;
  private final MetricsPort metrics;
  private final BlockingQueue<PacketEvent> inbound;
  private final Object writeLock = new Object();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Thread readerThread;
  private volatile IOException failure;

  TcpRadioLink(
      String address,
      Socket socket,
      BufferedReader reader,
      BufferedWriter writer,
      long localNodeNum,
      PacketJsonCodec codec,
      int queueCapacity,
      MetricsPort metrics) {
    this.address = address;
    this.socket = socket;
    this.reader = reader;
    this.writer = writer;
    this.localNodeNum = localNodeNum;
    this.codec = codec;
    this.metrics = metrics;
    this.inbound = new LinkedBlockingQueue<>(queueCapacity);
    this.readerThread = new Thread(this::readLoop, "mesh-link-reader");
    this.readerThread.setDaemon(true);
  }

  void start() {
    readerThread.start();
  }

  @Override
  public long localNodeNum() {
    return localNodeNum;
  }

  @Override
  public Optional<PacketEvent> poll(Duration timeout) throws IOException, InterruptedException {
    PacketEvent next = inbound.poll();
    if (next == null) {
      checkFailed();
      next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    if (next == null) {
      checkFailed();
      return Optional.empty();
    }
    return Optional.of(next);
  }

  @Override
  public void sendText(String text, String target) throws InvalidNodeIdException, IOException {
    long destination = NodeTargets.resolve(target);
    String line = codec.encodeSendText(text, destination);
    if (!isOpen()) {
      throw new IOException("Link to " + address + " is closed");
    }
    synchronized (writeLock) {
      writer.write(line);
      writer.write('\n');
      writer.flush();
    }
    log.debug("Sent text to {}: {}", NodeTargets.format(destination), Logs.truncate(text, 64));
  }

  @Override
  public boolean isOpen() {
    return !closed.get() && failure == null;
  }

  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (failure == null) {
      failure = new IOException("Link to " + address + " closed");
    }
    socket.close();
  }

  private void readLoop() {
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        Optional<PacketEvent> event = codec.decodePacket(line);
        if (event.isEmpty()) {
          metrics.increment("mesh.link.decode.dropped");
          log.debug("Dropped undecodable line from {}: {}", address, Logs.truncate(line, 64));
          continue;
        }
        enqueue(event.get());
      }
      fail(new EOFException("Gateway " + address + " closed the connection"));
    } catch (IOException ex) {
      fail(ex);
    }
  }

  private void enqueue(PacketEvent event) {
    while (!inbound.offer(event)) {
      if (inbound.poll() != null) {
        metrics.increment("mesh.link.queue.dropped");
      }
    }
  }

  private void fail(IOException cause) {
    if (failure == null) {
      failure = cause;
    }
    if (!closed.get()) {
      log.debug("Reader for {} stopped: {}", address, cause.getMessage());
    }
  }

  private void checkFailed() throws IOException {
    IOException current = failure;
    if (current != null && inbound.isEmpty()) {
      throw new IOException(current.getMessage(), current);
    }
  }
}
