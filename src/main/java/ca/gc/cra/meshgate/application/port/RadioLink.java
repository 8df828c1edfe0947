package ca.gc.cra.meshgate.application.port;

import ca.gc.cra.meshgate.domain.mesh.PacketEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * <strong>What:</strong> One open connection to the radio gateway.
 * <p><strong>Why:</strong> Exposes the gateway's push stream as bounded polls so the owner controls pacing and
 * shutdown.</p>
 * <p><strong>Role:</strong> Application port produced by {@link RadioTransport}; owned exclusively by the
 * connection manager.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report the gateway's own node number.</li>
 *   <li>Deliver decoded packets in arrival order.</li>
 *   <li>Send text to a single node or broadcast.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #poll(Duration)} is called from a single thread;
 * {@link #sendText(String, String)} may run concurrently with polling and with other sends.</p>
 *
 * @implNote Owners must always {@link #close()} the link, including after a poll failure.
 * @since 0.1.0
 */
public interface RadioLink extends AutoCloseable {
  /**
   * Returns the gateway's own node number, learned while connecting.
   *
   * @return local node number
   */
  long localNodeNum();

  /**
   * Waits up to {@code timeout} for the next decoded packet.
   *
   * @param timeout maximum time to block
   * @return the next packet, or empty when none arrived in time
   * @throws IOException if the link failed; the link is unusable afterwards
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  Optional<PacketEvent> poll(Duration timeout) throws IOException, InterruptedException;

  /**
   * Sends a text message.
   *
   * @param text message body; never {@code null}
   * @param target destination node reference, or {@code null}/blank to broadcast
   * @throws InvalidNodeIdException if {@code target} does not name a node; nothing is sent
   * @throws IOException if the write fails
   */
  void sendText(String text, String target) throws InvalidNodeIdException, IOException;

  /**
   * Indicates whether the link is still usable.
   *
   * @return {@code false} once closed or failed
   */
  boolean isOpen();

  /**
   * Releases the underlying connection. Idempotent.
   *
   * @throws IOException if the connection cannot be released cleanly
   */
  @Override
  void close() throws IOException;
}
