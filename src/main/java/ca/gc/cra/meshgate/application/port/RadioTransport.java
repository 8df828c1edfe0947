package ca.gc.cra.meshgate.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port that opens links to a mesh radio gateway.
 * <p><strong>Why:</strong> Keeps the connection manager agnostic of the gateway's wire protocol.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code TcpRadioTransport}.</p>
 * <p><strong>Thread-safety:</strong> Called only from the connection thread.</p>
 * <p><strong>Observability:</strong> Failures surface as exceptions; the caller logs and counts them.</p>
 *
 * @since 0.1.0
 */
public interface RadioTransport {
  /**
   * Opens a link to the gateway at {@code address} and completes any handshake needed to learn the
   * local node number.
   *
   * @param address gateway address understood by the adapter (for example {@code host:port})
   * @return an open link owned by the caller
   * @throws IOException if the gateway is unreachable or the handshake fails
   * @throws InterruptedException if the calling thread is interrupted while connecting
   *
   * <p><strong>Performance:</strong> Blocks for at most the adapter's connect and handshake timeouts.</p>
   */
  RadioLink connect(String address) throws IOException, InterruptedException;
}
