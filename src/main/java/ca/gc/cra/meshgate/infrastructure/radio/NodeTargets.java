package ca.gc.cra.meshgate.infrastructure.radio;

import ca.gc.cra.meshgate.application.port.InvalidNodeIdException;
import java.util.regex.Pattern;

/**
 * Resolves user-supplied destination references to numeric node ids.
 * <p>Accepted forms: {@code null} or blank and {@code ^all} for broadcast, {@code !} followed by one to
 * eight hex digits, or an unsigned 32-bit decimal.</p>
 *
 * @since 0.1.0
 */
public final class NodeTargets {
  /** Node number addressing every node on the mesh. */
  public static final long BROADCAST = 0xFFFFFFFFL;
  /** Symbolic broadcast reference. */
  public static final String BROADCAST_REFERENCE = "^all";

  private static final Pattern HEX_ID = Pattern.compile("![0-9A-Fa-f]{1,8}");
  private static final Pattern DECIMAL_ID = Pattern.compile("[0-9]{1,10}");

  private NodeTargets() {
    // Utility
  }

  /**
   * Resolves a destination reference.
   *
   * @param target reference as supplied by the caller
   * @return node number, {@link #BROADCAST} for broadcast
   * @throws InvalidNodeIdException if the reference is not a recognised form
   */
  public static long resolve(String target) throws InvalidNodeIdException {
    if (target == null || target.isBlank()) {
      return BROADCAST;
    }
    String trimmed = target.trim();
    if (BROADCAST_REFERENCE.equals(trimmed)) {
      return BROADCAST;
    }
    if (HEX_ID.matcher(trimmed).matches()) {
      return Long.parseLong(trimmed.substring(1), 16);
    }
    if (DECIMAL_ID.matcher(trimmed).matches()) {
      long value = Long.parseLong(trimmed);
      if (value <= BROADCAST) {
        return value;
      }
    }
    throw new InvalidNodeIdException(target);
  }

  /**
   * Formats a node number in the {@code !hex} style used by the mesh.
   *
   * @param nodeNum node number
   * @return eight-digit lowercase hex reference
   */
  public static String format(long nodeNum) {
    return String.format("!%08x", nodeNum & BROADCAST);
  }
}
