package ca.gc.cra.meshgate.domain.mesh;

/**
 * Telemetry section of a decoded packet. Either metrics section may be absent.
 *
 * @param time reading time in epoch seconds as reported by the sender
 * @param deviceMetrics device section or {@code null}
 * @param environmentMetrics environment section or {@code null}
 * @since 0.1.0
 */
public record Telemetry(long time, DeviceMetrics deviceMetrics, EnvironmentMetrics environmentMetrics) {

  /**
   * Indicates whether the packet carried a device metrics section.
   *
   * @return {@code true} when {@link #deviceMetrics()} is present
   */
  public boolean hasDeviceMetrics() {
    return deviceMetrics != null;
  }

  /**
   * Indicates whether the packet carried an environment metrics section.
   *
   * @return {@code true} when {@link #environmentMetrics()} is present
   */
  public boolean hasEnvironmentMetrics() {
    return environmentMetrics != null;
  }
}
