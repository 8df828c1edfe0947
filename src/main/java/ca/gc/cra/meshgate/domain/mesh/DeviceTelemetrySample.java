package ca.gc.cra.meshgate.domain.mesh;

import java.util.Objects;

/**
 * Latest device telemetry retained for a node.
 *
 * @param nodeNum reporting node
 * @param time reading time in epoch seconds
 * @param deviceMetrics device readings; never {@code null}
 * @since 0.1.0
 */
public record DeviceTelemetrySample(long nodeNum, long time, DeviceMetrics deviceMetrics) {
  public DeviceTelemetrySample {
    Objects.requireNonNull(deviceMetrics, "deviceMetrics");
  }
}
