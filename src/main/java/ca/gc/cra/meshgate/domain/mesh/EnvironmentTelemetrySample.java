package ca.gc.cra.meshgate.domain.mesh;

import java.util.Objects;

/**
 * Latest environment telemetry retained for a node.
 *
 * @param nodeNum reporting node
 * @param time reading time in epoch seconds
 * @param environmentMetrics environment readings; never {@code null}
 * @since 0.1.0
 */
public record EnvironmentTelemetrySample(long nodeNum, long time, EnvironmentMetrics environmentMetrics) {
  public EnvironmentTelemetrySample {
    Objects.requireNonNull(environmentMetrics, "environmentMetrics");
  }
}
