package ca.gc.cra.meshgate.application.store;

import ca.gc.cra.meshgate.domain.mesh.DeviceMetrics;
import ca.gc.cra.meshgate.domain.mesh.DeviceTelemetrySample;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentMetrics;
import ca.gc.cra.meshgate.domain.mesh.EnvironmentTelemetrySample;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Latest-value caches for device and environment telemetry, keyed by node.
 * <p><strong>Role:</strong> Written by the event dispatcher on the connection thread; read by request threads.</p>
 * <p><strong>Thread-safety:</strong> The two kinds are independent maps; each upsert is a single atomic put.</p>
 * <p><strong>Performance:</strong> No eviction; cardinality is bounded by the number of distinct nodes.</p>
 *
 * @since 0.1.0
 */
public final class TelemetryStore {
  private final ConcurrentMap<Long, DeviceTelemetrySample> device = new ConcurrentHashMap<>();
  private final ConcurrentMap<Long, EnvironmentTelemetrySample> environment = new ConcurrentHashMap<>();

  /**
   * Replaces the device telemetry held for {@code nodeNum}.
   *
   * @param nodeNum reporting node
   * @param time reading time in epoch seconds
   * @param metrics device readings; must not be {@code null}
   * @return the stored sample
   */
  public DeviceTelemetrySample upsertDevice(long nodeNum, long time, DeviceMetrics metrics) {
    DeviceTelemetrySample sample = new DeviceTelemetrySample(nodeNum, time, Objects.requireNonNull(metrics, "metrics"));
    device.put(nodeNum, sample);
    return sample;
  }

  /**
   * Replaces the environment telemetry held for {@code nodeNum}.
   *
   * @param nodeNum reporting node
   * @param time reading time in epoch seconds
   * @param metrics environment readings; must not be {@code null}
   * @return the stored sample
   */
  public EnvironmentTelemetrySample upsertEnvironment(long nodeNum, long time, EnvironmentMetrics metrics) {
    EnvironmentTelemetrySample sample =
        new EnvironmentTelemetrySample(nodeNum, time, Objects.requireNonNull(metrics, "metrics"));
    environment.put(nodeNum, sample);
    return sample;
  }

  /**
   * Copies the device telemetry cache.
   *
   * @return unmodifiable map ordered by node number
   */
  public Map<Long, DeviceTelemetrySample> snapshotDevice() {
    return Collections.unmodifiableMap(new TreeMap<>(device));
  }

  /**
   * Copies the environment telemetry cache.
   *
   * @return unmodifiable map ordered by node number
   */
  public Map<Long, EnvironmentTelemetrySample> snapshotEnvironment() {
    return Collections.unmodifiableMap(new TreeMap<>(environment));
  }
}
