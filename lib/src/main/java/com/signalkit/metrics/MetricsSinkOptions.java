package com.signalkit.metrics;

import com.signalkit.internal.influx.InfluxHttpBackend;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;
import org.immutables.value.Value;

/** Tuning knobs for {@link InfluxMetricsSink}; the defaults suit production. */
@Value.Immutable
public abstract class MetricsSinkOptions {
  @Value.Default
  public Duration probeInterval() {
    return ConnectivityProbe.DEFAULT_INTERVAL;
  }

  /** How long {@link InfluxMetricsSink#close()} waits for queued writes of a serialized backend. */
  @Value.Default
  public Duration drainTimeout() {
    return Duration.ofSeconds(5);
  }

  @Value.Default
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Value.Default
  public Function<BackendConfig, MetricsBackend> backendFactory() {
    return InfluxHttpBackend::new;
  }

  @Value.Check
  protected void check() {
    if (probeInterval().isNegative() || probeInterval().isZero()) {
      throw new IllegalStateException("probeInterval must be positive, got " + probeInterval());
    }
  }

  public static MetricsSinkOptions defaults() {
    return ImmutableMetricsSinkOptions.builder().build();
  }

  public static ImmutableMetricsSinkOptions.Builder builder() {
    return ImmutableMetricsSinkOptions.builder();
  }
}
