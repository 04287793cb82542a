package com.signalkit.metrics;

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/** Outcome of the most recent reachability check. */
@Value.Immutable
public abstract class ConnectivityState {
  public enum Status {
    /** No check has completed yet. */
    UNKNOWN,
    REACHABLE,
    UNREACHABLE
  }

  public abstract Status status();

  /** Message of the last failure; empty unless {@link #status()} is UNREACHABLE. */
  public abstract Optional<String> lastError();

  public abstract Optional<Instant> checkedAt();

  /** Number of completed checks. */
  @Value.Default
  public long checks() {
    return 0;
  }

  @Value.Default
  public long consecutiveFailures() {
    return 0;
  }

  @Value.Check
  protected void check() {
    if (status() != Status.UNREACHABLE && lastError().isPresent()) {
      throw new IllegalStateException("only an unreachable state carries an error");
    }
  }

  public static ConnectivityState unknown() {
    return ImmutableConnectivityState.builder().status(Status.UNKNOWN).build();
  }

  ConnectivityState reachable(Instant at) {
    return ImmutableConnectivityState.builder()
        .status(Status.REACHABLE)
        .checkedAt(at)
        .checks(checks() + 1)
        .consecutiveFailures(0)
        .build();
  }

  ConnectivityState unreachable(Instant at, String error) {
    return ImmutableConnectivityState.builder()
        .status(Status.UNREACHABLE)
        .lastError(error)
        .checkedAt(at)
        .checks(checks() + 1)
        .consecutiveFailures(consecutiveFailures() + 1)
        .build();
  }
}
