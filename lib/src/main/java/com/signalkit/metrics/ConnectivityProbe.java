package com.signalkit.metrics;

import com.signalkit.internal.PriorityThreadFactory;
import com.signalkit.internal.encoding.ValueRenderer;
import com.signalkit.log.LevelLogger;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically pings the backend on a daemon thread. Failures are logged at WARN and the schedule
 * carries on; success is silent. The first check runs as soon as the probe starts.
 */
public class ConnectivityProbe {
  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
  static final String DURING = "influxdb.ping";

  private static final int EXECUTOR_CORE_POOL_SIZE = 1;

  private final MetricsBackend backend;
  private final LevelLogger logger;
  private final Clock clock;
  private final Duration interval;
  private final AtomicReference<ConnectivityState> state;

  private final ScheduledThreadPoolExecutor scheduler;
  private Optional<ScheduledFuture<?>> scheduledChecks;

  public ConnectivityProbe(MetricsBackend backend, LevelLogger logger, Duration interval, Clock clock) {
    this.backend = backend;
    this.logger = logger;
    this.interval = interval;
    this.clock = clock;
    this.state = new AtomicReference<>(ConnectivityState.unknown());

    this.scheduler =
        new ScheduledThreadPoolExecutor(
            EXECUTOR_CORE_POOL_SIZE, new PriorityThreadFactory(Thread.MIN_PRIORITY, "signalkit-probe"));
    this.scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    this.scheduledChecks = Optional.empty();
  }

  /** Starts checking. Calling it again, or after {@link #stop()}, does nothing. */
  public synchronized void start() {
    if (scheduledChecks.isPresent() || scheduler.isShutdown()) {
      return;
    }
    scheduledChecks =
        Optional.of(
            scheduler.scheduleWithFixedDelay(
                this::check, 0, interval.toMillis(), TimeUnit.MILLISECONDS));
  }

  /** Cancels the schedule and interrupts a check in flight. Idempotent. */
  public synchronized void stop() {
    scheduledChecks.ifPresent(future -> future.cancel(true));
    scheduler.shutdownNow();
  }

  public boolean isStopped() {
    return scheduler.isShutdown();
  }

  public ConnectivityState state() {
    return state.get();
  }

  void check() {
    try {
      backend.ping();
      state.updateAndGet(current -> current.reachable(clock.instant()));
    } catch (BackendException exception) {
      reportFailure(exception);
    } catch (InterruptedException exception) {
      // Only stop() interrupts a check.
      Thread.currentThread().interrupt();
    } catch (RuntimeException exception) {
      // A periodic task that throws is never rescheduled.
      reportFailure(exception);
    }
  }

  private void reportFailure(Exception exception) {
    final String message = ValueRenderer.errorMessage(exception);
    state.updateAndGet(current -> current.unreachable(clock.instant(), message));
    logger
        .warn()
        .log(
            "err", exception,
            "during", DURING,
            LevelLogger.MSG_KEY, String.format("couldn't ping influxdb: %s", message));
  }
}
