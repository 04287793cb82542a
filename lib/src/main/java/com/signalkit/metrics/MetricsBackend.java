package com.signalkit.metrics;

/**
 * Client for a time-series backend. {@link #isConcurrencySafe()} declares whether the sink may
 * call {@link #write} from several threads at once; if not, the sink funnels writes through a
 * single writer thread.
 */
public interface MetricsBackend extends AutoCloseable {
  /** Cheap round trip proving the backend is reachable. */
  void ping() throws BackendException, InterruptedException;

  void write(String database, MeasurementPoint point) throws BackendException, InterruptedException;

  boolean isConcurrencySafe();

  /** Releases connections and threads. Further calls fail. */
  @Override
  void close();
}
