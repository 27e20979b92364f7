package com.onthegomap.buildingtiles.stats;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A utility that collects statistics about tiles served, view updates and failures, beyond what logs can convey.
 * <p>
 * {@link #inMemory()} only counts data errors and is meant for tests and embedded use, {@link #prometheus()} keeps a
 * <a href="https://prometheus.io/">prometheus</a> registry that the server exposes at {@code /metrics}.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that only keeps data error counts in-memory. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Returns a new stat collector backed by a prometheus registry that also exports JVM metrics. */
  static Stats prometheus() {
    return new PrometheusStats();
  }

  /** Records that a tile at {@code zoom} with an encoded size of {@code bytes} was served in {@code elapsed}. */
  void servedTile(int zoom, int bytes, Duration elapsed);

  /** Records that a query against the building store failed during {@code operation}. */
  default void storeError(String operation) {
    dataError("store_" + operation);
  }

  /**
   * Records that an invalid input feature was discarded where {@code errorCode} can be used to identify the kind of
   * failure.
   */
  default void dataError(String errorCode) {
    if (errorCode != null) {
      dataErrors().merge(errorCode, 1L, Long::sum);
    }
  }

  /** Returns the number of data errors recorded for each error code. */
  Map<String, Long> dataErrors();

  /** Records that a client replaced the current viewport. */
  void viewUpdated();

  /** Records that view statistics were recomputed from the store instead of served from the memo. */
  void viewStatsRecomputed();

  /** Returns all metrics in the prometheus text exposition format, or an empty string if they are not kept. */
  default String metricsText() {
    return "";
  }

  @Override
  void close();

  /** A stat collector that only keeps data error counts. */
  class InMemory implements Stats {

    private final Map<String, Long> dataErrors = new ConcurrentHashMap<>();

    /** use {@link #inMemory()} */
    private InMemory() {}

    @Override
    public void servedTile(int zoom, int bytes, Duration elapsed) {}

    @Override
    public Map<String, Long> dataErrors() {
      return dataErrors;
    }

    @Override
    public void viewUpdated() {}

    @Override
    public void viewStatsRecomputed() {}

    @Override
    public void close() {}
  }
}
