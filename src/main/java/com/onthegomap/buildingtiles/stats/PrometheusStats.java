package com.onthegomap.buildingtiles.stats;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import io.prometheus.client.hotspot.DefaultExports;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link Stats} implementation that keeps metrics in a <a href="https://prometheus.io/">prometheus</a> registry so
 * they can be scraped from the running server.
 */
class PrometheusStats implements Stats {

  private static final String BASE = "buildingtiles_";
  private static final double NANOSECONDS_PER_SECOND = 1_000_000_000d;

  private final CollectorRegistry registry = new CollectorRegistry();
  private final Map<String, Long> dataErrorCounters = new ConcurrentHashMap<>();

  PrometheusStats() {
    DefaultExports.register(registry);
  }

  private final Counter tilesServed = Counter
    .build(BASE + "tiles_served", "Number of tiles served by zoom level")
    .labelNames("zoom")
    .register(registry);

  private final Histogram tileBytes = Histogram
    .build(BASE + "tile_bytes", "Encoded tile sizes by zoom level")
    .buckets(1_000, 10_000, 100_000, 500_000)
    .labelNames("zoom")
    .register(registry);

  private final Histogram tileLatency = Histogram
    .build(BASE + "tile_latency_seconds", "Time spent computing a tile")
    .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1, 5)
    .register(registry);

  @Override
  public void servedTile(int zoom, int bytes, Duration elapsed) {
    String label = Integer.toString(zoom);
    tilesServed.labels(label).inc();
    tileBytes.labels(label).observe(bytes);
    tileLatency.observe(elapsed.toNanos() / NANOSECONDS_PER_SECOND);
  }

  private final Counter storeErrors = Counter
    .build(BASE + "store_errors", "Number of failed queries against the building store")
    .labelNames("operation")
    .register(registry);

  @Override
  public void storeError(String operation) {
    storeErrors.labels(operation).inc();
  }

  private final Counter dataErrors = Counter
    .build(BASE + "bad_input_data", "Number of building geometries dropped while encoding tiles")
    .labelNames("type")
    .register(registry);

  @Override
  public void dataError(String errorCode) {
    Stats.super.dataError(errorCode);
    dataErrors.labels(errorCode).inc();
  }

  @Override
  public Map<String, Long> dataErrors() {
    return dataErrorCounters;
  }

  private final Counter viewUpdates = Counter
    .build(BASE + "view_updates", "Number of times a client replaced the current viewport")
    .register(registry);

  @Override
  public void viewUpdated() {
    viewUpdates.inc();
  }

  private final Counter viewStatsRecomputations = Counter
    .build(BASE + "view_stats_recomputed", "Number of times view statistics were recomputed from the store")
    .register(registry);

  @Override
  public void viewStatsRecomputed() {
    viewStatsRecomputations.inc();
  }

  @Override
  public String metricsText() {
    try (StringWriter writer = new StringWriter()) {
      TextFormat.write004(writer, registry.metricFamilySamples());
      return writer.toString();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void close() {
    registry.clear();
  }
}
