package com.onthegomap.buildingtiles.view;

import com.onthegomap.buildingtiles.stats.Stats;
import com.onthegomap.buildingtiles.store.BuildingStore;
import com.onthegomap.buildingtiles.store.StoreException;
import com.onthegomap.buildingtiles.store.ViewStats;
import com.onthegomap.buildingtiles.util.LogUtil;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports the building count and area of the region in a {@link ViewStateRegister}, recomputing them from the store
 * only when the rounded view changes.
 * <p>
 * Recomputation happens under a lock so concurrent pollers never scan the store twice for the same view. A failed
 * query reports empty stats and is retried on the next poll.
 */
@ThreadSafe
public class ViewStatsTracker implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ViewStatsTracker.class);

  private final ViewStateRegister register;
  private final BuildingStore store;
  private final int positionPrecision;
  private final int zoomPrecision;
  private final Stats stats;
  private ScheduledExecutorService executor = null;

  @GuardedBy("this")
  private boolean computed = false;
  @GuardedBy("this")
  private ViewKey lastKey = null;
  @GuardedBy("this")
  private Result last = new Result(null, ViewStats.EMPTY);

  /** Stats for a view, where {@code view} is {@code null} if no client has reported one yet. */
  public record Result(Viewport view, ViewStats stats) {}

  public ViewStatsTracker(ViewStateRegister register, BuildingStore store, int positionPrecision, int zoomPrecision,
    Stats stats) {
    this.register = register;
    this.store = store;
    this.positionPrecision = positionPrecision;
    this.zoomPrecision = zoomPrecision;
    this.stats = stats;
  }

  /** Returns the stats for the current view, reusing the previous result if the rounded view did not change. */
  public synchronized Result poll() {
    Optional<Viewport> view = register.getView();
    ViewKey key = view.map(v -> ViewKey.of(v, positionPrecision, zoomPrecision)).orElse(null);
    if (computed && Objects.equals(key, lastKey)) {
      return last;
    }
    if (view.isEmpty()) {
      computed = true;
      lastKey = null;
      last = new Result(null, ViewStats.EMPTY);
      return last;
    }
    Viewport viewport = view.get();
    try {
      ViewStats result = store.handle().aggregateInBBox(viewport.lonLatBounds());
      stats.viewStatsRecomputed();
      computed = true;
      lastKey = key;
      last = new Result(viewport, result);
      LOGGER.debug("View {} has {} buildings covering {} m2", viewport, result.count(), Math.round(result.area()));
      return last;
    } catch (StoreException e) {
      stats.storeError("view_stats");
      LOGGER.warn("Error computing stats for {}: {}", viewport, e.toString());
      return new Result(viewport, ViewStats.EMPTY);
    }
  }

  /** Starts polling the register every {@code interval} on a background daemon thread. */
  public synchronized ViewStatsTracker startPolling(Duration interval) {
    if (executor != null) {
      throw new IllegalStateException("Already polling");
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r);
      thread.setDaemon(true);
      thread.setName("view-stats-poller");
      return thread;
    });
    executor.scheduleWithFixedDelay(this::pollAndLog, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    LOGGER.info("Polling view stats every {}", interval);
    return this;
  }

  /** Polls once and logs the new stats if they were recomputed for a different view. Returns true if it logged. */
  boolean pollAndLog() {
    ViewKey before;
    synchronized (this) {
      before = lastKey;
    }
    try (var ignored = LogUtil.stage("view-stats")) {
      Result after = poll();
      ViewKey afterKey;
      synchronized (this) {
        afterKey = lastKey;
      }
      if (afterKey != null && !afterKey.equals(before)) {
        LOGGER.info("View changed: {} buildings, {} m2", after.stats().count(), Math.round(after.stats().area()));
        return true;
      }
    } catch (RuntimeException e) {
      // an exception would cancel future runs of the scheduled task
      LOGGER.error("Error polling view stats", e);
    }
    return false;
  }

  @Override
  public synchronized void close() {
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }
}
