package com.onthegomap.buildingtiles;

import com.onthegomap.buildingtiles.config.Arguments;
import com.onthegomap.buildingtiles.config.ServerConfig;
import com.onthegomap.buildingtiles.http.MapPage;
import com.onthegomap.buildingtiles.http.TileServer;
import com.onthegomap.buildingtiles.stats.Stats;
import com.onthegomap.buildingtiles.store.BuildingStore;
import com.onthegomap.buildingtiles.store.SqliteBuildingStore;
import com.onthegomap.buildingtiles.util.LogUtil;
import com.onthegomap.buildingtiles.view.ViewStateRegister;
import com.onthegomap.buildingtiles.view.ViewStatsTracker;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entrypoint that serves building vector tiles from a SQLite building database.
 * <p>
 * Arguments come from the command line ({@code db=buildings.sqlite port=8080}), JVM properties prefixed with
 * {@code buildingtiles.}, environmental variables prefixed with {@code BUILDINGTILES_}, or a properties file passed as
 * {@code config}.
 */
public class BuildingTilesMain implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(BuildingTilesMain.class);

  private final Stats stats;
  private final BuildingStore store;
  private final ViewStatsTracker statsTracker;
  private final TileServer server;

  private BuildingTilesMain(ServerConfig config, Stats stats, BuildingStore store) {
    this.stats = stats;
    this.store = store;
    ViewStateRegister register = new ViewStateRegister();
    this.statsTracker = new ViewStatsTracker(register, store, config.positionPrecision(), config.zoomPrecision(),
      stats);
    TileService service = new TileService(store, register, statsTracker, stats, config.layerName(), config.minZoom(),
      config.maxZoom(), config.tileBuffer());
    MapPage mapPage = new MapPage(config.map(), config.maxZoom(), config.layerName());
    this.server = new TileServer(service, stats, mapPage, config.threads(), config.cacheMaxAge(), config.publicUrl());
  }

  /**
   * Opens the building database, starts the HTTP server and returns a handle to stop it.
   *
   * @throws IllegalArgumentException if the database or building table is missing
   */
  public static BuildingTilesMain start(ServerConfig config, Stats stats) {
    try (var ignored = LogUtil.stage("startup")) {
      LOGGER.info("Starting with {}", config);
      BuildingStore store = SqliteBuildingStore.open(config.db(), config.table(), config.queryTimeout(), stats);
      BuildingTilesMain main;
      try {
        main = new BuildingTilesMain(config, stats, store);
        main.server.start(config.host(), config.port());
      } catch (RuntimeException e) {
        store.close();
        throw e;
      }
      if (!config.statsPollInterval().isZero()) {
        main.statsTracker.startPolling(config.statsPollInterval());
      }
      return main;
    }
  }

  public int port() {
    return server.port();
  }

  @Override
  public void close() {
    server.close();
    statsTracker.close();
    store.close();
    stats.close();
  }

  public static void main(String[] args) throws InterruptedException {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    ServerConfig config = ServerConfig.from(arguments);
    Stats stats = arguments.getStats();
    BuildingTilesMain main = start(config, stats);
    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try (var ignored = LogUtil.stage("shutdown")) {
        LOGGER.info("Shutting down");
        main.close();
      } finally {
        stopped.countDown();
      }
    }, "shutdown"));
    stopped.await();
  }
}
