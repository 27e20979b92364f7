package com.onthegomap.buildingtiles.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.onthegomap.buildingtiles.TileService;
import com.onthegomap.buildingtiles.geo.TileCoord;
import com.onthegomap.buildingtiles.stats.Stats;
import com.onthegomap.buildingtiles.store.ViewStats;
import com.onthegomap.buildingtiles.util.JsonUtils;
import com.onthegomap.buildingtiles.view.ViewStatsTracker;
import com.onthegomap.buildingtiles.view.Viewport;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end of the building tile server.
 * <p>
 * Routes:
 * <ul>
 * <li>{@code GET /tiles/{z}/{x}/{y}.pbf} building vector tile</li>
 * <li>{@code GET /health} liveness check</li>
 * <li>{@code POST /update-view} and {@code GET /get-bounds} write and read the current view</li>
 * <li>{@code GET /stats} building count and area of the current view</li>
 * <li>{@code GET /tiles.json} TileJSON describing the tile endpoint</li>
 * <li>{@code GET /} MapLibre page showing the tiles</li>
 * <li>{@code GET /metrics} prometheus metrics</li>
 * </ul>
 * Every response allows cross-origin requests.
 */
public class TileServer implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileServer.class);

  static final String MVT_CONTENT_TYPE = "application/vnd.mapbox-vector-tile";
  static final String EMPTY_TILE_CONTENT_TYPE = "application/x-protobuf";
  static final String JSON_CONTENT_TYPE = "application/json";

  private final TileService service;
  private final Stats stats;
  private final MapPage mapPage;
  private final int cacheMaxAge;
  private final String publicUrl;
  private final Javalin app;

  public TileServer(TileService service, Stats stats, MapPage mapPage, int threads, int cacheMaxAge,
    String publicUrl) {
    this.service = service;
    this.stats = stats;
    this.mapPage = mapPage;
    this.cacheMaxAge = cacheMaxAge;
    this.publicUrl = publicUrl;
    this.app = Javalin.create(config -> {
      config.showJavalinBanner = false;
      // jetty leases its acceptor and selector threads from the same pool
      int reserved = Runtime.getRuntime().availableProcessors() + 8;
      QueuedThreadPool pool = new QueuedThreadPool(threads + reserved, Math.min(threads, 8));
      pool.setName("tile-worker");
      config.jetty.threadPool = pool;
    });
    app.before(this::addCorsHeaders);
    app.options("/*", ctx -> ctx.status(204));
    app.get("/tiles/{z}/{x}/{y}", this::handleTile);
    app.get("/health", ctx -> ctx.contentType("text/plain").result("OK"));
    app.post("/update-view", this::handleUpdateView);
    app.get("/get-bounds", this::handleGetBounds);
    app.get("/stats", this::handleStats);
    app.get("/tiles.json", this::handleTileJson);
    app.get("/", ctx -> ctx.contentType("text/html; charset=utf-8").result(mapPage.render(ctx::queryParam)));
    app.get("/metrics", ctx -> ctx.contentType("text/plain; version=0.0.4; charset=utf-8").result(stats.metricsText()));
    app.exception(Exception.class, (e, ctx) -> {
      LOGGER.error("Error handling {} {}", ctx.method(), ctx.path(), e);
      json(ctx.status(500), Map.of("status", "error", "message", "Internal server error"));
    });
  }

  /** Starts listening on {@code host:port}, where port 0 picks a free port. */
  public TileServer start(String host, int port) {
    app.start(host, port);
    LOGGER.info("Serving building tiles on http://{}:{}/", host, app.port());
    return this;
  }

  /** Returns the port the server is listening on. */
  public int port() {
    return app.port();
  }

  @Override
  public void close() {
    app.stop();
  }

  private void addCorsHeaders(Context ctx) {
    ctx.header("Access-Control-Allow-Origin", "*");
    if (ctx.method() == HandlerType.OPTIONS) {
      ctx.header("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
      ctx.header("Access-Control-Allow-Headers", "Content-Type");
      ctx.header("Access-Control-Max-Age", "86400");
    }
  }

  /**
   * Returns the tile coordinate from the path, where the last segment may end in {@code .pbf}.
   *
   * @throws IllegalArgumentException if a segment is not an integer or the tile is outside the grid
   */
  static TileCoord parseTile(String z, String x, String y) {
    String yValue = y.endsWith(".pbf") ? y.substring(0, y.length() - ".pbf".length()) : y;
    TileCoord coord;
    try {
      coord = TileCoord.ofXYZ(Integer.parseInt(x), Integer.parseInt(yValue), Integer.parseInt(z));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid tile coordinates", e);
    }
    if (!coord.isValid()) {
      throw new IllegalArgumentException("Tile " + coord + " is outside the tile grid");
    }
    return coord;
  }

  private void handleTile(Context ctx) {
    TileCoord coord;
    try {
      coord = parseTile(ctx.pathParam("z"), ctx.pathParam("x"), ctx.pathParam("y"));
    } catch (IllegalArgumentException e) {
      ctx.status(400).contentType("text/plain").result(e.getMessage());
      return;
    }
    TileService.TileResult tile = service.getTile(coord);
    if (tile.status() == TileService.TileStatus.RENDERED) {
      ctx.contentType(MVT_CONTENT_TYPE);
      ctx.header("Cache-Control", "public, max-age=" + cacheMaxAge);
    } else {
      ctx.contentType(EMPTY_TILE_CONTENT_TYPE);
    }
    ctx.result(tile.data());
  }

  /**
   * Returns the viewport in a {@code {"bounds": {"north", "south", "east", "west"}, "zoom"}} request body.
   *
   * @throws IllegalArgumentException with a message for the client if the body is malformed or has no bounds
   */
  static Viewport parseViewport(String body) {
    JsonNode root = JsonUtils.parse(body == null || body.isBlank() ? "{}" : body);
    JsonNode bounds = root.path("bounds");
    if (bounds.isMissingNode() || bounds.isNull() || bounds.isEmpty()) {
      throw new IllegalArgumentException("No bounds provided");
    }
    JsonNode zoom = root.path("zoom");
    double north = coordinate(bounds, "north");
    double south = coordinate(bounds, "south");
    double east = coordinate(bounds, "east");
    double west = coordinate(bounds, "west");
    // a view across the antimeridian would need two envelopes
    if (west > east) {
      throw new IllegalArgumentException("Invalid bounds: west must not be greater than east");
    }
    if (south > north) {
      throw new IllegalArgumentException("Invalid bounds: south must not be greater than north");
    }
    return new Viewport(north, south, east, west, zoom.isNumber() ? zoom.asDouble() : null);
  }

  private static double coordinate(JsonNode bounds, String name) {
    JsonNode value = bounds.path(name);
    if (!value.isNumber()) {
      throw new IllegalArgumentException("Invalid bounds: " + name + " must be a number");
    }
    return value.asDouble();
  }

  private void handleUpdateView(Context ctx) {
    Viewport view;
    try {
      view = parseViewport(ctx.body());
    } catch (IllegalArgumentException e) {
      json(ctx.status(400), Map.of("status", "error", "message", e.getMessage()));
      return;
    }
    service.updateView(view);
    json(ctx, Map.of("status", "ok"));
  }

  private void handleGetBounds(Context ctx) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("bounds", service.currentView().orElse(null));
    json(ctx, result);
  }

  private void handleStats(Context ctx) {
    ViewStatsTracker.Result current = service.viewStats();
    ViewStats viewStats = current.stats();
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("bounds", current.view());
    result.put("count", viewStats.count());
    result.put("area", viewStats.area());
    json(ctx, result);
  }

  private void handleTileJson(Context ctx) {
    String base = publicUrl != null ? publicUrl : ctx.scheme() + "://" + ctx.host();
    json(ctx, service.tileJson(base));
  }

  private static void json(Context ctx, Object value) {
    ctx.contentType(JSON_CONTENT_TYPE).result(JsonUtils.toJsonString(value));
  }
}
