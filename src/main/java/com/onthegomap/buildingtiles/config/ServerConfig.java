package com.onthegomap.buildingtiles.config;

import com.onthegomap.buildingtiles.geo.TileCoord;
import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Holds the configuration for the building tile server.
 * <p>
 * Build it from {@link Arguments} with {@link #from(Arguments)}, values are validated when the record is created.
 */
public record ServerConfig(
  Path db,
  String table,
  String layerName,
  String host,
  int port,
  int threads,
  int minZoom,
  int maxZoom,
  int tileBuffer,
  int cacheMaxAge,
  Duration queryTimeout,
  int positionPrecision,
  int zoomPrecision,
  Duration statsPollInterval,
  MapDefaults map,
  String publicUrl
) {

  private static final Pattern COLOR = Pattern.compile("#[0-9a-fA-F]{3,8}");

  public ServerConfig {
    if (db == null) {
      throw new IllegalArgumentException("db is required");
    }
    if (port < 0 || port > 65_535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be at least 1, got " + threads);
    }
    if (minZoom < 0 || maxZoom > TileCoord.MAX_ZOOM || minZoom > maxZoom) {
      throw new IllegalArgumentException(
        "Invalid zoom range: min_zoom=" + minZoom + " max_zoom=" + maxZoom + ", must be within [0, " +
          TileCoord.MAX_ZOOM + "]");
    }
    if (tileBuffer < 0 || tileBuffer > 4096) {
      throw new IllegalArgumentException("tile_buffer must be between 0 and 4096, got " + tileBuffer);
    }
    if (cacheMaxAge < 0) {
      throw new IllegalArgumentException("cache_max_age can not be negative, got " + cacheMaxAge);
    }
    if (queryTimeout.isNegative() || queryTimeout.isZero()) {
      throw new IllegalArgumentException("query_timeout must be positive, got " + queryTimeout);
    }
    if (positionPrecision < 0 || positionPrecision > 12 || zoomPrecision < 0 || zoomPrecision > 6) {
      throw new IllegalArgumentException(
        "Invalid precision: position_precision=" + positionPrecision + " zoom_precision=" + zoomPrecision);
    }
    if (statsPollInterval.isNegative()) {
      throw new IllegalArgumentException("stats_poll_interval can not be negative, got " + statsPollInterval);
    }
    if (publicUrl != null) {
      publicUrl = publicUrl.replaceAll("/+$", "");
    }
  }

  /** Returns the configuration parsed from {@code arguments}, using defaults for anything that is missing. */
  public static ServerConfig from(Arguments arguments) {
    int minZoom = arguments.getInteger("min_zoom", "lowest zoom level that returns buildings", 10);
    return new ServerConfig(
      arguments.file("db", "path to the sqlite building database", Path.of("data", "buildings.sqlite")),
      arguments.getString("table", "name of the building table", "buildings"),
      arguments.getString("layer_name", "name of the vector tile layer", "buildings"),
      arguments.getString("host", "address to bind to", "127.0.0.1"),
      arguments.getInteger("port", "port to listen on", 8080),
      arguments.threads(),
      minZoom,
      arguments.getInteger("max_zoom", "highest zoom level advertised in tilejson", 16),
      arguments.getInteger("tile_buffer", "extra area around each tile to include, in units of the 4096 extent", 256),
      arguments.getInteger("cache_max_age", "seconds clients may cache a tile", 3600),
      arguments.getDuration("query_timeout", "timeout for a single store query", "5s"),
      arguments.getInteger("position_precision", "decimals of the view bounds that identify a view", 4),
      arguments.getInteger("zoom_precision", "decimals of the view zoom that identify a view", 1),
      arguments.getDuration("stats_poll_interval", "how often to recompute view stats in the background, 0 to disable",
        "0s"),
      new MapDefaults(
        arguments.getDouble("map_center_lng", "initial map longitude", 5.12),
        arguments.getDouble("map_center_lat", "initial map latitude", 52.09),
        arguments.getDouble("map_zoom", "initial map zoom", 15),
        minZoom,
        arguments.getString("map_color", "building fill color", "#3388ff"),
        arguments.getDouble("map_opacity", "building fill opacity", 0.6)
      ),
      arguments.getString("public_url", "base URL clients use to reach this server, defaults to the request host", null)
    );
  }

  /**
   * Settings of the bundled map page that clients can override with query parameters.
   *
   * @param lng     initial longitude
   * @param lat     initial latitude
   * @param zoom    initial zoom
   * @param minZoom lowest zoom the building layer shows at
   * @param color   building fill color as a {@code #rrggbb} hex string
   * @param opacity building fill opacity between 0 and 1
   */
  public record MapDefaults(double lng, double lat, double zoom, int minZoom, String color, double opacity) {

    public MapDefaults {
      if (!COLOR.matcher(color).matches()) {
        throw new IllegalArgumentException("Invalid color: " + color);
      }
      if (opacity < 0 || opacity > 1) {
        throw new IllegalArgumentException("opacity must be between 0 and 1, got " + opacity);
      }
    }
  }
}
