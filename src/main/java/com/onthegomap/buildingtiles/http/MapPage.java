package com.onthegomap.buildingtiles.http;

import com.onthegomap.buildingtiles.config.ServerConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the bundled MapLibre page that displays the building tiles.
 * <p>
 * Query parameters {@code lng, lat, zoom, minzoom, color, opacity} override the configured defaults. Values that do
 * not parse fall back to the default so nothing from the request reaches the page unchecked.
 */
public class MapPage {

  private static final Pattern COLOR = Pattern.compile("#[0-9a-fA-F]{3,8}");
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-z]+)}");

  private final String template;
  private final ServerConfig.MapDefaults defaults;
  private final int maxZoom;
  private final String layerName;

  public MapPage(ServerConfig.MapDefaults defaults, int maxZoom, String layerName) {
    this.template = loadTemplate();
    this.defaults = defaults;
    this.maxZoom = maxZoom;
    this.layerName = layerName;
  }

  private static String loadTemplate() {
    try (InputStream is = MapPage.class.getResourceAsStream("map.html")) {
      if (is == null) {
        throw new IllegalStateException("map.html not found on classpath");
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Returns the page HTML where {@code params} looks up a query parameter by name, returning null if absent. */
  public String render(UnaryOperator<String> params) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("lng", number(params.apply("lng"), defaults.lng(), -180, 180));
    values.put("lat", number(params.apply("lat"), defaults.lat(), -90, 90));
    values.put("zoom", number(params.apply("zoom"), defaults.zoom(), 0, 24));
    values.put("minzoom", number(params.apply("minzoom"), defaults.minZoom(), 0, 24));
    values.put("maxzoom", Integer.toString(maxZoom));
    values.put("opacity", number(params.apply("opacity"), defaults.opacity(), 0, 1));
    String color = params.apply("color");
    values.put("color", color != null && COLOR.matcher(color).matches() ? color : defaults.color());
    values.put("layer", layerName.replaceAll("[^A-Za-z0-9_-]", ""));
    return PLACEHOLDER.matcher(template).replaceAll(match -> {
      String value = values.get(match.group(1));
      return Matcher.quoteReplacement(value == null ? match.group() : value);
    });
  }

  private static String number(String raw, double defaultValue, double min, double max) {
    double value = defaultValue;
    if (raw != null) {
      try {
        double parsed = Double.parseDouble(raw.strip());
        if (parsed >= min && parsed <= max) {
          value = parsed;
        }
      } catch (NumberFormatException e) {
        // keep the default
        value = defaultValue;
      }
    }
    return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
  }
}
