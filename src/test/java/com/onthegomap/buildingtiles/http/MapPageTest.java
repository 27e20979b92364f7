package com.onthegomap.buildingtiles.http;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.buildingtiles.config.ServerConfig;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MapPageTest {

  private final MapPage page = new MapPage(
    new ServerConfig.MapDefaults(5.12, 52.09, 15, 13, "#3388ff", 0.6), 16, "buildings");

  private String render(Map<String, String> params) {
    return page.render(params::get);
  }

  @Test
  void testDefaults() {
    String html = render(Map.of());
    assertTrue(html.contains("center: [5.12, 52.09]"), html);
    assertTrue(html.contains("zoom: 15\n"), html);
    assertTrue(html.contains("const MIN_ZOOM = 13;"), html);
    assertTrue(html.contains("maxzoom: 16"), html);
    assertTrue(html.contains("'fill-color': '#3388ff', 'fill-opacity': 0.6"), html);
    assertTrue(html.contains("const LAYER = 'buildings';"), html);
    assertFalse(html.contains("${"), html);
  }

  @Test
  void testQueryParametersOverrideDefaults() {
    String html = render(Map.of(
      "lng", "4.9",
      "lat", "52.37",
      "zoom", "17.5",
      "minzoom", "12",
      "color", "#ff0000",
      "opacity", "1"
    ));
    assertTrue(html.contains("center: [4.9, 52.37]"), html);
    assertTrue(html.contains("zoom: 17.5"), html);
    assertTrue(html.contains("const MIN_ZOOM = 12;"), html);
    assertTrue(html.contains("'fill-color': '#ff0000', 'fill-opacity': 1}"), html);
  }

  @ParameterizedTest
  @CsvSource({
    "lng, 181",
    "lng, abc",
    "lat, -91",
    "zoom, 1e9",
    "opacity, 2",
    "color, red",
    "color, '#fff;alert(1)'",
  })
  void testInvalidParametersFallBackToDefaults(String key, String value) {
    assertEquals(render(Map.of()), render(Map.of(key, value)));
  }

  @Test
  void testLayerNameIsSanitized() {
    String html = new MapPage(new ServerConfig.MapDefaults(0, 0, 1, 0, "#000", 1), 16, "b'); alert(1);//")
      .render(key -> null);
    assertTrue(html.contains("const LAYER = 'balert1';"), html);
  }
}
