package com.onthegomap.buildingtiles.util.log4j;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ElapsedTimeLookupPluginTest {

  @ParameterizedTest
  @CsvSource({
    "0, 0:00:00",
    "59, 0:00:59",
    "61, 0:01:01",
    "3600, 1:00:00",
    "90061, 25:01:01",
  })
  void testFormat(long seconds, String expected) {
    assertEquals(expected, ElapsedTimeLookupPlugin.format(Duration.ofSeconds(seconds)));
  }

  @Test
  void testLookup() {
    assertTrue(new ElapsedTimeLookupPlugin().lookup("now").matches("\\d+:\\d{2}:\\d{2}"));
  }

  @Test
  void testLookupMillis() {
    assertTrue(Long.parseLong(new ElapsedTimeLookupPlugin().lookup("millis")) >= 0);
  }
}
