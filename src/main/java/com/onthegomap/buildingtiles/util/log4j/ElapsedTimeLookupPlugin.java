package com.onthegomap.buildingtiles.util.log4j;

import java.time.Duration;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.lookup.StrLookup;

/**
 * Log4j lookup for server uptime: {@code $${uptime:now}} renders {@code H:MM:SS} and {@code $${uptime:millis}} the
 * elapsed milliseconds.
 * <p>
 * Found through {@code packages=com.onthegomap.buildingtiles.util.log4j} in {@code log4j2.properties}.
 */
@Plugin(name = "uptime", category = StrLookup.CATEGORY)
public class ElapsedTimeLookupPlugin implements StrLookup {

  // close enough to JVM start, log4j loads plugins while the first logger is created
  private static final long STARTED_NANOS = System.nanoTime();

  @Override
  public String lookup(String key) {
    Duration uptime = Duration.ofNanos(System.nanoTime() - STARTED_NANOS);
    return "millis".equals(key) ? Long.toString(uptime.toMillis()) : format(uptime);
  }

  @Override
  public String lookup(LogEvent event, String key) {
    return lookup(key);
  }

  static String format(Duration uptime) {
    long seconds = uptime.toSeconds();
    return String.format("%d:%02d:%02d", seconds / 3600, (seconds / 60) % 60, seconds % 60);
  }
}
