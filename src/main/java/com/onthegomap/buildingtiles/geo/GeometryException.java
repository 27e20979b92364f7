package com.onthegomap.buildingtiles.geo;

import com.onthegomap.buildingtiles.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thrown when a single building geometry can not be clipped or encoded. The building is left out of the tile and the
 * rest of the tile is still served.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;

  /**
   * @param stat    short code counted in the data error metric, like {@code snap_fix_input}
   * @param message detail to log, including enough to find the building it came from
   * @param cause   the JTS exception that triggered this one
   */
  public GeometryException(String stat, String message, Throwable cause) {
    super(message, cause);
    this.stat = stat;
  }

  public GeometryException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  public String stat() {
    return stat;
  }

  /** Counts this error as {@code <statPrefix>_<stat>} and logs it with {@code context}. */
  public void log(Stats stats, String statPrefix, String context) {
    stats.dataError(statPrefix + "_" + stat);
    LOGGER.warn("{}: {}", context, getMessage());
  }
}
