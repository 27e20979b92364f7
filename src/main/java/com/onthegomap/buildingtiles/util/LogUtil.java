package com.onthegomap.buildingtiles.util;

import org.slf4j.MDC;

/**
 * Tags log lines from the current thread with the part of the server that wrote them, for example
 * {@code [startup] Using R*Tree index buildings_rtree}.
 * <p>
 * The tag lives in the SLF4j {@link MDC} under {@code stage}, which the log pattern prints with {@code %X{stage}}.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Restores the previous stage of a thread when closed. */
  @FunctionalInterface
  public interface StageScope extends AutoCloseable {

    @Override
    void close();
  }

  /**
   * Prefixes logs from this thread with {@code [stage]} until the returned scope is closed, when the stage that was
   * active before comes back.
   */
  public static StageScope stage(String stage) {
    String previous = MDC.get(STAGE_KEY);
    MDC.put(STAGE_KEY, "[" + stage + "] ");
    return () -> {
      if (previous == null) {
        MDC.remove(STAGE_KEY);
      } else {
        MDC.put(STAGE_KEY, previous);
      }
    };
  }

  /** Returns the stage logs from this thread are tagged with, or {@code null} outside of any stage. */
  public static String currentStage() {
    String value = MDC.get(STAGE_KEY);
    // strip the "[stage] " wrapper
    return value == null ? null : value.substring(1, value.length() - 2);
  }
}
