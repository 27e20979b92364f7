package com.onthegomap.buildingtiles.view;

/**
 * A {@link Viewport} rounded to a fixed number of decimals so that tiny floating point differences between two map
 * positions do not count as a new view.
 * <p>
 * Values are stored scaled to integers, a missing zoom is treated as zoom 0.
 */
record ViewKey(long north, long south, long east, long west, long zoom) {

  static ViewKey of(Viewport view, int positionPrecision, int zoomPrecision) {
    return new ViewKey(
      round(view.north(), positionPrecision),
      round(view.south(), positionPrecision),
      round(view.east(), positionPrecision),
      round(view.west(), positionPrecision),
      round(view.zoom() == null ? 0 : view.zoom(), zoomPrecision)
    );
  }

  private static long round(double value, int decimals) {
    return Math.round(value * Math.pow(10, decimals));
  }
}
