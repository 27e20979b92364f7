package com.onthegomap.buildingtiles.store;

import com.onthegomap.buildingtiles.geo.GeoUtils;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.locationtech.jts.geom.Envelope;

/** An in-memory {@link BuildingStore} that counts queries and can be told to fail. */
public class FakeBuildingStore implements BuildingStore, BuildingStore.Handle {

  private final List<Building> buildings = new CopyOnWriteArrayList<>();
  public final AtomicInteger queries = new AtomicInteger();
  public final AtomicInteger aggregates = new AtomicInteger();
  private volatile boolean failing = false;
  private volatile boolean closed = false;

  public FakeBuildingStore add(Building building) {
    buildings.add(building);
    return this;
  }

  /** Make every following query throw a {@link StoreException} until set back to {@code false}. */
  public FakeBuildingStore failing(boolean failing) {
    this.failing = failing;
    return this;
  }

  public boolean isClosed() {
    return closed;
  }

  private void maybeFail() {
    if (failing) {
      throw new StoreException("query failed", new SQLException("database is locked"));
    }
  }

  @Override
  public Handle handle() {
    return this;
  }

  @Override
  public List<Building> queryInBBox(Envelope lonLatBounds) {
    queries.incrementAndGet();
    maybeFail();
    return buildings.stream()
      .filter(building -> building.geometry().getEnvelopeInternal().intersects(lonLatBounds))
      .toList();
  }

  @Override
  public ViewStats aggregateInBBox(Envelope lonLatBounds) {
    aggregates.incrementAndGet();
    maybeFail();
    List<Building> matches = buildings.stream()
      .filter(building -> building.geometry().getEnvelopeInternal().intersects(lonLatBounds))
      .toList();
    double area = matches.stream().mapToDouble(building -> GeoUtils.webMercatorArea(building.geometry())).sum();
    return new ViewStats(matches.size(), area);
  }

  @Override
  public void close() {
    closed = true;
  }
}
