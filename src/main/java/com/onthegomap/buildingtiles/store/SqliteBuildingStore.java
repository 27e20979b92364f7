package com.onthegomap.buildingtiles.store;

import com.onthegomap.buildingtiles.geo.GeoUtils;
import com.onthegomap.buildingtiles.stats.Stats;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import net.jcip.annotations.NotThreadSafe;
import net.jcip.annotations.ThreadSafe;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.ProgressHandler;
import org.sqlite.SQLiteConfig;

/**
 * A {@link BuildingStore} backed by a read-only SQLite file.
 * <p>
 * The table holds one row per building with the footprint as WKB in {@code geometry} and its bounding box in
 * {@code bbox_xmin, bbox_xmax, bbox_ymin, bbox_ymax}. When a {@code <table>_rtree} R*Tree virtual table keyed by the
 * building rowid exists, queries go through it, otherwise they filter the bounding box columns directly.
 */
@ThreadSafe
public class SqliteBuildingStore implements BuildingStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteBuildingStore.class);
  private static final Pattern VALID_TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  static final List<String> REQUIRED_COLUMNS = List.of(
    "id", "geometry", "bbox_xmin", "bbox_xmax", "bbox_ymin", "bbox_ymax"
  );
  static final List<String> ATTRIBUTE_COLUMNS = List.of("name", "height", "class", "subtype", "num_floors");
  // virtual machine instructions between deadline checks
  private static final int PROGRESS_INTERVAL = 1_000;

  // load the sqlite driver
  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found");
    }
  }

  private final Path path;
  private final String table;
  private final boolean hasRtree;
  private final String querySql;
  private final String aggregateSql;
  private final Duration queryTimeout;
  private final Stats stats;
  private final WorkerConnections<SqliteHandle> connections;

  private SqliteBuildingStore(Path path, String table, boolean hasRtree, Set<String> columns, Duration queryTimeout,
    Stats stats) {
    this.path = path;
    this.table = table;
    this.hasRtree = hasRtree;
    this.stats = stats;
    this.queryTimeout = queryTimeout;
    StringBuilder select = new StringBuilder("b.id, b.geometry");
    for (String column : ATTRIBUTE_COLUMNS) {
      select.append(", ").append(columns.contains(column) ? "b." + column : "NULL").append(" AS ").append(column);
    }
    String from = hasRtree ?
      "%s b JOIN %s_rtree r ON b.rowid = r.id AND r.xmin <= ? AND r.xmax >= ? AND r.ymin <= ? AND r.ymax >= ?"
        .formatted(table, table) :
      table + " b";
    String where = "b.bbox_xmin <= ? AND b.bbox_xmax >= ? AND b.bbox_ymin <= ? AND b.bbox_ymax >= ?";
    this.querySql = "SELECT %s FROM %s WHERE %s ORDER BY b.rowid".formatted(select, from, where);
    this.aggregateSql = "SELECT b.geometry FROM %s WHERE %s".formatted(from, where);
    this.connections = new WorkerConnections<>(() -> new SqliteHandle(newReadOnlyConnection(path)));
  }

  /**
   * Opens the building table {@code table} in the SQLite file at {@code path} for reading.
   *
   * @throws IllegalArgumentException if the file does not exist or does not contain the table with the required
   *                                  columns
   */
  public static SqliteBuildingStore open(Path path, String table, Duration queryTimeout, Stats stats) {
    Objects.requireNonNull(path);
    if (!VALID_TABLE_NAME.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + table);
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Building database not found: " + path.toAbsolutePath());
    }
    Set<String> columns;
    boolean hasRtree;
    try (Connection connection = newReadOnlyConnection(path)) {
      columns = columnNames(connection, table);
      if (columns.isEmpty()) {
        throw new IllegalArgumentException("Table " + table + " not found in " + path.toAbsolutePath());
      }
      for (String required : REQUIRED_COLUMNS) {
        if (!columns.contains(required)) {
          throw new IllegalArgumentException("Table " + table + " is missing required column " + required);
        }
      }
      hasRtree = !columnNames(connection, table + "_rtree").isEmpty();
    } catch (SQLException | StoreException e) {
      throw new IllegalArgumentException("Unable to read " + path.toAbsolutePath(), e);
    }
    if (hasRtree) {
      LOGGER.info("Using R*Tree index {}_rtree of {}", table, path);
    } else {
      LOGGER.warn("No {}_rtree index in {}, tile queries will scan the bounding box columns", table, path);
    }
    return new SqliteBuildingStore(path, table, hasRtree, columns, queryTimeout, stats);
  }

  private static Set<String> columnNames(Connection connection, String table) throws SQLException {
    Set<String> result = new HashSet<>();
    try (
      var statement = connection.createStatement();
      @SuppressWarnings("java:S2077") // table name checked against a regex
      ResultSet rs = statement.executeQuery("PRAGMA table_info(%s)".formatted(table))
    ) {
      while (rs.next()) {
        result.add(rs.getString("name").toLowerCase());
      }
    }
    return result;
  }

  private static Connection newReadOnlyConnection(Path path) {
    SQLiteConfig config = new SQLiteConfig();
    config.setReadOnly(true);
    config.setCacheSize(100_000);
    config.setTempStore(SQLiteConfig.TempStore.MEMORY);
    String url = "jdbc:sqlite:" + path.toAbsolutePath();
    try {
      return DriverManager.getConnection(url, config.toProperties());
    } catch (SQLException e) {
      throw new StoreException("Unable to open " + url, e);
    }
  }

  private static Double getDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static Integer getInteger(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  public Path path() {
    return path;
  }

  public String table() {
    return table;
  }

  /** Returns true if queries go through the {@code <table>_rtree} index. */
  public boolean hasRtree() {
    return hasRtree;
  }

  /** Returns the number of per-thread connections currently open. */
  public int openConnections() {
    return connections.size();
  }

  @Override
  public Handle handle() {
    return connections.forThread();
  }

  @Override
  public void close() {
    connections.close();
  }

  /**
   * A connection and its prepared statements, used from a single thread.
   * <p>
   * Each query runs against a deadline of {@code queryTimeout}: a progress handler on the connection aborts the
   * statement once the deadline passes, which surfaces as a {@link StoreException}.
   */
  @NotThreadSafe
  private class SqliteHandle implements Handle, AutoCloseable {

    private final Connection connection;
    private final WKBReader wkbReader = GeoUtils.wkbReader();
    private PreparedStatement query = null;
    private PreparedStatement aggregate = null;
    private long deadlineNanos = Long.MAX_VALUE;
    private boolean running = false;

    SqliteHandle(Connection connection) {
      this.connection = connection;
      try {
        ProgressHandler.setHandler(connection, PROGRESS_INTERVAL, new ProgressHandler() {
          @Override
          protected int progress() {
            return pastDeadline() ? 1 : 0;
          }
        });
      } catch (SQLException e) {
        throw new StoreException("Unable to set query deadline on " + path, e);
      }
    }

    private void startDeadline() {
      deadlineNanos = System.nanoTime() + queryTimeout.toNanos();
      running = true;
    }

    private boolean pastDeadline() {
      return running && System.nanoTime() - deadlineNanos > 0;
    }

    private StoreException failure(String action, Envelope bounds, SQLException e) {
      if (pastDeadline()) {
        stats.storeError("timeout");
        return new StoreException(action + " " + table + " in " + bounds + " timed out after " +
          queryTimeout.toMillis() + "ms", e);
      }
      return new StoreException("Error " + action + " " + table + " in " + bounds, e);
    }

    private void bind(PreparedStatement statement, Envelope bounds) throws SQLException {
      int idx = 1;
      int params = hasRtree ? 2 : 1;
      for (int i = 0; i < params; i++) {
        statement.setDouble(idx++, bounds.getMaxX());
        statement.setDouble(idx++, bounds.getMinX());
        statement.setDouble(idx++, bounds.getMaxY());
        statement.setDouble(idx++, bounds.getMinY());
      }
    }

    private Geometry readGeometry(String id, byte[] wkb) {
      if (wkb == null) {
        stats.dataError("store_missing_geometry");
        LOGGER.debug("Building {} has no geometry", id);
        return null;
      }
      try {
        return wkbReader.read(wkb);
      } catch (ParseException | IllegalArgumentException e) {
        stats.dataError("store_invalid_wkb");
        LOGGER.debug("Building {} has invalid WKB: {}", id, e.toString());
        return null;
      }
    }

    @Override
    public List<Building> queryInBBox(Envelope lonLatBounds) {
      List<Building> result = new ArrayList<>();
      try {
        if (query == null) {
          query = connection.prepareStatement(querySql);
        }
        bind(query, lonLatBounds);
        startDeadline();
        try (ResultSet rs = query.executeQuery()) {
          while (rs.next()) {
            String id = rs.getString("id");
            Geometry geometry = readGeometry(id, rs.getBytes("geometry"));
            if (geometry != null) {
              result.add(new Building(
                id,
                geometry,
                rs.getString("name"),
                getDouble(rs, "height"),
                rs.getString("class"),
                rs.getString("subtype"),
                getInteger(rs, "num_floors")
              ));
            }
          }
        }
      } catch (SQLException e) {
        throw failure("querying", lonLatBounds, e);
      } finally {
        running = false;
      }
      return result;
    }

    @Override
    public ViewStats aggregateInBBox(Envelope lonLatBounds) {
      long count = 0;
      double area = 0;
      try {
        if (aggregate == null) {
          aggregate = connection.prepareStatement(aggregateSql);
        }
        bind(aggregate, lonLatBounds);
        startDeadline();
        try (ResultSet rs = aggregate.executeQuery()) {
          while (rs.next()) {
            count++;
            Geometry geometry = readGeometry(null, rs.getBytes(1));
            if (geometry != null) {
              area += GeoUtils.webMercatorArea(geometry);
            }
          }
        }
      } catch (SQLException e) {
        throw failure("aggregating", lonLatBounds, e);
      } finally {
        running = false;
      }
      return new ViewStats(count, area);
    }

    @Override
    public void close() throws SQLException {
      ProgressHandler.clearHandler(connection);
      connection.close();
    }
  }
}
