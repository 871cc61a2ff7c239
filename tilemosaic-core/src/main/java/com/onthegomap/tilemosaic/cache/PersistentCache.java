package com.onthegomap.tilemosaic.cache;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Durable store of upstream answers keyed by string, backed by a single sqlite database.
 * <p>
 * Each write is one upsert statement so a crash leaves every key either at its old or its new value. Entries are never
 * evicted. Rows that cannot be decoded are reported as missing.
 */
@ThreadSafe
public class PersistentCache implements Closeable {

  public static final String FILE_NAME = "tilemosaic.db";

  private static final Logger LOGGER = LoggerFactory.getLogger(PersistentCache.class);

  private static final String TABLE = "cache_entries";
  private static final String COL_KEY = "key";
  private static final String COL_PAYLOAD = "payload";
  private static final String COL_ABSENT = "absent";
  private static final String COL_ETAG = "etag";
  private static final String COL_LAST_MODIFIED = "last_modified";
  private static final String COL_EXPIRES_AT = "expires_at";
  private static final String COL_STORED_AT = "stored_at";

  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found");
    }
  }

  private final Connection connection;
  private final PreparedStatement getStatement;
  private final PreparedStatement putStatement;
  private final PreparedStatement refreshStatement;

  private PersistentCache(Connection connection) {
    this.connection = connection;
    try {
      try (Statement statement = connection.createStatement()) {
        statement.execute("""
          create table if not exists %s (
            %s text primary key,
            %s blob not null,
            %s integer not null,
            %s text,
            %s integer,
            %s integer,
            %s integer not null
          )
          """.formatted(TABLE, COL_KEY, COL_PAYLOAD, COL_ABSENT, COL_ETAG, COL_LAST_MODIFIED, COL_EXPIRES_AT,
          COL_STORED_AT));
      }
      getStatement = connection.prepareStatement("""
        select %s, %s, %s, %s, %s, %s from %s where %s = ?
        """.formatted(COL_PAYLOAD, COL_ABSENT, COL_ETAG, COL_LAST_MODIFIED, COL_EXPIRES_AT, COL_STORED_AT, TABLE,
        COL_KEY));
      putStatement = connection.prepareStatement("""
        insert into %s (%s, %s, %s, %s, %s, %s, %s) values (?, ?, ?, ?, ?, ?, ?)
        on conflict(%s) do update set
          %s = excluded.%s,
          %s = excluded.%s,
          %s = excluded.%s,
          %s = excluded.%s,
          %s = excluded.%s,
          %s = excluded.%s
        """.formatted(TABLE, COL_KEY, COL_PAYLOAD, COL_ABSENT, COL_ETAG, COL_LAST_MODIFIED, COL_EXPIRES_AT,
        COL_STORED_AT, COL_KEY,
        COL_PAYLOAD, COL_PAYLOAD,
        COL_ABSENT, COL_ABSENT,
        COL_ETAG, COL_ETAG,
        COL_LAST_MODIFIED, COL_LAST_MODIFIED,
        COL_EXPIRES_AT, COL_EXPIRES_AT,
        COL_STORED_AT, COL_STORED_AT));
      refreshStatement = connection.prepareStatement("""
        update %s set %s = ?, %s = ?, %s = ?, %s = ? where %s = ?
        """.formatted(TABLE, COL_ETAG, COL_LAST_MODIFIED, COL_EXPIRES_AT, COL_STORED_AT, COL_KEY));
    } catch (SQLException e) {
      throw new CacheIOException("Unable to initialize cache schema", e);
    }
  }

  /** Opens (creating if needed) the cache database {@value #FILE_NAME} inside {@code directory}. */
  public static PersistentCache open(Path directory) {
    Objects.requireNonNull(directory);
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new CacheIOException("Unable to create cache directory " + directory, e);
    }
    Path path = directory.resolve(FILE_NAME);
    SQLiteConfig config = new SQLiteConfig();
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    config.setBusyTimeout(10_000);
    LOGGER.debug("Opening cache {}", path.toAbsolutePath());
    return new PersistentCache(newConnection("jdbc:sqlite:" + path.toAbsolutePath(), config));
  }

  /** Returns a cache that won't get written to disk. Useful for unit tests. */
  public static PersistentCache newInMemoryDatabase() {
    return new PersistentCache(newConnection("jdbc:sqlite::memory:", new SQLiteConfig()));
  }

  private static Connection newConnection(String url, SQLiteConfig config) {
    try {
      return DriverManager.getConnection(url, config.toProperties());
    } catch (SQLException e) {
      throw new CacheIOException("Unable to open " + url, e);
    }
  }

  /**
   * Returns the freshness of {@code entry} at {@code now}.
   * <p>
   * An entry is fresh only while its explicit expiry lies in the future. An expired entry, or one that never had an
   * explicit lifetime, must be revalidated using whatever validators it has.
   */
  public static Freshness evaluateFreshness(Optional<CacheEntry> entry, Instant now) {
    if (entry.isEmpty()) {
      return Freshness.ABSENT;
    }
    CacheEntry value = entry.get();
    if (value.expiresAt().isPresent() && value.expiresAt().get().isAfter(now)) {
      return Freshness.FRESH;
    }
    return Freshness.needsRevalidation(value.validators());
  }

  /** Returns the entry stored under {@code key}, or empty if there is none or it cannot be decoded. */
  public synchronized Optional<CacheEntry> get(String key) {
    try {
      getStatement.setString(1, key);
      try (ResultSet rs = getStatement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return decode(key, rs);
      }
    } catch (SQLException e) {
      throw new CacheIOException("Error reading cache entry " + key, e);
    }
  }

  private static Optional<CacheEntry> decode(String key, ResultSet rs) throws SQLException {
    try {
      byte[] payload = rs.getBytes(COL_PAYLOAD);
      long storedAt = rs.getLong(COL_STORED_AT);
      if (payload == null || rs.wasNull()) {
        throw new IllegalArgumentException("missing payload or timestamp");
      }
      return Optional.of(new CacheEntry(
        payload,
        rs.getInt(COL_ABSENT) != 0,
        Optional.ofNullable(rs.getString(COL_ETAG)),
        getInstant(rs, COL_LAST_MODIFIED),
        getInstant(rs, COL_EXPIRES_AT),
        Instant.ofEpochMilli(storedAt)
      ));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Ignoring undecodable cache entry {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<Instant> getInstant(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? Optional.empty() : Optional.of(Instant.ofEpochMilli(value));
  }

  private static void setInstant(PreparedStatement statement, int index, Optional<Instant> value)
    throws SQLException {
    if (value.isPresent()) {
      statement.setLong(index, value.get().toEpochMilli());
    } else {
      statement.setNull(index, Types.INTEGER);
    }
  }

  /** Inserts or replaces the entry stored under {@code key}. */
  public synchronized void put(String key, CacheEntry entry) {
    try {
      putStatement.setString(1, key);
      putStatement.setBytes(2, entry.payload());
      putStatement.setInt(3, entry.absent() ? 1 : 0);
      putStatement.setString(4, entry.etag().orElse(null));
      setInstant(putStatement, 5, entry.lastModified());
      setInstant(putStatement, 6, entry.expiresAt());
      putStatement.setLong(7, entry.storedAt().toEpochMilli());
      putStatement.executeUpdate();
    } catch (SQLException e) {
      throw new CacheIOException("Error writing cache entry " + key, e);
    }
  }

  /**
   * Replaces only the freshness metadata of the entry under {@code key} after upstream confirmed it is unchanged.
   * Validators missing from {@code freshness} keep their stored values.
   *
   * @return the updated entry, or empty if there was nothing stored under {@code key}
   */
  public synchronized Optional<CacheEntry> refresh(String key, ResponseFreshness freshness, Instant now) {
    Optional<CacheEntry> existing = get(key);
    if (existing.isEmpty()) {
      return existing;
    }
    CacheEntry updated = existing.get().withFreshness(freshness, now);
    try {
      refreshStatement.setString(1, updated.etag().orElse(null));
      setInstant(refreshStatement, 2, updated.lastModified());
      setInstant(refreshStatement, 3, updated.expiresAt());
      refreshStatement.setLong(4, updated.storedAt().toEpochMilli());
      refreshStatement.setString(5, key);
      refreshStatement.executeUpdate();
    } catch (SQLException e) {
      throw new CacheIOException("Error refreshing cache entry " + key, e);
    }
    return Optional.of(updated);
  }

  /** Returns the number of stored entries. */
  public synchronized long size() {
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery("select count(*) from " + TABLE)
    ) {
      return rs.next() ? rs.getLong(1) : 0;
    } catch (SQLException e) {
      throw new CacheIOException("Error counting cache entries", e);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    try {
      getStatement.close();
      putStatement.close();
      refreshStatement.close();
      connection.close();
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }
}
