package org.example.urlshortener.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.example.urlshortener.model.UserUrl;

/**
 * Durable backend over a relational database reached through JDBC.
 *
 * <p>Connections come from a HikariCP pool created at construction; the pool opens its first
 * connection right away, so an unreachable database fails the constructor. The {@code urls} table
 * and its indexes are created when missing. Every operation borrows a connection for its own
 * duration, so the storage can be shared by any number of threads. Batch saves and deletions run
 * in a single transaction. {@link #close()} shuts the pool down.
 */
public class SqlUrlStorage implements UrlStorage {

  /** SQLState for unique/primary-key violations (PostgreSQL and H2). */
  static final String UNIQUE_VIOLATION = "23505";

  private static final int PING_TIMEOUT_SEC = 5;
  private static final int MAX_POOL_SIZE = 10;
  private static final long CONNECT_TIMEOUT_SEC = 5;

  private final HikariDataSource pool;

  /**
   * Connects to the database described by {@code dsn} and prepares the schema.
   *
   * @param dsn JDBC URL or PostgreSQL connection string (see {@link JdbcDsn})
   * @throws StorageException if the string is invalid, the database is unreachable, or the schema
   *     cannot be created
   */
  public SqlUrlStorage(String dsn) throws StorageException {
    JdbcDsn target;
    try {
      target = JdbcDsn.parse(dsn);
    } catch (IllegalArgumentException e) {
      throw new StorageException(e.getMessage(), e);
    }

    HikariConfig config = new HikariConfig();
    config.setPoolName("url-storage");
    config.setJdbcUrl(target.url());
    config.setDataSourceProperties(target.properties());
    config.setMaximumPoolSize(MAX_POOL_SIZE);
    config.setMinimumIdle(1);
    config.setConnectionTimeout(TimeUnit.SECONDS.toMillis(CONNECT_TIMEOUT_SEC));
    try {
      this.pool = new HikariDataSource(config);
    } catch (RuntimeException e) {
      // PoolInitializationException, or no driver for the URL
      throw new StorageException("Cannot connect to database: " + e.getMessage(), e);
    }

    try (Connection c = connect();
        Statement st = c.createStatement()) {
      st.execute(UrlQueries.CREATE_TABLE);
      st.execute(
          target.isPostgres()
              ? UrlQueries.CREATE_ORIGINAL_URL_HASH_INDEX
              : UrlQueries.CREATE_ORIGINAL_URL_INDEX);
      st.execute(UrlQueries.CREATE_USER_ID_INDEX);
    } catch (SQLException e) {
      pool.close();
      throw new StorageException("Cannot initialize database: " + e.getMessage(), e);
    }
  }

  private Connection connect() throws SQLException {
    return pool.getConnection();
  }

  @Override
  public void save(String shortId, String originalUrl, String userId) throws StorageException {
    try (Connection c = connect();
        PreparedStatement ps = c.prepareStatement(UrlQueries.INSERT_URL)) {
      bindInsert(ps, shortId, originalUrl, userId);
      ps.executeUpdate();
    } catch (SQLException e) {
      if (isUniqueViolation(e)) throw new DuplicateShortIdException(shortId, e);
      throw new StorageException("Failed to save " + shortId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void saveBatch(Map<String, String> items, String userId) throws StorageException {
    if (items.isEmpty()) return;
    try (Connection c = connect()) {
      c.setAutoCommit(false);
      String current = null;
      try (PreparedStatement ps = c.prepareStatement(UrlQueries.INSERT_URL)) {
        for (Map.Entry<String, String> e : items.entrySet()) {
          current = e.getKey();
          bindInsert(ps, e.getKey(), e.getValue(), userId);
          ps.executeUpdate();
        }
        c.commit();
      } catch (SQLException e) {
        rollbackQuietly(c);
        if (isUniqueViolation(e)) throw new DuplicateShortIdException(current, e);
        throw new StorageException("Failed to save batch at " + current + ": " + e.getMessage(), e);
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to save batch: " + e.getMessage(), e);
    }
  }

  private static void bindInsert(PreparedStatement ps, String shortId, String url, String userId)
      throws SQLException {
    ps.setString(1, shortId);
    ps.setString(2, url);
    ps.setString(3, userId);
  }

  @Override
  public Optional<String> get(String shortId) throws StorageException {
    try (Connection c = connect();
        PreparedStatement ps = c.prepareStatement(UrlQueries.SELECT_BY_SHORT_ID)) {
      ps.setString(1, shortId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to get " + shortId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<String> findByOriginalUrl(String originalUrl) throws StorageException {
    try (Connection c = connect();
        PreparedStatement ps = c.prepareStatement(UrlQueries.SELECT_BY_ORIGINAL_URL)) {
      ps.setString(1, originalUrl);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to look up " + originalUrl + ": " + e.getMessage(), e);
    }
  }

  @Override
  public List<UserUrl> getUrlsByUserId(String userId) throws StorageException {
    try (Connection c = connect();
        PreparedStatement ps = c.prepareStatement(UrlQueries.SELECT_BY_USER_ID)) {
      ps.setString(1, userId);
      List<UserUrl> out = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(new UserUrl(rs.getString(1), rs.getString(2)));
        }
      }
      return out;
    } catch (SQLException e) {
      throw new StorageException("Failed to list URLs of " + userId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void deleteUrls(List<String> shortIds, String userId) throws StorageException {
    if (shortIds.isEmpty()) return;
    try (Connection c = connect()) {
      c.setAutoCommit(false);
      try (PreparedStatement ps = c.prepareStatement(UrlQueries.MARK_DELETED)) {
        for (String shortId : shortIds) {
          ps.setString(1, shortId);
          ps.setString(2, userId);
          ps.executeUpdate();
        }
        c.commit();
      } catch (SQLException e) {
        rollbackQuietly(c);
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to delete " + shortIds + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void ping() throws StorageException {
    try (Connection c = connect()) {
      if (!c.isValid(PING_TIMEOUT_SEC)) {
        throw new StorageException("Database connection is not valid");
      }
    } catch (SQLException e) {
      throw new StorageException("Database is unreachable: " + e.getMessage(), e);
    }
  }

  /** Closes the connection pool; later operations fail with {@link StorageException}. */
  @Override
  public void close() {
    pool.close();
  }

  private static void rollbackQuietly(Connection c) {
    try {
      c.rollback();
    } catch (SQLException e) {
      System.err.println("[sql-storage] rollback failed: " + e.getMessage());
    }
  }

  static boolean isUniqueViolation(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (UNIQUE_VIOLATION.equals(cur.getSQLState())) return true;
    }
    return false;
  }
}
