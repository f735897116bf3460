package org.example.urlshortener.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.*;

/**
 * Runs the storage contract against {@link SqlUrlStorage} on an in-process H2 database in
 * PostgreSQL mode. Every test gets its own named in-memory database.
 */
public class SqlUrlStorageTest extends UrlStorageContract {

  static String h2Url() {
    return "jdbc:h2:mem:urls_"
        + UUID.randomUUID().toString().replace("-", "")
        + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
  }

  @Override
  protected UrlStorage newStorage() throws StorageException {
    return new SqlUrlStorage(h2Url());
  }

  @Override
  protected void assertPing(UrlStorage storage) {
    assertDoesNotThrow(storage::ping);
  }

  @Test
  @DisplayName("schema creation is idempotent: a second storage on the same database sees the data")
  void schema_idempotent() throws Exception {
    String url = h2Url();
    SqlUrlStorage first = new SqlUrlStorage(url);
    first.save("keep", "https://keep.example", "u");

    SqlUrlStorage second = new SqlUrlStorage(url);
    assertEquals(Optional.of("https://keep.example"), second.get("keep"));
    first.close();
    second.close();
  }

  @Test
  @DisplayName("operations share a bounded connection pool that close() shuts down")
  void pooledConnections_closedWithStorage() throws Exception {
    SqlUrlStorage pooled = new SqlUrlStorage(h2Url());
    for (int i = 0; i < 50; i++) {
      pooled.save("p" + i, "https://p.example/" + i, "u");
    }
    assertEquals(50, pooled.getUrlsByUserId("u").size());

    pooled.close();

    assertThrows(StorageException.class, () -> pooled.get("p0"));
    assertThrows(StorageException.class, pooled::ping);
  }

  @Test
  @DisplayName("stored URLs are not limited to a fixed column length")
  void longUrl_roundTrip() throws Exception {
    String longUrl = "https://long.example/" + "a".repeat(10_000);

    storage.save("long", longUrl, "u");

    assertEquals(Optional.of(longUrl), storage.get("long"));
    assertEquals(Optional.of("long"), storage.findByOriginalUrl(longUrl));
  }

  @Test
  @DisplayName("an unreachable database fails construction")
  void unreachable_failsConstruction() {
    assertThrows(
        StorageException.class, () -> new SqlUrlStorage("jdbc:postgresql://127.0.0.1:1/nodb"));
  }

  @Test
  @DisplayName("a garbage connection string fails construction")
  void garbageDsn_failsConstruction() {
    assertThrows(StorageException.class, () -> new SqlUrlStorage("not a dsn"));
  }

  @Test
  @DisplayName("unique violations are recognised through chained SQL exceptions")
  void uniqueViolation_detection() {
    SQLException outer = new SQLException("batch failed", "HY000");
    outer.setNextException(new SQLException("dup", SqlUrlStorage.UNIQUE_VIOLATION));

    assertTrue(SqlUrlStorage.isUniqueViolation(outer));
    assertFalse(SqlUrlStorage.isUniqueViolation(new SQLException("other", "42000")));
  }
}
