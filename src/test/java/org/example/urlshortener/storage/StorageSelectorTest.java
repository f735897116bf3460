package org.example.urlshortener.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/** Tests for the SQL → file → memory fallback chain of {@link StorageSelector}. */
public class StorageSelectorTest {

  @TempDir Path tempDir;

  private static final String UNREACHABLE_DSN = "jdbc:postgresql://127.0.0.1:1/nodb";

  @Test
  @DisplayName("a reachable database wins over a file path")
  void reachableSql_selected() {
    UrlStorage s = StorageSelector.select(SqlUrlStorageTest.h2Url(), tempDir.resolve("f.json").toString());
    try {
      assertInstanceOf(SqlUrlStorage.class, s);
      assertFalse(Files.exists(tempDir.resolve("f.json")), "File backend must not be touched.");
    } finally {
      s.close();
    }
  }

  @Test
  @DisplayName("unreachable database + writable file path selects the file backend, which writes")
  void unreachableSql_fallsBackToFile() throws Exception {
    Path file = tempDir.resolve("urls.json");

    UrlStorage s = StorageSelector.select(UNREACHABLE_DSN, file.toString());
    assertInstanceOf(FileUrlStorage.class, s);
    String before = Files.readString(file, StandardCharsets.UTF_8);

    s.save("abc12345", "https://example.com", "u1");
    s.close();

    String after = Files.readString(file, StandardCharsets.UTF_8);
    assertNotEquals(before, after, "Saving must change the file content.");
    assertTrue(after.contains("abc12345"));
  }

  @Test
  @DisplayName("a libpq-style URL pointing nowhere also falls back")
  void unreachablePostgresUrl_fallsBack() {
    UrlStorage s = StorageSelector.select("postgres://user:pw@127.0.0.1:1/db?sslmode=disable", "");
    assertInstanceOf(MemoryUrlStorage.class, s);
    assertFalse(s instanceof FileUrlStorage);
  }

  @Test
  @DisplayName("no settings selects memory")
  void nothingConfigured_memory() {
    UrlStorage s = StorageSelector.select("", null);
    assertEquals(MemoryUrlStorage.class, s.getClass());
  }

  @Test
  @DisplayName("an unusable file path falls through to memory")
  void badFile_fallsBackToMemory() throws Exception {
    Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "[{]", StandardCharsets.UTF_8);

    UrlStorage s = StorageSelector.select(null, file.toString());
    assertEquals(MemoryUrlStorage.class, s.getClass());
  }

  @Test
  @DisplayName("a cascade of failures ends in memory")
  void cascade_memory() {
    UrlStorage s = StorageSelector.select(UNREACHABLE_DSN, tempDir.toString());
    assertEquals(MemoryUrlStorage.class, s.getClass());
  }
}
