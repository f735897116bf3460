package org.example.urlshortener.storage;

import java.nio.file.Paths;

/**
 * Picks the storage backend once at startup.
 *
 * <p>Priority: SQL when a connection string is given, then the JSON file when a path is given,
 * then memory. A backend that fails to construct is logged and skipped; the memory backend cannot
 * fail, so selection always succeeds. There are no retries and the choice is never revisited.
 */
public final class StorageSelector {
  private StorageSelector() {}

  /**
   * Builds the first backend that can be constructed.
   *
   * @param sqlDsn database connection string, or {@code null}/blank to skip SQL
   * @param filePath JSON storage file, or {@code null}/blank to skip the file backend
   * @return a ready backend (never {@code null})
   */
  public static UrlStorage select(String sqlDsn, String filePath) {
    if (sqlDsn != null && !sqlDsn.isBlank()) {
      try {
        UrlStorage sql = new SqlUrlStorage(sqlDsn);
        System.out.println("[storage] using SQL storage");
        return sql;
      } catch (StorageException e) {
        System.err.println("[storage] SQL storage unavailable, falling back: " + e.getMessage());
      }
    }

    if (filePath != null && !filePath.isBlank()) {
      try {
        UrlStorage file = new FileUrlStorage(Paths.get(filePath));
        System.out.println("[storage] using file storage: " + filePath);
        return file;
      } catch (StorageException e) {
        System.err.println("[storage] file storage unavailable, falling back: " + e.getMessage());
      } catch (RuntimeException e) {
        // e.g. InvalidPathException for an unusable path string
        System.err.println("[storage] invalid storage path " + filePath + ": " + e.getMessage());
      }
    }

    System.out.println("[storage] using in-memory storage");
    return new MemoryUrlStorage();
  }
}
