package org.example.urlshortener.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.example.urlshortener.model.UserUrl;

/**
 * Persistence contract shared by the in-memory, file and SQL backends.
 *
 * <p>Records are keyed by short identifier and carry the original URL, the owner and a
 * soft-delete flag. Deleted records are invisible to every read operation.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface UrlStorage extends AutoCloseable {

  /**
   * Stores a new live record.
   *
   * @throws DuplicateShortIdException if {@code shortId} is already stored (the existing record is
   *     not modified)
   * @throws StorageException on any other backend failure
   */
  void save(String shortId, String originalUrl, String userId) throws StorageException;

  /**
   * Stores every {@code shortId -> originalUrl} pair for {@code userId}, all or nothing.
   *
   * @throws DuplicateShortIdException if any id of the batch is already stored; nothing is saved
   * @throws StorageException on any other backend failure
   */
  void saveBatch(Map<String, String> items, String userId) throws StorageException;

  /**
   * Resolves a short identifier. Absent and deleted records both yield an empty result.
   *
   * @param shortId short identifier
   * @return the original URL of a live record, or empty
   */
  Optional<String> get(String shortId) throws StorageException;

  /**
   * Finds the short identifier of a live record with exactly this original URL.
   *
   * @param originalUrl URL compared as an opaque string
   * @return short identifier, or empty when no live record matches
   */
  Optional<String> findByOriginalUrl(String originalUrl) throws StorageException;

  /**
   * Lists live records owned by {@code userId}. Each item's {@code shortUrl} holds the bare short
   * identifier. Order is unspecified.
   */
  List<UserUrl> getUrlsByUserId(String userId) throws StorageException;

  /**
   * Marks the listed identifiers deleted, but only those owned by {@code userId}. Identifiers that
   * are unknown or owned by someone else are skipped without error.
   */
  void deleteUrls(List<String> shortIds, String userId) throws StorageException;

  /**
   * Checks connectivity of the underlying database.
   *
   * @throws PingNotSupportedException on backends without a database
   * @throws StorageException if the database cannot be reached
   */
  void ping() throws StorageException;

  /** Releases backend resources. Safe to call more than once. */
  @Override
  void close();
}
