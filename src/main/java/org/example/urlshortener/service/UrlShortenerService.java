package org.example.urlshortener.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.example.urlshortener.model.BatchShortenRequest;
import org.example.urlshortener.model.BatchShortenResponse;
import org.example.urlshortener.model.ShortenResult;
import org.example.urlshortener.model.UserUrl;
import org.example.urlshortener.storage.DuplicateShortIdException;
import org.example.urlshortener.storage.StorageException;
import org.example.urlshortener.storage.UrlStorage;

/**
 * Application service for the URL shortener: shortening (single and batch) with global
 * deduplication, resolving, per-user listing and soft deletion.
 *
 * <p>The service talks to a {@link UrlStorage} through its interface only and builds external
 * short URLs as {@code baseUrl + "/" + shortId}; {@code baseUrl} must not end with a slash.
 *
 * <h2>Per-user cache</h2>
 *
 * <p>{@link #getUrlsByUserId(String)} is read-through: the first call for a user fetches from the
 * backend and keeps the result; later calls return the kept snapshot. Any shorten, batch or delete
 * call for that user removes the entry before touching the backend. The whole map is guarded by
 * one read-write lock, always taken before any backend lock. Each invalidation stamps the user
 * with a new sequence number; a fetch fills the cache only if its user's stamp is unchanged.
 *
 * <h2>Deduplication</h2>
 *
 * <p>The lookup and the save of {@link #shorten(String, String)} run under a lock striped by URL,
 * so concurrent calls for one URL create at most one record. Lock order: URL stripe, cache lock,
 * backend.
 *
 * <h2>Collisions</h2>
 *
 * <p>A save rejected with {@link DuplicateShortIdException} is retried with fresh identifiers up
 * to {@link #MAX_SAVE_ATTEMPTS} times.
 *
 * <p><strong>Thread-safety:</strong> all public methods may be called concurrently.
 */
public class UrlShortenerService implements AutoCloseable {

  /** Default size of the deletion worker pool. */
  public static final int DEFAULT_DELETE_WORKERS = 4;

  /** Attempts per shorten/batch before a short-id collision is surfaced. */
  static final int MAX_SAVE_ATTEMPTS = 5;

  private static final int URL_LOCK_STRIPES = 64;

  private final UrlStorage storage;
  private final ShortIdGenerator generator;
  private final String baseUrl;
  private final DeletePipeline deletes;

  private final Object[] urlLocks = new Object[URL_LOCK_STRIPES];

  private final Map<String, List<UserUrl>> cache = new HashMap<>();
  private final Map<String, Long> stamps = new HashMap<>();
  private final ReadWriteLock cacheLock = new ReentrantReadWriteLock();
  private long invalidationSeq;

  /**
   * Creates a service with {@link #DEFAULT_DELETE_WORKERS} deletion workers.
   *
   * @param storage backend chosen at startup
   * @param generator short-id source
   * @param baseUrl prefix of every short URL, without a trailing slash
   */
  public UrlShortenerService(UrlStorage storage, ShortIdGenerator generator, String baseUrl) {
    this(storage, generator, baseUrl, DEFAULT_DELETE_WORKERS);
  }

  /**
   * @param storage backend chosen at startup
   * @param generator short-id source
   * @param baseUrl prefix of every short URL, without a trailing slash
   * @param deleteWorkers number of concurrent deletion workers
   */
  public UrlShortenerService(
      UrlStorage storage, ShortIdGenerator generator, String baseUrl, int deleteWorkers) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.deletes = new DeletePipeline(storage, deleteWorkers);
    for (int i = 0; i < urlLocks.length; i++) urlLocks[i] = new Object();
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  // ---------- Create ----------

  /**
   * Shortens a URL for {@code userId}.
   *
   * <ol>
   *   <li>If a live record already has this URL (whoever owns it), its short URL is returned with
   *       {@code isNew = false}. A failing lookup is surfaced, never treated as "not found".
   *   <li>Otherwise a new id is generated, the user's cache entry is dropped and the record is
   *       saved.
   * </ol>
   *
   * @param originalUrl URL to shorten (validated by the caller)
   * @param userId opaque owner id
   * @return short URL and whether it was newly created
   * @throws StorageException if the lookup or the save fails
   * @throws IllegalStateException if the generator returns an empty id
   */
  public ShortenResult shorten(String originalUrl, String userId) throws StorageException {
    synchronized (urlLocks[Math.floorMod(originalUrl.hashCode(), urlLocks.length)]) {
      return lookupOrSave(originalUrl, userId);
    }
  }

  private ShortenResult lookupOrSave(String originalUrl, String userId) throws StorageException {
    Optional<String> existing;
    try {
      existing = storage.findByOriginalUrl(originalUrl);
    } catch (StorageException e) {
      throw new StorageException("Error finding URL " + originalUrl + ": " + e.getMessage(), e);
    }
    if (existing.isPresent()) {
      return new ShortenResult(shortUrl(existing.get()), false);
    }

    DuplicateShortIdException lastConflict = null;
    for (int attempt = 0; attempt < MAX_SAVE_ATTEMPTS; attempt++) {
      String shortId = nextId();
      invalidate(userId);
      try {
        storage.save(shortId, originalUrl, userId);
        return new ShortenResult(shortUrl(shortId), true);
      } catch (DuplicateShortIdException e) {
        lastConflict = e;
      } catch (StorageException e) {
        throw new StorageException(
            "Error saving " + shortId + " -> " + originalUrl + ": " + e.getMessage(), e);
      }
    }
    throw new StorageException(
        "Error saving " + originalUrl + ": no free short id after " + MAX_SAVE_ATTEMPTS
            + " attempts",
        lastConflict);
  }

  /**
   * Shortens every item of a batch for {@code userId} in one backend call.
   *
   * <p>Batch items are not deduplicated; each gets its own id, even when two items carry the same
   * URL. The response has one entry per request item, in request order, each carrying that item's
   * correlation id.
   *
   * @param items request items
   * @param userId opaque owner id
   * @return one response per item
   * @throws StorageException if the batch cannot be saved
   * @throws IllegalStateException if the generator returns empty or repeating ids
   */
  public List<BatchShortenResponse> shortenBatch(List<BatchShortenRequest> items, String userId)
      throws StorageException {
    if (items.isEmpty()) return List.of();

    DuplicateShortIdException lastConflict = null;
    for (int attempt = 0; attempt < MAX_SAVE_ATTEMPTS; attempt++) {
      // ids.get(i) belongs to items.get(i)
      List<String> ids = new ArrayList<>(items.size());
      Map<String, String> batch = new LinkedHashMap<>();
      for (BatchShortenRequest item : items) {
        String shortId = nextDistinctId(batch);
        batch.put(shortId, item.originalUrl);
        ids.add(shortId);
      }

      invalidate(userId);
      try {
        storage.saveBatch(batch, userId);
      } catch (DuplicateShortIdException e) {
        lastConflict = e;
        continue;
      } catch (StorageException e) {
        throw new StorageException(
            "Error saving batch of " + items.size() + " URLs: " + e.getMessage(), e);
      }

      List<BatchShortenResponse> out = new ArrayList<>(items.size());
      for (int i = 0; i < items.size(); i++) {
        out.add(new BatchShortenResponse(items.get(i).correlationId, shortUrl(ids.get(i))));
      }
      return out;
    }
    throw new StorageException(
        "Error saving batch: no free short ids after " + MAX_SAVE_ATTEMPTS + " attempts",
        lastConflict);
  }

  private String nextId() {
    String shortId = generator.generate();
    if (shortId == null || shortId.isEmpty()) {
      throw new IllegalStateException(
          "Failed to generate short ID: generator returned an empty id (check shortIdLength)");
    }
    return shortId;
  }

  private String nextDistinctId(Map<String, String> batch) {
    for (int i = 0; i < MAX_SAVE_ATTEMPTS; i++) {
      String shortId = nextId();
      if (!batch.containsKey(shortId)) return shortId;
    }
    throw new IllegalStateException("Failed to generate short ID: generator keeps repeating ids");
  }

  // ---------- Read ----------

  /**
   * Resolves a short id. Deleted and unknown ids both resolve to empty. Not cached.
   *
   * @param shortId short identifier
   * @return the original URL, if live
   * @throws StorageException on backend failure
   */
  public Optional<String> get(String shortId) throws StorageException {
    return storage.get(shortId);
  }

  /**
   * Lists the live URLs of {@code userId} with full short URLs, through the per-user cache.
   *
   * @param userId opaque owner id
   * @return unmodifiable snapshot; order unspecified
   * @throws StorageException on backend failure (nothing is cached then)
   */
  public List<UserUrl> getUrlsByUserId(String userId) throws StorageException {
    Long seen;
    cacheLock.readLock().lock();
    try {
      List<UserUrl> cached = cache.get(userId);
      if (cached != null) return cached;
      seen = stamps.get(userId);
    } finally {
      cacheLock.readLock().unlock();
    }

    List<UserUrl> fetched;
    try {
      fetched = storage.getUrlsByUserId(userId);
    } catch (StorageException e) {
      throw new StorageException(
          "Error getting URLs of user " + userId + ": " + e.getMessage(), e);
    }
    List<UserUrl> views = new ArrayList<>(fetched.size());
    for (UserUrl u : fetched) {
      views.add(new UserUrl(shortUrl(u.shortUrl), u.originalUrl));
    }
    List<UserUrl> snapshot = List.copyOf(views);

    cacheLock.writeLock().lock();
    try {
      if (Objects.equals(stamps.get(userId), seen)) {
        cache.put(userId, snapshot);
      }
    } finally {
      cacheLock.writeLock().unlock();
    }
    return snapshot;
  }

  // ---------- Delete ----------

  /**
   * Soft-deletes the given ids on behalf of {@code userId}.
   *
   * <p>The user's cache entry is dropped immediately, then one deletion per id is handed to the
   * bounded worker pool. Dispatch only queues work, so the call returns without waiting for any
   * deletion. Ids the user does not own are skipped by the backend; per-item failures are logged,
   * never reported here.
   *
   * @param shortIds ids to delete
   * @param userId opaque owner id
   * @return completes when every deletion has been attempted; may be ignored
   * @throws IllegalStateException if the service has been closed
   */
  public CompletableFuture<Void> deleteUrls(List<String> shortIds, String userId) {
    invalidate(userId);
    if (shortIds.isEmpty()) return CompletableFuture.completedFuture(null);
    return deletes.submit(shortIds, userId);
  }

  // ---------- Misc ----------

  /**
   * Forwards the backend connectivity check.
   *
   * @throws org.example.urlshortener.storage.PingNotSupportedException if the backend has no
   *     database
   * @throws StorageException if the database is unreachable
   */
  public void ping() throws StorageException {
    storage.ping();
  }

  /** Waits for queued deletions, then closes the backend. */
  @Override
  public void close() {
    deletes.close();
    storage.close();
  }

  private void invalidate(String userId) {
    cacheLock.writeLock().lock();
    try {
      cache.remove(userId);
      stamps.put(userId, ++invalidationSeq);
    } finally {
      cacheLock.writeLock().unlock();
    }
  }

  private String shortUrl(String shortId) {
    return baseUrl + "/" + shortId;
  }
}
