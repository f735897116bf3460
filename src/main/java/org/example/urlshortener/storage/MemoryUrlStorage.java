package org.example.urlshortener.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.example.urlshortener.model.UrlRecord;
import org.example.urlshortener.model.UserUrl;

/**
 * Volatile backend keeping every record in a map guarded by a read-write lock.
 *
 * <p>Records are copied on the way in and out, so callers never share mutable state with the map.
 * Subclasses can observe each completed mutation through {@link #afterMutation()}, which runs after
 * the write lock has been released.
 */
public class MemoryUrlStorage implements UrlStorage {

  private final Map<String, UrlRecord> records;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /** Creates an empty storage. */
  public MemoryUrlStorage() {
    this(new HashMap<>());
  }

  /**
   * Creates a storage pre-filled with {@code initial}, keyed by short id.
   *
   * @param initial records to start with; the map is taken over, not copied
   */
  protected MemoryUrlStorage(Map<String, UrlRecord> initial) {
    this.records = initial;
  }

  @Override
  public void save(String shortId, String originalUrl, String userId) throws StorageException {
    lock.writeLock().lock();
    try {
      if (records.containsKey(shortId)) {
        throw new DuplicateShortIdException(shortId);
      }
      records.put(shortId, new UrlRecord(shortId, originalUrl, userId));
    } finally {
      lock.writeLock().unlock();
    }
    afterMutation();
  }

  @Override
  public void saveBatch(Map<String, String> items, String userId) throws StorageException {
    if (items.isEmpty()) return;
    lock.writeLock().lock();
    try {
      // all-or-nothing: reject the whole batch before touching the map
      for (String shortId : items.keySet()) {
        if (records.containsKey(shortId)) {
          throw new DuplicateShortIdException(shortId);
        }
      }
      for (Map.Entry<String, String> e : items.entrySet()) {
        records.put(e.getKey(), new UrlRecord(e.getKey(), e.getValue(), userId));
      }
    } finally {
      lock.writeLock().unlock();
    }
    afterMutation();
  }

  @Override
  public Optional<String> get(String shortId) {
    lock.readLock().lock();
    try {
      UrlRecord r = records.get(shortId);
      if (r == null || !r.isLive()) return Optional.empty();
      return Optional.of(r.originalUrl);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<String> findByOriginalUrl(String originalUrl) {
    lock.readLock().lock();
    try {
      for (UrlRecord r : records.values()) {
        if (r.isLive() && originalUrl.equals(r.originalUrl)) {
          return Optional.of(r.shortId);
        }
      }
      return Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<UserUrl> getUrlsByUserId(String userId) {
    lock.readLock().lock();
    try {
      List<UserUrl> out = new ArrayList<>();
      for (UrlRecord r : records.values()) {
        if (r.isLive() && userId.equals(r.userId)) {
          out.add(new UserUrl(r.shortId, r.originalUrl));
        }
      }
      return out;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void deleteUrls(List<String> shortIds, String userId) {
    boolean changed = false;
    lock.writeLock().lock();
    try {
      for (String shortId : shortIds) {
        UrlRecord r = records.get(shortId);
        if (r != null && r.isLive() && userId.equals(r.userId)) {
          r.deleted = true;
          changed = true;
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (changed) afterMutation();
  }

  @Override
  public void ping() throws StorageException {
    throw new PingNotSupportedException("memory storage");
  }

  @Override
  public void close() {}

  /**
   * Returns detached copies of every record, live or deleted.
   *
   * @return snapshot taken under the read lock
   */
  protected List<UrlRecord> snapshot() {
    lock.readLock().lock();
    try {
      List<UrlRecord> out = new ArrayList<>(records.size());
      for (UrlRecord r : records.values()) out.add(r.copy());
      return out;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Hook invoked after a mutation has been applied and the write lock released. */
  protected void afterMutation() {}
}
