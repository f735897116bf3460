package org.example.urlshortener.storage;

import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.example.urlshortener.model.UrlRecord;
import org.example.urlshortener.util.JsonFiles;

/**
 * Backend that keeps records in memory and mirrors them to a JSON array on disk.
 *
 * <p>Reads never touch the file. Every mutation marks the storage dirty and schedules a flush on a
 * single background thread; the mutating call returns as soon as the in-memory map is updated.
 * Flushes are serialized by {@code flushLock} and coalesce: a flush that finds the storage clean
 * does nothing, so a burst of mutations ends in one or two rewrites.
 *
 * <p>The file is always replaced atomically (see {@link JsonFiles#writeAtomic(Path, Object)}). A
 * crash between a mutation and its flush loses that mutation. {@link #close()} waits for pending
 * flushes.
 */
public class FileUrlStorage extends MemoryUrlStorage {

  private static final Type LIST_TYPE = new TypeToken<List<UrlRecord>>() {}.getType();
  private static final long CLOSE_TIMEOUT_SEC = 10;

  private final Path file;
  private final AtomicBoolean dirty = new AtomicBoolean(false);
  private final Object flushLock = new Object();
  private final ExecutorService flusher;

  /**
   * Opens (or creates) the storage file.
   *
   * <p>An existing file is loaded; an empty one is treated as no records. A missing file is
   * created with an empty array right away, so an unwritable location fails here rather than on
   * the first flush.
   *
   * @param file path of the JSON file
   * @throws StorageException if the path is a directory, the file is malformed, or it cannot be
   *     created
   */
  public FileUrlStorage(Path file) throws StorageException {
    super(load(file));
    this.file = file;
    this.flusher =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "file-storage-flush");
              t.setDaemon(true);
              return t;
            });
  }

  private static Map<String, UrlRecord> load(Path file) throws StorageException {
    Map<String, UrlRecord> records = new HashMap<>();
    if (Files.isDirectory(file)) {
      throw new StorageException("Storage path is a directory: " + file);
    }
    try {
      if (!Files.exists(file)) {
        JsonFiles.writeAtomic(file, new ArrayList<UrlRecord>());
        return records;
      }
      List<UrlRecord> entries = JsonFiles.read(file, LIST_TYPE);
      if (entries != null) {
        for (UrlRecord r : entries) {
          if (r == null || r.shortId == null) continue;
          records.put(r.shortId, r);
        }
      }
      return records;
    } catch (IOException e) {
      throw new StorageException("Cannot open storage file " + file + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns the backing file.
   *
   * @return path given at construction
   */
  public Path getFile() {
    return file;
  }

  @Override
  protected void afterMutation() {
    dirty.set(true);
    try {
      flusher.execute(this::flushQuietly);
    } catch (RejectedExecutionException e) {
      // closed: nobody will flush later, do it now
      flushQuietly();
    }
  }

  /**
   * Writes the current state to disk if anything changed since the last flush.
   *
   * @throws StorageException if the file cannot be written; the storage stays dirty
   */
  public void flush() throws StorageException {
    synchronized (flushLock) {
      if (!dirty.getAndSet(false)) return;
      List<UrlRecord> entries = snapshot();
      try {
        JsonFiles.writeAtomic(file, entries);
      } catch (IOException e) {
        dirty.set(true);
        throw new StorageException("Failed to write " + file + ": " + e.getMessage(), e);
      }
    }
  }

  private void flushQuietly() {
    try {
      flush();
    } catch (StorageException e) {
      System.err.println("[file-storage] " + e.getMessage());
    }
  }

  @Override
  public void ping() throws StorageException {
    throw new PingNotSupportedException("file storage");
  }

  @Override
  public void close() {
    flusher.shutdown();
    try {
      if (!flusher.awaitTermination(CLOSE_TIMEOUT_SEC, TimeUnit.SECONDS)) {
        System.err.println("[file-storage] flush did not finish in " + CLOSE_TIMEOUT_SEC + "s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    flushQuietly();
  }
}
