package org.example.urlshortener.storage;

/**
 * Root of every failure reported by a {@link UrlStorage} backend.
 *
 * <p>Checked on purpose: callers of the storage layer always decide whether a failure is surfaced
 * or only logged.
 */
public class StorageException extends Exception {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
