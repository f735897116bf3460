package org.example.urlshortener.storage;

/**
 * Thrown when a save hits a short identifier that is already stored. Existing data is left
 * unchanged; for batch saves nothing from the batch is stored.
 */
public class DuplicateShortIdException extends StorageException {

  private final String shortId;

  public DuplicateShortIdException(String shortId) {
    super("short id already exists: " + shortId);
    this.shortId = shortId;
  }

  public DuplicateShortIdException(String shortId, Throwable cause) {
    super("short id already exists: " + shortId, cause);
    this.shortId = shortId;
  }

  /**
   * @return the conflicting short identifier
   */
  public String getShortId() {
    return shortId;
  }
}
