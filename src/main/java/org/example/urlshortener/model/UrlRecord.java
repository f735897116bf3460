package org.example.urlshortener.model;

/**
 * A single stored URL mapping.
 *
 * <p>A {@code UrlRecord} binds a generated short identifier to the original URL, remembers which
 * user created it and whether it has been soft-deleted.
 *
 * <p>All fields are public to keep JSON serialization simple. Callers must treat the object as a
 * mutable data holder and copy it before handing it out of a backend.
 *
 * <h2>Fields overview</h2>
 *
 * <ul>
 *   <li>{@code shortId} – primary key; the path segment of the short URL.
 *   <li>{@code originalUrl} – the URL that was shortened, compared as an opaque string.
 *   <li>{@code userId} – opaque identifier of the owner.
 *   <li>{@code deleted} – {@code true} once the owner deleted the mapping.
 * </ul>
 *
 * <p>A record is <em>live</em> while {@code deleted} is {@code false}.
 */
public class UrlRecord {

  /** Generated short identifier, unique per backend. */
  public String shortId;

  /** The original URL. */
  public String originalUrl;

  /** Owner of the mapping. */
  public String userId;

  /** Soft-delete flag. */
  public boolean deleted;

  /** Creates an empty record (used by Gson). */
  public UrlRecord() {}

  /**
   * Creates a live record.
   *
   * @param shortId short identifier
   * @param originalUrl original URL
   * @param userId owner
   */
  public UrlRecord(String shortId, String originalUrl, String userId) {
    this.shortId = shortId;
    this.originalUrl = originalUrl;
    this.userId = userId;
    this.deleted = false;
  }

  /**
   * Returns {@code true} if this record has not been deleted.
   *
   * @return whether the record is live
   */
  public boolean isLive() {
    return !deleted;
  }

  /**
   * Returns a field-by-field copy.
   *
   * @return detached copy of this record
   */
  public UrlRecord copy() {
    UrlRecord r = new UrlRecord(shortId, originalUrl, userId);
    r.deleted = deleted;
    return r;
  }
}
