package org.example.urlshortener.storage;

/**
 * SQL used by {@link SqlUrlStorage}.
 *
 * <p>Statements stay within the subset PostgreSQL and H2 (PostgreSQL mode) both accept.
 */
final class UrlQueries {
  private UrlQueries() {}

  /**
   * Table of URL mappings; {@code short_id} is the primary key. {@code original_url} has no length
   * limit, the front end decides how long a URL may be.
   */
  static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS urls ("
          + " short_id VARCHAR(255) PRIMARY KEY,"
          + " original_url VARCHAR NOT NULL,"
          + " user_id VARCHAR(255),"
          + " is_deleted BOOLEAN NOT NULL DEFAULT FALSE)";

  static final String CREATE_ORIGINAL_URL_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_urls_original_url ON urls (original_url)";

  /** PostgreSQL variant: a hash index has no per-entry size limit, unlike a btree. */
  static final String CREATE_ORIGINAL_URL_HASH_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_urls_original_url ON urls USING HASH (original_url)";

  static final String CREATE_USER_ID_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_urls_user_id ON urls (user_id)";

  /** Plain insert; a primary-key conflict surfaces as SQLState {@code 23505}. */
  static final String INSERT_URL =
      "INSERT INTO urls (short_id, original_url, user_id) VALUES (?, ?, ?)";

  static final String SELECT_BY_SHORT_ID =
      "SELECT original_url FROM urls WHERE short_id = ? AND is_deleted = FALSE";

  static final String SELECT_BY_ORIGINAL_URL =
      "SELECT short_id FROM urls WHERE original_url = ? AND is_deleted = FALSE LIMIT 1";

  static final String SELECT_BY_USER_ID =
      "SELECT short_id, original_url FROM urls WHERE user_id = ? AND is_deleted = FALSE";

  /** Only rows owned by the caller are touched. */
  static final String MARK_DELETED =
      "UPDATE urls SET is_deleted = TRUE WHERE short_id = ? AND user_id = ?";
}
