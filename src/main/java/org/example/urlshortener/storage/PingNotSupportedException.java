package org.example.urlshortener.storage;

/**
 * Returned by {@link UrlStorage#ping()} on backends that have no database connection to check.
 *
 * <p>Front ends should treat it as "nothing to check" rather than "database is down".
 */
public class PingNotSupportedException extends StorageException {

  public PingNotSupportedException(String backend) {
    super(backend + " does not support database connection check");
  }
}
