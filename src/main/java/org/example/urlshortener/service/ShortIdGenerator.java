package org.example.urlshortener.service;

/**
 * Source of short identifiers.
 *
 * <p>Implementations make no uniqueness promise; collisions are detected by the storage backend
 * and handled by {@link UrlShortenerService}. Must be safe for concurrent use.
 */
@FunctionalInterface
public interface ShortIdGenerator {

  /**
   * Produces a new identifier.
   *
   * @return identifier; an empty result is treated as a configuration error by the service
   */
  String generate();
}
