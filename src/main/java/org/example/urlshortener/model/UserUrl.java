package org.example.urlshortener.model;

import java.util.Objects;

/**
 * Externally visible projection of a live record owned by a user.
 *
 * <p>Backends fill {@code shortUrl} with the bare short identifier; the service rewrites it to the
 * full short URL before handing the list out. Instances are immutable, so cached lists can be
 * shared between callers.
 */
public final class UserUrl {

  /** Short identifier (from a backend) or full short URL (from the service). */
  public final String shortUrl;

  /** The original URL. */
  public final String originalUrl;

  public UserUrl(String shortUrl, String originalUrl) {
    this.shortUrl = shortUrl;
    this.originalUrl = originalUrl;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof UserUrl)) return false;
    UserUrl that = (UserUrl) o;
    return Objects.equals(shortUrl, that.shortUrl) && Objects.equals(originalUrl, that.originalUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shortUrl, originalUrl);
  }

  @Override
  public String toString() {
    return shortUrl + " -> " + originalUrl;
  }
}
