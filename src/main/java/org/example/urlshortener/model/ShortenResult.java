package org.example.urlshortener.model;

import java.util.Objects;

/**
 * Outcome of shortening a single URL.
 *
 * <p>{@code isNew} is {@code false} when the URL already had a live short identifier (created by
 * any user) and that existing identifier is returned instead of a new one. Front ends use it to
 * choose between "created" and "conflict" responses.
 */
public final class ShortenResult {

  private final String shortUrl;
  private final boolean isNew;

  /**
   * @param shortUrl full short URL ({@code baseUrl + "/" + shortId})
   * @param isNew whether a new mapping was stored
   */
  public ShortenResult(String shortUrl, boolean isNew) {
    this.shortUrl = shortUrl;
    this.isNew = isNew;
  }

  public String getShortUrl() {
    return shortUrl;
  }

  public boolean isNew() {
    return isNew;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ShortenResult)) return false;
    ShortenResult that = (ShortenResult) o;
    return isNew == that.isNew && Objects.equals(shortUrl, that.shortUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shortUrl, isNew);
  }

  @Override
  public String toString() {
    return "ShortenResult{shortUrl='" + shortUrl + "', isNew=" + isNew + '}';
  }
}
