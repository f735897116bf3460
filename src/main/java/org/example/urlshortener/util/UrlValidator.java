package org.example.urlshortener.util;

import java.net.URI;
import java.util.Locale;

/**
 * Validates HTTP/HTTPS URLs before they reach the shortening service.
 *
 * <p>The shortening core treats URLs as opaque strings, so every front end checks its input here
 * first. Accepted URLs parse as a {@link URI}, use the {@code http} or {@code https} scheme and
 * have a non-blank host. Leading/trailing whitespace is ignored.
 */
public final class UrlValidator {
  private UrlValidator() {}

  /**
   * Returns the trimmed URL if it is acceptable, otherwise explains why not.
   *
   * @param url candidate URL string
   * @param maxLen maximum allowed length after trimming
   * @return the trimmed URL
   * @throws IllegalArgumentException with a user-readable reason when the URL is rejected
   */
  public static String requireHttpUrl(String url, int maxLen) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Empty URL.");
    }
    String trimmed = url.trim();
    if (trimmed.length() > maxLen) {
      throw new IllegalArgumentException("URL is longer than " + maxLen + " characters.");
    }
    URI uri;
    try {
      uri = URI.create(trimmed);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed URL: " + trimmed, e);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("Only http/https URLs are allowed.");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("URL has no host.");
    }
    return trimmed;
  }

  /**
   * Boolean form of {@link #requireHttpUrl(String, int)}.
   *
   * @param url candidate URL string
   * @param maxLen maximum allowed length after trimming
   * @return {@code true} if the URL would be accepted
   */
  public static boolean isValidHttpUrl(String url, int maxLen) {
    try {
      requireHttpUrl(url, maxLen);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
