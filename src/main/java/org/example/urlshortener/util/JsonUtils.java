package org.example.urlshortener.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON utilities for the application.
 *
 * <p>Provides the {@link Gson} configuration shared by the file backend and the configuration
 * loader: pretty printing, HTML escaping disabled so URLs containing {@code &} or {@code =} stay
 * readable on disk.
 *
 * <p><b>Thread safety:</b> the returned {@link Gson} instance is immutable and can be reused from
 * any thread.
 */
public final class JsonUtils {
  private JsonUtils() {}

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  /**
   * Returns the shared {@link Gson} instance.
   *
   * @return configured Gson ready for use across the app
   */
  public static Gson gson() {
    return GSON;
  }
}
