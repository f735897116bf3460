package org.example.urlshortener.app;

import org.example.urlshortener.cli.ConsoleInput;
import org.example.urlshortener.cli.ConsoleShell;
import org.example.urlshortener.cli.LocalUserId;
import org.example.urlshortener.config.ShortenerConfig;
import org.example.urlshortener.service.RandomShortIdGenerator;
import org.example.urlshortener.service.UrlShortenerService;
import org.example.urlshortener.storage.StorageSelector;
import org.example.urlshortener.storage.UrlStorage;

/**
 * Entry point of the URL shortener console application.
 *
 * <ol>
 *   <li>Resolves configuration from {@code config.json}, the environment and flags (see {@link
 *       ShortenerConfig#load(String[], java.util.Map)}).
 *   <li>Selects the storage backend (SQL, file, then memory).
 *   <li>Builds the generator and the service, resolves the local user id.
 *   <li>Runs the console loop, then closes the service so queued deletions and file flushes
 *       complete.
 * </ol>
 */
public class Main {

  /**
   * Launches the application.
   *
   * @param args {@code -b baseUrl -d dsn -f file -l idLength -w deleteWorkers -c configPath}
   */
  public static void main(String[] args) {
    ShortenerConfig config;
    try {
      config = ShortenerConfig.load(args, System.getenv());
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid configuration: " + e.getMessage());
      System.exit(2);
      return;
    }

    UrlStorage storage = StorageSelector.select(config.databaseDsn, config.fileStoragePath);

    try (UrlShortenerService service =
        new UrlShortenerService(
            storage,
            new RandomShortIdGenerator(config.shortIdLength),
            config.baseUrl,
            config.deleteWorkers)) {
      ConsoleShell shell =
          new ConsoleShell(
              service,
              new ConsoleInput(System.in, System.out),
              System.out,
              new LocalUserId(LocalUserId.DEFAULT_FILE),
              config.maxUrlLength);

      System.out.println("========================================");
      System.out.println(" URL Shortener (Java)");
      System.out.println("========================================");
      System.out.println("User: " + shell.getUserId());
      System.out.println("Base URL: " + config.baseUrl);
      System.out.println("Type 'help' for commands, 'quit' to exit.\n");

      shell.mainLoop();
    }

    System.out.println("\nBye!");
  }
}
