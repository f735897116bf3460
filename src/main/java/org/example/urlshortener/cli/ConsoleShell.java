package org.example.urlshortener.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.example.urlshortener.model.BatchShortenRequest;
import org.example.urlshortener.model.BatchShortenResponse;
import org.example.urlshortener.model.ShortenResult;
import org.example.urlshortener.model.UserUrl;
import org.example.urlshortener.service.UrlShortenerService;
import org.example.urlshortener.storage.PingNotSupportedException;
import org.example.urlshortener.storage.StorageException;
import org.example.urlshortener.util.UrlValidator;

/**
 * Command-line front end of the shortener.
 *
 * <p>Reads one command per line, validates the input, calls {@link UrlShortenerService} on behalf
 * of the current user and prints the outcome. Service failures are printed, never thrown, so one
 * bad command does not end the session.
 *
 * <h2>Commands</h2>
 *
 * <ul>
 *   <li>{@code shorten <url>} – prints {@code created} or {@code exists} with the short URL
 *   <li>{@code batch <corrId>=<url> ...} – one line per item
 *   <li>{@code get <id>} – resolves a short id
 *   <li>{@code list} – the current user's URLs
 *   <li>{@code delete <id> ...} – accepted at once, deleted in the background
 *   <li>{@code ping} – storage connectivity
 *   <li>{@code whoami}, {@code user <id>}, {@code help}, {@code quit}
 * </ul>
 *
 * <p>Intended for single-threaded, interactive use.
 */
public class ConsoleShell {

  private final UrlShortenerService service;
  private final ConsoleInput input;
  private final PrintStream out;
  private final LocalUserId identity;
  private final int maxUrlLength;
  private String userId;

  /**
   * @param service shortening service
   * @param input command source
   * @param out where results are printed
   * @param identity store of the current user id
   * @param maxUrlLength longest accepted URL
   */
  public ConsoleShell(
      UrlShortenerService service,
      ConsoleInput input,
      PrintStream out,
      LocalUserId identity,
      int maxUrlLength) {
    this.service = service;
    this.input = input;
    this.out = out;
    this.identity = identity;
    this.maxUrlLength = maxUrlLength;
    this.userId = identity.ensure();
  }

  public String getUserId() {
    return userId;
  }

  /** Runs until {@code quit} or end of input. */
  public void mainLoop() {
    while (true) {
      String line = input.readTrimmed("> ");
      if (line == null) {
        out.println("Input closed. Exiting.");
        return;
      }
      if (line.isEmpty()) continue;
      if (!execute(line)) return;
    }
  }

  /**
   * Executes a single command line.
   *
   * @param line command with arguments separated by whitespace
   * @return {@code false} if the command asks to exit
   */
  public boolean execute(String line) {
    String[] parts = line.trim().split("\\s+");
    String cmd = parts[0].toLowerCase(Locale.ROOT);
    List<String> args = Arrays.asList(parts).subList(1, parts.length);
    try {
      switch (cmd) {
        case "shorten" -> actionShorten(args);
        case "batch" -> actionBatch(args);
        case "get" -> actionGet(args);
        case "list" -> actionList();
        case "delete" -> actionDelete(args);
        case "ping" -> actionPing();
        case "whoami" -> out.println("User: " + userId);
        case "user" -> actionSwitchUser(args);
        case "help" -> printHelp();
        case "quit", "exit", "q" -> {
          return false;
        }
        default -> out.println("Unknown command: " + cmd + " (try 'help')");
      }
    } catch (IllegalArgumentException e) {
      out.println(e.getMessage());
    } catch (StorageException e) {
      out.println("Storage error: " + e.getMessage());
    } catch (IllegalStateException e) {
      out.println("Service error: " + e.getMessage());
    }
    return true;
  }

  private void actionShorten(List<String> args) throws StorageException {
    if (args.size() != 1) throw new IllegalArgumentException("Usage: shorten <url>");
    String url = UrlValidator.requireHttpUrl(args.get(0), maxUrlLength);
    ShortenResult r = service.shorten(url, userId);
    out.println((r.isNew() ? "created " : "exists ") + r.getShortUrl());
  }

  private void actionBatch(List<String> args) throws StorageException {
    if (args.isEmpty()) throw new IllegalArgumentException("Usage: batch <corrId>=<url> ...");
    List<BatchShortenRequest> items = new ArrayList<>(args.size());
    for (String arg : args) {
      int eq = arg.indexOf('=');
      if (eq <= 0) throw new IllegalArgumentException("Expected <corrId>=<url>, got: " + arg);
      String url = UrlValidator.requireHttpUrl(arg.substring(eq + 1), maxUrlLength);
      items.add(new BatchShortenRequest(arg.substring(0, eq), url));
    }
    for (BatchShortenResponse r : service.shortenBatch(items, userId)) {
      out.println(r.correlationId + " " + r.shortUrl);
    }
  }

  private void actionGet(List<String> args) throws StorageException {
    if (args.size() != 1) throw new IllegalArgumentException("Usage: get <id>");
    Optional<String> url = service.get(stripBase(args.get(0)));
    out.println(url.map(u -> "-> " + u).orElse("Not found: " + args.get(0)));
  }

  private void actionList() throws StorageException {
    List<UserUrl> urls = service.getUrlsByUserId(userId);
    if (urls.isEmpty()) {
      out.println("No URLs.");
      return;
    }
    for (UserUrl u : urls) {
      out.println(u.shortUrl + " -> " + u.originalUrl);
    }
  }

  private void actionDelete(List<String> args) {
    if (args.isEmpty()) throw new IllegalArgumentException("Usage: delete <id> ...");
    List<String> ids = new ArrayList<>(args.size());
    for (String a : args) ids.add(stripBase(a));
    service.deleteUrls(ids, userId);
    out.println("accepted " + ids.size());
  }

  private void actionPing() throws StorageException {
    try {
      service.ping();
      out.println("ping: ok");
    } catch (PingNotSupportedException e) {
      out.println("ping: no database configured");
    }
  }

  private void actionSwitchUser(List<String> args) {
    if (args.size() != 1) throw new IllegalArgumentException("Usage: user <id>");
    if (identity.switchTo(args.get(0))) {
      userId = args.get(0);
      out.println("User: " + userId);
    } else {
      out.println("Could not switch user.");
    }
  }

  /** Accepts either a bare short id or a full short URL. */
  private String stripBase(String raw) {
    String prefix = service.getBaseUrl() + "/";
    return raw.startsWith(prefix) ? raw.substring(prefix.length()) : raw;
  }

  private void printHelp() {
    out.println("Commands:");
    out.println("  shorten <url>                 shorten one URL");
    out.println("  batch <corrId>=<url> ...      shorten several URLs at once");
    out.println("  get <id>                      resolve a short id");
    out.println("  list                          list your URLs");
    out.println("  delete <id> ...               delete your URLs");
    out.println("  ping                          check the storage connection");
    out.println("  whoami | user <id>            show or switch the current user");
    out.println("  quit                          exit");
  }
}
