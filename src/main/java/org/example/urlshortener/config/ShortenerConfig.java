package org.example.urlshortener.config;

import com.google.gson.Gson;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.example.urlshortener.util.JsonFiles;
import org.example.urlshortener.util.JsonUtils;

/**
 * Application configuration holder with load helpers.
 *
 * <p>Values are resolved in layers, each overriding the previous one:
 *
 * <ol>
 *   <li>built-in defaults (the field initializers below);
 *   <li>a JSON file, {@code data/config.json} unless {@code -c} names another one; a missing file
 *       is created with defaults, an unreadable one is reported and ignored;
 *   <li>environment variables {@code BASE_URL}, {@code DATABASE_DSN}, {@code FILE_STORAGE_PATH},
 *       {@code SHORT_ID_LENGTH}, {@code DELETE_WORKERS};
 *   <li>command-line flags {@code -b}, {@code -d}, {@code -f}, {@code -l}, {@code -w}.
 * </ol>
 *
 * <p><b>File format:</b> pretty-printed JSON produced by Gson. All fields are public for simple
 * serialization.
 *
 * <pre>{@code
 * ShortenerConfig cfg = ShortenerConfig.load(args, System.getenv());
 * UrlStorage storage = StorageSelector.select(cfg.databaseDsn, cfg.fileStoragePath);
 * }</pre>
 */
public class ShortenerConfig {

  /** Prefix of every short URL, without a trailing slash. */
  public String baseUrl = "http://localhost:8080";

  /** Database connection string; empty disables the SQL backend. */
  public String databaseDsn = "";

  /** JSON storage file; empty disables the file backend. */
  public String fileStoragePath = "";

  /** Length of generated short ids. */
  public int shortIdLength = 8;

  /** Number of concurrent deletion workers. */
  public int deleteWorkers = 4;

  /** Longest URL accepted by the front end. */
  public int maxUrlLength = 2048;

  private static final Gson GSON = JsonUtils.gson();

  /** Default location of the configuration file. */
  public static final Path DEFAULT_CONFIG_PATH = Paths.get("data", "config.json");

  /**
   * Resolves the configuration from file, environment and flags, then validates it.
   *
   * @param args command-line arguments
   * @param env environment variables (usually {@link System#getenv()})
   * @return validated configuration
   * @throws IllegalArgumentException on an unknown flag, a flag without value, a non-numeric
   *     number or an invalid final value
   */
  public static ShortenerConfig load(String[] args, Map<String, String> env) {
    Path configPath = DEFAULT_CONFIG_PATH;
    String explicit = flagValue(args, "-c");
    if (explicit != null) configPath = Paths.get(explicit);

    ShortenerConfig cfg = loadOrCreateDefault(configPath);
    cfg.applyEnv(env);
    cfg.applyFlags(args);
    cfg.validate();
    return cfg;
  }

  /**
   * Loads configuration from {@code path}, creating the file with defaults if it does not exist.
   *
   * <p>If the file is present but cannot be read or parsed, defaults are used and the cause is
   * printed to {@code System.err}.
   *
   * @param path configuration file
   * @return configuration from disk or defaults (never {@code null})
   */
  public static ShortenerConfig loadOrCreateDefault(Path path) {
    try {
      if (Files.exists(path)) {
        ShortenerConfig cfg = JsonFiles.read(path, ShortenerConfig.class);
        return (cfg != null) ? cfg : new ShortenerConfig();
      }
      ShortenerConfig def = new ShortenerConfig();
      JsonFiles.writeAtomic(path, def);
      return def;
    } catch (IOException e) {
      System.err.println(
          "Failed to load " + path + ", using in-memory defaults. Cause: " + e.getMessage());
      return new ShortenerConfig();
    }
  }

  /**
   * Overrides fields from environment variables that are present and non-empty.
   *
   * @param env environment variables
   */
  void applyEnv(Map<String, String> env) {
    String v;
    if ((v = nonEmpty(env.get("BASE_URL"))) != null) baseUrl = v;
    if ((v = nonEmpty(env.get("DATABASE_DSN"))) != null) databaseDsn = v;
    if ((v = nonEmpty(env.get("FILE_STORAGE_PATH"))) != null) fileStoragePath = v;
    if ((v = nonEmpty(env.get("SHORT_ID_LENGTH"))) != null) {
      shortIdLength = parseInt("SHORT_ID_LENGTH", v);
    }
    if ((v = nonEmpty(env.get("DELETE_WORKERS"))) != null) {
      deleteWorkers = parseInt("DELETE_WORKERS", v);
    }
  }

  /**
   * Overrides fields from {@code -flag value} pairs.
   *
   * @param args command-line arguments
   */
  void applyFlags(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String flag = args[i];
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("Flag " + flag + " needs a value");
      }
      String value = args[++i];
      switch (flag) {
        case "-b" -> baseUrl = value;
        case "-d" -> databaseDsn = value;
        case "-f" -> fileStoragePath = value;
        case "-l" -> shortIdLength = parseInt(flag, value);
        case "-w" -> deleteWorkers = parseInt(flag, value);
        case "-c" -> {
          // handled before the file is read
        }
        default -> throw new IllegalArgumentException("Unknown flag: " + flag);
      }
    }
  }

  /**
   * Checks the resolved values.
   *
   * @throws IllegalArgumentException if any value is unusable
   */
  void validate() {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl must not be empty");
    }
    if (baseUrl.endsWith("/")) {
      throw new IllegalArgumentException("baseUrl must not end with '/': " + baseUrl);
    }
    if (shortIdLength <= 0) {
      throw new IllegalArgumentException("shortIdLength must be positive: " + shortIdLength);
    }
    if (deleteWorkers <= 0) {
      throw new IllegalArgumentException("deleteWorkers must be positive: " + deleteWorkers);
    }
    if (maxUrlLength <= 0) {
      throw new IllegalArgumentException("maxUrlLength must be positive: " + maxUrlLength);
    }
    if (databaseDsn == null) databaseDsn = "";
    if (fileStoragePath == null) fileStoragePath = "";
  }

  /**
   * Serializes this configuration as it would be written to disk.
   *
   * @return pretty-printed JSON
   */
  public String toJson() {
    return GSON.toJson(this);
  }

  private static String flagValue(String[] args, String flag) {
    for (int i = 0; i + 1 < args.length; i += 2) {
      if (flag.equals(args[i])) return args[i + 1];
    }
    return null;
  }

  private static String nonEmpty(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a number: " + value, e);
    }
  }
}
