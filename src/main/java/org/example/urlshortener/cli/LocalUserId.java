package org.example.urlshortener.cli;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Stable pseudo-identity of the console user.
 *
 * <p>The id is a random UUID kept in a one-line text file ({@code .local/user.id} by default). The
 * shortening service treats it as an opaque owner id; nothing here authenticates anyone.
 *
 * <p>On I/O failure a warning goes to {@code System.err} and an ephemeral id is used for the
 * current process only.
 */
public final class LocalUserId {

  /** Default location of the id file. */
  public static final Path DEFAULT_FILE = Paths.get(".local", "user.id");

  private final Path file;

  public LocalUserId(Path file) {
    this.file = file;
  }

  /**
   * Returns the stored id, creating and storing a new one when the file is missing or blank.
   *
   * @return user id (never {@code null})
   */
  public String ensure() {
    try {
      if (Files.exists(file)) {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
          String s = br.readLine();
          if (s != null && !s.isBlank()) {
            return s.trim();
          }
        }
      }
      String generated = UUID.randomUUID().toString();
      write(generated);
      return generated;
    } catch (IOException e) {
      String fallback = UUID.randomUUID().toString();
      System.err.println(
          "Warning: cannot persist user id, using ephemeral: "
              + fallback
              + " (cause: "
              + e.getMessage()
              + ")");
      return fallback;
    }
  }

  /**
   * Replaces the stored id, e.g. to act as another user.
   *
   * @param userId new id; must be non-blank (format is not validated)
   * @return {@code true} if written; {@code false} for blank input or an I/O error
   */
  public boolean switchTo(String userId) {
    if (userId == null || userId.isBlank()) return false;
    try {
      write(userId.trim());
      return true;
    } catch (IOException e) {
      System.err.println("Failed to write user id: " + e.getMessage());
      return false;
    }
  }

  private void write(String userId) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    try (BufferedWriter bw =
        Files.newBufferedWriter(
            file,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      bw.write(userId);
      bw.write("\n");
    }
  }
}
