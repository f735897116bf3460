package org.example.urlshortener.util;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Minimal JSON file helper.
 *
 * <ul>
 *   <li>{@link #read(Path, Type)} parses a whole file into a model type.
 *   <li>{@link #writeAtomic(Path, Object)} writes to a temporary sibling file and then atomically
 *       moves it into place, so readers never observe a partially written file.
 * </ul>
 *
 * <p>All file I/O uses UTF-8. The class is stateless; callers serialize concurrent writers to the
 * same path themselves.
 */
public final class JsonFiles {
  private JsonFiles() {}

  private static final Gson GSON = JsonUtils.gson();

  /**
   * Reads JSON from {@code path} into an object of type {@code typeOfT}.
   *
   * @param path file to read; must exist
   * @param typeOfT target type (e.g. {@code new TypeToken<List<Foo>>() {}.getType()})
   * @param <T> result type
   * @return parsed value, or {@code null} when the file is empty or contains only whitespace
   * @throws IOException if the file cannot be read or does not contain valid JSON for {@code
   *     typeOfT}
   */
  public static <T> T read(Path path, Type typeOfT) throws IOException {
    try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return GSON.fromJson(br, typeOfT);
    } catch (JsonParseException e) {
      throw new IOException("Malformed JSON in " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Writes {@code value} as JSON to {@code target} using an atomic replace.
   *
   * <p>The temporary file is named {@code .<filename>.tmp} and lives next to {@code target}.
   * Missing parent directories are created.
   *
   * @param target destination file
   * @param value object to serialize
   * @throws IOException if the directory cannot be created or the write/move fails
   */
  public static void writeAtomic(Path target, Object value) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(value, "value");

    Path abs = target.toAbsolutePath();
    Path parent = abs.getParent();
    if (parent == null) {
      throw new IOException("Target path has no parent directory: " + target);
    }
    Files.createDirectories(parent);

    Path fn = abs.getFileName();
    String baseName = (fn != null) ? fn.toString() : "data";
    Path tmp = parent.resolve("." + baseName + ".tmp");

    try (BufferedWriter bw =
        Files.newBufferedWriter(
            tmp,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(value, bw);
    }

    Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
