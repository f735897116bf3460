package org.example.urlshortener.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.example.urlshortener.model.UrlRecord;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

public class JsonFilesTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("writeAtomic creates parents and leaves no temp files behind")
  void writeAtomic_createsParents() throws Exception {
    Path target = tempDir.resolve("a/b/records.json");

    JsonFiles.writeAtomic(target, new UrlRecord[] {new UrlRecord("id1", "https://e.example", "u")});

    UrlRecord[] back = JsonFiles.read(target, UrlRecord[].class);
    assertEquals(1, back.length);
    assertEquals("id1", back[0].shortId);
    try (Stream<Path> files = Files.list(target.getParent())) {
      assertEquals(1, files.count(), "Only the target file should remain.");
    }
  }

  @Test
  @DisplayName("an empty file reads as null, malformed JSON as IOException")
  void read_emptyAndMalformed() throws Exception {
    Path empty = tempDir.resolve("empty.json");
    Files.writeString(empty, "  ", StandardCharsets.UTF_8);
    assertNull(JsonFiles.read(empty, UrlRecord[].class));

    Path bad = tempDir.resolve("bad.json");
    Files.writeString(bad, "[{", StandardCharsets.UTF_8);
    assertThrows(IOException.class, () -> JsonFiles.read(bad, UrlRecord[].class));
  }

  @Test
  @DisplayName("URLs are written without HTML escaping")
  void noHtmlEscaping() throws Exception {
    Path target = tempDir.resolve("q.json");
    JsonFiles.writeAtomic(
        target, new UrlRecord[] {new UrlRecord("q", "https://e.example/?a=1&b=<2>", "u")});

    String raw = Files.readString(target, StandardCharsets.UTF_8);
    assertTrue(raw.contains("?a=1&b=<2>"), raw);
  }
}
