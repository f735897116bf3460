package org.example.urlshortener.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.example.urlshortener.service.ShortIdGenerator;
import org.example.urlshortener.service.UrlShortenerService;
import org.example.urlshortener.storage.MemoryUrlStorage;
import org.example.urlshortener.storage.StorageException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConsoleShell}.
 *
 * <p>Commands run against an in-memory backend with a counting id generator ({@code s1}, {@code
 * s2}, ...). Output goes to a byte buffer; the user id file lives in a {@code @TempDir}.
 */
public class ConsoleShellTest {

  private static final String BASE = "http://x";

  @TempDir Path tempDir;

  private MemoryUrlStorage storage;
  private UrlShortenerService service;
  private ByteArrayOutputStream buf;
  private ConsoleShell shell;

  @BeforeEach
  void setUp() {
    storage = new MemoryUrlStorage();
    service = new UrlShortenerService(storage, counting(), BASE);
    shell = newShell(service, "");
  }

  @AfterEach
  void tearDown() {
    service.close();
  }

  // ---------- helpers ----------

  private static ShortIdGenerator counting() {
    AtomicInteger n = new AtomicInteger();
    return () -> "s" + n.incrementAndGet();
  }

  private ConsoleShell newShell(UrlShortenerService svc, String script) {
    buf = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
    ConsoleInput in =
        new ConsoleInput(new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)), out);
    return new ConsoleShell(svc, in, out, new LocalUserId(tempDir.resolve("user.id")), 2048);
  }

  /** Runs one command and returns what it printed. */
  private String run(String line) {
    buf.reset();
    assertTrue(shell.execute(line));
    return buf.toString(StandardCharsets.UTF_8).trim();
  }

  // ---------- tests ----------

  @Test
  @DisplayName("shorten prints created, then exists for the same URL")
  void shorten_createdThenExists() {
    assertEquals("created http://x/s1", run("shorten https://example.com"));
    assertEquals("exists http://x/s1", run("shorten https://example.com"));
  }

  @Test
  @DisplayName("invalid input prints the reason and does not reach the service")
  void shorten_invalid() {
    assertEquals("Only http/https URLs are allowed.", run("shorten ftp://example.com"));
    assertEquals("Usage: shorten <url>", run("shorten"));
    assertTrue(storage.getUrlsByUserId(shell.getUserId()).isEmpty());
  }

  @Test
  @DisplayName("batch prints one line per item with its correlation id")
  void batch() {
    String out = run("batch a=https://a.example b=https://b.example");

    assertEquals("a http://x/s1\nb http://x/s2", out.replace("\r\n", "\n"));
    assertEquals("Expected <corrId>=<url>, got: nope", run("batch nope"));
  }

  @Test
  @DisplayName("get accepts a bare id or a full short URL")
  void get() {
    run("shorten https://example.com");

    assertEquals("-> https://example.com", run("get s1"));
    assertEquals("-> https://example.com", run("get http://x/s1"));
    assertEquals("Not found: zzz", run("get zzz"));
  }

  @Test
  @DisplayName("list shows the current user's URLs")
  void list() {
    assertEquals("No URLs.", run("list"));
    run("shorten https://example.com");
    assertEquals("http://x/s1 -> https://example.com", run("list"));
  }

  @Test
  @DisplayName("delete is accepted at once and applied in the background")
  void delete() {
    run("shorten https://example.com");

    assertEquals("accepted 1", run("delete http://x/s1"));
    service.close();

    assertEquals(Optional.empty(), storage.get("s1"));
  }

  @Test
  @DisplayName("ping reports that the memory backend has no database")
  void ping() {
    assertEquals("ping: no database configured", run("ping"));
  }

  @Test
  @DisplayName("user switches identity and persists it")
  void switchUser() throws Exception {
    String original = shell.getUserId();
    assertEquals("User: " + original, run("whoami"));

    assertEquals("User: bob", run("user bob"));
    run("shorten https://bob.example");

    assertEquals("bob", shell.getUserId());
    assertEquals("bob", Files.readString(tempDir.resolve("user.id")).trim());
    assertEquals(1, storage.getUrlsByUserId("bob").size());
    assertTrue(storage.getUrlsByUserId(original).isEmpty());
  }

  @Test
  @DisplayName("unknown commands point at help, quit ends the session")
  void unknownAndQuit() {
    assertEquals("Unknown command: frob (try 'help')", run("frob"));
    assertTrue(run("help").startsWith("Commands:"));
    assertFalse(shell.execute("quit"));
    assertFalse(shell.execute("Q"));
  }

  @Test
  @DisplayName("backend and generator failures are printed, not thrown")
  void failuresPrinted() {
    MemoryUrlStorage failing =
        new MemoryUrlStorage() {
          @Override
          public void save(String shortId, String originalUrl, String userId)
              throws StorageException {
            throw new StorageException("disk full");
          }
        };
    try (UrlShortenerService broken = new UrlShortenerService(failing, counting(), BASE)) {
      shell = newShell(broken, "");
      String out = run("shorten https://example.com");
      assertTrue(out.startsWith("Storage error: "), out);
      assertTrue(out.contains("disk full"), out);
    }

    try (UrlShortenerService empty =
        new UrlShortenerService(new MemoryUrlStorage(), () -> "", BASE)) {
      shell = newShell(empty, "");
      String out = run("shorten https://example.com");
      assertTrue(out.startsWith("Service error: Failed to generate short ID"), out);
    }
  }

  @Test
  @DisplayName("mainLoop runs scripted commands until quit")
  void mainLoop_quit() {
    shell = newShell(service, "shorten https://example.com\n\nlist\nquit\nlist\n");

    shell.mainLoop();

    String out = buf.toString(StandardCharsets.UTF_8);
    assertTrue(out.contains("created http://x/s1"));
    assertTrue(out.contains("http://x/s1 -> https://example.com"));
    assertFalse(out.contains("Input closed"));
  }

  @Test
  @DisplayName("mainLoop stops at end of input")
  void mainLoop_eof() {
    shell = newShell(service, "whoami\n");

    shell.mainLoop();

    assertTrue(buf.toString(StandardCharsets.UTF_8).contains("Input closed. Exiting."));
  }

  @Test
  @DisplayName("the same user id is reused across sessions")
  void userId_persisted() {
    String first = shell.getUserId();
    ConsoleShell again = newShell(service, "");
    assertEquals(first, again.getUserId());
  }
}
