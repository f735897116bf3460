package org.example.urlshortener.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.*;

public class RandomShortIdGeneratorTest {

  @Test
  @DisplayName("ids have the configured length and use only alphanumerics")
  void lengthAndAlphabet() {
    RandomShortIdGenerator gen = new RandomShortIdGenerator(8);
    for (int i = 0; i < 500; i++) {
      String id = gen.generate();
      assertEquals(8, id.length());
      assertTrue(id.matches("[a-zA-Z0-9]+"), "Unexpected character in " + id);
    }
  }

  @Test
  @DisplayName("length 0 yields empty ids, negative length is rejected")
  void edgeLengths() {
    assertEquals("", new RandomShortIdGenerator(0).generate());
    assertThrows(IllegalArgumentException.class, () -> new RandomShortIdGenerator(-1));
  }

  @Test
  @DisplayName("the same seed yields the same sequence")
  void seeded() {
    RandomShortIdGenerator a = new RandomShortIdGenerator(10, new Random(42));
    RandomShortIdGenerator b = new RandomShortIdGenerator(10, new Random(42));
    for (int i = 0; i < 20; i++) {
      assertEquals(a.generate(), b.generate());
    }
  }

  @Test
  @DisplayName("many ids are practically unique")
  void practicallyUnique() {
    RandomShortIdGenerator gen = new RandomShortIdGenerator(8);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 10_000; i++) seen.add(gen.generate());
    assertEquals(10_000, seen.size());
  }

  @Test
  @DisplayName("concurrent callers all get well-formed ids")
  void concurrentCallers() throws Exception {
    RandomShortIdGenerator gen = new RandomShortIdGenerator(6);
    Set<String> seen = Collections.synchronizedSet(new HashSet<>());
    Thread[] threads = new Thread[4];
    for (int t = 0; t < threads.length; t++) {
      threads[t] =
          new Thread(
              () -> {
                for (int i = 0; i < 250; i++) seen.add(gen.generate());
              });
      threads[t].start();
    }
    for (Thread t : threads) t.join();

    assertTrue(seen.size() > 990, "Too many repeats: " + seen.size());
    for (String id : seen) assertEquals(6, id.length());
  }
}
