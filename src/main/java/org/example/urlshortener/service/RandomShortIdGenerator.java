package org.example.urlshortener.service;

import java.util.Random;

/**
 * Generates fixed-length identifiers drawn uniformly from the 62 alphanumeric characters.
 *
 * <p>The random source is seeded once at construction. {@link #generate()} is synchronized.
 */
public class RandomShortIdGenerator implements ShortIdGenerator {

  private static final char[] B62 =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

  private final int length;
  private final Random rnd;

  /**
   * @param length identifier length; {@code 0} yields empty identifiers
   */
  public RandomShortIdGenerator(int length) {
    this(length, new Random());
  }

  /**
   * @param length identifier length
   * @param rnd random source, used as is (tests pass a seeded one)
   */
  public RandomShortIdGenerator(int length, Random rnd) {
    if (length < 0) {
      throw new IllegalArgumentException("Short id length must not be negative: " + length);
    }
    this.length = length;
    this.rnd = rnd;
  }

  public int getLength() {
    return length;
  }

  @Override
  public synchronized String generate() {
    char[] c = new char[length];
    for (int i = 0; i < length; i++) c[i] = B62[rnd.nextInt(B62.length)];
    return new String(c);
  }
}
