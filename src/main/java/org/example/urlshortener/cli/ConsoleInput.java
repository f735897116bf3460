package org.example.urlshortener.cli;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Scanner;

/**
 * Line-oriented console input.
 *
 * <p>Wraps a UTF-8 {@link Scanner} over the given stream. {@link #readTrimmed(String)} prints a
 * prompt, reads one line and trims it; it returns {@code null} on end of input.
 */
public final class ConsoleInput {

  private final Scanner sc;
  private final PrintStream out;

  /**
   * @param in source of lines (usually {@code System.in})
   * @param out where prompts are printed
   */
  public ConsoleInput(InputStream in, PrintStream out) {
    this.sc = new Scanner(in, StandardCharsets.UTF_8);
    this.out = out;
  }

  /**
   * Prints {@code prompt} (without newline) and reads one line.
   *
   * @param prompt text printed before reading
   * @return trimmed line, or {@code null} if the input is exhausted or closed
   */
  public String readTrimmed(String prompt) {
    out.print(prompt);
    try {
      return sc.nextLine().trim();
    } catch (IllegalStateException | NoSuchElementException e) {
      return null; // input stream closed
    }
  }
}
