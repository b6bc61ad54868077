package com.pourrice.chat.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text and chat lines.
 *
 * <p>Writes to the stdout file descriptor so that console output never interleaves with the logging
 * configuration's appenders.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    synchronized (writer) {
      writer.println(message);
    }
  }

  /**
   * Prints several lines without interleaving with other threads.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    synchronized (writer) {
      for (String line : lines) {
        writer.println(line);
      }
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
