package io.sm2env.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes the human-facing lines of a run (help, usage, confirmations and secret listings) to stdout.
 *
 * <p>Rendered secrets go through {@code OutputPort}; this class only carries the text around them. Logs stay on
 * stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  /**
   * Prints one line, typically usage text or a write confirmation.
   *
   * @param line text without trailing newline
   */
  public static void println(String line) {
    out().println(line);
  }

  /**
   * Prints the result of a {@code list} run.
   *
   * <p>An empty list prints {@code No secrets found.}; otherwise a header, one {@code - name} line per secret, a
   * blank line and the total.</p>
   *
   * @param names secret names in display order
   */
  public static void secretNames(List<String> names) {
    PrintWriter out = out();
    if (names.isEmpty()) {
      out.println("No secrets found.");
      return;
    }
    out.println("Available secrets:");
    names.forEach(name -> out.println("- " + name));
    out.println();
    out.println("Total: " + names.size() + " secrets");
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer != null ? writer : CONSOLE;
  }
}
