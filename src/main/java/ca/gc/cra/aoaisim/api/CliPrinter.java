package ca.gc.cra.aoaisim.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/** Writes usage and dry-run text to stdout, outside the logging pipeline. */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TARGET = new AtomicReference<>(STDOUT);

  private CliPrinter() {
    // Utility
  }

  static void printLines(String... lines) {
    PrintWriter writer = TARGET.get();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void redirectForTesting(PrintWriter writer) {
    TARGET.set(writer == null ? STDOUT : writer);
  }
}
