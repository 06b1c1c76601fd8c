package ca.gc.cra.teleq.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;

/**
 * Writes command results to stdout.
 *
 * <p>Logs go to stderr through Logback, so {@code teleq query} output can be piped without log noise.
 * Tests swap the writer with {@link #setWriterForTesting(PrintWriter)}.</p>
 */
public final class CliPrinter {
  static final String CELL_SEPARATOR = " | ";

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  /**
   * Prints one line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    out().println(message);
  }

  /**
   * Prints each line in order; a {@code null} array prints nothing.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines != null) {
      PrintWriter out = out();
      for (String line : lines) {
        out.println(line);
      }
    }
  }

  /**
   * Prints a header row then one line per row, cells joined by {@value #CELL_SEPARATOR}.
   * Nothing is printed when there are no columns; {@code null} cells print as empty text.
   *
   * @param columns column names
   * @param rows row cells
   */
  public static void printTable(List<String> columns, List<? extends List<?>> rows) {
    if (columns.isEmpty()) {
      return;
    }
    PrintWriter out = out();
    out.println(String.join(CELL_SEPARATOR, columns));
    for (List<?> row : rows) {
      StringJoiner line = new StringJoiner(CELL_SEPARATOR);
      for (Object cell : row) {
        line.add(cell == null ? "" : cell.toString());
      }
      out.println(line);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer == null ? STDOUT : writer;
  }
}
