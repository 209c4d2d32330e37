package io.github.deckfilter.cli.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.deckfilter.model.ResolvedReport;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes resolved reports as JSON.
 */
public class ReportPrinter {

  private final ObjectMapper objectMapper;

  /**
   * Constructor.
   *
   * @param objectMapper the object mapper
   */
  public ReportPrinter(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Write to a file, creating parent directories.
   *
   * @param report the report
   * @param output the output
   * @throws IOException on write failure
   */
  public void write(final ResolvedReport report, final Path output) throws IOException {
    if (output.getParent() != null) {
      Files.createDirectories(output.getParent());
    }
    objectMapper.writeValue(output.toFile(), report);
  }

  /**
   * Print to a writer.
   *
   * @param report the report
   * @param out    the writer
   * @throws IOException on serialization failure
   */
  public void print(final ResolvedReport report, final PrintWriter out) throws IOException {
    out.println(objectMapper.writeValueAsString(report));
    out.flush();
  }
}
