package ca.gc.cra.tbfs.application.pipeline;

import ca.gc.cra.tbfs.domain.record.TextRecords;
import ca.gc.cra.tbfs.domain.record.TypedRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Loads a local tab-separated text file into a cluster typed bytes file, one record per line.
 *
 * <p>Lines are parsed with {@link TextRecords#parse(String)} and streamed; the input is never held in memory.</p>
 *
 * @since 0.1.0
 */
public final class LoadRecordsUseCase {
  private static final Logger log = LoggerFactory.getLogger(LoadRecordsUseCase.class);

  private final RecordWriter writer;

  /**
   * Creates the use case.
   *
   * @param writer record writer targeting the cluster
   */
  public LoadRecordsUseCase(RecordWriter writer) {
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  /**
   * Writes every line of {@code input} to {@code destination}.
   *
   * @param destination cluster path of the file to create
   * @param input local UTF-8 text file
   * @return number of records written
   * @throws IOException if the input cannot be read or the load fails
   */
  public long run(String destination, Path input) throws IOException {
    Objects.requireNonNull(input, "input");
    MDC.put("operation", "writetb");
    try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
      long written = writer.write(destination, new LineRecords(reader));
      log.info("Wrote {} record(s) from {} to {}", written, input, destination);
      return written;
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    } finally {
      MDC.remove("operation");
    }
  }

  private static final class LineRecords implements Iterator<TypedRecord> {
    private final BufferedReader reader;
    private String nextLine;
    private boolean done;

    private LineRecords(BufferedReader reader) {
      this.reader = reader;
    }

    @Override
    public boolean hasNext() {
      if (nextLine != null) {
        return true;
      }
      if (done) {
        return false;
      }
      try {
        nextLine = reader.readLine();
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
      done = nextLine == null;
      return !done;
    }

    @Override
    public TypedRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      String line = nextLine;
      nextLine = null;
      return TextRecords.parse(line);
    }
  }
}
