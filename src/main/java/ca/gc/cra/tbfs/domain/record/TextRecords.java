package ca.gc.cra.tbfs.domain.record;

import java.util.Base64;
import java.util.Objects;

/**
 * Converts records to and from the tab-separated text lines used by the CLI.
 *
 * <p>Formatting renders {@code byte[]} as Base64 and every other value through {@link String#valueOf(Object)}.
 * Parsing splits on the first tab and yields string keys and values.</p>
 */
public final class TextRecords {
  private static final char SEPARATOR = '\t';

  private TextRecords() {}

  /**
   * Renders one record as {@code key<TAB>value}.
   *
   * @param record record to render
   * @return single line without terminator
   */
  public static String format(TypedRecord record) {
    Objects.requireNonNull(record, "record");
    return render(record.key()) + SEPARATOR + render(record.value());
  }

  /**
   * Parses a {@code key<TAB>value} line into a string record. A line without a tab becomes a key with an
   * empty value.
   *
   * @param line text line without terminator
   * @return parsed record
   */
  public static TypedRecord parse(String line) {
    Objects.requireNonNull(line, "line");
    int idx = line.indexOf(SEPARATOR);
    if (idx < 0) {
      return new TypedRecord(line, "");
    }
    return new TypedRecord(line.substring(0, idx), line.substring(idx + 1));
  }

  private static String render(Object value) {
    if (value instanceof byte[] bytes) {
      return Base64.getEncoder().encodeToString(bytes);
    }
    return String.valueOf(value);
  }
}
