package ca.gc.cra.tbfs.testutil;

import ca.gc.cra.tbfs.application.port.RecordCodec.RecordDecoder;
import ca.gc.cra.tbfs.application.port.RecordCodec.RecordEncoder;
import ca.gc.cra.tbfs.domain.record.TypedRecord;
import ca.gc.cra.tbfs.infrastructure.codec.TypedBytesCodec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes and reads local typed bytes files for tests.
 */
public final class TypedBytesFixtures {
  private static final TypedBytesCodec CODEC = new TypedBytesCodec();

  private TypedBytesFixtures() {}

  public static Path write(Path file, List<TypedRecord> records) throws IOException {
    try (OutputStream out = Files.newOutputStream(file);
        RecordEncoder encoder = CODEC.encoder(out)) {
      for (TypedRecord record : records) {
        encoder.write(record);
      }
    }
    return file;
  }

  /** Writes {@code count} records keyed {@code prefix-i} with integer values {@code i}. */
  public static Path writeSequence(Path file, String prefix, int count) throws IOException {
    List<TypedRecord> records = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      records.add(TypedRecord.of(prefix + "-" + i, i));
    }
    return write(file, records);
  }

  public static List<TypedRecord> read(Path file) throws IOException {
    List<TypedRecord> records = new ArrayList<>();
    try (InputStream in = Files.newInputStream(file);
        RecordDecoder decoder = CODEC.decoder(in)) {
      TypedRecord record;
      while ((record = decoder.next()) != null) {
        records.add(record);
      }
    }
    return records;
  }
}
