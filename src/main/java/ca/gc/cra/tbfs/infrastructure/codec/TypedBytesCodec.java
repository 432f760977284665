package ca.gc.cra.tbfs.infrastructure.codec;

import ca.gc.cra.tbfs.application.port.RecordCodec;
import ca.gc.cra.tbfs.domain.record.TypedRecord;
import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link RecordCodec} for the typed bytes format produced by {@code dumptb} and consumed by {@code loadtb}:
 * each record is a key value immediately followed by a value value.
 *
 * @since 0.1.0
 */
public final class TypedBytesCodec implements RecordCodec {

  @Override
  public RecordDecoder decoder(InputStream in) {
    Objects.requireNonNull(in, "in");
    return new Decoder(in instanceof BufferedInputStream ? in : new BufferedInputStream(in));
  }

  @Override
  public RecordEncoder encoder(OutputStream out) {
    return new Encoder(Objects.requireNonNull(out, "out"));
  }

  private static final class Decoder implements RecordDecoder {
    private final InputStream stream;
    private final TypedBytesInput in;

    private Decoder(InputStream stream) {
      this.stream = stream;
      this.in = new TypedBytesInput(stream);
    }

    @Override
    public TypedRecord next() throws IOException {
      int typeByte = in.readTypeOrEnd();
      if (typeByte < 0) {
        return null;
      }
      Object key = in.readValue(typeByte);
      Object value;
      try {
        value = in.readValue();
      } catch (EOFException ex) {
        EOFException truncated = new EOFException("Stream ended between a record key and its value");
        truncated.initCause(ex);
        throw truncated;
      }
      return new TypedRecord(key, value);
    }

    @Override
    public void close() throws IOException {
      stream.close();
    }
  }

  private static final class Encoder implements RecordEncoder {
    private final OutputStream stream;
    private final TypedBytesOutput out;

    private Encoder(OutputStream stream) {
      this.stream = stream;
      this.out = new TypedBytesOutput(stream);
    }

    @Override
    public void write(TypedRecord record) throws IOException {
      Objects.requireNonNull(record, "record");
      TypedBytesOutput.requireEncodable(record.key());
      TypedBytesOutput.requireEncodable(record.value());
      out.writeValue(record.key());
      out.writeValue(record.value());
    }

    @Override
    public void flush() throws IOException {
      out.flush();
    }

    @Override
    public void close() throws IOException {
      try {
        out.flush();
      } finally {
        stream.close();
      }
    }
  }
}
