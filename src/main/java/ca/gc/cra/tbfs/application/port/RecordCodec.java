package ca.gc.cra.tbfs.application.port;

import ca.gc.cra.tbfs.domain.record.TypedRecord;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * <strong>What:</strong> Port for the record serialization format exchanged with the streaming tool.
 * <p><strong>Role:</strong> Output port implemented by {@code TypedBytesCodec}; the multiplexer and writer treat
 * the wire format as opaque.</p>
 * <p><strong>Thread-safety:</strong> Codecs are stateless factories; each decoder or encoder is confined to one
 * thread at a time.</p>
 *
 * @since 0.1.0
 */
public interface RecordCodec {
  /**
   * Wraps a byte stream in a decoder. Closing the decoder closes the stream.
   *
   * @param in encoded records
   * @return decoder reading from {@code in}
   */
  RecordDecoder decoder(InputStream in);

  /**
   * Wraps a byte stream in an encoder. Closing the encoder closes the stream.
   *
   * @param out destination of encoded records
   * @return encoder writing to {@code out}
   */
  RecordEncoder encoder(OutputStream out);

  /**
   * Pull-based reader of encoded records.
   */
  interface RecordDecoder extends Closeable {
    /**
     * Decodes the next record.
     *
     * @return next record, or {@code null} at a clean end of stream
     * @throws IOException if the stream is truncated mid-record or malformed
     */
    TypedRecord next() throws IOException;
  }

  /**
   * Writer of encoded records.
   */
  interface RecordEncoder extends Closeable, Flushable {
    /**
     * Encodes one record onto the stream.
     *
     * @param record record to encode
     * @throws IOException if the stream rejects the bytes
     * @throws IllegalArgumentException if the record holds a value type the format cannot represent
     */
    void write(TypedRecord record) throws IOException;
  }
}
