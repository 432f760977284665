package ca.gc.cra.tbfs.infrastructure.codec;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads typed bytes values from a stream. Not thread-safe.
 *
 * @since 0.1.0
 */
public final class TypedBytesInput {
  /** Deepest accepted nesting of vectors, lists and maps. */
  public static final int MAX_NESTING_DEPTH = 256;
  /** Largest accepted length prefix of a bytes or string value. */
  public static final int MAX_BYTES_LENGTH = 256 * 1024 * 1024;

  private final DataInputStream in;
  private int depth;

  /**
   * Wraps a stream. The caller keeps ownership of {@code in}.
   *
   * @param in source of typed bytes
   */
  public TypedBytesInput(InputStream in) {
    this.in = in instanceof DataInputStream data ? data : new DataInputStream(in);
  }

  /**
   * Reads the type byte that starts a value, allowing a clean end of stream.
   *
   * @return unsigned type byte, or {@code -1} at end of stream
   * @throws IOException if reading fails
   */
  public int readTypeOrEnd() throws IOException {
    return in.read();
  }

  /**
   * Reads one complete value.
   *
   * @return decoded value
   * @throws EOFException if the stream ends inside the value
   * @throws IOException if the value carries an unknown type code
   */
  public Object readValue() throws IOException {
    return readValue(in.readUnsignedByte());
  }

  /**
   * Reads the body of a value whose type byte has already been consumed.
   *
   * @param typeByte unsigned type byte
   * @return decoded value
   * @throws IOException if reading fails, the type code is unknown, containers nest deeper than
   *     {@link #MAX_NESTING_DEPTH} or a length prefix exceeds {@link #MAX_BYTES_LENGTH}
   */
  public Object readValue(int typeByte) throws IOException {
    TypeCode type = TypeCode.fromCode(typeByte);
    if (type == null) {
      throw new IOException("Unknown typed bytes type code " + typeByte);
    }
    return switch (type) {
      case BYTES -> readBytes();
      case BYTE -> in.readByte();
      case BOOLEAN -> in.readBoolean();
      case INT -> in.readInt();
      case LONG -> in.readLong();
      case FLOAT -> in.readFloat();
      case DOUBLE -> in.readDouble();
      case STRING -> new String(readBytes(), StandardCharsets.UTF_8);
      case VECTOR, LIST, MAP -> readContainer(type);
    };
  }

  private Object readContainer(TypeCode type) throws IOException {
    if (depth >= MAX_NESTING_DEPTH) {
      throw new IOException("Typed bytes containers nested deeper than " + MAX_NESTING_DEPTH);
    }
    depth++;
    try {
      return switch (type) {
        case VECTOR -> readVector();
        case LIST -> readList();
        case MAP -> readMap();
        default -> throw new IllegalArgumentException("Not a container type: " + type);
      };
    } finally {
      depth--;
    }
  }

  private byte[] readBytes() throws IOException {
    int length = readLength("byte length");
    if (length > MAX_BYTES_LENGTH) {
      throw new IOException("Byte length " + length + " exceeds limit of " + MAX_BYTES_LENGTH);
    }
    // Allocation follows the bytes present, not the prefix.
    byte[] bytes = in.readNBytes(length);
    if (bytes.length < length) {
      throw new EOFException("Stream ended after " + bytes.length + " of " + length + " bytes");
    }
    return bytes;
  }

  private List<Object> readVector() throws IOException {
    int count = readLength("vector length");
    List<Object> values = new ArrayList<>(Math.min(count, 1_024));
    for (int i = 0; i < count; i++) {
      values.add(readValue());
    }
    return values;
  }

  private List<Object> readList() throws IOException {
    List<Object> values = new ArrayList<>();
    while (true) {
      int typeByte = in.readUnsignedByte();
      if (typeByte == TypeCode.END_OF_LIST) {
        return values;
      }
      values.add(readValue(typeByte));
    }
  }

  private Map<Object, Object> readMap() throws IOException {
    int count = readLength("map size");
    Map<Object, Object> entries = new LinkedHashMap<>();
    for (int i = 0; i < count; i++) {
      Object key = readValue();
      entries.put(key, readValue());
    }
    return entries;
  }

  private int readLength(String what) throws IOException {
    int length = in.readInt();
    if (length < 0) {
      throw new IOException("Negative " + what + ": " + length);
    }
    return length;
  }
}
