package ca.gc.cra.tbfs.infrastructure.codec;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Writes Java values as typed bytes. Not thread-safe.
 *
 * <p>Supported types: {@code byte[]}, {@link Byte}, {@link Boolean}, {@link Short} and {@link Integer} (as int),
 * {@link Long}, {@link Float}, {@link Double}, {@link String}, {@link List} (as list) and {@link Map}.</p>
 *
 * @since 0.1.0
 */
public final class TypedBytesOutput {
  private final DataOutputStream out;

  /**
   * Wraps a stream. The caller keeps ownership of {@code out}.
   *
   * @param out sink for typed bytes
   */
  public TypedBytesOutput(OutputStream out) {
    this.out = out instanceof DataOutputStream data ? data : new DataOutputStream(out);
  }

  /**
   * Writes one value with its type byte.
   *
   * @param value value to encode
   * @throws IllegalArgumentException if the value is {@code null} or of an unsupported type; nothing has been
   *     written for that value
   * @throws IOException if writing fails
   */
  public void writeValue(Object value) throws IOException {
    if (value == null) {
      throw new IllegalArgumentException("typed bytes cannot encode null");
    }
    if (value instanceof byte[] bytes) {
      out.writeByte(TypeCode.BYTES.code());
      out.writeInt(bytes.length);
      out.write(bytes);
    } else if (value instanceof Byte b) {
      out.writeByte(TypeCode.BYTE.code());
      out.writeByte(b);
    } else if (value instanceof Boolean flag) {
      out.writeByte(TypeCode.BOOLEAN.code());
      out.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Short) {
      out.writeByte(TypeCode.INT.code());
      out.writeInt(((Number) value).intValue());
    } else if (value instanceof Long l) {
      out.writeByte(TypeCode.LONG.code());
      out.writeLong(l);
    } else if (value instanceof Float f) {
      out.writeByte(TypeCode.FLOAT.code());
      out.writeFloat(f);
    } else if (value instanceof Double d) {
      out.writeByte(TypeCode.DOUBLE.code());
      out.writeDouble(d);
    } else if (value instanceof String s) {
      byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
      out.writeByte(TypeCode.STRING.code());
      out.writeInt(utf8.length);
      out.write(utf8);
    } else if (value instanceof List<?> list) {
      requireEncodable(list);
      out.writeByte(TypeCode.LIST.code());
      for (Object element : list) {
        writeValue(element);
      }
      out.writeByte(TypeCode.END_OF_LIST);
    } else if (value instanceof Map<?, ?> map) {
      requireEncodable(map);
      out.writeByte(TypeCode.MAP.code());
      out.writeInt(map.size());
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        writeValue(entry.getKey());
        writeValue(entry.getValue());
      }
    } else {
      throw new IllegalArgumentException("Unsupported typed bytes value type: " + value.getClass().getName());
    }
  }

  /**
   * Flushes the underlying stream.
   *
   * @throws IOException if flushing fails
   */
  public void flush() throws IOException {
    out.flush();
  }

  /**
   * Checks a value and all of its nested elements without writing anything.
   *
   * @param value value to check
   * @throws IllegalArgumentException if the value or any nested element cannot be encoded
   */
  public static void requireEncodable(Object value) {
    if (value == null) {
      throw new IllegalArgumentException("typed bytes cannot encode null");
    }
    if (value instanceof List<?> list) {
      for (Object element : list) {
        requireEncodable(element);
      }
    } else if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        requireEncodable(entry.getKey());
        requireEncodable(entry.getValue());
      }
    } else if (!(value instanceof byte[]
        || value instanceof Byte
        || value instanceof Boolean
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Float
        || value instanceof Double
        || value instanceof String)) {
      throw new IllegalArgumentException("Unsupported typed bytes value type: " + value.getClass().getName());
    }
  }
}
