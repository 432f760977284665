package ca.gc.cra.tbfs.infrastructure.codec;

/**
 * Type codes of the typed bytes wire format.
 *
 * @since 0.1.0
 */
public enum TypeCode {
  BYTES(0),
  BYTE(1),
  BOOLEAN(2),
  INT(3),
  LONG(4),
  FLOAT(5),
  DOUBLE(6),
  STRING(7),
  VECTOR(8),
  LIST(9),
  MAP(10);

  /** Marker closing a {@link #LIST}. */
  public static final int END_OF_LIST = 255;

  private static final TypeCode[] BY_CODE = values();

  private final int code;

  TypeCode(int code) {
    this.code = code;
  }

  /**
   * Returns the on-wire byte of this type.
   *
   * @return type code, 0 to 10
   */
  public int code() {
    return code;
  }

  /**
   * Looks up a type by its on-wire byte.
   *
   * @param code unsigned byte read from the stream
   * @return matching type, or {@code null} when the code is not a known value type
   */
  public static TypeCode fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      return null;
    }
    return BY_CODE[code];
  }
}
