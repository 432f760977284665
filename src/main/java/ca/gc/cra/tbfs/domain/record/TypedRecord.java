package ca.gc.cra.tbfs.domain.record;

/**
 * <strong>What:</strong> One key/value pair of a typed-bytes dataset.
 * <p><strong>Role:</strong> Unit of data moved by the record writer and the record stream multiplexer; neither
 * inspects the key or the value.</p>
 * <p><strong>Thread-safety:</strong> The record is immutable; values such as {@code byte[]}, {@link java.util.List}
 * or {@link java.util.Map} are shared as produced by the codec and must not be mutated by consumers.</p>
 *
 * @param key record key; one of the value types supported by the codec
 * @param value record value; one of the value types supported by the codec
 * @implNote Equality delegates to the components' {@code equals}; {@code byte[]} keys compare by identity.
 * @since 0.1.0
 */
public record TypedRecord(Object key, Object value) {

  /**
   * Convenience factory mirroring the canonical constructor.
   *
   * @param key record key
   * @param value record value
   * @return new record
   */
  public static TypedRecord of(Object key, Object value) {
    return new TypedRecord(key, value);
  }
}
