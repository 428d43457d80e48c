package bytedfa.table;

/**
 * Number of bytes used to store each state id in a serialized table.
 */
public enum StateIdWidth {
  U8(1),
  U16(2),
  U32(4),
  U64(8);

  private final int bytes;

  StateIdWidth(int bytes) {
    this.bytes = bytes;
  }

  public int bytes() {
    return bytes;
  }

  /**
   * Largest state id which fits in this width.
   */
  public long maxStateId() {
    return bytes == 8 ? Long.MAX_VALUE : (1L << (8 * bytes)) - 1;
  }

  /**
   * Look up the width for a number of bytes.
   *
   * @param bytes one of {@code 1}, {@code 2}, {@code 4}, or {@code 8}
   * @return matching width
   * @throws IllegalArgumentException for any other size
   */
  public static StateIdWidth forBytes(int bytes) {
    for (StateIdWidth width : values()) {
      if (width.bytes == bytes) {
        return width;
      }
    }
    throw new IllegalArgumentException("State ids must be 1, 2, 4, or 8 bytes wide, not " + bytes);
  }
}
