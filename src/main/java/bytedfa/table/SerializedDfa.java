package bytedfa.table;

import bytedfa.ByteMatcher;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * DFA matching directly against a table written by {@link DfaTableWriter}.
 *
 * <p>The table is validated once when loaded, after which every state id in it
 * is known to be in range. Instances are immutable and safe to share between
 * threads.
 */
public final class SerializedDfa implements ByteMatcher {

  private static final int DEAD = 0;

  private final ByteBuffer table;
  private final TableLayout layout;
  private final StateIdWidth width;
  private final int stateCount;
  private final int start;
  private final int matchFlagsOffset;

  // Dense: where the rows start. Sparse: where each state's ranges start.
  private final int bodyOffset;
  private final int[] sparseOffsets;

  private SerializedDfa(
    ByteBuffer table,
    TableLayout layout,
    StateIdWidth width,
    int stateCount,
    int start,
    int bodyOffset,
    int[] sparseOffsets
  ) {
    this.table = table;
    this.layout = layout;
    this.width = width;
    this.stateCount = stateCount;
    this.start = start;
    this.matchFlagsOffset = DfaTableWriter.HEADER_SIZE;
    this.bodyOffset = bodyOffset;
    this.sparseOffsets = sparseOffsets;
  }

  /**
   * Load a table, detecting its byte order from the header.
   *
   * @param bytes serialized table (copied)
   * @return matcher backed by the table
   * @throws IllegalArgumentException if the table is truncated or corrupt
   */
  public static SerializedDfa fromBytes(byte[] bytes) {
    if (bytes.length < DfaTableWriter.HEADER_SIZE) {
      throw new IllegalArgumentException("DFA table is only " + bytes.length + " bytes long");
    }
    if (!Arrays.equals(bytes, 0, 8, DfaTableWriter.LABEL, 0, 8)) {
      throw new IllegalArgumentException("DFA table does not start with the expected label");
    }

    final ByteOrder order;
    if ((bytes[8] & 0xFF) == 0xFE && (bytes[9] & 0xFF) == 0xFF) {
      order = ByteOrder.BIG_ENDIAN;
    } else if ((bytes[8] & 0xFF) == 0xFF && (bytes[9] & 0xFF) == 0xFE) {
      order = ByteOrder.LITTLE_ENDIAN;
    } else {
      throw new IllegalArgumentException("DFA table has an invalid endianness marker");
    }

    final ByteBuffer table = ByteBuffer.wrap(bytes.clone()).asReadOnlyBuffer().order(order);

    final int version = table.getShort(10) & 0xFFFF;
    if (version != DfaTableWriter.VERSION) {
      throw new IllegalArgumentException("Unsupported DFA table version " + version);
    }
    final TableLayout layout = TableLayout.fromCode(table.get(12) & 0xFF);
    final StateIdWidth width = StateIdWidth.forBytes(table.get(13) & 0xFF);

    final long stateCount = table.getLong(16);
    if (stateCount < 1 || stateCount > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Invalid DFA state count " + stateCount);
    }
    final long start = table.getLong(24);
    if (start < 0 || start >= stateCount) {
      throw new IllegalArgumentException("Start state " + start + " is out of range");
    }

    final int count = (int) stateCount;
    final long bodyOffset = DfaTableWriter.HEADER_SIZE + (long) DfaTableWriter.matchFlagsSize(count);
    if (bodyOffset > bytes.length) {
      throw new IllegalArgumentException("DFA table is truncated");
    }

    final var dfa = new SerializedDfa(
      table,
      layout,
      width,
      count,
      (int) start,
      (int) bodyOffset,
      layout == TableLayout.SPARSE ? new int[count] : null
    );
    dfa.validateBody();
    return dfa;
  }

  /**
   * Load the table for the native byte order from a class path resource.
   *
   * <p>The resource is {@code baseName.bigendian.dfa} or
   * {@code baseName.littleendian.dfa}, resolved relative to {@code anchor}.
   * Meant for static initializers of generated classes, so failures are
   * unchecked.
   *
   * @param anchor class relative to which the resource is found
   * @param baseName resource name without the byte order suffix
   * @return matcher backed by the table
   */
  public static SerializedDfa loadNative(Class<?> anchor, String baseName) {
    final String resource = baseName + nativeSuffix();
    try (InputStream input = anchor.getResourceAsStream(resource)) {
      if (input == null) {
        throw new IllegalStateException(
          "Missing DFA table `" + resource + "` next to " + anchor.getName()
        );
      }
      return fromBytes(input.readAllBytes());
    } catch (IOException err) {
      throw new UncheckedIOException("Failed to read DFA table " + resource, err);
    }
  }

  /**
   * File name suffix of the table for the native byte order.
   */
  public static String nativeSuffix() {
    return suffix(ByteOrder.nativeOrder());
  }

  static String suffix(ByteOrder order) {
    return order == ByteOrder.BIG_ENDIAN ? ".bigendian.dfa" : ".littleendian.dfa";
  }

  /**
   * Check the size of the body and that every state id in it is in range,
   * recording where each sparse state starts.
   */
  private void validateBody() {
    final int capacity = table.capacity();
    if (layout == TableLayout.DENSE) {
      final long expected = bodyOffset + (long) stateCount * 256 * width.bytes();
      if (expected != capacity) {
        throw new IllegalArgumentException(
          "Dense DFA table should be " + expected + " bytes, but is " + capacity
        );
      }
      for (int position = bodyOffset; position < capacity; position += width.bytes()) {
        readStateId(position);
      }
    } else {
      int position = bodyOffset;
      for (int state = 0; state < stateCount; state++) {
        if (position + 2 > capacity) {
          throw new IllegalArgumentException("DFA table is truncated at state " + state);
        }
        sparseOffsets[state] = position;
        final int ranges = table.getShort(position) & 0xFFFF;
        position += 2;
        if (position + (long) ranges * rangeSize() > capacity) {
          throw new IllegalArgumentException("DFA table is truncated at state " + state);
        }
        int previousEnd = -1;
        for (int i = 0; i < ranges; i++) {
          final int rangeStart = table.get(position) & 0xFF;
          final int rangeEnd = table.get(position + 1) & 0xFF;
          if (rangeStart <= previousEnd || rangeEnd < rangeStart) {
            throw new IllegalArgumentException("Unsorted byte ranges in state " + state);
          }
          previousEnd = rangeEnd;
          readStateId(position + 2);
          position += rangeSize();
        }
      }
      if (position != capacity) {
        throw new IllegalArgumentException(
          "DFA table has " + (capacity - position) + " trailing bytes"
        );
      }
    }
  }

  private int rangeSize() {
    return 2 + width.bytes();
  }

  private int readStateId(int position) {
    final long id;
    switch (width) {
      case U8:
        id = table.get(position) & 0xFFL;
        break;
      case U16:
        id = table.getShort(position) & 0xFFFFL;
        break;
      case U32:
        id = table.getInt(position) & 0xFFFFFFFFL;
        break;
      case U64:
        id = table.getLong(position);
        break;
      default:
        throw new IllegalStateException("Unknown width " + width);
    }
    if (id < 0 || id >= stateCount) {
      throw new IllegalArgumentException("State id " + id + " at offset " + position + " is out of range");
    }
    return (int) id;
  }

  public TableLayout layout() {
    return layout;
  }

  public StateIdWidth width() {
    return width;
  }

  public ByteOrder byteOrder() {
    return table.order();
  }

  public int stateCount() {
    return stateCount;
  }

  public int start() {
    return start;
  }

  public boolean isMatch(int state) {
    return (table.get(matchFlagsOffset + state / 8) & (1 << (state % 8))) != 0;
  }

  /**
   * Follow a transition.
   *
   * @param state current state
   * @param input byte value in {@code 0-255}
   * @return next state
   */
  public int next(int state, int input) {
    if (layout == TableLayout.DENSE) {
      return readStateId(bodyOffset + (state * 256 + input) * width.bytes());
    }

    int position = sparseOffsets[state];
    final int ranges = table.getShort(position) & 0xFFFF;
    position += 2;
    for (int i = 0; i < ranges; i++, position += rangeSize()) {
      if (input < (table.get(position) & 0xFF)) {
        break;
      } else if (input <= (table.get(position + 1) & 0xFF)) {
        return readStateId(position + 2);
      }
    }
    return DEAD;
  }

  @Override
  public int matchLength(byte[] input, int offset, int end) {
    int state = start;
    int lastMatch = -1;
    for (int i = offset; i < end; i++) {
      state = next(state, input[i] & 0xFF);
      if (state == DEAD) {
        return lastMatch;
      } else if (isMatch(state)) {
        lastMatch = i + 1 - offset;
      }
    }
    return lastMatch;
  }

  @Override
  public int reverseMatchLength(byte[] input, int offset, int end) {
    int state = start;
    int lastMatch = -1;
    for (int i = end - 1; i >= offset; i--) {
      state = next(state, input[i] & 0xFF);
      if (state == DEAD) {
        return lastMatch;
      } else if (isMatch(state)) {
        lastMatch = end - i;
      }
    }
    return lastMatch;
  }
}
