package bytedfa.table;

import bytedfa.dfa.Dfa;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a {@link Dfa} into a flat table which {@link SerializedDfa} can
 * match against without rebuilding the automaton.
 *
 * <p>The table starts with a fixed 32-byte header:
 *
 * <pre>
 * offset  size  field
 * 0       8     label "bytedfa\0"
 * 8       2     0xFEFF, in the byte order of the table
 * 10      2     format version
 * 12      1     layout (0 dense, 1 sparse)
 * 13      1     bytes per state id
 * 14      2     reserved, always 0
 * 16      8     number of states
 * 24      8     start state
 * </pre>
 *
 * <p>This is followed by one bit per state marking matching states (bit
 * {@code id % 8} of byte {@code id / 8}), then the transitions. A dense table
 * stores 256 state ids per state. A sparse table stores, per state, a 2-byte
 * count of ranges and then the start byte, end byte, and target of each range
 * whose target is not the dead state.
 */
public final class DfaTableWriter {

  private static final Logger logger = LoggerFactory.getLogger(DfaTableWriter.class);

  static final byte[] LABEL = "bytedfa\0".getBytes(StandardCharsets.US_ASCII);
  static final short ENDIANNESS_MARKER = (short) 0xFEFF;
  static final short VERSION = 1;
  static final int HEADER_SIZE = 32;

  private DfaTableWriter() { }

  /**
   * Serialize a DFA.
   *
   * @param dfa automaton to serialize
   * @param options layout and state id width
   * @param order byte order of every multi-byte field
   * @return serialized table
   * @throws IllegalArgumentException if some state id does not fit in the
   *   requested width
   */
  public static byte[] toBytes(Dfa dfa, TableOptions options, ByteOrder order) {
    final StateIdWidth width = options.width();
    final int stateCount = dfa.stateCount();
    if (stateCount - 1 > width.maxStateId()) {
      throw new IllegalArgumentException(
        "DFA has " + stateCount + " states, which do not fit in "
          + width.bytes() + "-byte state ids"
      );
    }

    final List<List<Dfa.Transition>> sparse = new ArrayList<>();
    final long bodySize;
    if (options.layout() == TableLayout.DENSE) {
      bodySize = (long) stateCount * Dfa.ALPHABET_SIZE * width.bytes();
    } else {
      long size = 0;
      for (int state = 0; state < stateCount; state++) {
        final var live = new ArrayList<Dfa.Transition>();
        for (Dfa.Transition transition : dfa.sparseTransitions(state)) {
          if (transition.next() != Dfa.DEAD) {
            live.add(transition);
          }
        }
        sparse.add(live);
        size += 2 + (long) live.size() * (2 + width.bytes());
      }
      bodySize = size;
    }

    final long totalSize = HEADER_SIZE + matchFlagsSize(stateCount) + bodySize;
    if (totalSize > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("DFA table would take " + totalSize + " bytes");
    }

    final ByteBuffer buffer = ByteBuffer.allocate((int) totalSize).order(order);
    buffer.put(LABEL);
    buffer.putShort(ENDIANNESS_MARKER);
    buffer.putShort(VERSION);
    buffer.put((byte) options.layout().code);
    buffer.put((byte) width.bytes());
    buffer.putShort((short) 0);
    buffer.putLong(stateCount);
    buffer.putLong(dfa.start());

    final byte[] matchFlags = new byte[matchFlagsSize(stateCount)];
    for (int state = 0; state < stateCount; state++) {
      if (dfa.isMatch(state)) {
        matchFlags[state / 8] |= (byte) (1 << (state % 8));
      }
    }
    buffer.put(matchFlags);

    if (options.layout() == TableLayout.DENSE) {
      for (int state = 0; state < stateCount; state++) {
        for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
          putStateId(buffer, width, dfa.next(state, b));
        }
      }
    } else {
      for (List<Dfa.Transition> transitions : sparse) {
        buffer.putShort((short) transitions.size());
        for (Dfa.Transition transition : transitions) {
          buffer.put((byte) transition.start());
          buffer.put((byte) transition.end());
          putStateId(buffer, width, transition.next());
        }
      }
    }

    logger.debug(
      "Serialized {} states into a {} {} table of {} bytes",
      stateCount,
      options.layout(),
      order,
      totalSize
    );
    return buffer.array();
  }

  static int matchFlagsSize(int stateCount) {
    return (stateCount + 7) / 8;
  }

  private static void putStateId(ByteBuffer buffer, StateIdWidth width, int id) {
    switch (width) {
      case U8:
        buffer.put((byte) id);
        break;
      case U16:
        buffer.putShort((short) id);
        break;
      case U32:
        buffer.putInt(id);
        break;
      case U64:
        buffer.putLong(id);
        break;
      default:
        throw new IllegalStateException("Unknown width " + width);
    }
  }
}
