package bytedfa.table;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import bytedfa.DfaCompiler;
import bytedfa.dfa.Dfa;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class DfaTableWriterTest {

  private static final List<String> PATTERNS = List.of(
    "a",
    "a|zz|z",
    "[a-c]+x?|b{2,4}",
    "[\\u0080-\\u07FF]+|\\p{IsGreek}",
    "(?:\\r\\n|[\\x00-\\x1F])|[^\\x00-\\x1F]+"
  );

  private static final List<String> INPUTS = List.of(
    "", "a", "zz", "zy", "abcx", "bbbb", "bx", "\u00e9\u00e9a", "\u03b1\u03b2",
    "\r\n", "\r", "\u0001\u0002", "hello world", "\u4e2d\u6587"
  );

  private static final List<ByteOrder> ORDERS = List.of(ByteOrder.BIG_ENDIAN, ByteOrder.LITTLE_ENDIAN);

  @Test
  public void everyLayoutWidthAndOrderAgreesWithDfa() {
    for (String pattern : PATTERNS) {
      final Dfa dfa = DfaCompiler.compile(pattern);
      for (TableLayout layout : TableLayout.values()) {
        for (StateIdWidth width : StateIdWidth.values()) {
          for (ByteOrder order : ORDERS) {
            final var options = new TableOptions(layout, width);
            final SerializedDfa table = SerializedDfa.fromBytes(DfaTableWriter.toBytes(dfa, options, order));
            assertThat(table.stateCount(), is(dfa.stateCount()));
            assertThat(table.start(), is(dfa.start()));
            assertThat(table.layout(), is(layout));
            assertThat(table.width(), is(width));
            assertThat(table.byteOrder(), is(order));

            for (String input : INPUTS) {
              final byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
              assertThat(
                pattern + " " + options + " " + order + " on " + input,
                table.matchLength(bytes, 0, bytes.length),
                is(dfa.matchLength(bytes, 0, bytes.length))
              );
            }
          }
        }
      }
    }
  }

  @Test
  public void transitionsAndMatchFlagsRoundTrip() {
    final Dfa dfa = DfaCompiler.compile("[a-c]+x?|b{2,4}");
    final SerializedDfa table = SerializedDfa.fromBytes(
      DfaTableWriter.toBytes(dfa, TableOptions.DEFAULT.withLayout(TableLayout.SPARSE), ByteOrder.BIG_ENDIAN)
    );
    for (int state = 0; state < dfa.stateCount(); state++) {
      assertThat(table.isMatch(state), is(dfa.isMatch(state)));
      for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
        assertThat(table.next(state, b), is(dfa.next(state, b)));
      }
    }
  }

  @Test
  public void header() {
    final Dfa dfa = DfaCompiler.compile("ab");
    final var options = new TableOptions(TableLayout.DENSE, StateIdWidth.U16);
    final byte[] bytes = DfaTableWriter.toBytes(dfa, options, ByteOrder.LITTLE_ENDIAN);
    final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

    assertThat(Arrays.copyOf(bytes, 8), is("bytedfa\0".getBytes(StandardCharsets.US_ASCII)));
    assertThat(bytes[8], is((byte) 0xFF));
    assertThat(bytes[9], is((byte) 0xFE));
    assertThat(buffer.getShort(10), is((short) 1));
    assertThat(bytes[12], is((byte) 0));
    assertThat(bytes[13], is((byte) 2));
    assertThat(buffer.getLong(16), is((long) dfa.stateCount()));
    assertThat(buffer.getLong(24), is((long) dfa.start()));

    final int matchFlags = (dfa.stateCount() + 7) / 8;
    assertThat(bytes.length, is(32 + matchFlags + dfa.stateCount() * 256 * 2));
  }

  @Test
  public void sparseTablesOmitDeadRanges() {
    final Dfa dfa = DfaCompiler.compile("a");
    final byte[] bytes = DfaTableWriter.toBytes(
      dfa,
      new TableOptions(TableLayout.SPARSE, StateIdWidth.U8),
      ByteOrder.BIG_ENDIAN
    );
    // Dead and matching states have no live ranges, the start state has one
    assertThat(bytes.length, is(32 + 1 + 2 + (2 + 1 + 1 + 1) + 2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void stateIdsMustFitWidth() {
    final Dfa dfa = DfaCompiler.compile("a{300}");
    DfaTableWriter.toBytes(dfa, new TableOptions(TableLayout.DENSE, StateIdWidth.U8), ByteOrder.BIG_ENDIAN);
  }

  @Test
  public void widestIdThatFits() {
    final Dfa dfa = DfaCompiler.compile("a{254}");
    assertThat(dfa.stateCount(), is(256));
    final byte[] bytes = DfaTableWriter.toBytes(
      dfa,
      new TableOptions(TableLayout.SPARSE, StateIdWidth.U8),
      ByteOrder.BIG_ENDIAN
    );
    final byte[] input = new byte[254];
    Arrays.fill(input, (byte) 'a');
    assertThat(SerializedDfa.fromBytes(bytes).matchLength(input, 0, input.length), is(254));
  }

  @Test
  public void stateIdWidths() {
    assertThat(StateIdWidth.forBytes(1), is(StateIdWidth.U8));
    assertThat(StateIdWidth.forBytes(8), is(StateIdWidth.U64));
    assertThat(StateIdWidth.U8.maxStateId(), is(255L));
    assertThat(StateIdWidth.U16.maxStateId(), is(65535L));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unsupportedWidth() {
    StateIdWidth.forBytes(3);
  }
}
