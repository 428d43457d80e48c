package bytedfa.dfa;

import bytedfa.ByteMatcher;
import bytedfa.graph.DotGraph;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Deterministic finite automaton over bytes, stored as a dense table with
 * {@value #ALPHABET_SIZE} transitions per state.
 *
 * <p>State {@link #DEAD} is always present: it does not match and all of its
 * transitions lead back to itself. Every transition of a newly added state
 * also leads to {@link #DEAD} until it is set.
 */
public final class Dfa implements ByteMatcher, DotGraph<Integer, String> {

  public static final int DEAD = 0;
  public static final int ALPHABET_SIZE = 256;

  private int[] transitions;
  private boolean[] matching;
  private int stateCount;
  private int start = DEAD;

  /**
   * Outgoing transitions on a contiguous range of bytes.
   *
   * @param start first byte (inclusive)
   * @param end last byte (inclusive)
   * @param next target state
   */
  public record Transition(int start, int end, int next) { }

  /**
   * Make an automaton with only the dead state, which matches nothing.
   */
  public Dfa() {
    this.transitions = new int[16 * ALPHABET_SIZE];
    this.matching = new boolean[16];
    this.stateCount = 1;
  }

  /**
   * Add a state whose transitions all lead to {@link #DEAD}.
   *
   * @param isMatch whether the state is matching
   * @return id of the new state
   */
  int addState(boolean isMatch) {
    if (stateCount == matching.length) {
      matching = Arrays.copyOf(matching, stateCount * 2);
      transitions = Arrays.copyOf(transitions, stateCount * 2 * ALPHABET_SIZE);
    }
    matching[stateCount] = isMatch;
    return stateCount++;
  }

  void setTransition(int from, int input, int to) {
    transitions[from * ALPHABET_SIZE + input] = to;
  }

  void setStart(int start) {
    this.start = start;
  }

  void setMatch(int state, boolean isMatch) {
    matching[state] = isMatch;
  }

  /**
   * Drop every state with an id of {@code count} or more.
   */
  void truncate(int count) {
    stateCount = count;
    matching = Arrays.copyOf(matching, Math.max(count, 1));
    transitions = Arrays.copyOf(transitions, Math.max(count, 1) * ALPHABET_SIZE);
  }

  public int stateCount() {
    return stateCount;
  }

  public int start() {
    return start;
  }

  public boolean isMatch(int state) {
    return matching[state];
  }

  /**
   * Follow a transition.
   *
   * @param state current state
   * @param input byte value in {@code 0-255}
   * @return next state
   */
  public int next(int state, int input) {
    return transitions[state * ALPHABET_SIZE + input];
  }

  /**
   * Number of matching states.
   */
  public int matchCount() {
    int count = 0;
    for (int state = 0; state < stateCount; state++) {
      if (matching[state]) {
        count++;
      }
    }
    return count;
  }

  /**
   * Transitions out of a state, collapsing adjacent bytes with the same
   * target into one range. The ranges cover all bytes in order, including
   * those leading to {@link #DEAD}.
   *
   * @param state state whose transitions are collapsed
   * @return ranges in increasing byte order
   */
  public List<Transition> sparseTransitions(int state) {
    final var ranges = new ArrayList<Transition>();
    final int base = state * ALPHABET_SIZE;
    int rangeStart = 0;
    for (int b = 1; b <= ALPHABET_SIZE; b++) {
      if (b == ALPHABET_SIZE || transitions[base + b] != transitions[base + rangeStart]) {
        ranges.add(new Transition(rangeStart, b - 1, transitions[base + rangeStart]));
        rangeStart = b;
      }
    }
    return ranges;
  }

  /**
   * Length of the longest match, leftmost from {@code offset}.
   *
   * <p>Scanning stops as soon as the dead state is reached. Entering the start
   * state does not count as a match, so a match is never empty.
   */
  @Override
  public int matchLength(byte[] input, int offset, int end) {
    int state = start;
    int lastMatch = -1;
    for (int i = offset; i < end; i++) {
      state = transitions[state * ALPHABET_SIZE + (input[i] & 0xFF)];
      if (state == DEAD) {
        return lastMatch;
      } else if (matching[state]) {
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
      state = transitions[state * ALPHABET_SIZE + (input[i] & 0xFF)];
      if (state == DEAD) {
        return lastMatch;
      } else if (matching[state]) {
        lastMatch = end - i;
      }
    }
    return lastMatch;
  }

  /**
   * Textual dump of every state, one per line.
   *
   * <p>Each line starts with {@code D} for the dead state or {@code >} for the
   * start state, then {@code *} for a matching state, then the zero-padded id
   * and the transitions to live states.
   */
  @Override
  public String toString() {
    final var builder = new StringBuilder();
    for (int state = 0; state < stateCount; state++) {
      builder.append(state == DEAD ? 'D' : state == start ? '>' : ' ');
      builder.append(matching[state] ? '*' : ' ');
      builder.append(String.format("%04d: ", state));

      boolean first = true;
      for (Transition transition : sparseTransitions(state)) {
        if (transition.next() == DEAD) {
          continue;
        }
        if (!first) {
          builder.append(", ");
        }
        first = false;
        builder.append(rangeLabel(transition)).append(" => ").append(transition.next());
      }
      builder.append('\n');
    }
    return builder.toString();
  }

  private static String rangeLabel(Transition transition) {
    return transition.start() == transition.end()
      ? escapeByte(transition.start())
      : escapeByte(transition.start()) + "-" + escapeByte(transition.end());
  }

  /**
   * Render a byte as printable ASCII, or else as an escape.
   *
   * @param value byte in {@code 0-255}
   * @return escaped form, such as {@code a}, {@code \n}, or {@code \xff}
   */
  public static String escapeByte(int value) {
    switch (value) {
      case '\t':
        return "\\t";
      case '\r':
        return "\\r";
      case '\n':
        return "\\n";
      case '\\':
        return "\\\\";
      case '\'':
        return "\\'";
      case '"':
        return "\\\"";
      default:
        if (0x20 <= value && value < 0x7F) {
          return Character.toString((char) value);
        }
        return String.format("\\x%02x", value);
    }
  }

  @Override
  public Stream<Vertex<Integer>> vertices() {
    return IntStream
      .range(1, stateCount)
      .mapToObj(state -> new Vertex<>(state, matching[state]));
  }

  @Override
  public Stream<Edge<Integer, String>> edges() {
    final Stream<Edge<Integer, String>> startEdge = start == DEAD
      ? Stream.empty()
      : Stream.of(new Edge<Integer, String>(null, start, null));
    final Stream<Edge<Integer, String>> transitionEdges = IntStream
      .range(1, stateCount)
      .boxed()
      .flatMap(state -> sparseTransitions(state)
        .stream()
        .filter(transition -> transition.next() != DEAD)
        .map(transition -> new Edge<>(state, transition.next(), rangeLabel(transition))));
    return Stream.concat(startEdge, transitionEdges);
  }
}
