package bytedfa.nfa;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * State in a Thompson NFA over bytes.
 *
 * <p>States refer to each other by their index in the {@link Nfa}. Edges out
 * of {@link Empty} and {@link Union} states are epsilon transitions.
 */
public interface NfaState {

  /**
   * Unconditionally move to another state.
   *
   * @param next target state, {@code 0} until patched
   */
  record Empty(int next) implements NfaState {
    @Override
    public String toString() {
      return "Empty(" + next + ")";
    }
  }

  /**
   * Consume one byte in {@code [start, end]} and move to another state.
   */
  record Range(int start, int end, int next) implements NfaState {
    public Range {
      if (start < 0 || end > 0xFF || start > end) {
        throw new IllegalArgumentException("Invalid byte range " + start + "-" + end);
      }
    }

    public boolean accepts(int value) {
      return start <= value && value <= end;
    }

    @Override
    public String toString() {
      return String.format("Range(%02X-%02X => %d)", start, end, next);
    }
  }

  /**
   * Branch to every alternate, the first being the most preferred.
   *
   * <p>Unions are immutable. Patching one replaces it with a copy holding the
   * new alternate at the back (or at the front, for reverse unions).
   *
   * @param alternates target states in priority order
   * @param reverse whether patched alternates take priority over earlier ones
   */
  record Union(List<Integer> alternates, boolean reverse) implements NfaState {
    public Union {
      alternates = List.copyOf(alternates);
    }

    public Union(boolean reverse) {
      this(List.of(), reverse);
    }

    Union withAlternate(int to) {
      final var extended = new ArrayList<Integer>(alternates.size() + 1);
      if (reverse) {
        extended.add(to);
        extended.addAll(alternates);
      } else {
        extended.addAll(alternates);
        extended.add(to);
      }
      return new Union(extended, reverse);
    }

    @Override
    public String toString() {
      return alternates
        .stream()
        .map(String::valueOf)
        .collect(Collectors.joining(", ", reverse ? "ReverseUnion(" : "Union(", ")"));
    }
  }

  /**
   * Accept.
   */
  record Match() implements NfaState {
    @Override
    public String toString() {
      return "Match";
    }
  }
}
