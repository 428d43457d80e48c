package bytedfa.nfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thompson NFA over bytes, stored as an append-only table of states.
 *
 * <p>State {@code 0} is always the start state: an {@link NfaState.Empty}
 * pointing at the entry of the compiled pattern.
 */
public final class Nfa {

  public static final int START = 0;

  private final List<NfaState> states = new ArrayList<>();

  Nfa() {
    states.add(new NfaState.Empty(0));
  }

  /**
   * Number of states.
   */
  public int size() {
    return states.size();
  }

  /**
   * Look up a state by index.
   *
   * @param id index of the state
   */
  public NfaState state(int id) {
    return states.get(id);
  }

  public List<NfaState> states() {
    return Collections.unmodifiableList(states);
  }

  int add(NfaState state) {
    states.add(state);
    return states.size() - 1;
  }

  int addEmpty() {
    return add(new NfaState.Empty(0));
  }

  int addRange(int start, int end) {
    return add(new NfaState.Range(start, end, 0));
  }

  int addUnion() {
    return add(new NfaState.Union(false));
  }

  int addReverseUnion() {
    return add(new NfaState.Union(true));
  }

  int addMatch() {
    return add(new NfaState.Match());
  }

  /**
   * Point the exit of one state at another.
   *
   * @param from state whose outgoing edge is set (or, for unions, added)
   * @param to target state
   */
  void patch(int from, int to) {
    final NfaState state = states.get(from);
    if (state instanceof NfaState.Empty) {
      states.set(from, new NfaState.Empty(to));
    } else if (state instanceof NfaState.Range range) {
      states.set(from, new NfaState.Range(range.start(), range.end(), to));
    } else if (state instanceof NfaState.Union union) {
      states.set(from, union.withAlternate(to));
    }
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder();
    for (int id = 0; id < states.size(); id++) {
      builder.append(String.format("%04d: %s%n", id, states.get(id)));
    }
    return builder.toString();
  }
}
