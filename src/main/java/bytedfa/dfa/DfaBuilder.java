package bytedfa.dfa;

import bytedfa.nfa.Nfa;
import bytedfa.nfa.NfaState;
import bytedfa.util.SparseSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction of a DFA from a Thompson NFA.
 *
 * <p>Each DFA state stands for the set of NFA {@code Range} states that are
 * simultaneously active, together with whether the NFA has reached its match
 * state. Since every NFA path into a match is kept, the resulting DFA finds
 * the longest match regardless of alternation order or greediness.
 */
public final class DfaBuilder {

  private static final Logger logger = LoggerFactory.getLogger(DfaBuilder.class);

  private final Nfa nfa;
  private final Dfa dfa = new Dfa();

  // Key of each DFA state, indexed by DFA state id
  private final List<StateKey> keys = new ArrayList<>();
  private final Map<StateKey, Integer> cache = new HashMap<>();
  private final ArrayDeque<Integer> worklist = new ArrayDeque<>();

  // Reusable scratch space
  private final SparseSet closure;
  private final StateKey scratch;
  private int[] stack = new int[16];
  private final boolean[] byteClassStarts = new boolean[Dfa.ALPHABET_SIZE + 1];

  private DfaBuilder(Nfa nfa) {
    this.nfa = nfa;
    this.closure = new SparseSet(nfa.size());
    this.scratch = StateKey.scratch(nfa.size());
  }

  /**
   * Build the DFA equivalent to an NFA.
   *
   * @param nfa NFA whose start state is {@link Nfa#START}
   * @return DFA, not minimized
   */
  public static Dfa build(Nfa nfa) {
    return new DfaBuilder(nfa).build();
  }

  private Dfa build() {
    final StateKey dead = StateKey.dead();
    keys.add(dead);
    cache.put(dead, Dfa.DEAD);

    closure.clear();
    epsilonClosure(Nfa.START);
    dfa.setStart(stateForClosure());

    while (!worklist.isEmpty()) {
      final int state = worklist.pop();
      computeTransitions(state);
    }

    logger.debug("Built DFA with {} states from NFA with {} states", dfa.stateCount(), nfa.size());
    return dfa;
  }

  /**
   * Fill in all transitions out of a DFA state.
   *
   * <p>Bytes are grouped into classes bounded by the endpoints of the NFA
   * ranges in the state: all bytes in a class lead to the same DFA state, so
   * the closure only needs computing once per class.
   */
  private void computeTransitions(int state) {
    final StateKey key = keys.get(state);

    Arrays.fill(byteClassStarts, false);
    byteClassStarts[0] = true;
    for (int i = 0; i < key.size(); i++) {
      final var range = (NfaState.Range) nfa.state(key.get(i));
      byteClassStarts[range.start()] = true;
      byteClassStarts[range.end() + 1] = true;
    }

    int next = Dfa.DEAD;
    for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
      if (byteClassStarts[b]) {
        closure.clear();
        for (int i = 0; i < key.size(); i++) {
          final var range = (NfaState.Range) nfa.state(key.get(i));
          if (range.accepts(b)) {
            epsilonClosure(range.next());
          }
        }
        next = stateForClosure();
      }
      dfa.setTransition(state, b, next);
    }
  }

  /**
   * Add to {@link #closure} every state reachable from {@code start} by
   * epsilon transitions.
   *
   * <p>Union alternates are pushed in reverse, so they are visited in priority
   * order.
   */
  private void epsilonClosure(int start) {
    if (closure.contains(start)) {
      return;
    }

    int stackSize = 0;
    stack[stackSize++] = start;
    while (stackSize > 0) {
      int id = stack[--stackSize];
      while (closure.insert(id)) {
        final NfaState state = nfa.state(id);
        if (state instanceof NfaState.Empty empty) {
          id = empty.next();
        } else if (state instanceof NfaState.Union union) {
          final List<Integer> alternates = union.alternates();
          if (alternates.isEmpty()) {
            break;
          }
          for (int i = alternates.size() - 1; i >= 1; i--) {
            if (stackSize == stack.length) {
              stack = Arrays.copyOf(stack, stackSize * 2);
            }
            stack[stackSize++] = alternates.get(i);
          }
          id = alternates.get(0);
        } else {
          break;
        }
      }
    }
  }

  /**
   * Find or allocate the DFA state for the current {@link #closure}.
   */
  private int stateForClosure() {
    scratch.clear();
    for (int i = 0; i < closure.size(); i++) {
      final int id = closure.get(i);
      final NfaState state = nfa.state(id);
      if (state instanceof NfaState.Range) {
        scratch.add(id);
      } else if (state instanceof NfaState.Match) {
        scratch.setMatch();
      }
    }
    scratch.canonicalize();

    final Integer existing = cache.get(scratch);
    if (existing != null) {
      return existing;
    }

    final StateKey frozen = scratch.freeze();
    final int state = dfa.addState(frozen.isMatch());
    keys.add(frozen);
    cache.put(frozen, state);
    worklist.push(state);
    return state;
  }
}
