package bytedfa.dfa;

import java.util.Arrays;

/**
 * Canonical description of a DFA state during subset construction: the sorted
 * set of NFA {@code Range} states it stands for, and whether the NFA match
 * state is reachable.
 *
 * <p>A single mutable scratch key is refilled for every lookup; only keys that
 * miss the cache get {@linkplain #freeze frozen} into a right-sized copy.
 */
final class StateKey {

  private int[] nfaStates;
  private int size;
  private boolean match;

  private StateKey(int[] nfaStates, int size, boolean match) {
    this.nfaStates = nfaStates;
    this.size = size;
    this.match = match;
  }

  static StateKey scratch(int capacity) {
    return new StateKey(new int[capacity], 0, false);
  }

  static StateKey dead() {
    return new StateKey(new int[0], 0, false);
  }

  void clear() {
    size = 0;
    match = false;
  }

  void add(int nfaState) {
    if (size == nfaStates.length) {
      nfaStates = Arrays.copyOf(nfaStates, Math.max(4, size * 2));
    }
    nfaStates[size++] = nfaState;
  }

  void setMatch() {
    match = true;
  }

  /**
   * Sort and deduplicate the NFA states.
   */
  void canonicalize() {
    Arrays.sort(nfaStates, 0, size);
    int unique = 0;
    for (int i = 0; i < size; i++) {
      if (unique == 0 || nfaStates[unique - 1] != nfaStates[i]) {
        nfaStates[unique++] = nfaStates[i];
      }
    }
    size = unique;
  }

  StateKey freeze() {
    return new StateKey(Arrays.copyOf(nfaStates, size), size, match);
  }

  int size() {
    return size;
  }

  int get(int index) {
    return nfaStates[index];
  }

  boolean isMatch() {
    return match;
  }

  @Override
  public int hashCode() {
    int hash = match ? 1 : 0;
    for (int i = 0; i < size; i++) {
      hash = 31 * hash + nfaStates[i];
    }
    return hash;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof StateKey key)) {
      return false;
    }
    return match == key.match
      && Arrays.equals(nfaStates, 0, size, key.nfaStates, 0, key.size);
  }

  @Override
  public String toString() {
    return (match ? "*" : "") + Arrays.toString(Arrays.copyOf(nfaStates, size));
  }
}
