package bytedfa;

import java.util.OptionalInt;

/**
 * Anchored, longest-match recognizer over bytes.
 *
 * <p>Implemented by in-memory DFAs, by DFAs loaded from serialized tables, and
 * by DFAs compiled into bytecode. All of them agree on the result.
 */
public interface ByteMatcher {

  /**
   * Length of the longest non-empty match starting at {@code offset}.
   *
   * @param input bytes to match against
   * @param offset where the match starts
   * @param end offset (exclusive) past which no byte is read
   * @return length of the longest match, or {@code -1} if there is none
   */
  int matchLength(byte[] input, int offset, int end);

  /**
   * Length of the longest non-empty match ending at {@code end}, reading the
   * input backwards from {@code end - 1}.
   *
   * <p>Meant for DFAs compiled in reverse: such a DFA finds the matches of
   * its forward pattern that end at {@code end}.
   *
   * @param input bytes to match against
   * @param offset offset before which no byte is read
   * @param end where the match ends (exclusive)
   * @return length of the longest match, or {@code -1} if there is none
   */
  int reverseMatchLength(byte[] input, int offset, int end);

  default OptionalInt find(byte[] input, int offset, int end) {
    final int length = matchLength(input, offset, end);
    return length < 0 ? OptionalInt.empty() : OptionalInt.of(length);
  }

  /**
   * Find the longest match at the start of the input.
   *
   * @param input bytes to match against
   * @return length of the longest non-empty match, if there is one
   */
  default OptionalInt find(byte[] input) {
    return find(input, 0, input.length);
  }
}
