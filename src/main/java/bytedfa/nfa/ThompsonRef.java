package bytedfa.nfa;

/**
 * Compiled fragment of an NFA, with one entry and one exit.
 *
 * <p>The exit state is not yet patched: connecting the fragment to whatever
 * follows it means patching {@code end}.
 *
 * @param start entry state
 * @param end exit state
 */
public record ThompsonRef(int start, int end) { }
