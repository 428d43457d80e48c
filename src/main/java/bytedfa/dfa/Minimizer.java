package bytedfa.dfa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimization of a DFA by partition refinement (Hopcroft's algorithm).
 *
 * <p>States start out split into matching and non-matching blocks. A block is
 * split whenever some of its states have a transition on a byte into a
 * "splitter" block and others don't. Once no block can be split, every block
 * is a set of equivalent states and is merged into its lowest-numbered member.
 */
public final class Minimizer {

  private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

  private final Dfa dfa;
  private final int stateCount;

  // Reverse transitions: for byte `b`, the states going to `s` are
  // `incomingSources[b][incomingOffsets[b][s] .. incomingOffsets[b][s + 1]]`
  private final int[][] incomingOffsets;
  private final int[][] incomingSources;

  private final List<Block> partitions = new ArrayList<>();
  private final List<Block> waiting = new ArrayList<>();
  private final int[] blockOf;

  // Scratch space for one splitting step
  private final int[] marked;
  private int markGeneration = 0;
  private final int[] markedPerBlock;
  private final List<Integer> touchedBlocks = new ArrayList<>();

  /**
   * Set of equivalent states, sorted by id.
   *
   * <p>Blocks are never modified: splitting replaces a block with two new ones.
   */
  private record Block(int[] members) {
    int size() {
      return members.length;
    }
  }

  private Minimizer(Dfa dfa) {
    this.dfa = dfa;
    this.stateCount = dfa.stateCount();
    this.incomingOffsets = new int[Dfa.ALPHABET_SIZE][];
    this.incomingSources = new int[Dfa.ALPHABET_SIZE][];
    this.blockOf = new int[stateCount];
    this.marked = new int[stateCount];
    this.markedPerBlock = new int[stateCount];
    buildIncoming();
  }

  /**
   * Minimize a DFA in place.
   *
   * <p>The minimized DFA matches the same language, the dead state keeps id
   * {@link Dfa#DEAD}, and the start state is renumbered as needed.
   *
   * @param dfa automaton to minimize
   * @throws IllegalStateException if the DFA has no matching state
   */
  public static void minimize(Dfa dfa) {
    if (dfa.matchCount() == 0) {
      throw new IllegalStateException("Cannot minimize a DFA with no matching states");
    }
    final int before = dfa.stateCount();
    new Minimizer(dfa).run();
    logger.debug("Minimized DFA from {} to {} states", before, dfa.stateCount());
  }

  private void buildIncoming() {
    for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
      final int[] offsets = new int[stateCount + 1];
      for (int state = 0; state < stateCount; state++) {
        offsets[dfa.next(state, b) + 1]++;
      }
      for (int state = 0; state < stateCount; state++) {
        offsets[state + 1] += offsets[state];
      }

      final int[] sources = new int[stateCount];
      final int[] fill = Arrays.copyOf(offsets, stateCount);
      for (int state = 0; state < stateCount; state++) {
        sources[fill[dfa.next(state, b)]++] = state;
      }
      incomingOffsets[b] = offsets;
      incomingSources[b] = sources;
    }
  }

  private void run() {
    initialPartition();

    while (!waiting.isEmpty()) {
      final Block splitter = waiting.remove(waiting.size() - 1);
      for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
        splitOn(splitter, b);
      }
    }

    rewrite();
  }

  private void initialPartition() {
    final var matching = new ArrayList<Integer>();
    final var nonMatching = new ArrayList<Integer>();
    for (int state = 0; state < stateCount; state++) {
      (dfa.isMatch(state) ? matching : nonMatching).add(state);
    }

    final Block matchBlock = new Block(matching.stream().mapToInt(Integer::intValue).toArray());
    final Block otherBlock = new Block(nonMatching.stream().mapToInt(Integer::intValue).toArray());

    // Smallest first, dropping the empty block
    if (otherBlock.size() == 0) {
      addPartition(matchBlock);
    } else if (matchBlock.size() <= otherBlock.size()) {
      addPartition(matchBlock);
      addPartition(otherBlock);
    } else {
      addPartition(otherBlock);
      addPartition(matchBlock);
    }
    waiting.add(matchBlock);
  }

  private void addPartition(Block block) {
    final int index = partitions.size();
    partitions.add(block);
    for (int state : block.members()) {
      blockOf[state] = index;
    }
  }

  /**
   * Split every block having states both with and without a transition on
   * {@code b} into the splitter.
   *
   * <p>Only blocks containing such a state are examined: a block no state of
   * which enters the splitter cannot be split by it.
   */
  private void splitOn(Block splitter, int b) {
    final int[] offsets = incomingOffsets[b];
    final int[] sources = incomingSources[b];
    markGeneration++;

    for (int target : splitter.members()) {
      for (int i = offsets[target]; i < offsets[target + 1]; i++) {
        final int source = sources[i];
        if (marked[source] == markGeneration) {
          continue;
        }
        marked[source] = markGeneration;
        final int block = blockOf[source];
        if (markedPerBlock[block]++ == 0) {
          touchedBlocks.add(block);
        }
      }
    }

    for (int blockIndex : touchedBlocks) {
      final Block block = partitions.get(blockIndex);
      final int markedCount = markedPerBlock[blockIndex];
      markedPerBlock[blockIndex] = 0;
      if (markedCount == block.size()) {
        continue;
      }

      final int[] inside = new int[markedCount];
      final int[] outside = new int[block.size() - markedCount];
      int insideSize = 0;
      int outsideSize = 0;
      for (int state : block.members()) {
        if (marked[state] == markGeneration) {
          inside[insideSize++] = state;
        } else {
          outside[outsideSize++] = state;
        }
      }
      final Block intersection = new Block(inside);
      final Block difference = new Block(outside);

      partitions.set(blockIndex, intersection);
      addPartition(difference);

      final int waitingIndex = indexOfWaiting(block);
      if (waitingIndex >= 0) {
        waiting.set(waitingIndex, intersection);
        waiting.add(difference);
      } else {
        waiting.add(intersection.size() <= difference.size() ? intersection : difference);
      }
    }
    touchedBlocks.clear();
  }

  private int indexOfWaiting(Block block) {
    for (int i = 0; i < waiting.size(); i++) {
      if (waiting.get(i) == block) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Collapse each block into its lowest-numbered state, renumber the
   * surviving states densely in increasing order, and truncate the table.
   */
  private void rewrite() {
    final int[] representative = new int[stateCount];
    for (int state = 0; state < stateCount; state++) {
      representative[state] = partitions.get(blockOf[state]).members()[0];
    }

    final int[] newId = new int[stateCount];
    int count = 0;
    for (int state = 0; state < stateCount; state++) {
      if (representative[state] == state) {
        newId[state] = count++;
      }
    }

    // Rows only ever move to lower or equal ids, so copying in order is safe
    for (int state = 0; state < stateCount; state++) {
      if (representative[state] != state) {
        continue;
      }
      final int target = newId[state];
      for (int b = 0; b < Dfa.ALPHABET_SIZE; b++) {
        dfa.setTransition(target, b, newId[representative[dfa.next(state, b)]]);
      }
      dfa.setMatch(target, dfa.isMatch(state));
    }

    dfa.setStart(newId[representative[dfa.start()]]);
    dfa.truncate(count);
  }
}
