package bytedfa.codegen;

import bytedfa.dfa.Dfa;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Generates the body of {@code ByteMatcher.matchLength} (or, scanning
 * backwards, of {@code ByteMatcher.reverseMatchLength}) for a DFA.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * method: every live state is a block, and a transition is a jump to the
 * block of the target state. The dead state has no block: going to it means
 * returning the last match.
 */
final class DfaMethodCodegen {

  /**
   * Largest byte range still checked through the switch instead of through a
   * range check.
   */
  private static final int SMALL_RANGE_THRESHOLD = 16;

  private final MethodVisitor mv;
  private final Dfa dfa;
  private final boolean reverse;

  // Locals: `this` is 0, then the three arguments, then temporaries
  private final int inputLocal = 1;
  private final int offsetLocal = 2;
  private final int endLocal = 3;
  private final int lastMatchLocal = 4;
  private final int positionLocal = 5;
  private final int byteLocal = 6;

  /**
   * Entering a state: records the match if the state is matching.
   */
  private final Label[] entryLabels;

  /**
   * Reading the next byte in a state.
   */
  private final Label[] stepLabels;

  /**
   * Return the last match recorded.
   */
  private final Label returnLastMatch = new Label();

  DfaMethodCodegen(MethodVisitor mv, Dfa dfa, boolean reverse) {
    this.mv = mv;
    this.dfa = dfa;
    this.reverse = reverse;
    this.entryLabels = new Label[dfa.stateCount()];
    this.stepLabels = new Label[dfa.stateCount()];
    for (int state = 0; state < dfa.stateCount(); state++) {
      if (state != Dfa.DEAD) {
        entryLabels[state] = new Label();
        stepLabels[state] = new Label();
      }
    }
  }

  void visitDfa() {
    // lastMatch = -1; position = offset (or end, backwards)
    pushInt(-1);
    mv.visitVarInsn(Opcodes.ISTORE, lastMatchLocal);
    mv.visitVarInsn(Opcodes.ILOAD, reverse ? endLocal : offsetLocal);
    mv.visitVarInsn(Opcodes.ISTORE, positionLocal);

    // Starting does not count as a match, so skip the entry block
    if (dfa.start() == Dfa.DEAD) {
      mv.visitJumpInsn(Opcodes.GOTO, returnLastMatch);
    } else {
      mv.visitJumpInsn(Opcodes.GOTO, stepLabels[dfa.start()]);
    }

    for (int state = 0; state < dfa.stateCount(); state++) {
      if (state != Dfa.DEAD) {
        visitState(state);
      }
    }

    mv.visitLabel(returnLastMatch);
    mv.visitVarInsn(Opcodes.ILOAD, lastMatchLocal);
    mv.visitInsn(Opcodes.IRETURN);
  }

  private void visitState(int state) {
    mv.visitLabel(entryLabels[state]);
    if (dfa.isMatch(state)) {
      if (reverse) {
        // lastMatch = end - position
        mv.visitVarInsn(Opcodes.ILOAD, endLocal);
        mv.visitVarInsn(Opcodes.ILOAD, positionLocal);
      } else {
        // lastMatch = position - offset
        mv.visitVarInsn(Opcodes.ILOAD, positionLocal);
        mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      }
      mv.visitInsn(Opcodes.ISUB);
      mv.visitVarInsn(Opcodes.ISTORE, lastMatchLocal);
    }

    mv.visitLabel(stepLabels[state]);

    if (reverse) {
      // if (position <= offset) return lastMatch
      mv.visitVarInsn(Opcodes.ILOAD, positionLocal);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitJumpInsn(Opcodes.IF_ICMPLE, returnLastMatch);

      // byte = input[--position] & 0xFF
      mv.visitIincInsn(positionLocal, -1);
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, positionLocal);
      mv.visitInsn(Opcodes.BALOAD);
      pushInt(0xFF);
      mv.visitInsn(Opcodes.IAND);
      mv.visitVarInsn(Opcodes.ISTORE, byteLocal);
    } else {
      // if (position >= end) return lastMatch
      mv.visitVarInsn(Opcodes.ILOAD, positionLocal);
      mv.visitVarInsn(Opcodes.ILOAD, endLocal);
      mv.visitJumpInsn(Opcodes.IF_ICMPGE, returnLastMatch);

      // byte = input[position++] & 0xFF
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, positionLocal);
      mv.visitInsn(Opcodes.BALOAD);
      pushInt(0xFF);
      mv.visitInsn(Opcodes.IAND);
      mv.visitVarInsn(Opcodes.ISTORE, byteLocal);
      mv.visitIincInsn(positionLocal, 1);
    }

    visitTransitions(dfa.sparseTransitions(state));
  }

  /**
   * Generate the branching logic for the transitions out of a state.
   *
   * <p>Bytes in small ranges all get fed into one switch. Large ranges get
   * grouped by target and are tried in order, each group with a single
   * combined range check. Anything left over goes to the dead state.
   *
   * @param transitions transitions covering every byte
   */
  private void visitTransitions(List<Dfa.Transition> transitions) {
    final var shortRanges = new TreeMap<Integer, Label>();
    final var longRanges = new LinkedHashMap<Integer, List<Dfa.Transition>>();

    for (Dfa.Transition transition : transitions) {
      if (transition.next() == Dfa.DEAD) {
        continue;
      }
      if (transition.end() - transition.start() < SMALL_RANGE_THRESHOLD) {
        for (int b = transition.start(); b <= transition.end(); b++) {
          shortRanges.put(b, entryLabels[transition.next()]);
        }
      } else {
        longRanges.computeIfAbsent(transition.next(), k -> new ArrayList<>()).add(transition);
      }
    }

    if (!shortRanges.isEmpty()) {
      final Label fallthrough = longRanges.isEmpty() ? returnLastMatch : new Label();
      mv.visitVarInsn(Opcodes.ILOAD, byteLocal);
      visitByteSwitch(fallthrough, shortRanges);
      if (!longRanges.isEmpty()) {
        mv.visitLabel(fallthrough);
      }
    }

    for (Map.Entry<Integer, List<Dfa.Transition>> entry : longRanges.entrySet()) {

      /* `x` is in `[lo, hi]` iff `((lo - 1) - x) & (x - (hi + 1))` is negative
       * (both sides are negative exactly when `x` is in the range). For a
       * union of ranges, OR together the checks for every range and branch
       * once on the sign of the result.
       */
      boolean first = true;
      for (Dfa.Transition range : entry.getValue()) {
        pushInt(range.start() - 1);
        mv.visitVarInsn(Opcodes.ILOAD, byteLocal);
        mv.visitInsn(Opcodes.ISUB);

        mv.visitVarInsn(Opcodes.ILOAD, byteLocal);
        pushInt(range.end() + 1);
        mv.visitInsn(Opcodes.ISUB);

        mv.visitInsn(Opcodes.IAND);
        if (first) {
          first = false;
        } else {
          mv.visitInsn(Opcodes.IOR);
        }
      }
      mv.visitJumpInsn(Opcodes.IFLT, entryLabels[entry.getKey()]);
    }

    mv.visitJumpInsn(Opcodes.GOTO, returnLastMatch);
  }

  /**
   * Jump on the byte on top of the stack.
   *
   * <p>Cases filling at least half the span from the smallest to the largest
   * byte become a {@code tableswitch} (gaps jump to {@code fallthrough}),
   * sparser ones a {@code lookupswitch}.
   *
   * @param fallthrough where bytes without a case jump
   * @param cases non-empty map from byte to jump target
   */
  private void visitByteSwitch(Label fallthrough, TreeMap<Integer, Label> cases) {
    final int low = cases.firstKey();
    final int high = cases.lastKey();

    if (cases.size() == 1) {
      if (low == 0) {
        mv.visitJumpInsn(Opcodes.IFEQ, cases.get(low));
      } else {
        pushInt(low);
        mv.visitJumpInsn(Opcodes.IF_ICMPEQ, cases.get(low));
      }
      mv.visitJumpInsn(Opcodes.GOTO, fallthrough);
    } else if (2 * cases.size() >= high - low + 1) {
      final Label[] labels = new Label[high - low + 1];
      for (int b = low; b <= high; b++) {
        labels[b - low] = cases.getOrDefault(b, fallthrough);
      }
      mv.visitTableSwitchInsn(low, high, fallthrough, labels);
    } else {
      final int[] keys = new int[cases.size()];
      final Label[] labels = new Label[cases.size()];
      int i = 0;
      for (Map.Entry<Integer, Label> entry : cases.entrySet()) {
        keys[i] = entry.getKey();
        labels[i] = entry.getValue();
        i++;
      }
      mv.visitLookupSwitchInsn(fallthrough, keys, labels);
    }
  }

  /**
   * Push a constant in {@code -1..256}, the range of bytes and their
   * neighbours, in as few bytes of code as possible.
   */
  private void pushInt(int value) {
    if (-1 <= value && value <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + value);
    } else if (Byte.MIN_VALUE <= value && value <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, value);
    } else {
      mv.visitIntInsn(Opcodes.SIPUSH, value);
    }
  }
}
