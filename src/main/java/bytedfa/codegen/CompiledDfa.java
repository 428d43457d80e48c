package bytedfa.codegen;

import bytedfa.ByteMatcher;
import bytedfa.dfa.Dfa;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.MethodTooLargeException;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a DFA into a hidden class implementing {@link ByteMatcher}.
 *
 * <p>The generated {@code matchLength} and {@code reverseMatchLength} have no
 * table lookups: each state is a block of bytecode and each transition is a
 * jump, so the JIT can compile the whole automaton into straight-line native
 * code.
 */
public final class CompiledDfa {

  private static final Logger logger = LoggerFactory.getLogger(CompiledDfa.class);

  // Hidden classes must be in the same package as the lookup defining them
  private static final String CLASS_NAME = "bytedfa/codegen/CompiledDfa$Matcher";

  private static final String OBJECT_CLASS_NAME = Type.getInternalName(Object.class);
  private static final String MATCHER_CLASS_NAME = Type.getInternalName(ByteMatcher.class);

  private static final String CONSTRUCTOR_DESCRIPTOR =
    MethodType.methodType(void.class).toMethodDescriptorString();
  private static final String MATCH_LENGTH_DESCRIPTOR =
    MethodType.methodType(int.class, byte[].class, int.class, int.class).toMethodDescriptorString();

  private CompiledDfa() { }

  /**
   * Compile a DFA into a matcher.
   *
   * @param dfa automaton to compile
   * @return matcher agreeing with {@link Dfa#matchLength} and
   *   {@link Dfa#reverseMatchLength}
   * @throws IllegalArgumentException if the DFA is too large for one method
   */
  public static ByteMatcher compile(Dfa dfa) {
    final byte[] classBytes = generateClass(dfa);
    logger.debug("Generated {} bytes of class file for {} states", classBytes.length, dfa.stateCount());

    final MethodHandle constructMatcher;
    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      constructMatcher = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
    } catch (IllegalAccessException | NoSuchMethodException err) {
      throw new IllegalStateException("Failed to load compiled DFA", err);
    }

    try {
      return (ByteMatcher) constructMatcher.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct compiled DFA", error);
    }
  }

  /**
   * Generate the class file for a DFA.
   *
   * @param dfa automaton to compile
   * @return class file bytes
   * @throws IllegalArgumentException if the DFA is too large for one method
   */
  static byte[] generateClass(Dfa dfa) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      CLASS_NAME,
      null, // signature
      OBJECT_CLASS_NAME,
      new String[] { MATCHER_CLASS_NAME }
    );

    // Constructor (which takes no arguments, the class has no state)
    {
      final var mv = cw.visitMethod(Opcodes.ACC_PUBLIC, "<init>", CONSTRUCTOR_DESCRIPTOR, null, null);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      mv.visitMethodInsn(Opcodes.INVOKESPECIAL, OBJECT_CLASS_NAME, "<init>", CONSTRUCTOR_DESCRIPTOR, false);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `matchLength` and `reverseMatchLength` methods
    for (boolean reverse : new boolean[] { false, true }) {
      final String name = reverse ? "reverseMatchLength" : "matchLength";
      final var mv = cw.visitMethod(Opcodes.ACC_PUBLIC, name, MATCH_LENGTH_DESCRIPTOR, null, null);
      mv.visitCode();
      new DfaMethodCodegen(mv, dfa, reverse).visitDfa();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    try {
      return cw.toByteArray();
    } catch (MethodTooLargeException err) {
      throw new IllegalArgumentException(
        "DFA with " + dfa.stateCount() + " states is too large to compile into one method",
        err
      );
    }
  }
}
