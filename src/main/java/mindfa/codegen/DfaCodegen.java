package mindfa.codegen;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import mindfa.Dfa;
import mindfa.Recognizer;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compile a DFA into a JVM class implementing {@link Recognizer}.
 *
 * <p>Every DFA state becomes a labelled block in the body of {@code accepts}
 * and transitions become jumps between blocks, so running the generated
 * recognizer involves no table lookups or boxing.
 */
public final class DfaCodegen {

  private static final Logger logger = LoggerFactory.getLogger(DfaCodegen.class);

  private static final String CLASS_NAME = "mindfa/codegen/CompiledRecognizer";

  // Local variable slots in `accepts`
  private static final int INPUT_VAR = 1;
  private static final int OFFSET_VAR = 2;
  private static final int LENGTH_VAR = 3;

  private DfaCodegen() { }

  /**
   * Generate, load, and instantiate a recognizer for a DFA.
   *
   * @param dfa automaton to compile
   * @return recognizer accepting exactly the inputs {@code dfa} accepts
   * @throws IllegalStateException if the class cannot be generated or loaded
   */
  public static Recognizer compile(Dfa dfa) {
    final byte[] classBytes;
    try {
      classBytes = generateRecognizerClass(dfa, dfa.allStates().size() + " states").toByteArray();
    } catch (RuntimeException error) {
      throw new IllegalStateException("Failed to generate recognizer class", error);
    }
    logger.debug("Generated recognizer class of {} bytes for {} DFA states", classBytes.length, dfa.allStates().size());

    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return (Recognizer) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to load recognizer class", error);
    }
  }

  /**
   * Generate a class implementing {@link Recognizer}.
   *
   * @param dfa automaton to compile
   * @param description short summary included in {@code toString} of instances
   * @return class writer holding the finished class
   */
  static ClassWriter generateRecognizerClass(Dfa dfa, String description) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      CLASS_NAME,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.RECOGNIZER_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `toString`
    {
      final var mv = Method.TOSTRING_M.newMethod(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL);
      mv.visitCode();
      mv.visitLdcInsn("CompiledRecognizer(" + description + ")");
      mv.visitInsn(Opcodes.ARETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts`
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL);
      mv.visitCode();
      new AcceptsCodegen(mv, dfa).visitAccepts();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  /**
   * Body of {@code boolean accepts(CharSequence input)}.
   */
  private static final class AcceptsCodegen extends BytecodeHelpers {

    private final Dfa dfa;
    private final Map<Integer, Label> stateLabels = new HashMap<>();
    private final Label rejectLabel = new Label();

    AcceptsCodegen(MethodVisitor mv, Dfa dfa) {
      super(mv);
      this.dfa = dfa;
    }

    private Label stateLabel(int state) {
      return stateLabels.computeIfAbsent(state, k -> new Label());
    }

    void visitAccepts() {
      // int offset = 0; int length = input.length();
      mv.visitInsn(Opcodes.ICONST_0);
      mv.visitVarInsn(Opcodes.ISTORE, OFFSET_VAR);
      mv.visitVarInsn(Opcodes.ALOAD, INPUT_VAR);
      Method.LENGTH_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
      mv.visitVarInsn(Opcodes.ISTORE, LENGTH_VAR);
      mv.visitJumpInsn(Opcodes.GOTO, stateLabel(dfa.initialState));

      for (int state : dfa.allStates()) {
        visitState(state);
      }

      mv.visitLabel(rejectLabel);
      mv.visitInsn(Opcodes.ICONST_0);
      mv.visitInsn(Opcodes.IRETURN);
    }

    private void visitState(int state) {
      mv.visitLabel(stateLabel(state));

      // if (offset >= length) return accepting;
      final var notDone = new Label();
      mv.visitVarInsn(Opcodes.ILOAD, OFFSET_VAR);
      mv.visitVarInsn(Opcodes.ILOAD, LENGTH_VAR);
      mv.visitJumpInsn(Opcodes.IF_ICMPLT, notDone);
      visitConstantInt(dfa.finalStates.contains(state) ? 1 : 0);
      mv.visitInsn(Opcodes.IRETURN);

      // switch (input.charAt(offset++))
      mv.visitLabel(notDone);
      mv.visitVarInsn(Opcodes.ALOAD, INPUT_VAR);
      mv.visitVarInsn(Opcodes.ILOAD, OFFSET_VAR);
      Method.CHARAT_M.invokeMethod(mv, Method.CHARSEQUENCE_CLASS_NAME);
      mv.visitIincInsn(OFFSET_VAR, 1);

      final Map<Character, Integer> transitions = dfa.transitionsMap(state);
      final SortedSet<Character> symbols = new TreeSet<>(transitions.keySet());
      final int[] values = new int[symbols.size()];
      final Label[] labels = new Label[symbols.size()];
      int i = 0;
      for (char symbol : symbols) {
        values[i] = symbol;
        labels[i] = stateLabel(transitions.get(symbol));
        i++;
      }
      visitLookupBranch(rejectLabel, values, labels);
    }
  }
}
