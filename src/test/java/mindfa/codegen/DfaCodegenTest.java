package mindfa.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import mindfa.Dfa;
import mindfa.Recognizer;
import org.junit.jupiter.api.Test;

public class DfaCodegenTest {

  @Test
  public void emptyLanguage() {
    final Recognizer recognizer = DfaCodegen.compile(new Dfa(Map.of(), 0, Set.of()));
    assertFalse(recognizer.accepts(""));
    assertFalse(recognizer.accepts("a"));
  }

  @Test
  public void emptyString() {
    final Recognizer recognizer = DfaCodegen.compile(new Dfa(Map.of(), 0, Set.of(0)));
    assertTrue(recognizer.accepts(""));
    assertFalse(recognizer.accepts("a"));
  }

  @Test
  public void singleSymbolBranch() {
    // Includes the NUL character, which is compared against zero
    final Dfa dfa = new Dfa(Map.of(0, Map.of('\0', 1), 1, Map.of('z', 2)), 0, Set.of(2));
    final Recognizer recognizer = DfaCodegen.compile(dfa);
    assertTrue(recognizer.accepts("\0z"));
    assertFalse(recognizer.accepts("z"));
    assertFalse(recognizer.accepts("\0"));
  }

  @Test
  public void denseAndSparseSwitches() {
    // 'a'..'d' is contiguous, 'a' 'm' 'z' is not
    final Dfa dfa = new Dfa(
      Map.of(
        0, Map.of('a', 1, 'b', 1, 'c', 2, 'd', 2),
        1, Map.of('a', 0, 'm', 2, 'z', 0)
      ),
      0,
      Set.of(2)
    );
    final Recognizer recognizer = DfaCodegen.compile(dfa);
    for (String input : new String[] { "", "a", "c", "d", "am", "az", "azc", "bzbm", "e", "ab", "cm" }) {
      assertEquals(dfa.accepts(input), recognizer.accepts(input), input);
    }
  }

  @Test
  public void sparseStateIds() {
    final Dfa dfa = new Dfa(Map.of(100, Map.of('x', 7), 7, Map.of('y', 100)), 100, Set.of(100));
    final Recognizer recognizer = DfaCodegen.compile(dfa);
    assertTrue(recognizer.accepts("xyxy"));
    assertFalse(recognizer.accepts("xyx"));
  }

  @Test
  public void manyStates() {
    // Chain accepting exactly 500 'a's
    final var states = new HashMap<Integer, Map<Character, Integer>>();
    for (int i = 0; i < 500; i++) {
      states.put(i, Map.of('a', i + 1));
    }
    final Dfa dfa = new Dfa(states, 0, Set.of(500));
    final Recognizer recognizer = DfaCodegen.compile(dfa);
    assertTrue(recognizer.accepts("a".repeat(500)));
    assertFalse(recognizer.accepts("a".repeat(499)));
    assertFalse(recognizer.accepts("a".repeat(501)));
  }

  @Test
  public void methodTooLarge() {
    // Every state costs a couple dozen bytes of code, so this overflows 64KiB
    final var states = new HashMap<Integer, Map<Character, Integer>>();
    for (int i = 0; i < 10000; i++) {
      states.put(i, Map.of('a', i + 1));
    }
    final Dfa dfa = new Dfa(states, 0, Set.of(10000));
    assertThrows(IllegalStateException.class, () -> DfaCodegen.compile(dfa));
  }

  @Test
  public void freshClassEveryTime() {
    final Dfa dfa = new Dfa(Map.of(0, Map.of('a', 0)), 0, Set.of(0));
    final Recognizer first = DfaCodegen.compile(dfa);
    final Recognizer second = DfaCodegen.compile(dfa);
    assertNotSame(first.getClass(), second.getClass());
    assertTrue(first.toString().startsWith("CompiledRecognizer("));
  }
}
