package mindfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class DfaTest {

  private static Nfa.Transition edge(char symbol, int target) {
    return new Nfa.Transition(symbol, target);
  }

  @Test
  public void fromSingleLiteral() {
    // 0 --a--> 1
    final Nfa nfa = new Nfa(List.of(List.of(edge('a', 1)), List.of()), 0, Set.of(1));
    final Dfa dfa = Dfa.fromNfa(nfa);

    assertEquals(0, dfa.initialState);
    assertEquals(Set.of(1), dfa.finalStates);
    assertEquals(Integer.valueOf(1), dfa.transitionsMap(0).get('a'));
  }

  @Test
  public void fromUnion() {
    // 0 --a--> 1 (accepting), 0 --b--> 2
    final Nfa nfa = new Nfa(
      List.of(List.of(edge('a', 1), edge('b', 2)), List.of(), List.of()),
      0,
      Set.of(1)
    );
    final Dfa dfa = Dfa.fromNfa(nfa);

    assertEquals(Set.of(1), dfa.finalStates);
    assertEquals(Map.of('a', 1, 'b', 2), dfa.transitionsMap(0));
  }

  @Test
  public void fromConcatenation() {
    // 0 --a--> 1 --b--> 2
    final Nfa nfa = new Nfa(
      List.of(List.of(edge('a', 1)), List.of(edge('b', 2)), List.of()),
      0,
      Set.of(2)
    );
    final Dfa dfa = Dfa.fromNfa(nfa);

    final int s1 = dfa.transitionsMap(dfa.initialState).get('a');
    final int s2 = dfa.transitionsMap(s1).get('b');
    assertTrue(dfa.finalStates.contains(s2));
    assertFalse(dfa.finalStates.contains(s1));
  }

  @Test
  public void fromSelfLoop() {
    // 0 (accepting) --a--> 0
    final Nfa nfa = new Nfa(List.of(List.of(edge('a', 0))), 0, Set.of(0));
    final Dfa dfa = Dfa.fromNfa(nfa);

    assertTrue(dfa.finalStates.contains(dfa.initialState));
    assertEquals(Integer.valueOf(dfa.initialState), dfa.transitionsMap(dfa.initialState).get('a'));
  }

  @Test
  public void fromLoopThenAccept() {
    // 0 --a,b--> 0, 0 --c--> 1 (accepting)
    final Nfa nfa = new Nfa(
      List.of(List.of(edge('a', 0), edge('b', 0), edge('c', 1)), List.of()),
      0,
      Set.of(1)
    );
    final Dfa dfa = Dfa.fromNfa(nfa);

    final int s0 = dfa.initialState;
    assertEquals(Integer.valueOf(s0), dfa.transitionsMap(s0).get('a'));
    assertEquals(Integer.valueOf(s0), dfa.transitionsMap(s0).get('b'));
    assertTrue(dfa.finalStates.contains(dfa.transitionsMap(s0).get('c')));
  }

  @Test
  public void mergesNondeterministicTargets() {
    // 0 --a--> 1, 0 --a--> 2, 1 --b--> 3 (accepting), 2 --c--> 3
    final Nfa nfa = new Nfa(
      List.of(
        List.of(edge('a', 1), edge('a', 2)),
        List.of(edge('b', 3)),
        List.of(edge('c', 3)),
        List.of()
      ),
      0,
      Set.of(3)
    );
    final Dfa dfa = Dfa.fromNfa(nfa);

    // Breadth first numbering: {0} = 0, {1,2} = 1, {3} = 2
    assertEquals(Set.of(0, 1, 2), dfa.allStates());
    assertEquals(Map.of('a', 1), dfa.transitionsMap(0));
    assertEquals(Map.of('b', 2, 'c', 2), dfa.transitionsMap(1));
    assertEquals(Set.of(2), dfa.finalStates);
  }

  @Test
  public void determinizationPreservesLanguage() {
    final var random = new Random(2024);
    final List<String> inputs = AutomataTesting.allStrings("abc", 5);
    for (int i = 0; i < 40; i++) {
      final Regex regex = AutomataTesting.randomRegex(random, "abc", 4);
      final Nfa nfa = Nfa.fromEpsilonNfa(EpsilonNfa.fromRegex(regex));
      final Dfa dfa = Dfa.fromNfa(nfa);

      assertTrue(dfa.allStates().size() <= Math.pow(2, nfa.states.size()));
      for (String input : inputs) {
        assertEquals(nfa.accepts(input), dfa.accepts(input), () -> regex + " on \"" + input + "\"");
      }
    }
  }

  @Test
  public void missingTransitionRejects() {
    final Dfa dfa = new Dfa(Map.of(0, Map.of('a', 1)), 0, Set.of(0, 1));
    assertTrue(dfa.accepts(""));
    assertTrue(dfa.accepts("a"));
    assertFalse(dfa.accepts("b"));
    assertFalse(dfa.accepts("aa"));
  }

  @Test
  public void rejectsNegativeStateIds() {
    assertThrows(IllegalArgumentException.class, () -> new Dfa(Map.of(0, Map.of('a', -1)), 0, Set.of()));
    assertThrows(IllegalArgumentException.class, () -> new Dfa(Map.of(), -3, Set.of()));
  }

  @Test
  public void pruneUnreachable() {
    // State 2 is unreachable and state 3 is only reachable from it
    final Dfa dfa = new Dfa(
      Map.of(
        0, Map.of('a', 1),
        2, Map.of('a', 3)
      ),
      0,
      Set.of(1, 3)
    );
    assertEquals(Set.of(0, 1), dfa.reachableStates());

    final Dfa pruned = dfa.pruneUnreachable();
    assertEquals(Set.of(0, 1), pruned.allStates());
    assertEquals(Set.of(1), pruned.finalStates);
    assertTrue(pruned.accepts("a"));
    assertFalse(pruned.accepts(""));
  }

  @Test
  public void statesAreCopied() {
    final var transitions = new HashMap<Integer, Map<Character, Integer>>();
    transitions.put(0, new HashMap<>(Map.of('a', 0)));
    final Dfa dfa = new Dfa(transitions, 0, Set.of(0));
    transitions.get(0).put('b', 0);

    assertEquals(Map.of('a', 0), dfa.transitionsMap(0));
    assertThrows(UnsupportedOperationException.class, () -> dfa.states.put(1, Map.of()));
  }
}
