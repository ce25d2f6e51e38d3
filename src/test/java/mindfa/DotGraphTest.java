package mindfa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class DotGraphTest {

  @Test
  public void dfaGraph() {
    final Dfa dfa = new Dfa(Map.of(0, Map.of('a', 1)), 0, Set.of(1));
    final String expected = String.join(
      "\n",
      "digraph \"dfa\" {",
      "  rankdir = LR;",
      "  \"0\" [shape = circle, label = <0>];",
      "  \"1\" [shape = doublecircle, label = <1>];",
      "  \"_init\" [shape = none, label = <>];",
      "  \"_init\" -> \"0\";",
      "  \"0\" -> \"1\" [label = <<font face=\"courier\">a</font>>];",
      "}"
    );
    assertEquals(expected, dfa.dotGraph("dfa"));
  }

  @Test
  public void epsilonEdges() {
    final EpsilonNfa enfa = EpsilonNfa.fromRegex(Regex.parse("ab"));
    final String dot = enfa.dotGraph("enfa");
    assertTrue(dot.contains("\"1\" -> \"2\" [label = <&epsilon;>];"), dot);
    assertTrue(dot.contains("\"3\" [shape = doublecircle, label = <3>];"), dot);
    assertTrue(dot.contains("\"_init\" -> \"0\";"), dot);
  }

  @Test
  public void escapesNonAlphanumericSymbols() {
    final Dfa dfa = new Dfa(Map.of(0, Map.of('<', 0)), 0, Set.of(0));
    final String dot = dfa.dotGraph("quoted \"name\"");
    assertTrue(dot.startsWith("digraph \"quoted \\\"name\\\"\" {"), dot);
    assertTrue(dot.contains("\\u003C"), dot);
  }

  @Test
  public void nfaGraphListsEveryState() {
    final Nfa nfa = Nfa.fromEpsilonNfa(EpsilonNfa.fromRegex(Regex.parse("(a+b)*c")));
    assertEquals(nfa.states.size(), nfa.vertices().count());
    assertEquals(nfa.states.stream().mapToLong(List::size).sum(), nfa.edges().count());
  }
}
