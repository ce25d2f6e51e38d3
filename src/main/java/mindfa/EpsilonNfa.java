package mindfa;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nondeterministic automaton with epsilon transitions.
 *
 * This is the output of the Thompson-style construction over a {@link Regex}
 * and the input to epsilon elimination ({@link Nfa#fromEpsilonNfa}).
 */
public final class EpsilonNfa implements Recognizer, DotGraph<Integer, TransitionLabel> {

  private static final Logger logger = LoggerFactory.getLogger(EpsilonNfa.class);

  /**
   * Edge out of a state.
   *
   * @param label symbol consumed (or epsilon)
   * @param targetState state at the other end of the edge
   */
  public record Transition(TransitionLabel label, int targetState) { }

  /**
   * State transitions, indexed along all of the starting nodes.
   *
   * This list is not modifiable and supports fast random access. The inner
   * lists are in insertion order and also not modifiable.
   */
  public final List<List<Transition>> states;

  /**
   * Index of the initial state inside {@code states}.
   */
  public final int initialState;

  /**
   * Accepting states.
   */
  public final Set<Integer> finalStates;

  private EpsilonNfa(List<List<Transition>> states, int initialState, Set<Integer> finalStates) {
    this.states = states;
    this.initialState = initialState;
    this.finalStates = finalStates;
  }

  /**
   * Compile an AST into an epsilon-NFA.
   *
   * @param regex regular expression AST
   * @return automaton accepting exactly the language of the AST
   */
  public static EpsilonNfa fromRegex(Regex regex) {
    final var builder = new Builder();
    return builder.constructNfa(regex.accept(builder));
  }

  /**
   * Sub-automaton under construction.
   *
   * {@code start} has no incoming edges from outside the fragment and
   * {@code accept} has no outgoing edges until the fragment is composed.
   *
   * @param start entry state
   * @param accept exit state
   */
  public record Fragment(int start, int accept) { }

  /**
   * Thompson construction, one fragment per AST node.
   *
   * The builder owns the state counter and the transitions collected so far,
   * so fragments built by the same builder never share a state. A builder can
   * only produce one automaton.
   */
  public static final class Builder implements RegexVisitor<Fragment> {

    private boolean used = false;
    private final List<List<Transition>> transitions = new ArrayList<>();

    /**
     * Summon a fresh state identifier.
     *
     * @return fresh state ID
     */
    int freshState() {
      transitions.add(new ArrayList<>());
      return transitions.size() - 1;
    }

    private void addEpsilon(int from, int to) {
      transitions.get(from).add(new Transition(EpsilonTransition.EPSILON, to));
    }

    @Override
    public Fragment visitLiteral(char symbol) {
      final int start = freshState();
      final int accept = freshState();
      transitions.get(start).add(new Transition(new SymbolTransition(symbol), accept));
      return new Fragment(start, accept);
    }

    @Override
    public Fragment visitConcatenation(Fragment lhs, Fragment rhs) {
      addEpsilon(lhs.accept(), rhs.start());
      return new Fragment(lhs.start(), rhs.accept());
    }

    @Override
    public Fragment visitAlternation(Fragment lhs, Fragment rhs) {
      final int start = freshState();
      final int accept = freshState();
      addEpsilon(start, lhs.start());
      addEpsilon(start, rhs.start());
      addEpsilon(lhs.accept(), accept);
      addEpsilon(rhs.accept(), accept);
      return new Fragment(start, accept);
    }

    @Override
    public Fragment visitKleene(Fragment arg) {
      final int start = freshState();
      final int accept = freshState();
      addEpsilon(start, arg.start());        // enter
      addEpsilon(arg.accept(), arg.start()); // loop
      addEpsilon(start, accept);             // skip
      addEpsilon(arg.accept(), accept);      // exit
      return new Fragment(start, accept);
    }

    /**
     * Finalize the construction of the epsilon-NFA.
     *
     * @param root fragment for the root of the AST
     * @return automaton whose start and accept are those of the root
     */
    public EpsilonNfa constructNfa(Fragment root) {
      if (used) {
        throw new IllegalStateException("construct may only be called once on an epsilon-NFA builder");
      } else {
        used = true;
      }

      final var states = transitions
        .stream()
        .map(List::copyOf)
        .collect(Collectors.toUnmodifiableList());

      logger.debug("Built epsilon-NFA with {} states", states.size());
      return new EpsilonNfa(states, root.start(), Set.of(root.accept()));
    }
  }

  /**
   * Set of states reachable using only epsilon transitions.
   *
   * @param state state from which to start
   * @return closure, always containing {@code state}
   */
  public IntSet epsilonClosure(int state) {
    return epsilonClosure(IntSet.of(state));
  }

  /**
   * Union of the epsilon closures of several states.
   *
   * All the closures are explored with one breadth-first search sharing a
   * single visited set.
   *
   * @param from states from which to start
   * @return closure, always containing all of {@code from}
   */
  public IntSet epsilonClosure(Iterable<Integer> from) {
    final var seenStates = new HashSet<Integer>();
    final var toVisit = new LinkedList<Integer>();

    for (int state : from) {
      if (seenStates.add(state)) {
        toVisit.addLast(state);
      }
    }

    while (!toVisit.isEmpty()) {
      final int next = toVisit.removeFirst();
      for (Transition transition : states.get(next)) {
        if (transition.label() == EpsilonTransition.EPSILON && seenStates.add(transition.targetState())) {
          toVisit.addLast(transition.targetState());
        }
      }
    }

    return new IntSet(seenStates);
  }

  /**
   * States reached from a set of states by consuming exactly one symbol.
   *
   * @param from states from which to move
   * @param symbol symbol to consume
   * @return targets of matching symbol edges (epsilon edges are not followed)
   */
  public IntSet move(Iterable<Integer> from, char symbol) {
    final var targets = new HashSet<Integer>();
    final var label = new SymbolTransition(symbol);
    for (int state : from) {
      for (Transition transition : states.get(state)) {
        if (label.equals(transition.label())) {
          targets.add(transition.targetState());
        }
      }
    }
    return new IntSet(targets);
  }

  /**
   * All symbols appearing on some edge.
   *
   * @return sorted alphabet
   */
  public SortedSet<Character> alphabet() {
    final var alphabet = new TreeSet<Character>();
    for (List<Transition> transitions : states) {
      for (Transition transition : transitions) {
        if (transition.label() instanceof SymbolTransition symbol) {
          alphabet.add(symbol.symbol());
        }
      }
    }
    return alphabet;
  }

  /**
   * Simulate the automaton on an input, tracking the closure of all current
   * states.
   */
  @Override
  public boolean accepts(CharSequence input) {
    IntSet current = epsilonClosure(initialState);
    for (int i = 0; i < input.length() && !current.isEmpty(); i++) {
      current = epsilonClosure(move(current, input.charAt(i)));
    }
    return current.intersects(finalStates);
  }

  @Override
  public Integer initialVertex() {
    return initialState;
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return IntStream
      .range(0, states.size())
      .mapToObj((int id) -> new DotGraph.Vertex<Integer>(id, finalStates.contains(id)));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, TransitionLabel>> edges() {
    return IntStream
      .range(0, states.size())
      .boxed()
      .flatMap((Integer from) -> {
        return states
          .get(from)
          .stream()
          .map(transition -> new DotGraph.Edge<>(from, transition.targetState(), transition.label()));
      });
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, TransitionLabel> edge) {
    return edge.label().dotLabel();
  }
}
