package mindfa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
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
 * Nondeterministic automaton without epsilon transitions.
 *
 * A state may have several edges for the same symbol.
 */
public final class Nfa implements Recognizer, DotGraph<Integer, Character> {

  private static final Logger logger = LoggerFactory.getLogger(Nfa.class);

  /**
   * Edge out of a state.
   *
   * @param symbol symbol consumed
   * @param targetState state at the other end of the edge
   */
  public record Transition(char symbol, int targetState) { }

  /**
   * State transitions, indexed along all of the starting nodes.
   *
   * Neither the list nor the inner lists are modifiable. There are no
   * duplicate edges out of a state.
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

  /**
   * Make an NFA from its parts.
   *
   * @param states transitions, indexed along starting nodes
   * @param initialState initial state
   * @param finalStates accepting states
   * @throws IllegalArgumentException if some state ID is not an index into {@code states}
   */
  public Nfa(List<List<Transition>> states, int initialState, Set<Integer> finalStates) {
    this.states = states
      .stream()
      .map(List::copyOf)
      .collect(Collectors.toUnmodifiableList());
    this.initialState = initialState;
    this.finalStates = Set.copyOf(finalStates);

    final int stateCount = this.states.size();
    final boolean outOfRange = !isState(initialState, stateCount)
      || this.finalStates.stream().anyMatch(state -> !isState(state, stateCount))
      || this.states
        .stream()
        .flatMap(List::stream)
        .anyMatch(transition -> !isState(transition.targetState(), stateCount));
    if (outOfRange) {
      throw new IllegalArgumentException("NFA state IDs must be between 0 and " + (stateCount - 1));
    }
  }

  private static boolean isState(int state, int stateCount) {
    return 0 <= state && state < stateCount;
  }

  /**
   * Remove epsilon transitions, merging states with identical closures.
   *
   * @param enfa input epsilon-NFA
   * @return equivalent NFA
   */
  public static Nfa fromEpsilonNfa(EpsilonNfa enfa) {
    return fromEpsilonNfa(enfa, EliminationStrategy.MERGE_CLOSURES);
  }

  /**
   * Remove epsilon transitions.
   *
   * @param enfa input epsilon-NFA
   * @param strategy how NFA states relate to epsilon-NFA states
   * @return equivalent NFA
   */
  public static Nfa fromEpsilonNfa(EpsilonNfa enfa, EliminationStrategy strategy) {
    final Nfa nfa = strategy == EliminationStrategy.PER_STATE
      ? perState(enfa)
      : mergingClosures(enfa);
    logger.debug(
      "Eliminated epsilon transitions ({}): {} states became {}",
      strategy,
      enfa.states.size(),
      nfa.states.size()
    );
    return nfa;
  }

  /**
   * Explore closure sets breadth first, starting from the closure of the
   * initial state.
   *
   * The closure sets are keyed by their sorted members, so the same closure
   * reached along different paths (or symbols) is only ever one state.
   */
  private static Nfa mergingClosures(EpsilonNfa enfa) {
    final SortedSet<Character> alphabet = enfa.alphabet();

    final var closureIds = new HashMap<IntSet, Integer>();
    final var closures = new ArrayList<IntSet>();
    final var toVisit = new LinkedList<Integer>();
    final var transitions = new ArrayList<List<Transition>>();
    final var finalStates = new HashSet<Integer>();

    // Seed the BFS
    final IntSet initialClosure = enfa.epsilonClosure(enfa.initialState);
    closureIds.put(initialClosure, 0);
    closures.add(initialClosure);
    transitions.add(new ArrayList<>());
    toVisit.addLast(0);

    while (!toVisit.isEmpty()) {
      final int current = toVisit.removeFirst();
      final IntSet closure = closures.get(current);
      if (closure.intersects(enfa.finalStates)) {
        finalStates.add(current);
      }

      final var edges = new LinkedHashSet<Transition>();
      for (char symbol : alphabet) {
        final IntSet moved = enfa.move(closure, symbol);
        if (moved.isEmpty()) {
          continue;
        }
        final IntSet target = enfa.epsilonClosure(moved);

        Integer targetId = closureIds.get(target);
        if (targetId == null) {
          targetId = closures.size();
          closureIds.put(target, targetId);
          closures.add(target);
          transitions.add(new ArrayList<>());
          toVisit.addLast(targetId);
        }
        edges.add(new Transition(symbol, targetId));
      }
      transitions.get(current).addAll(edges);
    }

    return new Nfa(transitions, 0, finalStates);
  }

  /**
   * Keep every epsilon-NFA state and give it the symbol edges of its closure.
   */
  private static Nfa perState(EpsilonNfa enfa) {
    final SortedSet<Character> alphabet = enfa.alphabet();
    final int stateCount = enfa.states.size();

    final var transitions = new ArrayList<List<Transition>>(stateCount);
    final var finalStates = new HashSet<Integer>();

    for (int state = 0; state < stateCount; state++) {
      final IntSet closure = enfa.epsilonClosure(state);
      if (closure.intersects(enfa.finalStates)) {
        finalStates.add(state);
      }

      final var edges = new ArrayList<Transition>();
      for (char symbol : alphabet) {
        final IntSet moved = enfa.move(closure, symbol);
        if (!moved.isEmpty()) {
          for (int target : enfa.epsilonClosure(moved)) {
            edges.add(new Transition(symbol, target));
          }
        }
      }
      transitions.add(edges);
    }

    return new Nfa(transitions, enfa.initialState, finalStates);
  }

  /**
   * All symbols appearing on some edge.
   *
   * @return sorted alphabet
   */
  public SortedSet<Character> alphabet() {
    return states
      .stream()
      .flatMap(List::stream)
      .map(Transition::symbol)
      .collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * Targets of the edges labelled with a symbol, from any of the given states.
   *
   * @param from source states
   * @param symbol symbol to consume
   * @return target states
   */
  public IntSet successors(Iterable<Integer> from, char symbol) {
    final var targets = new HashSet<Integer>();
    for (int state : from) {
      for (Transition transition : states.get(state)) {
        if (transition.symbol() == symbol) {
          targets.add(transition.targetState());
        }
      }
    }
    return new IntSet(targets);
  }

  /**
   * Simulate the automaton on an input, tracking the set of current states.
   */
  @Override
  public boolean accepts(CharSequence input) {
    IntSet current = IntSet.of(initialState);
    for (int i = 0; i < input.length() && !current.isEmpty(); i++) {
      current = successors(current, input.charAt(i));
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
  public Stream<DotGraph.Edge<Integer, Character>> edges() {
    return IntStream
      .range(0, states.size())
      .boxed()
      .flatMap((Integer from) -> {
        return states
          .get(from)
          .stream()
          .map(transition -> new DotGraph.Edge<>(from, transition.targetState(), transition.symbol()));
      });
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, Character> edge) {
    return SymbolTransition.symbolLabel(edge.label());
  }
}
