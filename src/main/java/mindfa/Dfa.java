package mindfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic finite automaton.
 *
 * The transition function is partial: a symbol missing from a state's map
 * means the input is rejected, not that it goes to some implicit dead state.
 */
public final class Dfa implements Recognizer, DotGraph<Integer, Character> {

  private static final Logger logger = LoggerFactory.getLogger(Dfa.class);

  /**
   * State transitions, indexed along starting nodes.
   *
   * States without outgoing transitions may be absent. Neither the outer nor
   * the inner maps are modifiable, and both iterate in ascending key order.
   */
  public final Map<Integer, Map<Character, Integer>> states;

  /**
   * Initial state.
   */
  public final int initialState;

  /**
   * Accepting states.
   */
  public final Set<Integer> finalStates;

  /**
   * Make a DFA from its parts.
   *
   * @param states transitions, indexed along starting nodes
   * @param initialState initial state
   * @param finalStates accepting states
   * @throws IllegalArgumentException if some state ID is negative
   */
  public Dfa(
    Map<Integer, Map<Character, Integer>> states,
    int initialState,
    Set<Integer> finalStates
  ) {
    final var copiedStates = new TreeMap<Integer, Map<Character, Integer>>();
    for (var entry : states.entrySet()) {
      copiedStates.put(entry.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(entry.getValue())));
    }
    this.states = Collections.unmodifiableSortedMap(copiedStates);
    this.initialState = initialState;
    this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<>(finalStates));

    if (allStates().stream().anyMatch(state -> state < 0)) {
      throw new IllegalArgumentException("DFA state IDs must be non-negative");
    }
  }

  /**
   * Construct a DFA from an NFA using the powerset construction.
   *
   * Subsets of NFA states are discovered breadth first from {@code {start}},
   * which becomes state 0, and numbered in discovery order.
   *
   * @param nfa input NFA
   * @return equivalent DFA
   */
  public static Dfa fromNfa(Nfa nfa) {
    final SortedSet<Character> alphabet = nfa.alphabet();

    // All `IntSet`s here are powerset states
    final var subsetIds = new HashMap<IntSet, Integer>();
    final var subsets = new ArrayList<IntSet>();
    final var toVisit = new LinkedList<Integer>();
    final var states = new HashMap<Integer, Map<Character, Integer>>();
    final var finalStates = new HashSet<Integer>();

    final var initialSubset = IntSet.of(nfa.initialState);
    subsetIds.put(initialSubset, 0);
    subsets.add(initialSubset);
    toVisit.addLast(0);

    while (!toVisit.isEmpty()) {
      final int current = toVisit.removeFirst();
      final IntSet subset = subsets.get(current);
      if (subset.intersects(nfa.finalStates)) {
        finalStates.add(current);
      }

      final var transitions = new LinkedHashMap<Character, Integer>();
      for (char symbol : alphabet) {
        final IntSet target = nfa.successors(subset, symbol);
        if (target.isEmpty()) {
          continue;
        }

        Integer targetId = subsetIds.get(target);
        if (targetId == null) {
          targetId = subsets.size();
          subsetIds.put(target, targetId);
          subsets.add(target);
          toVisit.addLast(targetId);
        }
        transitions.put(symbol, targetId);
      }
      states.put(current, transitions);
    }

    logger.debug("Determinized NFA with {} states into DFA with {} states", nfa.states.size(), subsets.size());
    return new Dfa(states, 0, finalStates);
  }

  /**
   * Minimize this DFA.
   *
   * @return equivalent DFA over the coarsest consistent partition of states
   * @see Minimizer#minimize(Dfa)
   */
  public Dfa minimized() {
    return Minimizer.minimize(this);
  }

  /**
   * Drop every state that cannot be reached from the initial state.
   *
   * State IDs are left as they are.
   *
   * @return equivalent DFA with only reachable states
   */
  public Dfa pruneUnreachable() {
    final Set<Integer> reachable = reachableStates();
    final var prunedStates = new HashMap<Integer, Map<Character, Integer>>();
    for (var entry : states.entrySet()) {
      if (reachable.contains(entry.getKey())) {
        prunedStates.put(entry.getKey(), entry.getValue());
      }
    }
    final Set<Integer> prunedFinals = finalStates
      .stream()
      .filter(reachable::contains)
      .collect(Collectors.toSet());
    return new Dfa(prunedStates, initialState, prunedFinals);
  }

  /**
   * Transitions out of a state.
   *
   * @param state state inside the DFA
   * @return map of symbols to target states (empty if there are none)
   */
  public Map<Character, Integer> transitionsMap(int state) {
    return states.getOrDefault(state, Map.of());
  }

  /**
   * Every state mentioned anywhere: the initial state, the accepting states,
   * and all transition sources and targets.
   *
   * @return sorted set of states
   */
  public SortedSet<Integer> allStates() {
    final var all = new TreeSet<Integer>();
    all.add(initialState);
    all.addAll(finalStates);
    for (var entry : states.entrySet()) {
      all.add(entry.getKey());
      all.addAll(entry.getValue().values());
    }
    return all;
  }

  /**
   * States reachable from the initial state.
   *
   * @return set of reachable states
   */
  public Set<Integer> reachableStates() {
    final var seenStates = new HashSet<Integer>();
    final var toVisit = new LinkedList<Integer>();
    seenStates.add(initialState);
    toVisit.push(initialState);

    while (!toVisit.isEmpty()) {
      for (int target : transitionsMap(toVisit.pop()).values()) {
        if (seenStates.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return seenStates;
  }

  /**
   * All symbols appearing on some transition.
   *
   * @return sorted alphabet
   */
  public SortedSet<Character> alphabet() {
    return states
      .values()
      .stream()
      .flatMap(transitions -> transitions.keySet().stream())
      .collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * Run the DFA on an input.
   *
   * The run stops at the first symbol without a transition.
   */
  @Override
  public boolean accepts(CharSequence input) {
    int currentState = initialState;
    for (int i = 0; i < input.length(); i++) {
      final Integer next = transitionsMap(currentState).get(input.charAt(i));
      if (next == null) {
        return false;
      }
      currentState = next;
    }
    return finalStates.contains(currentState);
  }

  @Override
  public Integer initialVertex() {
    return initialState;
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return allStates()
      .stream()
      .map((Integer id) -> new DotGraph.Vertex<Integer>(id, finalStates.contains(id)));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, Character>> edges() {
    return states
      .entrySet()
      .stream()
      .flatMap((Map.Entry<Integer, Map<Character, Integer>> transitions) -> {
        final Integer from = transitions.getKey();
        return transitions
          .getValue()
          .entrySet()
          .stream()
          .map((Map.Entry<Character, Integer> transition) -> {
            return new DotGraph.Edge<>(from, transition.getValue(), transition.getKey());
          });
      });
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, Character> edge) {
    return SymbolTransition.symbolLabel(edge.label());
  }

  @Override
  public String toString() {
    return "Dfa(initial = " + initialState + ", final = " + finalStates + ", states = " + states + ")";
  }
}
