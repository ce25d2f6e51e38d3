package mindfa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by partition refinement.
 *
 * This is a variant of Hopcroft's algorithm: classes are split in place
 * against splitter sets taken from a work queue, and only the smaller half of
 * each split goes back on the queue. Once the queue is empty, the partition is
 * checked for stability before the quotient automaton gets built.
 */
public final class Minimizer {

  private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

  private Minimizer() { }

  /**
   * Minimize a DFA.
   *
   * States of the output are the classes of the coarsest partition consistent
   * with acceptance and transitions, numbered in partition order. Unreachable
   * states are kept (and merged like any other state). States from which no
   * accepting state can be reached all end up in one class without
   * transitions, so a DFA with no accepting states collapses to a single
   * state.
   *
   * @param input input DFA
   * @return equivalent DFA with no two equivalent states
   */
  public static Dfa minimize(Dfa input) {
    final Dfa dfa = withoutDeadTransitions(input);
    final SortedSet<Integer> allStates = dfa.allStates();
    final SortedSet<Character> alphabet = dfa.alphabet();

    // Keys are target states, values map symbols to source states
    final var reversedTransitions = new HashMap<Integer, Map<Character, Set<Integer>>>();
    for (var entry : dfa.states.entrySet()) {
      final int fromState = entry.getKey();
      for (var transition : entry.getValue().entrySet()) {
        reversedTransitions
          .computeIfAbsent(transition.getValue(), k -> new HashMap<>())
          .computeIfAbsent(transition.getKey(), k -> new HashSet<>())
          .add(fromState);
      }
    }

    // Initial partition: rejecting, then accepting
    final var partition = new ArrayList<IntSet>();
    final IntSet[] initial = new IntSet(allStates).split(dfa.finalStates);
    for (IntSet powerState : new IntSet[] { initial[1], initial[0] }) {
      if (!powerState.isEmpty()) {
        partition.add(powerState);
      }
    }

    final var classOf = new HashMap<Integer, Integer>();
    for (int i = 0; i < partition.size(); i++) {
      for (int state : partition.get(i)) {
        classOf.put(state, i);
      }
    }

    final var toVisit = new LinkedList<IntSet>(partition);
    int rounds = 0;
    while (true) {
      rounds++;
      refine(alphabet, reversedTransitions, partition, classOf, toVisit);

      final IntSet unstable = unstableClass(dfa, alphabet, partition, classOf);
      if (unstable == null) {
        break;
      }
      logger.debug("Class {} is not stable after refinement, re-enqueueing all classes", unstable);
      toVisit.addAll(partition);
    }

    // Quotient automaton, using the smallest member of each class
    final var states = new HashMap<Integer, Map<Character, Integer>>();
    final var finalStates = new HashSet<Integer>();
    for (int i = 0; i < partition.size(); i++) {
      final IntSet powerState = partition.get(i);
      if (powerState.intersects(dfa.finalStates)) {
        finalStates.add(i);
      }

      final var transitions = new HashMap<Character, Integer>();
      for (var transition : dfa.transitionsMap(powerState.first()).entrySet()) {
        transitions.put(transition.getKey(), classOf.get(transition.getValue()));
      }
      if (!transitions.isEmpty()) {
        states.put(i, transitions);
      }
    }

    logger.debug(
      "Minimized DFA with {} states over {} symbols into {} states ({} refinement rounds)",
      allStates.size(),
      alphabet.size(),
      partition.size(),
      rounds
    );
    return new Dfa(states, classOf.get(dfa.initialState), finalStates);
  }

  /**
   * Drop every transition into a state from which no accepting state can be
   * reached.
   *
   * A missing transition already rejects, so this does not change the
   * language. Dead states keep their IDs but lose all their transitions.
   */
  private static Dfa withoutDeadTransitions(Dfa dfa) {
    final var predecessors = new HashMap<Integer, Set<Integer>>();
    for (var entry : dfa.states.entrySet()) {
      for (int target : entry.getValue().values()) {
        predecessors.computeIfAbsent(target, k -> new HashSet<>()).add(entry.getKey());
      }
    }

    final var live = new HashSet<Integer>(dfa.finalStates);
    final var toVisit = new LinkedList<Integer>(dfa.finalStates);
    while (!toVisit.isEmpty()) {
      for (int source : predecessors.getOrDefault(toVisit.removeFirst(), Set.of())) {
        if (live.add(source)) {
          toVisit.addLast(source);
        }
      }
    }

    final var states = new HashMap<Integer, Map<Character, Integer>>();
    int dropped = 0;
    for (var entry : dfa.states.entrySet()) {
      final var transitions = new HashMap<Character, Integer>();
      for (var transition : entry.getValue().entrySet()) {
        if (live.contains(transition.getValue())) {
          transitions.put(transition.getKey(), transition.getValue());
        } else {
          dropped++;
        }
      }
      states.put(entry.getKey(), transitions);
    }

    if (dropped == 0) {
      return dfa;
    }
    logger.debug("Dropped {} transitions into states which cannot accept", dropped);
    return new Dfa(states, dfa.initialState, dfa.finalStates);
  }

  /**
   * Split classes until the work queue is empty.
   *
   * A class which is split keeps its index for the intersection with the
   * predecessor set and the difference is appended at the end.
   */
  private static void refine(
    SortedSet<Character> alphabet,
    Map<Integer, Map<Character, Set<Integer>>> reversedTransitions,
    List<IntSet> partition,
    Map<Integer, Integer> classOf,
    LinkedList<IntSet> toVisit
  ) {
    while (!toVisit.isEmpty()) {
      final IntSet splitter = toVisit.removeFirst();

      for (char symbol : alphabet) {
        final var predecessors = new HashSet<Integer>();
        for (int state : splitter) {
          final var reversed = reversedTransitions.get(state);
          if (reversed != null) {
            predecessors.addAll(reversed.getOrDefault(symbol, Set.of()));
          }
        }
        if (predecessors.isEmpty()) {
          continue;
        }

        final var affected = new TreeSet<Integer>();
        for (int state : predecessors) {
          affected.add(classOf.get(state));
        }

        for (int index : affected) {
          final IntSet[] parts = partition.get(index).split(predecessors);
          final IntSet inside = parts[0];
          final IntSet outside = parts[1];
          if (inside.isEmpty() || outside.isEmpty()) {
            continue;
          }

          partition.set(index, inside);
          partition.add(outside);
          final int outsideIndex = partition.size() - 1;
          for (int state : outside) {
            classOf.put(state, outsideIndex);
          }
          toVisit.addLast(inside.size() <= outside.size() ? inside : outside);

          if (logger.isTraceEnabled()) {
            logger.trace("Split on '{}' into {} and {}", symbol, inside, outside);
          }
        }
      }
    }
  }

  /**
   * Find a class whose members disagree on where some symbol leads.
   *
   * @return some unstable class, or {@code null} if the partition is stable
   */
  private static IntSet unstableClass(
    Dfa dfa,
    SortedSet<Character> alphabet,
    List<IntSet> partition,
    Map<Integer, Integer> classOf
  ) {
    for (IntSet powerState : partition) {
      final var representative = dfa.transitionsMap(powerState.first());
      for (int state : powerState) {
        final var transitions = dfa.transitionsMap(state);
        for (char symbol : alphabet) {
          final Integer expected = representative.get(symbol);
          final Integer actual = transitions.get(symbol);
          if (expected == null && actual == null) {
            continue;
          }
          if (expected == null || actual == null || !classOf.get(expected).equals(classOf.get(actual))) {
            return powerState;
          }
        }
      }
    }
    return null;
  }
}
