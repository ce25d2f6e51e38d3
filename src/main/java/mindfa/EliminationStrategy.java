package mindfa;

/**
 * How epsilon transitions are removed when going from an {@link EpsilonNfa}
 * to an {@link Nfa}.
 *
 * Both strategies accept the same language.
 */
public enum EliminationStrategy {

  /**
   * One NFA state per distinct epsilon closure reachable from the start.
   *
   * States whose closures coincide collapse onto the same NFA state, so the
   * output is usually much smaller than the input.
   */
  MERGE_CLOSURES,

  /**
   * One NFA state per epsilon-NFA state, keeping its state IDs.
   */
  PER_STATE;
}
