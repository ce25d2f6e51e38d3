package mindfa;

/**
 * Label on an edge of an epsilon-NFA.
 *
 * This is either {@link EpsilonTransition#EPSILON} or a {@link SymbolTransition}.
 */
public interface TransitionLabel {

  /**
   * Label for a DOT graph transition.
   */
  String dotLabel();
}
