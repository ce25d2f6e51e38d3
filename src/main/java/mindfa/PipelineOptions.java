package mindfa;

/**
 * Knobs for {@link RegexPipeline}.
 *
 * @param eliminationStrategy how epsilon transitions are removed
 * @param pruneUnreachable drop unreachable DFA states before minimizing
 * @param minimize run the minimizer (otherwise the minimal DFA stage is the
 *   subset construction output)
 */
public record PipelineOptions(
  EliminationStrategy eliminationStrategy,
  boolean pruneUnreachable,
  boolean minimize
) {

  public static final PipelineOptions DEFAULT = new PipelineOptions(EliminationStrategy.MERGE_CLOSURES, false, true);

  public PipelineOptions {
    if (eliminationStrategy == null) {
      throw new IllegalArgumentException("Elimination strategy must not be null");
    }
  }

  public PipelineOptions withEliminationStrategy(EliminationStrategy strategy) {
    return new PipelineOptions(strategy, pruneUnreachable, minimize);
  }

  public PipelineOptions withPruneUnreachable(boolean prune) {
    return new PipelineOptions(eliminationStrategy, prune, minimize);
  }

  public PipelineOptions withMinimize(boolean minimizeDfa) {
    return new PipelineOptions(eliminationStrategy, pruneUnreachable, minimizeDfa);
  }
}
