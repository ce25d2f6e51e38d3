package mindfa;

import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run every stage from a regular expression to its minimal DFA.
 */
public final class RegexPipeline {

  private static final Logger logger = LoggerFactory.getLogger(RegexPipeline.class);

  private RegexPipeline() { }

  /**
   * Output of every stage.
   *
   * @param epsilonNfa Thompson construction output
   * @param nfa automaton without epsilon transitions
   * @param dfa subset construction output
   * @param minimalDfa minimized DFA, or the subset construction output (pruned
   *   if requested) when {@link PipelineOptions#minimize()} is off
   */
  public record Stages(
    EpsilonNfa epsilonNfa,
    Nfa nfa,
    Dfa dfa,
    Dfa minimalDfa
  ) { }

  /**
   * Parse a pattern and run it through the pipeline with default options.
   *
   * @param pattern regular expression source
   * @return all stages
   * @throws PatternSyntaxException if the pattern is malformed
   */
  public static Stages run(String pattern) throws PatternSyntaxException {
    return run(Regex.parse(pattern), PipelineOptions.DEFAULT);
  }

  public static Stages run(Regex regex) {
    return run(regex, PipelineOptions.DEFAULT);
  }

  /**
   * Run an AST through the pipeline.
   *
   * @param regex regular expression AST
   * @param options pipeline configuration
   * @return all stages
   */
  public static Stages run(Regex regex, PipelineOptions options) {
    final EpsilonNfa epsilonNfa = EpsilonNfa.fromRegex(regex);
    final Nfa nfa = Nfa.fromEpsilonNfa(epsilonNfa, options.eliminationStrategy());
    final Dfa dfa = Dfa.fromNfa(nfa);

    Dfa minimalDfa = options.pruneUnreachable() ? dfa.pruneUnreachable() : dfa;
    if (options.minimize()) {
      minimalDfa = minimalDfa.minimized();
    }

    logger.debug(
      "Pipeline for {}: {} -> {} -> {} -> {} states",
      regex,
      epsilonNfa.states.size(),
      nfa.states.size(),
      dfa.allStates().size(),
      minimalDfa.allStates().size()
    );
    return new Stages(epsilonNfa, nfa, dfa, minimalDfa);
  }
}
