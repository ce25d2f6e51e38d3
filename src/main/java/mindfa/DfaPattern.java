package mindfa;

import java.util.regex.PatternSyntaxException;
import mindfa.codegen.DfaCodegen;

/**
 * Regular expression compiled down to a minimal DFA.
 *
 * <p>Patterns only support full matches: {@link #matches(CharSequence)} is
 * true when the whole input is in the language of the pattern.
 */
public abstract class DfaPattern {

  private final String pattern;
  private final RegexPipeline.Stages stages;

  protected DfaPattern(String pattern, RegexPipeline.Stages stages) {
    this.pattern = pattern;
    this.stages = stages;
  }

  /**
   * Compile a pattern into a recognizer running as generated bytecode.
   *
   * @param regex source of the pattern
   * @return compiled DFA pattern
   * @throws PatternSyntaxException if the pattern is malformed
   * @throws IllegalStateException if the bytecode cannot be generated
   */
  public static DfaPattern compile(String regex) throws PatternSyntaxException {
    return compile(regex, PipelineOptions.DEFAULT);
  }

  public static DfaPattern compile(String regex, PipelineOptions options) throws PatternSyntaxException {
    return new CompiledDfaPattern(regex, RegexPipeline.run(Regex.parse(regex), options));
  }

  /**
   * Compile a pattern into a minimal DFA which is walked by an interpreter.
   *
   * <p>No bytecode is generated.
   *
   * @param regex source of the pattern
   * @return interpreted DFA pattern
   * @throws PatternSyntaxException if the pattern is malformed
   */
  public static DfaPattern interpreted(String regex) throws PatternSyntaxException {
    return interpreted(regex, PipelineOptions.DEFAULT);
  }

  public static DfaPattern interpreted(String regex, PipelineOptions options) throws PatternSyntaxException {
    return new InterpretableDfaPattern(regex, RegexPipeline.run(Regex.parse(regex), options));
  }

  /**
   * Returns initial regular expression from which the pattern was derived.
   *
   * @return source of the pattern
   */
  public String pattern() {
    return pattern;
  }

  /**
   * Automata built on the way to the minimal DFA.
   *
   * @return pipeline stages
   */
  public RegexPipeline.Stages stages() {
    return stages;
  }

  /**
   * Check whether the entire input matches the pattern.
   *
   * @param input string to match
   * @return whether the input is in the language of the pattern
   */
  public abstract boolean matches(CharSequence input);

  static final class CompiledDfaPattern extends DfaPattern {

    private final Recognizer recognizer;

    CompiledDfaPattern(String pattern, RegexPipeline.Stages stages) {
      super(pattern, stages);
      this.recognizer = DfaCodegen.compile(stages.minimalDfa());
    }

    @Override
    public boolean matches(CharSequence input) {
      return recognizer.accepts(input);
    }

    @Override
    public String toString() {
      return "DfaPattern.CompiledDfaPattern(" + pattern() + ")";
    }
  }

  static final class InterpretableDfaPattern extends DfaPattern {

    InterpretableDfaPattern(String pattern, RegexPipeline.Stages stages) {
      super(pattern, stages);
    }

    @Override
    public boolean matches(CharSequence input) {
      return stages().minimalDfa().accepts(input);
    }

    @Override
    public String toString() {
      return "DfaPattern.InterpretableDfaPattern(" + pattern() + ")";
    }
  }
}
