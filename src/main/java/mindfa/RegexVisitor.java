package mindfa;

/**
 * Bottom-up traversal of the regular expression AST.
 *
 * Children are always visited before their parent, left-hand side before
 * right-hand side.
 *
 * @param <R> output from traversing the regex AST
 */
public interface RegexVisitor<R> {

  /**
   * Matches exactly one symbol.
   *
   * @param symbol symbol to match
   */
  R visitLiteral(char symbol);

  /**
   * Matches a concatenation of two patterns.
   *
   * @param lhs first pattern to match
   * @param rhs second pattern to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches a union of two patterns.
   *
   * @param lhs first alternative
   * @param rhs second alternative
   */
  R visitAlternation(R lhs, R rhs);

  /**
   * Matches a pattern zero or more times.
   *
   * @param arg pattern to repeat
   */
  R visitKleene(R arg);
}
