package mindfa;

import java.util.regex.PatternSyntaxException;

/**
 * Regular expression AST.
 *
 * There are exactly four kinds of nodes: literal symbols, concatenation,
 * union, and Kleene star. Anything else (character classes, counted
 * repetition, anchors) has to be desugared before reaching this type.
 */
public interface Regex {

  /**
   * Traverse this AST bottom-up.
   *
   * @param visitor visitor receiving the nodes
   * @return output of the visitor for the root node
   */
  <R> R accept(RegexVisitor<R> visitor);

  /**
   * Visitor which builds up an explicit AST.
   */
  RegexVisitor<Regex> BUILDER = new RegexVisitor<Regex>() {
    @Override
    public Regex visitLiteral(char symbol) {
      return new Literal(symbol);
    }

    @Override
    public Regex visitConcatenation(Regex lhs, Regex rhs) {
      return new Concatenation(lhs, rhs);
    }

    @Override
    public Regex visitAlternation(Regex lhs, Regex rhs) {
      return new Alternation(lhs, rhs);
    }

    @Override
    public Regex visitKleene(Regex arg) {
      return new Kleene(arg);
    }
  };

  /**
   * Parse a pattern into an AST.
   *
   * @param pattern regular expression pattern
   * @return parsed AST
   * @throws PatternSyntaxException if the pattern is malformed
   */
  static Regex parse(String pattern) throws PatternSyntaxException {
    return RegexParser.parse(BUILDER, pattern);
  }

  /** Single symbol. */
  record Literal(char symbol) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitLiteral(symbol);
    }

    @Override
    public String toString() {
      return String.valueOf(symbol);
    }
  }

  /** {@code lhs} followed by {@code rhs}. */
  record Concatenation(Regex lhs, Regex rhs) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      final R lhsOut = lhs.accept(visitor);
      final R rhsOut = rhs.accept(visitor);
      return visitor.visitConcatenation(lhsOut, rhsOut);
    }

    @Override
    public String toString() {
      return "(" + lhs + rhs + ")";
    }
  }

  /** Either {@code lhs} or {@code rhs}. */
  record Alternation(Regex lhs, Regex rhs) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      final R lhsOut = lhs.accept(visitor);
      final R rhsOut = rhs.accept(visitor);
      return visitor.visitAlternation(lhsOut, rhsOut);
    }

    @Override
    public String toString() {
      return "(" + lhs + "+" + rhs + ")";
    }
  }

  /** Zero or more repetitions of {@code arg}. */
  record Kleene(Regex arg) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitKleene(arg.accept(visitor));
    }

    @Override
    public String toString() {
      return "(" + arg + ")*";
    }
  }
}
