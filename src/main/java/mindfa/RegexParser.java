package mindfa;

import java.util.regex.PatternSyntaxException;

/**
 * Parser for the pattern syntax accepted by the pipeline.
 *
 * This is a fairly standard recursive descent parser. The results are made
 * available through a visitor instead of as an explicit AST type (use
 * {@link Regex#BUILDER} to get an AST).
 *
 * Supported syntax, from lowest to highest precedence:
 *
 *   - {@code a+b}: union
 *   - {@code ab}: concatenation
 *   - {@code a*}: Kleene star
 *   - {@code (a)}: grouping
 *
 * Literals are letters and digits. Whitespace between tokens is ignored.
 */
public final class RegexParser<A> {

  // Used when "visiting" the AST bottom up
  final private RegexVisitor<A> visitor;

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  /**
   * Parse a regular expression pattern from an input string.
   *
   * @param visitor regex visitor used to accept bottom-up parsing progress
   * @param input regular expression pattern
   * @return parsed regular expression
   * @throws PatternSyntaxException if the pattern is malformed
   */
  public static <B> B parse(RegexVisitor<B> visitor, String input) throws PatternSyntaxException {
    final var parser = new RegexParser<B>(visitor, input);
    final B parsed = parser.parseUnion();
    parser.skipWhitespace();
    if (parser.position < parser.length) {
      throw parser.unexpectedToken();
    }
    return parsed;
  }

  private RegexParser(RegexVisitor<A> visitor, String input) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
  }

  /**
   * Parse a union.
   */
  private A parseUnion() {
    A unionLhs = parseConcatenation();
    while (peek() == '+') {
      position++;
      A unionRhs = parseConcatenation();
      unionLhs = visitor.visitAlternation(unionLhs, unionRhs);
    }
    return unionLhs;
  }

  /**
   * Parse a concatenation (at least one starred factor).
   */
  private A parseConcatenation() {
    A concatLhs = parseStarred();

    // Keep going as long as another factor can start here
    while (true) {
      final int c = peek();
      if (c == '(' || (c >= 0 && isLiteral((char) c))) {
        A concatRhs = parseStarred();
        concatLhs = visitor.visitConcatenation(concatLhs, concatRhs);
      } else {
        break;
      }
    }

    return concatLhs;
  }

  /**
   * Parse a primary followed by any number of stars.
   */
  private A parseStarred() {
    A starred = parsePrimary();
    while (peek() == '*') {
      position++;
      starred = visitor.visitKleene(starred);
    }
    return starred;
  }

  /**
   * Parse a literal or a parenthesized union.
   */
  private A parsePrimary() {
    final int c = peek();
    if (c < 0) {
      throw new PatternSyntaxException("Unexpected end of input", input, position);
    } else if (c == '(') {
      position++;
      final A inner = parseUnion();
      if (peek() != ')') {
        throw peek() < 0
          ? new PatternSyntaxException("Unexpected end of input, expected ')'", input, position)
          : unexpectedToken();
      }
      position++;
      return inner;
    } else if (isLiteral((char) c)) {
      position++;
      return visitor.visitLiteral((char) c);
    } else {
      throw unexpectedToken();
    }
  }

  /**
   * Look at the next non-whitespace character without consuming it.
   *
   * @return next character or {@code -1} at the end of the input
   */
  private int peek() {
    skipWhitespace();
    return position < length ? input.charAt(position) : -1;
  }

  private void skipWhitespace() {
    while (position < length && Character.isWhitespace(input.charAt(position))) {
      position++;
    }
  }

  private PatternSyntaxException unexpectedToken() {
    final char c = input.charAt(position);
    final String description = isToken(c)
      ? "Unexpected token '" + c + "'"
      : "Unexpected character '" + c + "'";
    return new PatternSyntaxException(description, input, position);
  }

  private static boolean isLiteral(char c) {
    return Character.isLetterOrDigit(c);
  }

  private static boolean isToken(char c) {
    return c == '+' || c == '*' || c == '(' || c == ')' || isLiteral(c);
  }
}
