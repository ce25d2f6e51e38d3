package mindfa;

/**
 * State transition consuming exactly one symbol.
 *
 * @param symbol symbol consumed by the transition
 */
public record SymbolTransition(char symbol) implements TransitionLabel {

  @Override
  public String dotLabel() {
    return symbolLabel(symbol);
  }

  /**
   * Print a symbol as an HTML label.
   *
   * Prints alphanumeric ascii characters as themselves and everything else
   * escaped.
   */
  static String symbolLabel(char symbol) {
    /* Note: "courier" is a monospaced font. Using just "monospace" leads to
     * alignment issues: https://gitlab.com/graphviz/graphviz/-/issues/1426
     */
    if (symbol <= 127 && Character.isLetterOrDigit(symbol)) {
      return String.format("<font face=\"courier\">%c</font>", symbol);
    } else {
      return String.format("<font face=\"courier\">\\\\u%04X</font>", (int) symbol);
    }
  }
}
