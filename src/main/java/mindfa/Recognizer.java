package mindfa;

/**
 * Exact-match membership test for a regular language.
 */
public interface Recognizer {

  /**
   * Check whether the full input is in the language.
   *
   * @param input input string, consumed one {@code char} at a time
   * @return whether the input is accepted
   */
  boolean accepts(CharSequence input);
}
