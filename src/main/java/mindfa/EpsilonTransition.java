package mindfa;

/**
 * Silent transition, taken without consuming any input.
 */
public enum EpsilonTransition implements TransitionLabel {
  EPSILON;

  @Override
  public String dotLabel() {
    return "&epsilon;";
  }
}
