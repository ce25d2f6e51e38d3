package mindfa;

import java.util.Arrays;
import java.util.Collection;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.TreeSet;
import java.util.stream.IntStream;
import java.util.stream.Collectors;

/**
 * Immutable set of integers.
 *
 * Elements are kept sorted, so two sets with the same members are equal and
 * hash the same regardless of the order they were collected in. This makes
 * the set usable as a map key for sets of automaton states.
 */
public final class IntSet implements Iterable<Integer> {

  public static final IntSet EMPTY = new IntSet(new int[0]);

  // Sorted and distinct elements
  private final int[] elements;

  public static IntSet of(int... elems) {
    return new IntSet(Arrays.stream(elems).boxed().collect(Collectors.toList()));
  }

  public IntSet(Collection<Integer> elems) {
    this.elements = new TreeSet<Integer>(elems).stream().mapToInt((Integer i) -> i.intValue()).toArray();
  }

  private IntSet(int[] sortedDistinct) {
    this.elements = sortedDistinct;
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(int element) {
    return Arrays.binarySearch(elements, element) >= 0;
  }

  /**
   * Smallest element.
   *
   * @throws NoSuchElementException if the set is empty
   */
  public int first() {
    if (elements.length == 0) {
      throw new NoSuchElementException("empty set");
    }
    return elements[0];
  }

  /**
   * Does this set share at least one element with the other collection?
   *
   * @param others elements to check against
   */
  public boolean intersects(Collection<Integer> others) {
    for (int element : elements) {
      if (others.contains(element)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Split this set into the members inside and outside another set.
   *
   * @param selector elements to pick out
   * @return pair of {@code [this ∩ selector, this \ selector]}
   */
  public IntSet[] split(Collection<Integer> selector) {
    final int[] inside = new int[elements.length];
    final int[] outside = new int[elements.length];
    int insideCount = 0;
    int outsideCount = 0;
    for (int element : elements) {
      if (selector.contains(element)) {
        inside[insideCount++] = element;
      } else {
        outside[outsideCount++] = element;
      }
    }
    return new IntSet[] {
      new IntSet(Arrays.copyOf(inside, insideCount)),
      new IntSet(Arrays.copyOf(outside, outsideCount))
    };
  }

  @Override
  public PrimitiveIterator.OfInt iterator() {
    return stream().iterator();
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof IntSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((IntSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
