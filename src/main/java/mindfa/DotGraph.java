package mindfa;

import java.util.stream.Stream;

/**
 * Automaton which can be rendered as a Graphviz DOT graph.
 *
 * Compile the output using {@code dot -Tsvg fsm.dot > fsm.svg}.
 *
 * @param <V> vertex identifiers
 * @param <E> edge labels
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edges starts
   * @param to vertex where the edges ends
   * @param label label on the edge
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Vertex at which runs start.
   *
   * @return initial vertex
   */
  V initialVertex();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return HTML label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : label.toString();
  }

  /**
   * Render a full Dot graph.
   *
   * The initial vertex gets an incoming arrow from a blank, generated vertex.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + ", label = <" + vertex.id() + ">];\n");
    }

    // Entry arrow
    final var entry = escapeId("_init");
    builder.append("  " + entry + " [shape = none, label = <>];\n");
    builder.append("  " + entry + " -> " + escapeId(initialVertex().toString()) + ";\n");

    // Edges
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final var from = escapeId(edge.from().toString());
      final var to = escapeId(edge.to().toString());
      builder.append("  " + from + " -> " + to + " [label = <" + renderEdgeLabel(edge) + ">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
