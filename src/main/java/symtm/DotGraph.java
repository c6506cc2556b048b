package symtm;

import java.util.stream.Stream;

/**
 * Graph which can be rendered with Graphviz.
 *
 * Compile the output using {@code dot -Tsvg machine.dot > machine.svg}.
 *
 * @param <V> vertices
 * @param <E> edge labels
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param initial does the machine start here?
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean initial, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts
   * @param to vertex where the edge ends
   * @param label label on the edge
   */
  record Edge<V, E>(V from, V to, E label) { }

  public Stream<Vertex<V>> vertices();

  public Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return HTML label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : escapeHtml(label.toString());
  }

  /**
   * Render a vertex label.
   *
   * @param vertex vertex associated with the label
   * @return HTML label string
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return escapeHtml(vertex.id().toString());
  }

  /**
   * Render a full Dot graph.
   *
   * Initial vertices get an arrow pointing in from an invisible vertex.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    int entries = 0;
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + ", label = <" + renderVertexLabel(vertex) + ">];\n");
      if (vertex.initial()) {
        final var entry = escapeId("_init" + entries++);
        builder.append("  " + entry + " [shape = none, label = <>];\n");
        builder.append("  " + entry + " -> " + id + ";\n");
      }
    }

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
   * Escape text for use inside an HTML-like Dot label.
   *
   * @param str raw label text
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
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
