package bytedfa.graph;

import java.util.stream.Stream;

/**
 * Automaton that can be drawn with Graphviz.
 *
 * <p>States are circles, matching states double circles. An edge with no
 * source is drawn from an invisible point, which is how the start state is
 * marked.
 *
 * @param <V> state identifier
 * @param <E> transition label
 */
public interface DotGraph<V, E> {

  record Vertex<V>(V id, boolean accepting) { }

  /**
   * @param from source state, or {@code null} for an entry arrow
   */
  record Edge<V, E>(V from, V to, E label) { }

  Stream<Vertex<V>> vertices();

  Stream<Edge<V, E>> edges();

  /**
   * DOT source for the automaton, laid out left to right.
   *
   * @param name graph title
   */
  default String dotGraph(String name) {
    final var dot = new StringBuilder();
    dot.append("digraph ").append(quote(name)).append(" {\n");
    dot.append("  rankdir = LR;\n");

    vertices().forEachOrdered(vertex -> dot
      .append("  ").append(quote(String.valueOf(vertex.id())))
      .append(" [shape = ").append(vertex.accepting() ? "doublecircle" : "circle")
      .append(", label = <").append(html(String.valueOf(vertex.id()))).append(">];\n"));

    final int[] entries = { 0 };
    edges().forEachOrdered(edge -> {
      final String from;
      if (edge.from() == null) {
        from = quote("entry" + entries[0]++);
        dot.append("  ").append(from).append(" [shape = point, style = invis];\n");
      } else {
        from = quote(String.valueOf(edge.from()));
      }
      final String label = edge.label() == null ? "" : html(edge.label().toString());
      dot.append("  ").append(from).append(" -> ").append(quote(String.valueOf(edge.to())))
        .append(" [label = <").append(label).append(">];\n");
    });

    return dot.append("}\n").toString();
  }

  private static String quote(String id) {
    return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  static String html(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
