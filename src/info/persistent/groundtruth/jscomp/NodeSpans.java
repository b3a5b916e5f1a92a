package info.persistent.groundtruth.jscomp;

import com.google.javascript.rhino.Node;

/**
 * Byte spans of parse tree nodes.
 */
final class NodeSpans {
  private NodeSpans() {}

  /**
   * The span recorded on {@code n}. A node without position information gets
   * an empty span at the start of its nearest positioned ancestor.
   */
  static Span of(SourceText source, Node n) {
    for (Node p = n; p != null; p = p.getParent()) {
      int start = source.toCharOffset(p.getLineno(), p.getCharno());
      if (start < 0) {
        continue;
      }
      if (p == n) {
        return source.span(start, start + Math.max(0, n.getLength()));
      }
      return source.span(start, start);
    }
    return Span.empty(0);
  }

  /** The span of the first {@code charLength} UTF-16 units of {@code n}. */
  static Span prefix(SourceText source, Node n, int charLength) {
    int start = source.toCharOffset(n.getLineno(), n.getCharno());
    if (start < 0) {
      return of(source, n);
    }
    return source.span(start, start + charLength);
  }
}
