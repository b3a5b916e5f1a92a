package info.persistent.groundtruth.jscomp;

/**
 * A half-open range of UTF-8 byte offsets into the source.
 */
public final class Span {
  public final int start;
  public final int end;

  public Span(int start, int end) {
    this.start = start;
    this.end = Math.max(start, end);
  }

  public static Span empty(int offset) {
    return new Span(offset, offset);
  }

  /** The smallest span containing both spans. */
  public Span cover(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }

  @Override public boolean equals(Object o) {
    if (!(o instanceof Span)) {
      return false;
    }
    Span other = (Span) o;
    return start == other.start && end == other.end;
  }

  @Override public int hashCode() {
    return 31 * start + end;
  }

  @Override public String toString() {
    return start + ":" + end;
  }
}
