package info.persistent.groundtruth.jscomp;

import com.google.javascript.jscomp.parsing.parser.TokenType;

/**
 * One token of the raw token stream.
 */
public final class LexToken {
  public final TokenType kind;
  public final Span span;

  public LexToken(TokenType kind, Span span) {
    this.kind = kind;
    this.span = span;
  }

  @Override public String toString() {
    return kind.name() + " " + span;
  }
}
