package info.persistent.groundtruth.jscomp;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a token stream, one token per line.
 */
public class TokenDumper {
  private final SourceText source;
  private final PrintStream out;

  public TokenDumper(SourceText source, PrintStream out) {
    this.source = source;
    this.out = out;
  }

  public void dump(List<LexToken> tokens) {
    out.println("=== TOKENS ===");
    out.println("token_count: " + tokens.size());
    for (LexToken token : tokens) {
      out.println("  " + token.kind.name() + " " + token.span + " "
          + source.snippet(token.span, SourceText.TOKEN_SNIPPET_BYTES));
    }
  }
}
