package info.persistent.groundtruth.jscomp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.io.ByteStreams;
import com.google.javascript.jscomp.parsing.parser.Scanner;
import com.google.javascript.jscomp.parsing.parser.SourceFile;
import com.google.javascript.jscomp.parsing.parser.Token;
import com.google.javascript.jscomp.parsing.parser.TokenType;
import com.google.javascript.jscomp.parsing.parser.util.ErrorReporter;
import com.google.javascript.jscomp.parsing.parser.util.SourcePosition;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Drives Closure's scanner over a whole file. The scanner leaves regular
 * expressions and template continuations to the parser, so the goal symbol
 * is chosen here from the preceding token.
 */
public class ClosureLexer {
  // A '/' after one of these continues an expression, i.e. it is division.
  private static final ImmutableSet<TokenType> EXPRESSION_ENDS =
      Sets.immutableEnumSet(
          TokenType.IDENTIFIER,
          TokenType.NUMBER,
          TokenType.STRING,
          TokenType.BIGINT,
          TokenType.REGULAR_EXPRESSION,
          TokenType.NO_SUBSTITUTION_TEMPLATE,
          TokenType.TEMPLATE_TAIL,
          TokenType.CLOSE_PAREN,
          TokenType.CLOSE_SQUARE,
          TokenType.CLOSE_CURLY,
          TokenType.PLUS_PLUS,
          TokenType.MINUS_MINUS,
          TokenType.THIS,
          TokenType.SUPER,
          TokenType.NULL,
          TokenType.TRUE,
          TokenType.FALSE,
          // Contextual keywords, usually plain identifiers.
          TokenType.LET,
          TokenType.STATIC,
          TokenType.TYPE,
          TokenType.DECLARE,
          TokenType.MODULE,
          TokenType.NAMESPACE);

  private final SourceText source;
  private final SourceFile file;

  public ClosureLexer(SourceText source) {
    this.source = source;
    this.file = new SourceFile(source.getName(), source.getText());
  }

  /**
   * Returns every token of the file in order, ending with a single
   * END_OF_FILE token. Scanner diagnostics go to {@code diagnostics}.
   */
  public ImmutableList<LexToken> tokenize(PrintStream diagnostics) {
    Scanner scanner = newScanner(diagnostics, 0);
    ImmutableList.Builder<LexToken> tokens = ImmutableList.builder();
    // Brace depth at each open template substitution.
    Deque<Integer> substitutions = new ArrayDeque<>();
    int braceDepth = 0;
    TokenType previous = null;
    while (true) {
      TokenType next = scanner.peekToken().type;
      Token token;
      if ((next == TokenType.SLASH || next == TokenType.SLASH_EQUAL)
          && !EXPRESSION_ENDS.contains(previous)) {
        token = scanner.nextRegularExpressionLiteralToken();
      } else if (next == TokenType.CLOSE_CURLY
          && !substitutions.isEmpty()
          && substitutions.peek() == braceDepth) {
        substitutions.pop();
        token = scanner.nextTemplateLiteralToken();
      } else {
        token = scanner.nextToken();
      }

      switch (token.type) {
        case OPEN_CURLY:
          braceDepth++;
          break;
        case CLOSE_CURLY:
          braceDepth--;
          break;
        case TEMPLATE_HEAD:
        case TEMPLATE_MIDDLE:
          substitutions.push(braceDepth);
          break;
        default:
          break;
      }

      tokens.add(new LexToken(token.type, spanOf(token)));
      if (token.type == TokenType.END_OF_FILE) {
        break;
      }
      previous = token.type;
    }
    return tokens.build();
  }

  /**
   * Spans of the {@code "use strict"} directives that open the directive
   * prologue starting at UTF-16 offset {@code charOffset}, each including
   * its semicolon when present.
   */
  public ImmutableList<Span> leadingUseStrict(int charOffset) {
    Scanner scanner = newScanner(
        new PrintStream(ByteStreams.nullOutputStream()), charOffset);
    ImmutableList.Builder<Span> directives = ImmutableList.builder();
    while (scanner.peekToken().type == TokenType.STRING) {
      Token literal = scanner.peekToken();
      if (!isUseStrict(literal)) {
        break;
      }
      scanner.nextToken();
      int end = literal.location.end.offset;
      if (scanner.peekToken().type == TokenType.SEMI_COLON) {
        end = scanner.nextToken().location.end.offset;
      }
      directives.add(source.span(literal.location.start.offset, end));
    }
    return directives.build();
  }

  private boolean isUseStrict(Token literal) {
    String raw = source.getText().substring(
        literal.location.start.offset, literal.location.end.offset);
    return raw.equals("'use strict'") || raw.equals("\"use strict\"");
  }

  private Scanner newScanner(PrintStream diagnostics, int charOffset) {
    return new Scanner(
        new DiagnosticReporter(source, diagnostics),
        (type, range, value) -> {},
        file,
        charOffset);
  }

  private Span spanOf(Token token) {
    int start = token.location.start.offset;
    switch (token.type) {
      case TEMPLATE_HEAD:
      case TEMPLATE_MIDDLE:
      case TEMPLATE_TAIL:
      case NO_SUBSTITUTION_TEMPLATE:
        // The scanner's range starts after the opening '`' or '}'.
        start = Math.max(0, start - 1);
        break;
      default:
        break;
    }
    return source.span(start, token.location.end.offset);
  }

  private static class DiagnosticReporter extends ErrorReporter {
    private final SourceText source;
    private final PrintStream out;

    DiagnosticReporter(SourceText source, PrintStream out) {
      this.source = source;
      this.out = out;
    }

    @Override protected void reportError(
        SourcePosition location, String message) {
      out.println("lex error: " + message + " at "
          + source.toByteOffset(location.offset));
    }

    @Override protected void reportWarning(
        SourcePosition location, String message) {
      out.println("lex warning: " + message + " at "
          + source.toByteOffset(location.offset));
    }
  }
}
