package info.persistent.groundtruth.jscomp;

import com.google.javascript.jscomp.JSError;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.CharacterCodingException;
import java.util.List;

/**
 * Runs one {@code ground-truth <mode> <path>} invocation against the given
 * output and diagnostic streams and computes its exit code: 0 when clean, 1
 * for usage, read or parse failures, 2 when the tree contained unsupported
 * nodes.
 */
public class GroundTruth {
  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_UNSUPPORTED = 2;

  private final PrintStream out;
  private final PrintStream err;

  public GroundTruth(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public int run(String... args) {
    Mode mode;
    try {
      mode = parseMode(args);
    } catch (UsageException e) {
      if (e.getMessage() != null) {
        err.println(e.getMessage());
      }
      printUsage();
      return EXIT_FAILURE;
    }

    String path = args[1];
    SourceText source;
    try {
      source = SourceText.read(new File(path));
    } catch (IOException e) {
      err.println("error: " + path + ": " + describe(e));
      return EXIT_FAILURE;
    }

    ClosureFrontEnd.Options options = new ClosureFrontEnd.Options();
    options.keepGoing = mode == Mode.ALL;
    ClosureFrontEnd frontEnd = new ClosureFrontEnd(options);

    if (mode == Mode.LEX) {
      dumpTokens(frontEnd, source);
      return EXIT_OK;
    }

    ParseResult parsed = frontEnd.parse(source);
    if (parsed.hasErrors()) {
      err.println("=== PARSE ERRORS (" + parsed.getErrors().size() + ") ===");
      for (JSError error : parsed.getErrors()) {
        err.println("  " + ClosureFrontEnd.format(error));
      }
      if (mode != Mode.ALL) {
        return EXIT_FAILURE;
      }
    }

    RenderAdapter renderAdapter = new RenderAdapter(frontEnd);
    int unsupported = 0;
    switch (mode) {
      case AST:
        unsupported = dumpTree(source, parsed);
        break;
      case MINIFY:
        out.print(renderAdapter.minify(parsed));
        break;
      case MANGLE:
        try {
          out.print(renderAdapter.mangle(source));
        } catch (RenderException e) {
          err.println("error: " + e.getMessage());
          return EXIT_FAILURE;
        }
        break;
      case SCOPE:
        dumpScope(frontEnd, source, parsed);
        break;
      case ALL:
        out.println("=== SOURCE: " + path + " (" + source.getByteLength()
            + " bytes, " + source.getLineCount() + " lines) ===");
        out.println();
        dumpTokens(frontEnd, source);
        out.println();
        unsupported = dumpTree(source, parsed);
        out.println();
        out.println("=== MINIFY ===");
        out.print(renderAdapter.minify(parsed));
        out.println();
        out.println();
        out.println("=== MANGLE ===");
        if (parsed.hasErrors()) {
          err.println("mangle skipped: the source has parse errors");
        } else {
          try {
            out.print(renderAdapter.mangle(source));
          } catch (RenderException e) {
            err.println("mangle skipped: " + e.getMessage());
          }
        }
        out.println();
        out.println();
        dumpScope(frontEnd, source, parsed);
        break;
      default:
        throw new IllegalStateException("Unexpected mode " + mode);
    }

    if (unsupported > 0) {
      err.println("error: " + unsupported
          + " unsupported AST node(s) encountered");
      return EXIT_UNSUPPORTED;
    }
    return parsed.hasErrors() ? EXIT_FAILURE : EXIT_OK;
  }

  private static Mode parseMode(String[] args) throws UsageException {
    if (args.length < 2) {
      throw new UsageException();
    }
    return Mode.forName(args[0]);
  }

  private static String describe(IOException e) {
    if (e instanceof CharacterCodingException) {
      return "stream did not contain valid UTF-8";
    }
    return e.getMessage() != null ? e.getMessage() : e.toString();
  }

  private void dumpTokens(ClosureFrontEnd frontEnd, SourceText source) {
    new TokenDumper(source, out).dump(frontEnd.tokenize(source, err));
  }

  private int dumpTree(SourceText source, ParseResult parsed) {
    TreeDumper dumper =
        new TreeDumper(source, new ClosureLexer(source), out, err);
    return dumper.dump(parsed.getScript());
  }

  private void dumpScope(
      ClosureFrontEnd frontEnd, SourceText source, ParseResult parsed) {
    List<JSError> semanticErrors = frontEnd.checkSemantics(parsed);
    if (!semanticErrors.isEmpty()) {
      err.println("Semantic errors:");
      for (JSError error : semanticErrors) {
        err.println("  " + ClosureFrontEnd.format(error));
      }
    }
    new ScopeDumper(out).dump(ScopeAnalyzer.analyze(
        parsed.getCompiler(), source, parsed.getScript()));
  }

  private void printUsage() {
    err.println("Usage: ground-truth <mode> <file.js>");
    err.println();
    err.println("Modes:");
    err.println("  lex      Full token stream (all tokens including punctuation/operators)");
    err.println("  ast      AST tree dump (one node per line, diffable)");
    err.println("  minify   Minified output (no mangling)");
    err.println("  mangle   Minified + mangled output");
    err.println("  scope    Scope analysis (per-reference resolution)");
    err.println("  all      All of the above");
    err.println();
    err.println("AST node count: ground-truth ast <file> | wc -l");
  }
}
