package info.persistent.groundtruth.jscomp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.ByteStreams;
import com.google.javascript.jscomp.CheckLevel;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.DiagnosticGroup;
import com.google.javascript.jscomp.DiagnosticGroups;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.Result;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.jscomp.deps.ModuleLoader;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Everything this tool asks of Closure Compiler: tokens, a parse tree, a
 * checks-only compilation for semantic errors, and compiler setup shared with
 * {@link RenderAdapter}.
 */
public class ClosureFrontEnd {
  public static class Options {
    // Class fields and static blocks are only accepted by the unstable mode.
    public LanguageMode languageIn = LanguageMode.UNSTABLE;
    // Keep the partial tree when parsing fails.
    public boolean keepGoing = false;
  }

  private static final ImmutableSet<String> PARSE_ERROR_KEYS = ImmutableSet.of(
      "JSC_PARSE_ERROR",
      "JSC_DUPLICATE_PARAM",
      "JSC_PARSE_TREE_TOO_DEEP",
      "JSC_LANGUAGE_FEATURE",
      "JSC_UNSUPPORTED_LANGUAGE_FEATURE");

  private static final ImmutableSet<String> MODULE_LOADING_KEYS = ImmutableSet.of(
      ModuleLoader.LOAD_WARNING.key,
      ModuleLoader.INVALID_MODULE_PATH.key);

  static final DiagnosticType RECOVERY_FAILED = DiagnosticType.error(
      "JSC_PARSE_ERROR", "{0}");

  private final Options options;

  public ClosureFrontEnd() {
    this(new Options());
  }

  public ClosureFrontEnd(Options options) {
    this.options = options;
  }

  public ImmutableList<LexToken> tokenize(
      SourceText source, PrintStream diagnostics) {
    return new ClosureLexer(source).tokenize(diagnostics);
  }

  /**
   * Parses {@code source} on its own. Imports are kept as written and never
   * resolved, so modules parse the same whether or not their dependencies
   * exist.
   */
  public ParseResult parse(SourceText source) {
    Compiler compiler = newCompiler();
    CompilerOptions compilerOptions = newCompilerOptions();
    compiler.initOptions(compilerOptions);
    Node script;
    try {
      script = compiler.parse(
          SourceFile.fromCode(source.getName(), source.getText()));
    } catch (RuntimeException e) {
      if (!options.keepGoing) {
        throw e;
      }
      // Recovery gave up part way through; keep the errors, drop the tree.
      script = IR.script();
      if (!hasParseError(compiler.getErrors())) {
        compiler.report(JSError.make(RECOVERY_FAILED, describe(e)));
      }
    }
    return new ParseResult(
        source,
        compiler,
        compilerOptions,
        script,
        withoutModuleLoading(compiler.getErrors()));
  }

  /**
   * Runs Closure's checks over the parsed source and returns the errors that
   * are not parse errors. Undeclared globals are not reported. Sources that
   * failed to parse are only checked up to the first error.
   */
  public ImmutableList<JSError> checkSemantics(ParseResult parsed) {
    Compiler compiler = newCompiler();
    CompilerOptions compilerOptions = newCompilerOptions();
    compilerOptions.setChecksOnly(true);
    compilerOptions.setContinueAfterErrors(!parsed.hasErrors());
    compilerOptions.setWarningLevel(
        DiagnosticGroups.UNDEFINED_VARIABLES, CheckLevel.OFF);
    Result result = compile(compiler, parsed.getSource(), compilerOptions);
    ImmutableList.Builder<JSError> errors = ImmutableList.builder();
    for (JSError error : withoutModuleLoading(result.errors)) {
      if (!isParseError(error)) {
        errors.add(error);
      }
    }
    return errors.build();
  }

  Compiler newCompiler() {
    Compiler compiler = new Compiler(
        new PrintStream(ByteStreams.nullOutputStream())); // Silence logging
    compiler.disableThreads();
    return compiler;
  }

  CompilerOptions newCompilerOptions() {
    CompilerOptions compilerOptions = new CompilerOptions();
    compilerOptions.setLanguageIn(options.languageIn);
    compilerOptions.setLanguageOut(LanguageMode.NO_TRANSPILE);
    compilerOptions.setEs6ModuleTranspilation(
        CompilerOptions.Es6ModuleTranspilation.NONE);
    compilerOptions.setEnableModuleRewriting(false);
    compilerOptions.setEmitUseStrict(false);
    compilerOptions.setWarningLevel(DiagnosticGroups.MODULE_LOAD, CheckLevel.OFF);
    compilerOptions.setWarningLevel(
        DiagnosticGroup.forType(ModuleLoader.INVALID_MODULE_PATH),
        CheckLevel.OFF);
    compilerOptions.setContinueAfterErrors(options.keepGoing);
    return compilerOptions;
  }

  static Result compile(
      Compiler compiler, SourceText source, CompilerOptions compilerOptions) {
    List<SourceFile> inputs = ImmutableList.of(
        SourceFile.fromCode(source.getName(), source.getText()));
    return compiler.compile(
        Collections.<SourceFile>emptyList(), inputs, compilerOptions);
  }

  public static boolean isParseError(JSError error) {
    return PARSE_ERROR_KEYS.contains(error.getType().key);
  }

  /** Formats {@code error} as {@code <description> (line <l>:<c>)}. */
  public static String format(JSError error) {
    return error.getDescription()
        + " (line " + error.getLineno() + ":" + error.getCharno() + ")";
  }

  private static boolean hasParseError(List<JSError> errors) {
    for (JSError error : errors) {
      if (isParseError(error)) {
        return true;
      }
    }
    return false;
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.toString();
  }

  // Imports are never resolved against other files.
  private static ImmutableList<JSError> withoutModuleLoading(
      List<JSError> errors) {
    ImmutableList.Builder<JSError> kept = ImmutableList.builder();
    for (JSError error : errors) {
      if (!MODULE_LOADING_KEYS.contains(error.getType().key)) {
        kept.add(error);
      }
    }
    return kept.build();
  }
}
