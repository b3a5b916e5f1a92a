package info.persistent.groundtruth.jscomp;

import com.google.common.collect.ImmutableList;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.rhino.Node;

/**
 * The outcome of parsing one {@link SourceText}. When parsing continued past
 * errors the script holds whatever tree Closure recovered.
 */
public final class ParseResult {
  private final SourceText source;
  private final Compiler compiler;
  private final CompilerOptions options;
  private final Node script;
  private final ImmutableList<JSError> errors;

  ParseResult(
      SourceText source,
      Compiler compiler,
      CompilerOptions options,
      Node script,
      ImmutableList<JSError> errors) {
    this.source = source;
    this.compiler = compiler;
    this.options = options;
    this.script = script;
    this.errors = errors;
  }

  public SourceText getSource() {
    return source;
  }

  public Compiler getCompiler() {
    return compiler;
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /** The SCRIPT node, or null if Closure produced no tree at all. */
  public Node getScript() {
    return script;
  }

  public ImmutableList<JSError> getErrors() {
    return errors;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
