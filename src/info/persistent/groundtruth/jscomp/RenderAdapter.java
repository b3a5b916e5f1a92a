package info.persistent.groundtruth.jscomp;

import info.persistent.jscomp.Ast;
import info.persistent.jscomp.Debug;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.PropertyRenamingPolicy;
import com.google.javascript.jscomp.Result;
import com.google.javascript.jscomp.VariableRenamingPolicy;
import com.google.javascript.rhino.Node;

import java.util.List;

/**
 * Minified and mangled renderings of a source, produced by Closure's code
 * printer and variable renamer.
 */
public class RenderAdapter {
  private final ClosureFrontEnd frontEnd;

  public RenderAdapter(ClosureFrontEnd frontEnd) {
    this.frontEnd = frontEnd;
  }

  /** Prints the parsed tree compactly, without comments. */
  public String minify(ParseResult parsed) {
    Node script = parsed.getScript();
    if (script == null) {
      return "";
    }
    return Debug.toCompactSource(
        script, parsed.getOptions(), script.isUseStrict());
  }

  /**
   * Recompiles {@code source} with every variable renamed (top level
   * included, properties untouched) and prints the result compactly.
   */
  public String mangle(SourceText source) throws RenderException {
    Compiler compiler = frontEnd.newCompiler();
    CompilerOptions options = frontEnd.newCompilerOptions();
    options.setContinueAfterErrors(false);
    options.setRenamingPolicy(
        VariableRenamingPolicy.ALL, PropertyRenamingPolicy.OFF);
    options.addWarningsGuard(new RenderWarningsGuard());
    Result result = ClosureFrontEnd.compile(compiler, source, options);
    if (!result.success) {
      List<String> messages = Lists.newArrayList();
      for (JSError error : result.errors) {
        messages.add(ClosureFrontEnd.format(error));
      }
      throw new RenderException(Joiner.on("; ").join(messages));
    }
    Node script = Ast.getScript(compiler);
    if (script == null) {
      return "";
    }
    return Debug.toCompactSource(script, options, script.isUseStrict());
  }
}
