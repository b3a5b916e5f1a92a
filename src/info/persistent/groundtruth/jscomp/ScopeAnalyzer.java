package info.persistent.groundtruth.jscomp;

import info.persistent.groundtruth.jscomp.ScopeGraph.Binding;
import info.persistent.groundtruth.jscomp.ScopeGraph.BindingFlag;
import info.persistent.groundtruth.jscomp.ScopeGraph.Reference;
import info.persistent.jscomp.Ast;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.jscomp.Scope;
import com.google.javascript.jscomp.Var;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ScopeGraph} from Closure's syntactic scopes. Scopes are
 * numbered in the order the traversal enters them; bindings in scope order,
 * then declaration order.
 */
public class ScopeAnalyzer implements NodeTraversal.ScopedCallback {
  private final SourceText source;
  private final Map<Node, Integer> scopeIds = Maps.newIdentityHashMap();
  private final Map<Var, Binding> bindingsByVar = Maps.newIdentityHashMap();
  private final List<Binding> bindings = Lists.newArrayList();
  private final ImmutableListMultimap.Builder<String, Reference> unresolved =
      ImmutableListMultimap.builder();
  private int referenceCount = 0;

  private ScopeAnalyzer(SourceText source) {
    this.source = source;
  }

  public static ScopeGraph analyze(
      AbstractCompiler compiler, SourceText source, Node script) {
    ScopeAnalyzer analyzer = new ScopeAnalyzer(source);
    if (script != null) {
      NodeTraversal.traverse(compiler, script, analyzer);
    }
    return new ScopeGraph(
        analyzer.scopeIds.size(), analyzer.bindings, analyzer.unresolved.build());
  }

  @Override public void enterScope(NodeTraversal t) {
    register(t.getScope());
  }

  @Override public void exitScope(NodeTraversal t) {}

  @Override public boolean shouldTraverse(
      NodeTraversal t, Node n, Node parent) {
    return true;
  }

  @Override public void visit(NodeTraversal t, Node n, Node parent) {
    if (!Ast.isReference(n)) {
      return;
    }
    boolean write = NodeUtil.isLValue(n);
    boolean read = !write || Ast.isReadModifyWrite(n);
    Binding binding = resolve(t.getScope().getVar(n.getString()));
    Reference reference = new Reference(
        referenceCount++,
        n.getString(),
        NodeSpans.of(source, n),
        ScopeGraph.referenceFlags(read, write),
        binding);
    if (binding != null) {
      binding.addReference(reference);
    } else {
      unresolved.put(n.getString(), reference);
    }
  }

  private Binding resolve(Var var) {
    if (var == null || isImplicit(var)) {
      return null;
    }
    if (!bindingsByVar.containsKey(var)) {
      register(var.getScope());
    }
    return bindingsByVar.get(var);
  }

  private void register(Scope scope) {
    Node root = scope.getRootNode();
    if (scopeIds.containsKey(root)) {
      return;
    }
    int scopeId = scopeIds.size();
    scopeIds.put(root, scopeId);
    for (Var var : scope.getVarIterable()) {
      if (isImplicit(var)) {
        continue;
      }
      Binding binding = new Binding(
          bindings.size(), var.getName(), scopeId, flagsOf(var));
      bindings.add(binding);
      bindingsByVar.put(var, binding);
    }
  }

  // 'arguments' is left unresolved, like an undeclared global.
  private static boolean isImplicit(Var var) {
    return var.isArguments() || var.isThis() || var.getNameNode() == null;
  }

  private static Set<BindingFlag> flagsOf(Var var) {
    Set<BindingFlag> flags = EnumSet.noneOf(BindingFlag.class);
    Token declarationType = Ast.getDeclarationType(var.getNameNode());
    if (declarationType == null) {
      return flags;
    }
    switch (declarationType) {
      case VAR:
        flags.add(BindingFlag.FUNCTION_SCOPED_VARIABLE);
        break;
      case LET:
        flags.add(BindingFlag.BLOCK_SCOPED_VARIABLE);
        break;
      case CONST:
        flags.add(BindingFlag.BLOCK_SCOPED_VARIABLE);
        flags.add(BindingFlag.CONST_VARIABLE);
        break;
      case FUNCTION:
        flags.add(BindingFlag.FUNCTION);
        break;
      case CLASS:
        flags.add(BindingFlag.CLASS);
        break;
      case PARAM_LIST:
        flags.add(BindingFlag.PARAMETER);
        break;
      case CATCH:
        flags.add(BindingFlag.CATCH_VARIABLE);
        break;
      case IMPORT:
        flags.add(BindingFlag.IMPORT);
        break;
      default:
        break;
    }
    return flags;
  }
}
