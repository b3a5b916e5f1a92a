package info.persistent.jscomp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Structural helpers for reading Closure parse trees.
 */
public class Ast {
  private static final ImmutableSet<Token> DECLARATION_TYPES =
      Sets.immutableEnumSet(
          Token.VAR,
          Token.LET,
          Token.CONST,
          Token.FUNCTION,
          Token.CLASS,
          Token.CATCH,
          Token.IMPORT,
          Token.PARAM_LIST);

  /**
   * Returns the SCRIPT node produced for the single input of a compilation,
   * or null if the compiler did not produce one.
   */
  public static Node getScript(Compiler compiler) {
    Node root = compiler.getRoot();
    if (root == null) {
      return null;
    }
    Node jsRoot = root.getSecondChild();
    if (jsRoot == null) {
      return null;
    }
    return jsRoot.getFirstChild();
  }

  /**
   * The node whose children are the top-level statements: the MODULE_BODY
   * for ES modules, the script itself otherwise.
   */
  public static Node getStatementContainer(Node script) {
    Node first = script.getFirstChild();
    if (first != null && first.isModuleBody() && first.getNext() == null) {
      return first;
    }
    return script;
  }

  public static Node unwrapCasts(Node n) {
    while (n.isCast()) {
      n = n.getFirstChild();
    }
    return n;
  }

  /** Operands of a (possibly nested) comma expression, left to right. */
  public static ImmutableList<Node> flattenCommas(Node comma) {
    ImmutableList.Builder<Node> operands = ImmutableList.builder();
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(comma);
    while (!pending.isEmpty()) {
      Node n = pending.pop();
      if (n.isComma()) {
        pending.push(n.getSecondChild());
        pending.push(n.getFirstChild());
      } else {
        operands.add(n);
      }
    }
    return operands.build();
  }

  /** Whether an EXPORT or IMPORT node carries a {@code from} module. */
  public static boolean hasModuleSource(Node declaration) {
    Node last = declaration.getLastChild();
    return declaration.hasMoreThanOneChild() && last != null && last.isStringLit();
  }

  /**
   * Whether {@code name} is a use of a binding, as opposed to a declaration
   * site or a name that only appears in module import/export syntax.
   */
  public static boolean isReference(Node name) {
    if (!name.isName() || name.getString().isEmpty()) {
      return false;
    }
    Node parent = name.getParent();
    if (parent == null) {
      return false;
    }
    if (parent.isImportSpec() && name == parent.getFirstChild()) {
      return false;
    }
    if (parent.isExportSpec()) {
      // Re-exports and exported aliases never name a local binding.
      if (name == parent.getSecondChild()) {
        return false;
      }
      Node export = parent.getGrandparent();
      if (export != null && hasModuleSource(export)) {
        return false;
      }
    }
    return !isDeclarationTarget(name);
  }

  /**
   * Whether {@code name} introduces a binding: a declared variable, a
   * parameter, a catch binding, a function or class name, or an import.
   * Handles nested destructuring and default values.
   */
  public static boolean isDeclarationTarget(Node name) {
    if (!NodeUtil.isLValue(name)) {
      return false;
    }
    if (name.getParent().isInc() || name.getParent().isDec()) {
      return false;
    }
    Node target = NodeUtil.getRootTarget(name);
    Node parent = target.getParent();
    if (parent.isRest() || parent.isDefaultValue()) {
      parent = parent.getParent();
    }
    if (parent.isDestructuringLhs()) {
      parent = parent.getParent();
    }
    switch (parent.getToken()) {
      case VAR:
      case LET:
      case CONST:
      case PARAM_LIST:
      case CATCH:
      case IMPORT:
      case IMPORT_SPEC:
      case FUNCTION:
      case CLASS:
        return true;
      default:
        return false;
    }
  }

  /** Whether a write to {@code target} also reads its previous value. */
  public static boolean isReadModifyWrite(Node target) {
    Node parent = target.getParent();
    if (parent == null) {
      return false;
    }
    if (parent.isInc() || parent.isDec()) {
      return true;
    }
    return NodeUtil.isCompoundAssignmentOp(parent)
        && parent.getFirstChild() == target;
  }

  /**
   * The kind of construct that declares {@code nameNode}: VAR, LET, CONST,
   * FUNCTION, CLASS, CATCH, IMPORT or PARAM_LIST. Returns null for names with
   * no syntactic declaration.
   */
  public static Token getDeclarationType(Node nameNode) {
    for (Node n = nameNode; n != null; n = n.getParent()) {
      if (DECLARATION_TYPES.contains(n.getToken())) {
        return n.getToken();
      }
    }
    return null;
  }
}
