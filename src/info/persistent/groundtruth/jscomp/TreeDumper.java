package info.persistent.groundtruth.jscomp;

import info.persistent.jscomp.Ast;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a Closure parse tree in pre-order, one line per node:
 * {@code <indent><Kind>[ <detail>] <start>:<end>}.
 *
 * <p>Nodes without a rendering rule are printed as a {@code ?<Category>}
 * placeholder, reported on the diagnostic stream and counted. The count is
 * returned from {@link #dump}.
 */
public class TreeDumper {
  private static final ImmutableMap<Token, String> BINARY_OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.ADD, "Add")
          .put(Token.SUB, "Sub")
          .put(Token.MUL, "Mul")
          .put(Token.DIV, "Div")
          .put(Token.MOD, "Mod")
          .put(Token.EXPONENT, "Exp")
          .put(Token.LSH, "Shl")
          .put(Token.RSH, "Shr")
          .put(Token.URSH, "UShr")
          .put(Token.BITOR, "BitOr")
          .put(Token.BITXOR, "BitXor")
          .put(Token.BITAND, "BitAnd")
          .put(Token.EQ, "Eq")
          .put(Token.NE, "Ne")
          .put(Token.SHEQ, "StrictEq")
          .put(Token.SHNE, "StrictNe")
          .put(Token.LT, "Lt")
          .put(Token.LE, "Le")
          .put(Token.GT, "Gt")
          .put(Token.GE, "Ge")
          .put(Token.IN, "In")
          .put(Token.INSTANCEOF, "InstanceOf")
          .build();

  private static final ImmutableMap<Token, String> LOGICAL_OPERATORS =
      ImmutableMap.of(
          Token.AND, "And",
          Token.OR, "Or",
          Token.COALESCE, "Coalesce");

  private static final ImmutableMap<Token, String> UNARY_OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.NOT, "Not")
          .put(Token.BITNOT, "BitNot")
          .put(Token.POS, "Plus")
          .put(Token.NEG, "Minus")
          .put(Token.TYPEOF, "TypeOf")
          .put(Token.VOID, "Void")
          .put(Token.DELPROP, "Delete")
          .build();

  private static final ImmutableMap<Token, String> ASSIGN_OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.ASSIGN, "Assign")
          .put(Token.ASSIGN_ADD, "AddAssign")
          .put(Token.ASSIGN_SUB, "SubAssign")
          .put(Token.ASSIGN_MUL, "MulAssign")
          .put(Token.ASSIGN_DIV, "DivAssign")
          .put(Token.ASSIGN_MOD, "ModAssign")
          .put(Token.ASSIGN_EXPONENT, "ExpAssign")
          .put(Token.ASSIGN_LSH, "ShlAssign")
          .put(Token.ASSIGN_RSH, "ShrAssign")
          .put(Token.ASSIGN_URSH, "UShrAssign")
          .put(Token.ASSIGN_BITOR, "BitOrAssign")
          .put(Token.ASSIGN_BITXOR, "BitXorAssign")
          .put(Token.ASSIGN_BITAND, "BitAndAssign")
          .put(Token.ASSIGN_OR, "OrAssign")
          .put(Token.ASSIGN_AND, "AndAssign")
          .put(Token.ASSIGN_COALESCE, "CoalesceAssign")
          .build();

  private final SourceText source;
  private final ClosureLexer lexer;
  private final PrintStream out;
  private final PrintStream err;
  private int unsupportedCount = 0;

  public TreeDumper(
      SourceText source, ClosureLexer lexer, PrintStream out, PrintStream err) {
    this.source = source;
    this.lexer = lexer;
    this.out = out;
    this.err = err;
  }

  /**
   * Prints the tree rooted at {@code script} and returns the number of
   * unsupported nodes encountered so far by this dumper.
   */
  public int dump(Node script) {
    out.println("=== AST ===");
    line(0, "Program", "", source.getWholeSpan());
    printHashbang();
    if (script != null) {
      printStatementList(
          Ast.getStatementContainer(script), 0, script.isUseStrict(), 1);
    }
    return unsupportedCount;
  }

  public int getUnsupportedCount() {
    return unsupportedCount;
  }

  private void printHashbang() {
    String text = source.getText();
    if (!text.startsWith("#!")) {
      return;
    }
    int end = 2;
    while (end < text.length() && !isLineTerminator(text.charAt(end))) {
      end++;
    }
    line(1, "Hashbang", text.substring(2, end), source.span(0, end));
  }

  private static boolean isLineTerminator(char c) {
    return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
  }

  // Statements

  /**
   * Prints a script or function body: its directive prologue, then its
   * statements. Closure removes leading "use strict" directives from the tree
   * and flags the container instead, so those are recovered from the source
   * starting at {@code prologueStart}.
   */
  private void printStatementList(
      Node container, int prologueStart, boolean useStrict, int depth) {
    if (useStrict && prologueStart >= 0) {
      for (Span directive : lexer.leadingUseStrict(prologueStart)) {
        line(depth, "Directive", "use strict", directive);
      }
    }
    boolean inPrologue = true;
    for (Node statement : container.children()) {
      if (inPrologue && isDirective(statement)) {
        Span literal = span(statement.getFirstChild());
        line(depth, "Directive", unquote(source.slice(literal)), span(statement));
        continue;
      }
      inPrologue = false;
      printStatement(statement, depth);
    }
  }

  private boolean isDirective(Node statement) {
    if (!statement.isExprResult() || !statement.getFirstChild().isStringLit()) {
      return false;
    }
    // A parenthesized string is an expression statement, not a directive.
    String text = source.slice(span(statement));
    return text.startsWith("'") || text.startsWith("\"");
  }

  private static String unquote(String literal) {
    if (literal.length() < 2) {
      return literal;
    }
    return literal.substring(1, literal.length() - 1);
  }

  private void printChildStatements(Node block, int depth) {
    for (Node statement : block.children()) {
      printStatement(statement, depth);
    }
  }

  private void printStatement(Node n, int depth) {
    switch (n.getToken()) {
      case BLOCK:
        if (n.isAddedBlock()) {
          printChildStatements(n, depth);
        } else {
          line(depth, "Block", "", span(n));
          printChildStatements(n, depth + 1);
        }
        break;
      case IF:
        line(depth, "If", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        printStatement(n.getSecondChild(), depth + 1);
        if (n.getChildCount() == 3) {
          printStatement(n.getLastChild(), depth + 1);
        }
        break;
      case WHILE:
        line(depth, "While", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        printStatement(n.getSecondChild(), depth + 1);
        break;
      case DO:
        line(depth, "DoWhile", "", span(n));
        printStatement(n.getFirstChild(), depth + 1);
        printExpression(n.getSecondChild(), depth + 1);
        break;
      case FOR:
        printFor(n, depth);
        break;
      case FOR_IN:
        printForEach(n, "ForIn", "", depth);
        break;
      case FOR_OF:
        printForEach(n, "ForOf", "", depth);
        break;
      case FOR_AWAIT_OF:
        printForEach(n, "ForOf", "await", depth);
        break;
      case SWITCH:
        printSwitch(n, depth);
        break;
      case TRY:
        printTry(n, depth);
        break;
      case RETURN:
        line(depth, "Return", "", span(n));
        if (n.hasChildren()) {
          printExpression(n.getFirstChild(), depth + 1);
        }
        break;
      case THROW:
        line(depth, "Throw", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        break;
      case BREAK:
        line(depth, "Break", labelOf(n), span(n));
        break;
      case CONTINUE:
        line(depth, "Continue", labelOf(n), span(n));
        break;
      case EXPR_RESULT:
        line(depth, "ExprStmt", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        break;
      case EMPTY:
        line(depth, "Empty", "", span(n));
        break;
      case DEBUGGER:
        line(depth, "Debugger", "", span(n));
        break;
      case WITH:
        line(depth, "With", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        printStatement(n.getSecondChild(), depth + 1);
        break;
      case LABEL:
        line(depth, "Labeled", n.getFirstChild().getString(),
            span(n).cover(span(n.getSecondChild())));
        printStatement(n.getSecondChild(), depth + 1);
        break;
      case VAR:
      case LET:
      case CONST:
        printVarDeclaration(n, depth);
        break;
      case FUNCTION:
        printFunction(n, "FuncDecl", span(n), depth);
        break;
      case CLASS:
        printClass(n, "Class", depth);
        break;
      case IMPORT:
        printImport(n, depth);
        break;
      case EXPORT:
        printExport(n, depth);
        break;
      default:
        unsupported(depth, "?Stmt", n);
        break;
    }
  }

  private static String labelOf(Node jump) {
    return jump.hasChildren() ? jump.getFirstChild().getString() : "";
  }

  private void printFor(Node n, int depth) {
    line(depth, "For", "", span(n));
    Node init = n.getFirstChild();
    Node test = init.getNext();
    Node update = test.getNext();
    if (!init.isEmpty()) {
      if (NodeUtil.isNameDeclaration(init)) {
        printVarDeclaration(init, depth + 1);
      } else {
        printExpression(init, depth + 1);
      }
    }
    if (!test.isEmpty()) {
      printExpression(test, depth + 1);
    }
    if (!update.isEmpty()) {
      printExpression(update, depth + 1);
    }
    printStatement(n.getLastChild(), depth + 1);
  }

  private void printForEach(Node n, String kind, String detail, int depth) {
    line(depth, kind, detail, span(n));
    Node left = n.getFirstChild();
    if (NodeUtil.isNameDeclaration(left)) {
      printVarDeclaration(left, depth + 1);
    } else {
      printPattern(left, depth + 1, false);
    }
    printExpression(n.getSecondChild(), depth + 1);
    printStatement(n.getLastChild(), depth + 1);
  }

  private void printSwitch(Node n, int depth) {
    line(depth, "Switch", "", span(n));
    printExpression(n.getFirstChild(), depth + 1);
    for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
      if (c.isCase()) {
        line(depth + 1, "Case", "", caseSpan(c));
        printExpression(c.getFirstChild(), depth + 2);
      } else if (c.isDefaultCase()) {
        line(depth + 1, "Default", "", caseSpan(c));
      } else {
        unsupported(depth + 1, "?Stmt", c);
        continue;
      }
      printChildStatements(c.getLastChild(), depth + 2);
    }
  }

  // Closure ends a case at its colon.
  private Span caseSpan(Node c) {
    Span span = span(c);
    Node last = c.getLastChild().getLastChild();
    return last == null ? span : span.cover(span(last));
  }

  private void printTry(Node n, int depth) {
    line(depth, "Try", "", span(n));
    Node block = n.getFirstChild();
    line(depth + 1, "Block", "", span(block));
    printChildStatements(block, depth + 2);
    for (Node handler : n.getSecondChild().children()) {
      line(depth + 1, "Catch", "", span(handler));
      Node param = handler.getFirstChild();
      if (!param.isEmpty()) {
        printPattern(param, depth + 2, true);
      }
      Node body = handler.getLastChild();
      line(depth + 2, "Block", "", span(body));
      printChildStatements(body, depth + 3);
    }
    if (n.getChildCount() == 3) {
      Node finallyBlock = n.getLastChild();
      line(depth + 1, "Finally", "", span(finallyBlock));
      printChildStatements(finallyBlock, depth + 2);
    }
  }

  private void printVarDeclaration(Node n, int depth) {
    line(depth, "VarDecl", Ascii.toLowerCase(n.getToken().name()), span(n));
    for (Node declarator : n.children()) {
      if (declarator.isName()) {
        Node init = declarator.getFirstChild();
        Span declaratorSpan = span(declarator);
        if (init != null) {
          declaratorSpan = declaratorSpan.cover(span(init));
        }
        line(depth + 1, "Declarator", "", declaratorSpan);
        String name = declarator.getString();
        line(depth + 2, "Ident", name,
            NodeSpans.prefix(source, declarator, name.length()));
        if (init != null) {
          printExpression(init, depth + 2);
        }
      } else if (declarator.isDestructuringLhs()) {
        line(depth + 1, "Declarator", "", span(declarator));
        printPattern(declarator.getFirstChild(), depth + 2, true);
        if (declarator.hasTwoChildren()) {
          printExpression(declarator.getSecondChild(), depth + 2);
        }
      } else {
        unsupported(depth + 1, "?Pattern", declarator);
      }
    }
  }

  // Modules

  private void printImport(Node n, int depth) {
    line(depth, "Import", n.getLastChild().getString(), span(n));
    Node defaultName = n.getFirstChild();
    if (defaultName.isName()) {
      line(depth + 1, "ImportDefault", defaultName.getString(), span(defaultName));
    }
    Node specs = n.getSecondChild();
    if (specs.isImportStar()) {
      line(depth + 1, "ImportNamespace", specs.getString(), span(specs));
    } else if (specs.isImportSpecs()) {
      for (Node spec : specs.children()) {
        if (spec.isImportSpec()) {
          line(depth + 1, "ImportSpec", alias(spec), span(spec));
        } else {
          unsupported(depth + 1, "?ImportSpec", spec);
        }
      }
    }
  }

  private void printExport(Node n, int depth) {
    String module = Ast.hasModuleSource(n) ? n.getLastChild().getString() : "";
    if (n.getBooleanProp(Node.EXPORT_ALL_FROM)) {
      line(depth, "ExportAll", module, span(n));
      return;
    }
    Node declaration = n.getFirstChild();
    if (n.getBooleanProp(Node.EXPORT_DEFAULT)) {
      line(depth, "ExportDefault", "", span(n));
      if (declaration.isFunction() && !declaration.isArrowFunction()) {
        printFunction(declaration, "FuncDecl", span(declaration), depth + 1);
      } else if (declaration.isClass()) {
        printClass(declaration, "Class", depth + 1);
      } else if (declaration.isEmpty()) {
        unsupported(depth + 1, "?ExportDefault", n);
      } else {
        printExpression(declaration, depth + 1);
      }
      return;
    }
    line(depth, "ExportNamed", module, span(n));
    if (declaration.isExportSpecs()) {
      for (Node spec : declaration.children()) {
        line(depth + 1, "ExportSpec", alias(spec), span(spec));
      }
    } else if (!declaration.isEmpty()) {
      printStatement(declaration, depth + 1);
    }
  }

  /** {@code name} when both names of a specifier agree, else {@code a as b}. */
  private static String alias(Node spec) {
    String from = spec.getFirstChild().getString();
    String to = spec.getLastChild().getString();
    return from.equals(to) ? from : from + " as " + to;
  }

  // Expressions

  private void printExpression(Node n, int depth) {
    n = Ast.unwrapCasts(n);
    if (isOptionalChain(n) && !continuesOptionalChain(n)) {
      line(depth, "Chain", "", expressionSpan(n));
      printExpressionNode(n, depth + 1);
    } else {
      printExpressionNode(n, depth);
    }
  }

  private static boolean isOptionalChain(Node n) {
    return n.isOptChainGetProp() || n.isOptChainGetElem() || n.isOptChainCall();
  }

  private static boolean continuesOptionalChain(Node n) {
    Node parent = n.getParent();
    return parent != null
        && isOptionalChain(parent)
        && parent.getFirstChild() == n
        && !parent.isOptionalChainStart();
  }

  private void printExpressionNode(Node n, int depth) {
    Token token = n.getToken();
    if (BINARY_OPERATORS.containsKey(token)) {
      printOperator(n, "Binary", BINARY_OPERATORS.get(token), depth);
      return;
    }
    if (LOGICAL_OPERATORS.containsKey(token)) {
      printOperator(n, "Logical", LOGICAL_OPERATORS.get(token), depth);
      return;
    }
    if (UNARY_OPERATORS.containsKey(token)) {
      printOperator(n, "Unary", UNARY_OPERATORS.get(token), depth);
      return;
    }
    if (ASSIGN_OPERATORS.containsKey(token)) {
      line(depth, "Assign", ASSIGN_OPERATORS.get(token), span(n));
      printPattern(n.getFirstChild(), depth + 1, false);
      printExpression(n.getSecondChild(), depth + 1);
      return;
    }

    switch (token) {
      case NAME:
        line(depth, "Ident", n.getString(), span(n));
        break;
      case NUMBER:
        printLiteral(n, "NumLit", depth);
        break;
      case STRINGLIT:
        printLiteral(n, "StrLit", depth);
        break;
      case BIGINT:
        printLiteral(n, "BigInt", depth);
        break;
      case REGEXP:
        printLiteral(n, "Regex", depth);
        break;
      case TRUE:
        line(depth, "true", "", span(n));
        break;
      case FALSE:
        line(depth, "false", "", span(n));
        break;
      case NULL:
        line(depth, "null", "", span(n));
        break;
      case THIS:
        line(depth, "this", "", span(n));
        break;
      case SUPER:
        line(depth, "super", "", span(n));
        break;
      case TEMPLATELIT:
        printTemplate(n, depth);
        break;
      case TAGGED_TEMPLATELIT:
        line(depth, "TaggedTemplate", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        printTemplate(n.getLastChild(), depth + 1);
        break;
      case INC:
      case DEC: {
        String detail = (n.isInc() ? "Increment" : "Decrement")
            + (n.getBooleanProp(Node.INCRDECR_PROP) ? " postfix" : " prefix");
        line(depth, "Update", detail, span(n));
        printExpression(n.getFirstChild(), depth + 1);
        break;
      }
      case HOOK:
        line(depth, "Ternary", "", span(n));
        printChildExpressions(n, depth + 1);
        break;
      case CALL:
      case OPTCHAIN_CALL:
        line(depth, "Call", n.isOptionalChainStart() ? "?." : "",
            expressionSpan(n));
        printExpression(n.getFirstChild(), depth + 1);
        printArguments(n, depth + 1);
        break;
      case NEW:
        line(depth, "New", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        printArguments(n, depth + 1);
        break;
      case GETPROP:
      case OPTCHAIN_GETPROP:
        line(depth, "Member",
            (n.isOptionalChainStart() ? "?." : "") + n.getString(),
            expressionSpan(n));
        printExpression(n.getFirstChild(), depth + 1);
        break;
      case GETELEM:
      case OPTCHAIN_GETELEM:
        line(depth, "Index", n.isOptionalChainStart() ? "?.[]" : "[]",
            expressionSpan(n));
        printChildExpressions(n, depth + 1);
        break;
      case ARRAYLIT:
        line(depth, "Array", "", span(n));
        for (Node element : n.children()) {
          if (element.isEmpty()) {
            line(depth + 1, "Elision", "", span(element));
          } else {
            printArgument(element, depth + 1);
          }
        }
        break;
      case OBJECTLIT:
        line(depth, "Object", "", span(n));
        for (Node member : n.children()) {
          printObjectMember(member, depth + 1);
        }
        break;
      case FUNCTION:
        if (n.isArrowFunction()) {
          printArrow(n, depth);
        } else {
          printFunction(n, "FuncExpr", span(n), depth);
        }
        break;
      case CLASS:
        printClass(n, "ClassExpr", depth);
        break;
      case COMMA:
        line(depth, "Sequence", "", span(n));
        for (Node operand : Ast.flattenCommas(n)) {
          printExpression(operand, depth + 1);
        }
        break;
      case AWAIT:
        line(depth, "Await", "", span(n));
        printExpression(n.getFirstChild(), depth + 1);
        break;
      case YIELD:
        line(depth, "Yield", n.isYieldAll() ? "*" : "", span(n));
        if (n.hasChildren()) {
          printExpression(n.getFirstChild(), depth + 1);
        }
        break;
      case DYNAMIC_IMPORT:
        line(depth, "ImportExpr", "", span(n));
        printChildExpressions(n, depth + 1);
        break;
      case IMPORT_META:
        line(depth, "MetaProperty", "import.meta", span(n));
        break;
      case NEW_TARGET:
        line(depth, "MetaProperty", "new.target", span(n));
        break;
      default:
        unsupported(depth, "?Expr", n);
        break;
    }
  }

  /**
   * The span of an expression, widened for member accesses and calls.
   * Closure positions a property access at its property name.
   */
  private Span expressionSpan(Node n) {
    Span span = span(n);
    switch (n.getToken()) {
      case GETPROP:
      case OPTCHAIN_GETPROP:
      case GETELEM:
      case OPTCHAIN_GETELEM:
      case CALL:
      case OPTCHAIN_CALL:
        return span.cover(expressionSpan(Ast.unwrapCasts(n.getFirstChild())));
      default:
        return span;
    }
  }

  private void printOperator(Node n, String kind, String operator, int depth) {
    line(depth, kind, operator, span(n));
    printChildExpressions(n, depth + 1);
  }

  private void printChildExpressions(Node n, int depth) {
    for (Node child : n.children()) {
      printExpression(child, depth);
    }
  }

  private void printLiteral(Node n, String kind, int depth) {
    Span span = span(n);
    line(depth, kind, snippet(span), span);
  }

  private void printArguments(Node call, int depth) {
    for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext()) {
      printArgument(arg, depth);
    }
  }

  private void printArgument(Node n, int depth) {
    if (n.isSpread()) {
      line(depth, "Spread", "", span(n));
      printExpression(n.getFirstChild(), depth + 1);
    } else {
      printExpression(n, depth);
    }
  }

  private void printTemplate(Node template, int depth) {
    line(depth, "Template", "", span(template));
    for (Node part : template.children()) {
      if (part.isTemplateLitString()) {
        Span quasi = quasiSpan(part);
        line(depth + 1, "Quasi", snippet(quasi), quasi);
      } else if (part.isTemplateLitSub()) {
        printExpression(part.getFirstChild(), depth + 1);
      } else {
        unsupported(depth + 1, "?Expr", part);
      }
    }
  }

  /**
   * The raw text of a template piece. Closure's range ends after the closing
   * backtick or the {@code ${} that opens the next substitution.
   */
  private Span quasiSpan(Node part) {
    int start = charStart(part);
    if (start < 0) {
      return span(part);
    }
    int end = start + part.getLength();
    String text = source.getText();
    if (end - start >= 2 && text.startsWith("${", end - 2)) {
      end -= 2;
    } else if (end - start >= 1 && end <= text.length()
        && text.charAt(end - 1) == '`') {
      end -= 1;
    }
    return source.span(start, end);
  }

  // Object literals

  private void printObjectMember(Node member, int depth) {
    switch (member.getToken()) {
      case STRING_KEY: {
        Span key = span(member);
        Node value = member.getFirstChild();
        boolean shorthand = member.isShorthandProperty();
        line(depth, "Property", shorthand ? "shorthand" : "",
            key.cover(span(value)));
        printKey(member, key, depth + 1);
        if (!shorthand) {
          printExpression(value, depth + 1);
        }
        break;
      }
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF: {
        Span key = span(member);
        Node function = member.getFirstChild();
        String detail = member.isGetterDef() ? "get"
            : member.isSetterDef() ? "set" : "method";
        line(depth, "Property", detail, key.cover(span(function)));
        printKey(member, key, depth + 1);
        printExpression(function, depth + 1);
        break;
      }
      case COMPUTED_PROP: {
        Node key = member.getFirstChild();
        Node value = member.getSecondChild();
        List<String> flags = Lists.newArrayList();
        if (isBracketed(key)) {
          flags.add("computed");
        }
        if (member.getBooleanProp(Node.COMPUTED_PROP_METHOD)) {
          flags.add("method");
        } else if (member.getBooleanProp(Node.COMPUTED_PROP_GETTER)) {
          flags.add("get");
        } else if (member.getBooleanProp(Node.COMPUTED_PROP_SETTER)) {
          flags.add("set");
        }
        line(depth, "Property", join(flags), span(member).cover(span(value)));
        printExpression(key, depth + 1);
        printExpression(value, depth + 1);
        break;
      }
      case OBJECT_SPREAD:
        printArgument(member, depth);
        break;
      default:
        unsupported(depth, "?Property", member);
        break;
    }
  }

  /**
   * Prints a non-computed key. Closure keeps only the key's value, so the
   * source decides whether it was written as a string, a number or a name.
   */
  private void printKey(Node key, Span span, int depth) {
    String text = source.slice(span);
    if (text.isEmpty()) {
      unsupported(depth, "?Key", key);
      return;
    }
    char first = text.charAt(0);
    if (first == '\'' || first == '"') {
      line(depth, "StrLit", snippet(span), span);
    } else if (Character.isDigit(first) || first == '.') {
      line(depth, "NumLit", snippet(span), span);
    } else {
      line(depth, "Ident", key.getString(), span);
    }
  }

  /**
   * Closure also uses computed members for methods and fields named by a
   * string or number literal. Only a key written inside brackets is computed.
   */
  private boolean isBracketed(Node key) {
    int pos = charStart(key) - 1;
    if (pos < 0) {
      return true;
    }
    String text = source.getText();
    while (pos >= 0 && Character.isWhitespace(text.charAt(pos))) {
      pos--;
    }
    return pos >= 0 && text.charAt(pos) == '[';
  }

  // Functions and classes

  private void printFunction(Node function, String label, Span span, int depth) {
    List<String> flags = Lists.newArrayList();
    if (function.isAsyncFunction()) {
      flags.add("async");
    }
    if (function.isGeneratorFunction()) {
      flags.add("*");
    }
    String name = function.getFirstChild().getString();
    if (!name.isEmpty()) {
      flags.add(name);
    }
    line(depth, label, join(flags), span);
    printParams(function.getSecondChild(), depth + 1);
    printFunctionBody(function.getLastChild(), depth + 1);
  }

  private void printArrow(Node function, int depth) {
    Node body = function.getLastChild();
    List<String> flags = Lists.newArrayList();
    if (function.isAsyncFunction()) {
      flags.add("async");
    }
    flags.add(body.isBlock() ? "block" : "expr");
    line(depth, "Arrow", join(flags), span(function));
    printParams(function.getSecondChild(), depth + 1);
    if (body.isBlock()) {
      printFunctionBody(body, depth + 1);
    } else {
      printExpression(body, depth + 1);
    }
  }

  private void printFunctionBody(Node body, int depth) {
    int open = charStart(body);
    printStatementList(
        body, open < 0 ? -1 : open + 1, body.isUseStrict(), depth);
  }

  private void printParams(Node params, int depth) {
    if (!params.hasChildren()) {
      return;
    }
    line(depth, "Params", "", span(params));
    for (Node param : params.children()) {
      printPattern(param, depth + 1, true);
    }
  }

  private void printClass(Node n, String label, int depth) {
    Node name = n.getFirstChild();
    line(depth, label, name.isName() ? name.getString() : "", span(n));
    Node superClass = name.getNext();
    if (!superClass.isEmpty()) {
      line(depth + 1, "Extends", "", span(superClass));
      printExpression(superClass, depth + 2);
    }
    for (Node member : n.getLastChild().children()) {
      printClassMember(member, depth + 1);
    }
  }

  private void printClassMember(Node member, int depth) {
    switch (member.getToken()) {
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF: {
        Span key = span(member);
        Node function = member.getFirstChild();
        List<String> flags = Lists.newArrayList();
        if (member.isStaticMember()) {
          flags.add("static");
        }
        if (member.isGetterDef()) {
          flags.add("get");
        } else if (member.isSetterDef()) {
          flags.add("set");
        } else if (!member.isStaticMember()
            && member.getString().equals("constructor")) {
          flags.add("constructor");
        }
        line(depth, "Method", join(flags), key.cover(span(function)));
        printKey(member, key, depth + 1);
        printFunction(function, "Body", span(function), depth + 1);
        break;
      }
      case COMPUTED_PROP: {
        Node key = member.getFirstChild();
        Node function = member.getSecondChild();
        List<String> flags = Lists.newArrayList();
        if (member.isStaticMember()) {
          flags.add("static");
        }
        if (member.getBooleanProp(Node.COMPUTED_PROP_GETTER)) {
          flags.add("get");
        } else if (member.getBooleanProp(Node.COMPUTED_PROP_SETTER)) {
          flags.add("set");
        }
        if (isBracketed(key)) {
          flags.add("computed");
        }
        line(depth, "Method", join(flags), span(member).cover(span(function)));
        printExpression(key, depth + 1);
        printFunction(function, "Body", span(function), depth + 1);
        break;
      }
      case MEMBER_FIELD_DEF:
        line(depth, "ClassProp", member.isStaticMember() ? "static" : "",
            span(member));
        printKey(member, fieldKeySpan(member), depth + 1);
        if (member.hasChildren()) {
          printExpression(member.getFirstChild(), depth + 1);
        }
        break;
      case COMPUTED_FIELD_DEF: {
        List<String> flags = Lists.newArrayList();
        if (member.isStaticMember()) {
          flags.add("static");
        }
        if (isBracketed(member.getFirstChild())) {
          flags.add("computed");
        }
        line(depth, "ClassProp", join(flags), span(member));
        printExpression(member.getFirstChild(), depth + 1);
        if (member.hasTwoChildren()) {
          printExpression(member.getSecondChild(), depth + 1);
        }
        break;
      }
      case BLOCK:
        line(depth, "StaticBlock", "", span(member));
        printChildStatements(member, depth + 1);
        break;
      default:
        unsupported(depth, "?ClassElem", member);
        break;
    }
  }

  /**
   * Closure positions a field at the start of its declaration, which may be
   * the {@code static} keyword, so the key is located in the source.
   */
  private Span fieldKeySpan(Node field) {
    int start = charStart(field);
    if (start < 0) {
      return span(field);
    }
    String text = source.getText();
    int pos = start;
    if (field.isStaticMember() && text.startsWith("static", pos)) {
      pos = skipWhitespace(text, pos + "static".length());
    }
    int end = pos;
    if (end < text.length() && (text.charAt(end) == '\'' || text.charAt(end) == '"')) {
      char quote = text.charAt(end++);
      while (end < text.length() && text.charAt(end) != quote) {
        end += text.charAt(end) == '\\' ? 2 : 1;
      }
      end = Math.min(end + 1, text.length());
    } else {
      while (end < text.length()
          && (Character.isUnicodeIdentifierPart(text.charAt(end))
              || text.charAt(end) == '$' || text.charAt(end) == '.')) {
        end++;
      }
    }
    return source.span(pos, end);
  }

  private static int skipWhitespace(String text, int pos) {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  // Patterns

  /**
   * Prints a binding pattern (declarations, parameters, catch bindings) or,
   * when {@code binding} is false, an assignment target.
   */
  private void printPattern(Node n, int depth, boolean binding) {
    switch (n.getToken()) {
      case NAME:
        line(depth, "Ident", n.getString(), span(n));
        break;
      case ARRAY_PATTERN: {
        Span pattern = span(n);
        line(depth, "ArrPattern", "", pattern);
        for (Node element : n.children()) {
          if (element.isEmpty()) {
            line(depth + 1, "Elision", "", pattern);
          } else {
            printPattern(element, depth + 1, binding);
          }
        }
        break;
      }
      case OBJECT_PATTERN:
        line(depth, "ObjPattern", "", span(n));
        for (Node member : n.children()) {
          printPatternMember(member, depth + 1, binding);
        }
        break;
      case ITER_REST:
      case OBJECT_REST:
        line(depth, "Rest", "", span(n));
        printPattern(n.getFirstChild(), depth + 1, binding);
        break;
      case DEFAULT_VALUE:
        line(depth, binding ? "AssignPattern" : "AssignDefault", "", span(n));
        printPattern(n.getFirstChild(), depth + 1, binding);
        printExpression(n.getSecondChild(), depth + 1);
        break;
      case GETPROP:
      case GETELEM:
      case CAST:
        if (!binding) {
          printExpression(n, depth);
          break;
        }
        unsupported(depth, "?Pattern", n);
        break;
      default:
        unsupported(depth, binding ? "?Pattern" : "?Target", n);
        break;
    }
  }

  private void printPatternMember(Node member, int depth, boolean binding) {
    switch (member.getToken()) {
      case STRING_KEY: {
        Span key = span(member);
        Node target = member.getFirstChild();
        Span property = key.cover(span(target));
        if (member.isShorthandProperty() && !binding) {
          line(depth, "BindProp", "shorthand " + member.getString(), property);
          if (target.isDefaultValue()) {
            printExpression(target.getSecondChild(), depth + 1);
          }
        } else {
          line(depth, "BindProp",
              member.isShorthandProperty() ? "shorthand" : "", property);
          printKey(member, key, depth + 1);
          printPattern(target, depth + 1, binding);
        }
        break;
      }
      case COMPUTED_PROP:
        line(depth, "BindProp", "computed", span(member));
        printExpression(member.getFirstChild(), depth + 1);
        printPattern(member.getSecondChild(), depth + 1, binding);
        break;
      case OBJECT_REST:
        printPattern(member, depth, binding);
        break;
      default:
        unsupported(depth, binding ? "?Pattern" : "?Target", member);
        break;
    }
  }

  // Output

  private Span span(Node n) {
    return NodeSpans.of(source, n);
  }

  private int charStart(Node n) {
    return source.toCharOffset(n.getLineno(), n.getCharno());
  }

  private String snippet(Span span) {
    return source.snippet(span, SourceText.NODE_SNIPPET_BYTES);
  }

  private static String join(List<String> flags) {
    return Joiner.on(' ').join(flags);
  }

  private void line(int depth, String kind, String detail, Span span) {
    StringBuilder text = new StringBuilder(Strings.repeat("  ", depth));
    text.append(kind);
    if (!detail.isEmpty()) {
      text.append(' ').append(TextEscaper.escape(detail));
    }
    text.append(' ').append(span);
    out.println(text);
  }

  private void unsupported(int depth, String category, Node n) {
    Span span = span(n);
    unsupportedCount++;
    line(depth, category, snippet(span), span);
    err.println("warning: unsupported node " + category + " at " + span);
  }
}
