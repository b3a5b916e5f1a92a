package info.persistent.groundtruth.jscomp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * Test {@link TreeDumper}.
 */
public class TreeDumperTest {
  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

  @Test public void testVariableDeclaration() throws Exception {
    String output = dump("let x = 1 + 2;");
    assertTrue(output, output.startsWith("=== AST ===\nProgram 0:14\n  VarDecl let "));
    assertContainsLines(output,
        "    Declarator 4:13",
        "      Ident x 4:5",
        "      Binary Add 8:13",
        "        NumLit 1 8:9",
        "        NumLit 2 12:13");
    assertEquals(1, countOccurrences(output, "Declarator"));
  }

  @Test public void testUseStrictDirective() throws Exception {
    String output = dump("\"use strict\"; x;");
    assertContainsLines(output,
        "  Directive use strict 0:13",
        "    Ident x 14:15");
  }

  @Test public void testOtherDirective() throws Exception {
    String output = dump("'use asm';\nx;");
    assertContainsLines(output, "  Directive use asm 0:10");
  }

  @Test public void testParenthesizedStringIsNotDirective() throws Exception {
    String output = dump("('use asm');");
    assertFalse(output, output.contains("Directive"));
    assertTrue(output, output.contains("StrLit 'use asm' "));
  }

  @Test public void testHashbang() throws Exception {
    String output = dump("#!/usr/bin/env node\nx;\n");
    assertTrue(output, output.startsWith(
        "=== AST ===\nProgram 0:23\n  Hashbang /usr/bin/env node 0:19\n"));
  }

  @Test public void testTemplate() throws Exception {
    String output = dump("`a${b}c`;");
    assertContainsLines(output,
        "      Quasi a 1:2",
        "      Ident b 4:5",
        "      Quasi c 6:7");
  }

  @Test public void testUpdate() throws Exception {
    assertContainsLines(dump("x++;"),
        "    Update Increment postfix 0:3",
        "      Ident x 0:1");
    assertContainsLines(dump("--x;"),
        "    Update Decrement prefix 0:3",
        "      Ident x 2:3");
  }

  @Test public void testOptionalChain() throws Exception {
    String output = dump("a?.b.c;");
    assertContainsLines(output,
        "    Chain 0:6",
        "      Member c 0:6",
        "        Member ?.b 0:4",
        "          Ident a 0:1");
    assertEquals(1, countOccurrences(output, "Chain"));
  }

  @Test public void testMemberSpansCoverObject() throws Exception {
    assertContainsLines(dump("a.b(c)[d];"),
        "    Index [] 0:9",
        "      Call 0:6",
        "        Member b 0:3",
        "          Ident a 0:1",
        "        Ident c 4:5",
        "      Ident d 7:8");
  }

  @Test public void testLabeledSpanCoversBody() throws Exception {
    assertContainsLines(dump("outer: for (;;) { break outer; }"),
        "  Labeled outer 0:32",
        "    For 7:32",
        "      Block 16:32",
        "        Break outer 18:30");
  }

  @Test public void testIfWhileDo() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  If\n" +
        "    Ident a\n" +
        "    ExprStmt\n" +
        "      Call\n" +
        "        Ident b\n" +
        "    Block\n" +
        "      ExprStmt\n" +
        "        Ident c\n" +
        "  While\n" +
        "    Ident i\n" +
        "    ExprStmt\n" +
        "      Update Decrement postfix\n" +
        "        Ident i\n" +
        "  DoWhile\n" +
        "    ExprStmt\n" +
        "      Call\n" +
        "        Ident x\n" +
        "    Ident y\n",
        shape(dump("if (a) b(); else { c; }\nwhile (i) i--;\ndo x(); while (y);")));
  }

  @Test public void testFor() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  For\n" +
        "    VarDecl let\n" +
        "      Declarator\n" +
        "        Ident i\n" +
        "        NumLit 0\n" +
        "    Binary Lt\n" +
        "      Ident i\n" +
        "      Ident n\n" +
        "    Update Increment postfix\n" +
        "      Ident i\n" +
        "    Block\n" +
        "  For\n" +
        "    Break\n",
        shape(dump("for (let i = 0; i < n; i++) {}\nfor (;;) break;")));
  }

  @Test public void testForInOf() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ForIn\n" +
        "    VarDecl const\n" +
        "      Declarator\n" +
        "        Ident k\n" +
        "    Ident o\n" +
        "    ExprStmt\n" +
        "      Call\n" +
        "        Ident f\n" +
        "        Ident k\n" +
        "  ForOf\n" +
        "    Ident x\n" +
        "    Ident xs\n" +
        "    ExprStmt\n" +
        "      Call\n" +
        "        Ident g\n" +
        "        Ident x\n" +
        "  FuncDecl async h\n" +
        "    ForOf await\n" +
        "      VarDecl const\n" +
        "        Declarator\n" +
        "          Ident y\n" +
        "      Ident ys\n" +
        "      Block\n",
        shape(dump(
            "for (const k in o) f(k);\n" +
            "for (x of xs) g(x);\n" +
            "async function h() { for await (const y of ys) {} }")));
  }

  @Test public void testSwitch() throws Exception {
    String output = dump("switch (x) { case 1: a(); break; default: b(); }");
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  Switch\n" +
        "    Ident x\n" +
        "    Case\n" +
        "      NumLit 1\n" +
        "      ExprStmt\n" +
        "        Call\n" +
        "          Ident a\n" +
        "      Break\n" +
        "    Default\n" +
        "      ExprStmt\n" +
        "        Call\n" +
        "          Ident b\n",
        shape(output));
    assertContainsLines(output,
        "    Case 13:32",
        "    Default 33:46",
        "      ExprStmt 42:46");
  }

  @Test public void testTry() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  Try\n" +
        "    Block\n" +
        "      ExprStmt\n" +
        "        Call\n" +
        "          Ident a\n" +
        "    Catch\n" +
        "      Ident e\n" +
        "      Block\n" +
        "        ExprStmt\n" +
        "          Call\n" +
        "            Ident b\n" +
        "            Ident e\n" +
        "    Finally\n" +
        "      ExprStmt\n" +
        "        Call\n" +
        "          Ident c\n" +
        "  Try\n" +
        "    Block\n" +
        "    Catch\n" +
        "      Block\n",
        shape(dump(
            "try { a(); } catch (e) { b(e); } finally { c(); }\n" +
            "try {} catch {}")));
  }

  @Test public void testObjectLiteral() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ExprStmt\n" +
        "    Assign Assign\n" +
        "      Ident x\n" +
        "      Object\n" +
        "        Property\n" +
        "          Ident a\n" +
        "          NumLit 1\n" +
        "        Property shorthand\n" +
        "          Ident b\n" +
        "        Property computed\n" +
        "          Ident c\n" +
        "          NumLit 2\n" +
        "        Property\n" +
        "          StrLit 'd'\n" +
        "          NumLit 3\n" +
        "        Property\n" +
        "          NumLit 4\n" +
        "          NumLit 5\n" +
        "        Property method\n" +
        "          Ident m\n" +
        "          FuncExpr\n" +
        "        Property get\n" +
        "          Ident g\n" +
        "          FuncExpr\n" +
        "            Return\n" +
        "              NumLit 1\n" +
        "        Spread\n" +
        "          Ident r\n",
        shape(dump(
            "x = {a: 1, b, [c]: 2, 'd': 3, 4: 5, m() {}, " +
            "get g() { return 1; }, ...r};")));
  }

  @Test public void testLiteralMethodKeysAreNotComputed() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ExprStmt\n" +
        "    Object\n" +
        "      Property method\n" +
        "        StrLit 'm'\n" +
        "        FuncExpr\n" +
        "      Property computed method\n" +
        "        StrLit 'n'\n" +
        "        FuncExpr\n",
        shape(dump("({'m'() {}, ['n']() {}});")));
  }

  @Test public void testArrayAndSequence() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ExprStmt\n" +
        "    Assign Assign\n" +
        "      Ident x\n" +
        "      Array\n" +
        "        NumLit 1\n" +
        "        Elision\n" +
        "        Spread\n" +
        "          Ident y\n" +
        "  ExprStmt\n" +
        "    Sequence\n" +
        "      Ident a\n" +
        "      Ident b\n" +
        "      Ident c\n",
        shape(dump("x = [1, , ...y];\na, b, c;")));
  }

  @Test public void testArrows() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ExprStmt\n" +
        "    Assign Assign\n" +
        "      Ident f\n" +
        "      Arrow expr\n" +
        "        Params\n" +
        "          Ident a\n" +
        "          AssignPattern\n" +
        "            Ident b\n" +
        "            NumLit 1\n" +
        "        Binary Add\n" +
        "          Ident a\n" +
        "          Ident b\n" +
        "  ExprStmt\n" +
        "    Assign Assign\n" +
        "      Ident g\n" +
        "      Arrow async block\n" +
        "        Params\n" +
        "          Ident x\n" +
        "        Return\n" +
        "          Ident x\n",
        shape(dump("f = (a, b = 1) => a + b;\ng = async x => { return x; };")));
  }

  @Test public void testClass() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  Class A\n" +
        "    Extends\n" +
        "      Ident B\n" +
        "    Method constructor\n" +
        "      Ident constructor\n" +
        "      Body\n" +
        "        Params\n" +
        "          Ident x\n" +
        "        ExprStmt\n" +
        "          Call\n" +
        "            super\n" +
        "            Ident x\n" +
        "    Method static\n" +
        "      Ident m\n" +
        "      Body\n" +
        "    Method get\n" +
        "      Ident g\n" +
        "      Body\n" +
        "        Return\n" +
        "          NumLit 1\n" +
        "    Method computed\n" +
        "      Ident k\n" +
        "      Body\n" +
        "    Method\n" +
        "      StrLit 'q'\n" +
        "      Body\n" +
        "    Method\n" +
        "      NumLit 1\n" +
        "      Body\n",
        shape(dump(
            "class A extends B {\n" +
            "  constructor(x) { super(x); }\n" +
            "  static m() {}\n" +
            "  get g() { return 1; }\n" +
            "  [k]() {}\n" +
            "  'q'() {}\n" +
            "  1() {}\n" +
            "}")));
  }

  @Test public void testClassFieldsAndStaticBlock() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  Class A\n" +
        "    ClassProp\n" +
        "      Ident y\n" +
        "      NumLit 1\n" +
        "    ClassProp static\n" +
        "      Ident z\n" +
        "    ClassProp computed\n" +
        "      Ident w\n" +
        "      NumLit 2\n" +
        "    StaticBlock\n" +
        "      ExprStmt\n" +
        "        Assign Assign\n" +
        "          Member z\n" +
        "            Ident A\n" +
        "          NumLit 3\n",
        shape(dump(
            "class A {\n" +
            "  y = 1;\n" +
            "  static z;\n" +
            "  [w] = 2;\n" +
            "  static { A.z = 3; }\n" +
            "}")));
  }

  @Test public void testModule() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  Import ./a.js\n" +
        "    ImportDefault d\n" +
        "    ImportNamespace ns\n" +
        "  Import ./b.js\n" +
        "    ImportSpec x as y\n" +
        "    ImportSpec z\n" +
        "  ExportNamed\n" +
        "    VarDecl const\n" +
        "      Declarator\n" +
        "        Ident c\n" +
        "        NumLit 1\n" +
        "  ExportNamed\n" +
        "    ExportSpec y as w\n" +
        "  ExportNamed ./e.js\n" +
        "    ExportSpec v\n" +
        "  ExportAll ./c.js\n" +
        "  ExportDefault\n" +
        "    FuncDecl\n",
        shape(dump(
            "import d, * as ns from './a.js';\n" +
            "import {x as y, z} from './b.js';\n" +
            "export const c = 1;\n" +
            "export {y as w};\n" +
            "export {v} from './e.js';\n" +
            "export * from './c.js';\n" +
            "export default function () {}")));
  }

  @Test public void testExportDefaultExpression() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ExportDefault\n" +
        "    Binary Add\n" +
        "      NumLit 1\n" +
        "      NumLit 2\n",
        shape(dump("export default 1 + 2;")));
  }

  @Test public void testDeclarationPatterns() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  VarDecl const\n" +
        "    Declarator\n" +
        "      ObjPattern\n" +
        "        BindProp shorthand\n" +
        "          Ident a\n" +
        "          Ident a\n" +
        "        BindProp\n" +
        "          Ident b\n" +
        "          ArrPattern\n" +
        "            Ident c\n" +
        "            Elision\n" +
        "            Rest\n" +
        "              Ident d\n" +
        "        BindProp computed\n" +
        "          StrLit 'e'\n" +
        "          AssignPattern\n" +
        "            Ident f\n" +
        "            NumLit 1\n" +
        "        Rest\n" +
        "          Ident g\n" +
        "      Ident h\n",
        shape(dump("const {a, b: [c, , ...d], ['e']: f = 1, ...g} = h;")));
  }

  @Test public void testAssignmentPatterns() throws Exception {
    assertEquals(
        "=== AST ===\n" +
        "Program\n" +
        "  ExprStmt\n" +
        "    Assign Assign\n" +
        "      ObjPattern\n" +
        "        BindProp shorthand p\n" +
        "        BindProp\n" +
        "          Ident q\n" +
        "          Member s\n" +
        "            Ident r\n" +
        "        BindProp shorthand t\n" +
        "          NumLit 2\n" +
        "      Ident u\n" +
        "  ExprStmt\n" +
        "    Assign Assign\n" +
        "      ArrPattern\n" +
        "        AssignDefault\n" +
        "          Ident v\n" +
        "          NumLit 3\n" +
        "      Ident w\n",
        shape(dump("({p, q: r.s, t = 2} = u);\n[v = 3] = w;")));
  }

  @Test public void testFunctionDeclaration() throws Exception {
    String output = dump("function f(a) { return a; }");
    assertTrue(output, output.contains("\n  FuncDecl f "));
    assertTrue(output, output.contains("\n    Params "));
    assertContainsLines(output,
        "      Ident a 11:12",
        "      Ident a 23:24");
    assertTrue(output, output.contains("\n    Return "));
  }

  @Test public void testByteOffsets() throws Exception {
    String output = dump("var \u00e9 = 1;");
    assertContainsLines(output,
        "      Ident \u00e9 4:6",
        "      NumLit 1 9:10");
  }

  @Test public void testUnsupportedStatement() throws Exception {
    SourceText source = SourceText.fromCode("test.js", "");
    Node script = new Node(Token.SCRIPT);
    script.addChildToBack(new Node(Token.PLACEHOLDER1));
    TreeDumper dumper = newDumper(source);
    assertEquals(1, dumper.dump(script));
    assertEquals(1, dumper.getUnsupportedCount());
    assertEquals("=== AST ===\nProgram 0:0\n  ?Stmt 0:0\n", output());
    assertEquals("warning: unsupported node ?Stmt at 0:0\n", errors());
  }

  @Test public void testUnsupportedExpression() throws Exception {
    SourceText source = SourceText.fromCode("test.js", "");
    Node script = new Node(Token.SCRIPT);
    script.addChildToBack(
        new Node(Token.EXPR_RESULT, new Node(Token.PLACEHOLDER2)));
    TreeDumper dumper = newDumper(source);
    assertEquals(1, dumper.dump(script));
    assertEquals(
        "=== AST ===\nProgram 0:0\n  ExprStmt 0:0\n    ?Expr 0:0\n", output());
  }

  @Test public void testNoScript() throws Exception {
    SourceText source = SourceText.fromCode("test.js", "x");
    assertEquals(0, newDumper(source).dump(null));
    assertEquals("=== AST ===\nProgram 0:1\n", output());
  }

  private String dump(String code) throws UnsupportedEncodingException {
    outBytes.reset();
    errBytes.reset();
    SourceText source = SourceText.fromCode("test.js", code);
    ParseResult parsed = new ClosureFrontEnd().parse(source);
    assertFalse(parsed.getErrors().toString(), parsed.hasErrors());
    int unsupported = newDumper(source).dump(parsed.getScript());
    assertEquals(errors(), 0, unsupported);
    return output();
  }

  private TreeDumper newDumper(SourceText source)
      throws UnsupportedEncodingException {
    return new TreeDumper(
        source,
        new ClosureLexer(source),
        new PrintStream(outBytes, true, "UTF-8"),
        new PrintStream(errBytes, true, "UTF-8"));
  }

  private String output() {
    return normalize(outBytes);
  }

  private String errors() {
    return normalize(errBytes);
  }

  private static String normalize(ByteArrayOutputStream bytes) {
    return new String(bytes.toByteArray(), StandardCharsets.UTF_8)
        .replace(System.lineSeparator(), "\n");
  }

  // The dump with every span removed.
  private static String shape(String output) {
    return output.replaceAll("(?m) \\d+:\\d+$", "");
  }

  private static void assertContainsLines(String output, String... lines) {
    for (String line : lines) {
      assertTrue(line + " in\n" + output, output.contains("\n" + line + "\n"));
    }
  }

  private static int countOccurrences(String output, String text) {
    int count = 0;
    for (int i = output.indexOf(text); i >= 0; i = output.indexOf(text, i + 1)) {
      count++;
    }
    return count;
  }
}
