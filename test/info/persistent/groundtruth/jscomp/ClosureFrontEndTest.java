package info.persistent.groundtruth.jscomp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import com.google.javascript.jscomp.JSError;
import com.google.javascript.rhino.Node;

import org.junit.Test;

import java.util.List;

/**
 * Test {@link ClosureFrontEnd}.
 */
public class ClosureFrontEndTest {
  @Test public void testParse() {
    ParseResult parsed = new ClosureFrontEnd().parse(
        SourceText.fromCode("test.js", "var a = 1;"));
    assertFalse(parsed.getErrors().toString(), parsed.hasErrors());
    assertNotNull(parsed.getScript());
    assertTrue(parsed.getScript().isScript());
    assertEquals(1, parsed.getScript().getChildCount());
  }

  @Test public void testParseModule() {
    ParseResult parsed = new ClosureFrontEnd().parse(
        SourceText.fromCode("test.js", "import x from './x.js'; export {x};"));
    assertFalse(parsed.getErrors().toString(), parsed.hasErrors());
    Node moduleBody = parsed.getScript().getFirstChild();
    assertTrue(moduleBody.isModuleBody());
    assertEquals(2, moduleBody.getChildCount());
    assertTrue(moduleBody.getFirstChild().isImport());
    assertTrue(moduleBody.getLastChild().isExport());
  }

  @Test public void testBareImportSpecifierIsNotAnError() {
    ParseResult parsed = new ClosureFrontEnd().parse(
        SourceText.fromCode("test.js", "import {m} from 'm';\nm();"));
    assertFalse(parsed.getErrors().toString(), parsed.hasErrors());
    assertEquals(2, parsed.getScript().getFirstChild().getChildCount());
  }

  @Test public void testParseClassFields() {
    ParseResult parsed = new ClosureFrontEnd().parse(SourceText.fromCode(
        "test.js", "class A { x = 1; static y; static { A.y = 2; } }"));
    assertFalse(parsed.getErrors().toString(), parsed.hasErrors());
  }

  @Test public void testParseError() {
    ParseResult parsed = new ClosureFrontEnd().parse(
        SourceText.fromCode("test.js", "var = ;"));
    assertTrue(parsed.hasErrors());
    JSError error = parsed.getErrors().get(0);
    assertTrue(ClosureFrontEnd.isParseError(error));
    String formatted = ClosureFrontEnd.format(error);
    assertTrue(formatted, formatted.endsWith("(line 1:" + error.getCharno() + ")"));
  }

  @Test public void testKeepGoing() {
    ClosureFrontEnd.Options options = new ClosureFrontEnd.Options();
    options.keepGoing = true;
    ParseResult parsed = new ClosureFrontEnd(options).parse(
        SourceText.fromCode("test.js", "var a = 1;\nvar = ;"));
    assertTrue(parsed.hasErrors());
    assertTrue(ClosureFrontEnd.isParseError(parsed.getErrors().get(0)));
    assertNotNull(parsed.getScript());
    assertTrue(parsed.getScript().isScript());
  }

  @Test public void testSemanticChecksAfterParseError() {
    ClosureFrontEnd.Options options = new ClosureFrontEnd.Options();
    options.keepGoing = true;
    ClosureFrontEnd frontEnd = new ClosureFrontEnd(options);
    ParseResult parsed = frontEnd.parse(
        SourceText.fromCode("test.js", "var a = 1;\nvar = ;"));
    for (JSError error : frontEnd.checkSemantics(parsed)) {
      assertFalse(ClosureFrontEnd.isParseError(error));
    }
  }

  @Test public void testUndeclaredGlobalsAreNotSemanticErrors() {
    ClosureFrontEnd frontEnd = new ClosureFrontEnd();
    List<JSError> errors = frontEnd.checkSemantics(frontEnd.parse(
        SourceText.fromCode("test.js", "undeclaredFunction(1);")));
    assertTrue(errors.toString(), errors.isEmpty());
  }

  @Test public void testRedeclarationIsSemanticError() {
    ClosureFrontEnd frontEnd = new ClosureFrontEnd();
    List<JSError> errors = frontEnd.checkSemantics(frontEnd.parse(
        SourceText.fromCode("test.js", "let a = 1; let a = 2;")));
    assertFalse(errors.isEmpty());
    for (JSError error : errors) {
      assertFalse(ClosureFrontEnd.isParseError(error));
    }
  }

  @Test public void testTokenize() {
    List<LexToken> tokens = new ClosureFrontEnd().tokenize(
        SourceText.fromCode("test.js", "a"), System.err);
    assertEquals(2, tokens.size());
  }
}
