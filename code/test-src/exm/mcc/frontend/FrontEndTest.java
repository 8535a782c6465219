package exm.mcc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import exm.mcc.ast.FunctionDecl;
import exm.mcc.common.exceptions.InvalidSyntaxException;
import exm.mcc.common.exceptions.LexException;
import exm.mcc.common.exceptions.MCCRuntimeError;
import exm.mcc.common.exceptions.UndefinedVarError;
import exm.mcc.common.exceptions.UninitializedVarError;
import exm.mcc.common.exceptions.UserException;
import exm.mcc.lexer.Token;
import exm.mcc.lexer.TokenKind;

public class FrontEndTest {

  private final FrontEnd frontEnd = new FrontEnd("test.c");

  @Test
  public void testStagesInOrder() {
    StageResult<List<Token>> tokens =
        frontEnd.tokenize("int main() { int a = 2; return a * a; }");
    assertTrue(tokens.isSuccess());
    assertNull(tokens.getError());
    List<Token> toks = tokens.getValue();
    assertEquals(TokenKind.EOF, toks.get(toks.size() - 1).getKind());

    StageResult<FunctionDecl> tree = frontEnd.parseFunction(toks);
    assertTrue(tree.isSuccess());

    StageResult<FunctionDecl> checked = frontEnd.analyze(tree.getValue());
    assertTrue(checked.isSuccess());
    assertTrue("Analysis returns the same tree",
               checked.getValue() == tree.getValue());
  }

  @Test
  public void testLexFailure() {
    StageResult<List<Token>> tokens = frontEnd.tokenize("int main() { # }");
    assertFalse(tokens.isSuccess());
    assertTrue(tokens.getError() instanceof LexException);
    assertEquals("test.c", tokens.getError().getFile());
    assertEquals(14, tokens.getError().getColumn());
  }

  @Test
  public void testParseFailure() {
    List<Token> toks = frontEnd.tokenize("int main() return 0;").getValue();
    StageResult<FunctionDecl> tree = frontEnd.parseFunction(toks);
    assertFalse(tree.isSuccess());
    assertTrue(tree.getError() instanceof InvalidSyntaxException);
    assertEquals("Expected '{' before block, found 'return'",
                 tree.getError().getRawMessage());
  }

  @Test
  public void testCompilePipeline() {
    assertTrue(frontEnd.compile("int main() { return 1; }").isSuccess());

    assertTrue(frontEnd.compile("int main() { return $; }").getError()
               instanceof LexException);
    assertTrue(frontEnd.compile("int main() { return; }").getError()
               instanceof InvalidSyntaxException);
    assertTrue(frontEnd.compile("int main() { return q; }").getError()
               instanceof UndefinedVarError);
    assertTrue(frontEnd.compile("int main() { int q = q; return q; }")
               .getError() instanceof UninitializedVarError);
  }

  @Test(expected=MCCRuntimeError.class)
  public void testValueOfFailure() {
    frontEnd.tokenize("@").getValue();
  }

  @Test(expected=LexException.class)
  public void testGetOrThrow() throws UserException {
    frontEnd.tokenize("@").getOrThrow();
  }

  @Test
  public void testLongExpressionCompiles() {
    StringBuilder src = new StringBuilder("int main() { int a = 1; return a");
    for (int i = 0; i < 50000; i++) {
      src.append(" + a");
    }
    src.append("; }");
    StageResult<FunctionDecl> result = frontEnd.compile(src.toString());
    assertTrue(String.valueOf(result.getError()), result.isSuccess());
  }

  @Test
  public void testDeepParenthesesFail() {
    String src = "int main() { return " + StringUtils.repeat("(", 20000) +
                 "1" + StringUtils.repeat(")", 20000) + "; }";
    StageResult<FunctionDecl> result = frontEnd.compile(src);
    assertFalse(result.isSuccess());
    assertTrue(result.getError() instanceof InvalidSyntaxException);
    assertTrue(result.getError().getRawMessage(),
        result.getError().getRawMessage().startsWith(
                                "Expression nested too deeply"));
    assertEquals("Reported at the first '(' past the limit",
                 21 + Parser.MAX_NESTING, result.getError().getColumn());
  }

  @Test
  public void testDeepStatementsFail() {
    String src = "int main() { " + StringUtils.repeat("if (1) ", 20000) +
                 "return 1; }";
    StageResult<FunctionDecl> result = frontEnd.compile(src);
    assertFalse(result.isSuccess());
    assertTrue(result.getError() instanceof InvalidSyntaxException);
    assertTrue(result.getError().getRawMessage(),
        result.getError().getRawMessage().startsWith(
                                "Statement nested too deeply"));
  }

  @Test
  public void testDeepBlocksFail() {
    String src = "int main() { " + StringUtils.repeat("{", 20000) +
                 StringUtils.repeat("}", 20000) + " return 0; }";
    StageResult<FunctionDecl> result = frontEnd.compile(src);
    assertFalse(result.isSuccess());
    assertTrue(result.getError() instanceof InvalidSyntaxException);
  }
}
