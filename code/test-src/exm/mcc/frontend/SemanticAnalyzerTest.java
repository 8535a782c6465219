package exm.mcc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.mcc.ast.BinaryExpr;
import exm.mcc.ast.Block;
import exm.mcc.ast.Expression;
import exm.mcc.ast.FunctionDecl;
import exm.mcc.ast.Identifier;
import exm.mcc.ast.NumberLiteral;
import exm.mcc.ast.OperatorKind;
import exm.mcc.ast.Return;
import exm.mcc.ast.SourcePos;
import exm.mcc.ast.Statement;
import exm.mcc.ast.VarDecl;
import exm.mcc.common.Logging;
import exm.mcc.common.exceptions.SemanticException;
import exm.mcc.common.exceptions.SemanticException.Kind;
import exm.mcc.common.exceptions.UserException;
import exm.mcc.lexer.Lexer;

public class SemanticAnalyzerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/SemanticAnalyzerTest.mcc.log", true);
  }

  private static FunctionDecl parse(String source) throws UserException {
    return new Parser(new Lexer(source).tokenize()).parseFunction();
  }

  private static void analyze(String source) throws UserException {
    new SemanticAnalyzer().analyze(parse(source));
  }

  /**
   * Check that analysis fails with expected kind and variable
   * @return the error for further checks
   */
  private static SemanticException expectError(String source, Kind kind,
                                    String varName) throws UserException {
    FunctionDecl fn = parse(source);
    try {
      new SemanticAnalyzer().analyze(fn);
    } catch (SemanticException e) {
      assertEquals(e.getMessage(), kind, e.getKind());
      assertEquals(varName, e.getVarName());
      return e;
    }
    fail("Expected " + kind + " for " + varName);
    return null;
  }

  @Test
  public void testValidProgram() throws UserException {
    analyze("int main() {\n" +
            "  int x = 42;\n" +
            "  if (x > 0) {\n" +
            "    return x * 2;\n" +
            "  }\n" +
            "  return 0;\n" +
            "}");
  }

  @Test
  public void testUndeclared() throws UserException {
    SemanticException e = expectError("int main(){ return y; }",
                                      Kind.UNDECLARED_VARIABLE, "y");
    assertEquals(1, e.getLine());
    assertEquals(20, e.getColumn());
    assertEquals("<input>:1:20: Use of undeclared variable 'y'",
                 e.getMessage());
  }

  @Test
  public void testThenScopeDoesNotLeak() throws UserException {
    expectError("int main(){ int x = 1; if (x > 0) { int y = 2; } return y; }",
                Kind.UNDECLARED_VARIABLE, "y");
  }

  @Test
  public void testUnbracedThenScopeDoesNotLeak() throws UserException {
    expectError("int main(){ if (1) int y = 2; return y; }",
                Kind.UNDECLARED_VARIABLE, "y");
  }

  @Test
  public void testElseScopeIsSibling() throws UserException {
    expectError("int main(){ if (1) int a = 1; else return a; return 0; }",
                Kind.UNDECLARED_VARIABLE, "a");

    analyze("int main(){ if (1) int a = 1; else int a = 2; return 0; }");
  }

  @Test
  public void testRedeclaration() throws UserException {
    SemanticException e = expectError(
        "int main(){ int x = 1; int x = 2; return x; }",
        Kind.DUPLICATE_DECLARATION, "x");
    assertEquals("Position of second declaration", 28, e.getColumn());
  }

  @Test
  public void testRedeclarationInNestedBlock() throws UserException {
    expectError("int main(){ { int x = 1; int x = 2; } return 0; }",
                Kind.DUPLICATE_DECLARATION, "x");
  }

  @Test
  public void testShadowing() throws UserException {
    analyze("int main(){ int x = 1; if (x > 0) { int x = 2; return x; } " +
            "return x; }");
    analyze("int main(){ int x = 1; { int x = x + 1; return x; } }");
  }

  @Test
  public void testSelfReferenceInInitializer() throws UserException {
    SemanticException e = expectError("int main(){ int x = x + 1; return x; }",
                Kind.UNINITIALIZED_VARIABLE, "x");
    assertEquals("<input>:1:21: Use of uninitialized variable 'x'",
                 e.getMessage());
  }

  @Test
  public void testFirstErrorWins() throws UserException {
    expectError("int main(){ return a + b; }",
                Kind.UNDECLARED_VARIABLE, "a");
    expectError("int main(){ int a = 1; if (b) { int a = 2; int a = 3; } " +
                "return c; }", Kind.UNDECLARED_VARIABLE, "b");
    expectError("int main(){ int a = 1; if (a) { int a = 2; int a = 3; } " +
                "return c; }", Kind.DUPLICATE_DECLARATION, "a");
  }

  @Test
  public void testCodeAfterReturnNotFlagged() throws UserException {
    analyze("int main(){ return 0; int z = 1; return z; }");
  }

  @Test
  public void testDeclaredInFunctionScopeVisibleInNestedBlocks()
      throws UserException {
    analyze("int main(){ int a = 1; { { if (a) { return a; } } } return a; }");
  }

  @Test
  public void testParameters() throws UserException {
    Block body = new Block(Arrays.<Statement>asList(new Return(
        new BinaryExpr(new Identifier("p"), OperatorKind.ADD,
                       new Identifier("q")))));
    new SemanticAnalyzer().analyze(
        new FunctionDecl("f", Arrays.asList("p", "q"), body));
  }

  @Test
  public void testDuplicateParameter() {
    Block body = new Block(Arrays.<Statement>asList(
                      new Return(new Identifier("p"))));
    try {
      SemanticAnalyzer.analyze("prog.c",
          new FunctionDecl("f", Arrays.asList("p", "p"), body));
      fail("Expected duplicate parameter error");
    } catch (SemanticException e) {
      assertEquals(Kind.DUPLICATE_DECLARATION, e.getKind());
      assertEquals("p", e.getVarName());
      assertEquals("prog.c", e.getFile());
    }
  }

  @Test
  public void testAnalyzerReusable() throws UserException {
    SemanticAnalyzer analyzer = new SemanticAnalyzer();
    analyzer.analyze(parse("int main(){ int x = 1; return x; }"));
    analyzer.analyze(parse("int main(){ int x = 2; return x; }"));
  }

  /**
   * Left-leaning chain p + p + ... with the given operand names, each
   * placed at its index as the column
   */
  private static Expression chain(String... names) {
    Expression expr = new Identifier(names[0], new SourcePos(1, 1));
    for (int i = 1; i < names.length; i++) {
      expr = new BinaryExpr(expr, OperatorKind.ADD,
                  new Identifier(names[i], new SourcePos(1, i + 1)));
    }
    return expr;
  }

  private static FunctionDecl returning(Expression value) {
    return new FunctionDecl("main", Arrays.<String>asList(),
        new Block(Arrays.<Statement>asList(
            new VarDecl("p", new NumberLiteral(1)), new Return(value))));
  }

  private static String[] repeated(String name, int count) {
    String[] names = new String[count];
    Arrays.fill(names, name);
    return names;
  }

  @Test
  public void testLongOperatorChain() throws UserException {
    new SemanticAnalyzer().analyze(returning(chain(repeated("p", 100000))));
  }

  @Test
  public void testLongOperatorChainVisitsLeftToRight() {
    String[] names = repeated("p", 100000);
    names[70000] = "late";
    names[40000] = "early";
    names[99999] = "last";
    try {
      new SemanticAnalyzer().analyze(returning(chain(names)));
      fail("Expected undeclared variable");
    } catch (SemanticException e) {
      assertEquals(Kind.UNDECLARED_VARIABLE, e.getKind());
      assertEquals("early", e.getVarName());
      assertEquals(40001, e.getColumn());
    }
  }
}
