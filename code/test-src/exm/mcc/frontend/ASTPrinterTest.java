package exm.mcc.frontend;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.mcc.ast.Block;
import exm.mcc.ast.FunctionDecl;
import exm.mcc.ast.NumberLiteral;
import exm.mcc.ast.Return;
import exm.mcc.ast.Statement;
import exm.mcc.common.exceptions.UserException;
import exm.mcc.lexer.Lexer;

public class ASTPrinterTest {

  private static FunctionDecl parse(String source) throws UserException {
    return new Parser(new Lexer(source).tokenize()).parseFunction();
  }

  @Test
  public void testPrintTree() throws UserException {
    FunctionDecl fn = parse("int main() {\n" +
        "  int x = 42;\n" +
        "  if (x > 0) {\n" +
        "    return x * 2;\n" +
        "  } else return 0.5;\n" +
        "}");
    String expected =
        "FunctionDecl main\n" +
        "  Block\n" +
        "    VarDecl x\n" +
        "      Number 42\n" +
        "    If\n" +
        "      Condition:\n" +
        "        BinaryExpr >\n" +
        "          Identifier x\n" +
        "          Number 0\n" +
        "      Then:\n" +
        "        Block\n" +
        "          Return\n" +
        "            BinaryExpr *\n" +
        "              Identifier x\n" +
        "              Number 2\n" +
        "      Else:\n" +
        "        Return\n" +
        "          Number 0.5\n";
    assertEquals(expected, ASTPrinter.print(fn));
  }

  @Test
  public void testPrintParameters() {
    FunctionDecl fn = new FunctionDecl("f", Arrays.asList("a", "b"),
        new Block(Arrays.<Statement>asList(
            new Return(new NumberLiteral(1)))));
    assertEquals("FunctionDecl f (a, b)\n" +
                 "  Block\n" +
                 "    Return\n" +
                 "      Number 1\n", ASTPrinter.print(fn));
  }
}
