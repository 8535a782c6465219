package exm.mcc.lexer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.mcc.common.Logging;
import exm.mcc.common.exceptions.LexException;

public class LexerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/LexerTest.mcc.log", true);
  }

  private static List<TokenKind> kinds(List<Token> tokens) {
    List<TokenKind> result = new ArrayList<TokenKind>();
    for (Token tok: tokens) {
      result.add(tok.getKind());
    }
    return result;
  }

  private static List<TokenKind> kinds(String source) throws LexException {
    return kinds(new Lexer(source).tokenize());
  }

  @Test
  public void testFunction() throws LexException {
    assertEquals(Arrays.asList(TokenKind.INT, TokenKind.IDENTIFIER,
          TokenKind.LPAREN, TokenKind.RPAREN, TokenKind.LBRACE,
          TokenKind.RETURN, TokenKind.NUMBER, TokenKind.SEMICOLON,
          TokenKind.RBRACE, TokenKind.EOF),
        kinds("int main() { return 0; }"));
  }

  @Test
  public void testEmptyInput() throws LexException {
    List<Token> tokens = new Lexer("").tokenize();
    assertEquals(1, tokens.size());
    assertEquals(new Token(TokenKind.EOF, "", 1, 1), tokens.get(0));
  }

  @Test
  public void testPositions() throws LexException {
    List<Token> tokens = new Lexer("int x\n  = 1;").tokenize();
    assertEquals(new Token(TokenKind.INT, "int", 1, 1), tokens.get(0));
    assertEquals(new Token(TokenKind.IDENTIFIER, "x", 1, 5), tokens.get(1));
    assertEquals("Column resets after newline",
        new Token(TokenKind.ASSIGN, "=", 2, 3), tokens.get(2));
    assertEquals(new Token(TokenKind.NUMBER, "1", 2, 5), tokens.get(3));
    assertEquals(new Token(TokenKind.SEMICOLON, ";", 2, 6), tokens.get(4));
    assertEquals("EOF at final cursor position",
        new Token(TokenKind.EOF, "", 2, 7), tokens.get(5));
  }

  @Test
  public void testTwoCharOperators() throws LexException {
    List<Token> tokens = new Lexer("x >= 1").tokenize();
    assertEquals("Three tokens plus EOF", 4, tokens.size());
    assertEquals(Arrays.asList(TokenKind.IDENTIFIER, TokenKind.GREATER_EQUAL,
                               TokenKind.NUMBER, TokenKind.EOF),
                 kinds(tokens));
    assertEquals(">=", tokens.get(1).getText());

    assertEquals(Arrays.asList(TokenKind.EQUAL, TokenKind.NOT_EQUAL,
          TokenKind.LESS_EQUAL, TokenKind.GREATER_EQUAL, TokenKind.LESS,
          TokenKind.GREATER, TokenKind.ASSIGN, TokenKind.EOF),
        kinds("== != <= >= < > ="));
  }

  @Test
  public void testAdjacentOperators() throws LexException {
    assertEquals("=== is == followed by =",
        Arrays.asList(TokenKind.EQUAL, TokenKind.ASSIGN, TokenKind.EOF),
        kinds("==="));
    assertEquals(Arrays.asList(TokenKind.IDENTIFIER, TokenKind.LESS,
          TokenKind.MINUS, TokenKind.NUMBER, TokenKind.EOF),
        kinds("a<-1"));
  }

  @Test
  public void testKeywords() throws LexException {
    assertEquals(Arrays.asList(TokenKind.INT, TokenKind.FLOAT, TokenKind.IF,
          TokenKind.ELSE, TokenKind.WHILE, TokenKind.RETURN, TokenKind.EOF),
        kinds("int float if else while return"));

    assertEquals("Keyword prefixes are identifiers",
        Arrays.asList(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER,
                      TokenKind.IDENTIFIER, TokenKind.EOF),
        kinds("integer _if while2"));
    assertTrue(TokenKind.WHILE.isKeyword());
    assertTrue(!TokenKind.IDENTIFIER.isKeyword());
  }

  @Test
  public void testNumbers() throws LexException {
    List<Token> tokens = new Lexer("3.14 007 1.2.3").tokenize();
    assertEquals(new Token(TokenKind.NUMBER, "3.14", 1, 1), tokens.get(0));
    assertEquals(new Token(TokenKind.NUMBER, "007", 1, 6), tokens.get(1));
    assertEquals("Malformed literal is a single token",
        new Token(TokenKind.NUMBER, "1.2.3", 1, 10), tokens.get(2));
  }

  @Test
  public void testNumberThenIdentifier() throws LexException {
    List<Token> tokens = new Lexer("12ab").tokenize();
    assertEquals(new Token(TokenKind.NUMBER, "12", 1, 1), tokens.get(0));
    assertEquals(new Token(TokenKind.IDENTIFIER, "ab", 1, 3), tokens.get(1));
  }

  @Test
  public void testDeterministic() throws LexException {
    String src = "int main() {\n  int x = 42;\n  if (x != 0) { return x; }\n}";
    assertEquals(new Lexer(src).tokenize(), new Lexer(src).tokenize());
  }

  @Test
  public void testBadCharacter() {
    try {
      new Lexer("int x = 1 @").tokenize();
      fail("Expected LexException");
    } catch (LexException e) {
      assertEquals('@', e.getOffendingChar());
      assertEquals(1, e.getLine());
      assertEquals(11, e.getColumn());
      assertEquals("<input>:1:11: Unexpected character: @", e.getMessage());
    }
  }

  @Test
  public void testLoneBang() {
    try {
      Lexer.tokenize("prog.c", "a\n ! b");
      fail("Expected LexException");
    } catch (LexException e) {
      assertEquals('!', e.getOffendingChar());
      assertEquals("prog.c", e.getFile());
      assertEquals(2, e.getLine());
      assertEquals(2, e.getColumn());
    }
  }

  @Test
  public void testTokenDumpFormat() throws LexException {
    Token tok = new Lexer("  foo").tokenize().get(0);
    assertEquals("Token: IDENTIFIER | Value: 'foo' | Line: 1 | Column: 3",
                 tok.toString());
  }
}
