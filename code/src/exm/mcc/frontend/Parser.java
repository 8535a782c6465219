/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.mcc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import exm.mcc.ast.BinaryExpr;
import exm.mcc.ast.Block;
import exm.mcc.ast.Expression;
import exm.mcc.ast.FunctionDecl;
import exm.mcc.ast.Identifier;
import exm.mcc.ast.If;
import exm.mcc.ast.NumberLiteral;
import exm.mcc.ast.OperatorKind;
import exm.mcc.ast.Return;
import exm.mcc.ast.SourcePos;
import exm.mcc.ast.Statement;
import exm.mcc.ast.VarDecl;
import exm.mcc.common.exceptions.InvalidSyntaxException;
import exm.mcc.lexer.Lexer;
import exm.mcc.lexer.Token;
import exm.mcc.lexer.TokenKind;

/**
 * Recursive descent parser.  One method per grammar rule; expression
 * rules are layered by precedence, lowest first:
 *
 * <pre>
 * function   := 'int' IDENT '(' ')' block
 * block      := '{' statement* '}'
 * statement  := 'return' expression ';'
 *             | 'if' '(' expression ')' statement ('else' statement)?
 *             | 'int' IDENT '=' expression ';'
 *             | block
 * expression := comparison
 * comparison := term (('>'|'>='|'<'|'<='|'=='|'!=') term)*
 * term       := factor (('+'|'-') factor)*
 * factor     := primary (('*'|'/') primary)*
 * primary    := NUMBER | IDENT | '(' expression ')'
 * </pre>
 *
 * The parser never backtracks.  The first mismatch throws.
 *
 * Parenthesized expressions and nested statements are limited to
 * {@link #MAX_NESTING} levels so that deep input is reported as a
 * syntax error instead of overflowing the stack.
 */
public class Parser {

  /** Maximum depth of nested parentheses, and separately of statements */
  public static final int MAX_NESTING = 256;

  private static final TokenKind[] COMPARISON_OPS = {
    TokenKind.GREATER, TokenKind.GREATER_EQUAL, TokenKind.LESS,
    TokenKind.LESS_EQUAL, TokenKind.EQUAL, TokenKind.NOT_EQUAL,
  };

  private static final TokenKind[] TERM_OPS = {
    TokenKind.PLUS, TokenKind.MINUS,
  };

  private static final TokenKind[] FACTOR_OPS = {
    TokenKind.MULTIPLY, TokenKind.DIVIDE,
  };

  private final String inputFile;
  private final List<Token> tokens;

  /** Index of next unconsumed token */
  private int current = 0;

  /** Rule nesting depth, for trace output */
  private int depth = 0;

  private int statementNesting = 0;
  private int parenNesting = 0;

  /**
   * @param inputFile name used in error messages
   * @param tokens lexer output: must end with an EOF token
   */
  public Parser(String inputFile, List<Token> tokens) {
    Preconditions.checkArgument(!tokens.isEmpty() &&
        tokens.get(tokens.size() - 1).is(TokenKind.EOF),
        "Token list must end with EOF");
    this.inputFile = inputFile == null ? Lexer.DEFAULT_SOURCE_NAME
                                       : inputFile;
    this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
  }

  public Parser(List<Token> tokens) {
    this(Lexer.DEFAULT_SOURCE_NAME, tokens);
  }

  public static FunctionDecl parseFunction(String inputFile,
      List<Token> tokens) throws InvalidSyntaxException {
    return new Parser(inputFile, tokens).parseFunction();
  }

  /**
   * Entry point: the whole token list must be exactly one function.
   */
  public FunctionDecl parseFunction() throws InvalidSyntaxException {
    enter("function");
    consume(TokenKind.INT, "Expected 'int' before function declaration");
    Token name = consume(TokenKind.IDENTIFIER, "Expected function name");
    consume(TokenKind.LPAREN, "Expected '(' after function name");
    consume(TokenKind.RPAREN, "Expected ')' after parameters");
    Block body = block();
    consume(TokenKind.EOF, "Expected end of input after function");
    exit();
    return new FunctionDecl(name.getText(), Collections.<String>emptyList(),
                            body, posOf(name));
  }

  private Block block() throws InvalidSyntaxException {
    enter("block");
    consume(TokenKind.LBRACE, "Expected '{' before block");
    List<Statement> statements = new ArrayList<Statement>();
    while (!check(TokenKind.RBRACE) && !check(TokenKind.EOF)) {
      statements.add(statement());
    }
    consume(TokenKind.RBRACE, "Expected '}' after block");
    exit();
    return new Block(statements);
  }

  private Statement statement() throws InvalidSyntaxException {
    enter("statement");
    if (statementNesting >= MAX_NESTING) {
      throw error(peek(), "Statement nested too deeply");
    }
    statementNesting++;
    Statement result;
    if (match(TokenKind.RETURN)) {
      Expression value = expression();
      consume(TokenKind.SEMICOLON, "Expected ';' after return statement");
      result = new Return(value);
    } else if (match(TokenKind.IF)) {
      consume(TokenKind.LPAREN, "Expected '(' after 'if'");
      Expression condition = expression();
      consume(TokenKind.RPAREN, "Expected ')' after if condition");
      Statement thenBranch = statement();
      Statement elseBranch = null;
      if (match(TokenKind.ELSE)) {
        elseBranch = statement();
      }
      result = new If(condition, thenBranch, elseBranch);
    } else if (match(TokenKind.INT)) {
      Token name = consume(TokenKind.IDENTIFIER, "Expected variable name");
      consume(TokenKind.ASSIGN, "Expected '=' after variable name");
      Expression initializer = expression();
      consume(TokenKind.SEMICOLON,
              "Expected ';' after variable declaration");
      result = new VarDecl(name.getText(), initializer, posOf(name));
    } else if (check(TokenKind.LBRACE)) {
      result = block();
    } else {
      throw error(peek(), "Expected statement");
    }
    statementNesting--;
    exit();
    return result;
  }

  private Expression expression() throws InvalidSyntaxException {
    return comparison();
  }

  private Expression comparison() throws InvalidSyntaxException {
    Expression expr = term();
    while (matchAny(COMPARISON_OPS)) {
      OperatorKind op = OperatorKind.fromToken(previous().getKind());
      Expression right = term();
      expr = new BinaryExpr(expr, op, right);
    }
    return expr;
  }

  private Expression term() throws InvalidSyntaxException {
    Expression expr = factor();
    while (matchAny(TERM_OPS)) {
      OperatorKind op = OperatorKind.fromToken(previous().getKind());
      Expression right = factor();
      expr = new BinaryExpr(expr, op, right);
    }
    return expr;
  }

  private Expression factor() throws InvalidSyntaxException {
    Expression expr = primary();
    while (matchAny(FACTOR_OPS)) {
      OperatorKind op = OperatorKind.fromToken(previous().getKind());
      Expression right = primary();
      expr = new BinaryExpr(expr, op, right);
    }
    return expr;
  }

  private Expression primary() throws InvalidSyntaxException {
    if (match(TokenKind.NUMBER)) {
      return new NumberLiteral(parseNumber(previous()));
    } else if (match(TokenKind.IDENTIFIER)) {
      Token id = previous();
      return new Identifier(id.getText(), posOf(id));
    } else if (match(TokenKind.LPAREN)) {
      if (parenNesting >= MAX_NESTING) {
        throw error(previous(), "Expression nested too deeply");
      }
      parenNesting++;
      Expression expr = expression();
      consume(TokenKind.RPAREN, "Expected ')' after expression");
      parenNesting--;
      return expr;
    }
    throw error(peek(), "Expected expression");
  }

  private double parseNumber(Token tok) throws InvalidSyntaxException {
    try {
      return Double.parseDouble(tok.getText());
    } catch (NumberFormatException e) {
      throw error(tok, "Invalid number literal '" + tok.getText() + "'");
    }
  }

  /**
   * @return current token, or the EOF token if past the end
   */
  private Token peek() {
    if (current >= tokens.size()) {
      return tokens.get(tokens.size() - 1);
    }
    return tokens.get(current);
  }

  private Token previous() {
    return tokens.get(current - 1);
  }

  private Token advance() {
    Token tok = peek();
    if (current < tokens.size()) {
      current++;
    }
    return tok;
  }

  private boolean check(TokenKind kind) {
    return peek().is(kind);
  }

  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean matchAny(TokenKind[] kinds) {
    for (TokenKind kind: kinds) {
      if (match(kind)) {
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenKind kind, String message)
      throws InvalidSyntaxException {
    if (check(kind)) {
      return advance();
    }
    throw error(peek(), message);
  }

  private InvalidSyntaxException error(Token tok, String message) {
    return new InvalidSyntaxException(inputFile, tok.getLine(),
          tok.getColumn(), message + ", found " + describe(tok));
  }

  private static String describe(Token tok) {
    if (tok.is(TokenKind.EOF)) {
      return TokenKind.EOF.describe();
    } else if (tok.is(TokenKind.IDENTIFIER) || tok.is(TokenKind.NUMBER)) {
      return tok.getKind().describe() + " '" + tok.getText() + "'";
    } else {
      return tok.getKind().describe();
    }
  }

  private static SourcePos posOf(Token tok) {
    return new SourcePos(tok.getLine(), tok.getColumn());
  }

  private void enter(String rule) {
    if (LogHelper.isTraceEnabled()) {
      Token tok = peek();
      LogHelper.trace(inputFile + ":" + tok.getLine() + ":" + tok.getColumn(),
                      depth * 2, rule);
    }
    depth++;
  }

  private void exit() {
    depth--;
  }
}
