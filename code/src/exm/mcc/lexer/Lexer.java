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
package exm.mcc.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.CharUtils;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.mcc.common.Logging;
import exm.mcc.common.exceptions.LexException;

/**
 * Converts source text into tokens.  A single cursor moves forward one
 * character at a time, tracking 1-based line and column.
 *
 * Lexer instances are single-use: create one per source text.
 */
public class Lexer {

  /** Name used in error messages when the text has no file */
  public static final String DEFAULT_SOURCE_NAME = "<input>";

  private final Logger logger = Logging.getMCCLogger();

  private final String inputFile;
  private final String input;

  private int position = 0;
  private int line = 1;
  private int column = 1;

  public Lexer(String inputFile, String input) {
    Preconditions.checkNotNull(input);
    this.inputFile = inputFile == null ? DEFAULT_SOURCE_NAME : inputFile;
    this.input = input;
  }

  public Lexer(String input) {
    this(DEFAULT_SOURCE_NAME, input);
  }

  /**
   * Convenience for new Lexer(source).tokenize()
   */
  public static List<Token> tokenize(String inputFile, String source)
      throws LexException {
    return new Lexer(inputFile, source).tokenize();
  }

  /**
   * Tokenize the entire input.
   * @return unmodifiable list ending with exactly one EOF token
   * @throws LexException on the first character that can't start a token
   */
  public List<Token> tokenize() throws LexException {
    List<Token> tokens = new ArrayList<Token>();
    Token tok;
    do {
      tok = nextToken();
      tokens.add(tok);
      if (logger.isTraceEnabled()) {
        logger.trace(tok);
      }
    } while (!tok.is(TokenKind.EOF));

    logger.debug("Lexed " + tokens.size() + " tokens from " + inputFile);
    return Collections.unmodifiableList(tokens);
  }

  private Token nextToken() throws LexException {
    skipWhitespace();

    if (atEnd()) {
      return new Token(TokenKind.EOF, "", line, column);
    }

    char c = peek();
    if (CharUtils.isAsciiNumeric(c)) {
      return readNumber();
    } else if (isIdentStart(c)) {
      return readWord();
    } else {
      return readOperator();
    }
  }

  /**
   * Digits and decimal points.  Malformed text such as 1.2.3 is
   * accepted here; the parser rejects it when converting the value.
   */
  private Token readNumber() {
    int startLine = line;
    int startCol = column;
    StringBuilder sb = new StringBuilder();
    while (!atEnd() && (CharUtils.isAsciiNumeric(peek()) || peek() == '.')) {
      sb.append(advance());
    }
    return new Token(TokenKind.NUMBER, sb.toString(), startLine, startCol);
  }

  private Token readWord() {
    int startLine = line;
    int startCol = column;
    StringBuilder sb = new StringBuilder();
    while (!atEnd() && isIdentChar(peek())) {
      sb.append(advance());
    }
    String word = sb.toString();
    TokenKind keyword = TokenKind.lookupKeyword(word);
    TokenKind kind = keyword != null ? keyword : TokenKind.IDENTIFIER;
    return new Token(kind, word, startLine, startCol);
  }

  private Token readOperator() throws LexException {
    int startLine = line;
    int startCol = column;
    char c = advance();
    TokenKind kind;
    switch (c) {
      case '+':
        kind = TokenKind.PLUS;
        break;
      case '-':
        kind = TokenKind.MINUS;
        break;
      case '*':
        kind = TokenKind.MULTIPLY;
        break;
      case '/':
        kind = TokenKind.DIVIDE;
        break;
      case '(':
        kind = TokenKind.LPAREN;
        break;
      case ')':
        kind = TokenKind.RPAREN;
        break;
      case '{':
        kind = TokenKind.LBRACE;
        break;
      case '}':
        kind = TokenKind.RBRACE;
        break;
      case ';':
        kind = TokenKind.SEMICOLON;
        break;
      // One character of lookahead for two-character operators
      case '=':
        kind = matchNext('=') ? TokenKind.EQUAL : TokenKind.ASSIGN;
        break;
      case '<':
        kind = matchNext('=') ? TokenKind.LESS_EQUAL : TokenKind.LESS;
        break;
      case '>':
        kind = matchNext('=') ? TokenKind.GREATER_EQUAL : TokenKind.GREATER;
        break;
      case '!':
        if (matchNext('=')) {
          kind = TokenKind.NOT_EQUAL;
          break;
        }
        throw new LexException(inputFile, startLine, startCol, c);
      default:
        throw new LexException(inputFile, startLine, startCol, c);
    }
    return new Token(kind, kind.text(), startLine, startCol);
  }

  private boolean matchNext(char expected) {
    if (!atEnd() && peek() == expected) {
      advance();
      return true;
    }
    return false;
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(peek())) {
      advance();
    }
  }

  private boolean atEnd() {
    return position >= input.length();
  }

  private char peek() {
    return input.charAt(position);
  }

  private char advance() {
    char c = input.charAt(position++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private static boolean isIdentStart(char c) {
    return CharUtils.isAsciiAlpha(c) || c == '_';
  }

  private static boolean isIdentChar(char c) {
    return CharUtils.isAsciiAlphanumeric(c) || c == '_';
  }
}
