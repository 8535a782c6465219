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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Closed set of token kinds produced by the lexer.
 */
public enum TokenKind {
  // Keywords
  INT("int"),
  FLOAT("float"),
  IF("if"),
  ELSE("else"),
  WHILE("while"),
  RETURN("return"),

  // Operators
  PLUS("+"),
  MINUS("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  ASSIGN("="),
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS("<"),
  GREATER(">"),
  LESS_EQUAL("<="),
  GREATER_EQUAL(">="),

  // Punctuation
  LPAREN("("),
  RPAREN(")"),
  LBRACE("{"),
  RBRACE("}"),
  SEMICOLON(";"),

  IDENTIFIER(null),
  NUMBER(null),
  /** Always the last token; also returned when reading past the end */
  EOF(null);

  /** Fixed spelling, or null if the text varies */
  private final String text;

  private TokenKind(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public boolean isKeyword() {
    return KEYWORDS.containsValue(this);
  }

  private static final Map<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
        .put(INT.text, INT)
        .put(FLOAT.text, FLOAT)
        .put(IF.text, IF)
        .put(ELSE.text, ELSE)
        .put(WHILE.text, WHILE)
        .put(RETURN.text, RETURN)
        .build();

  /**
   * @param word a complete identifier-like word
   * @return keyword kind if word is reserved, otherwise null
   */
  public static TokenKind lookupKeyword(String word) {
    return KEYWORDS.get(word);
  }

  /**
   * Human readable description for use in messages, e.g. "'>='"
   */
  public String describe() {
    if (text != null) {
      return "'" + text + "'";
    }
    switch (this) {
      case IDENTIFIER:
        return "identifier";
      case NUMBER:
        return "number";
      default:
        return "end of input";
    }
  }
}
