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
package exm.mcc.ast;

import java.util.EnumMap;
import java.util.Map;

import exm.mcc.lexer.TokenKind;

/**
 * Binary operators that may appear in a BinaryExpr.
 */
public enum OperatorKind {
  ADD(TokenKind.PLUS),
  SUBTRACT(TokenKind.MINUS),
  MULTIPLY(TokenKind.MULTIPLY),
  DIVIDE(TokenKind.DIVIDE),
  EQUAL(TokenKind.EQUAL),
  NOT_EQUAL(TokenKind.NOT_EQUAL),
  LESS(TokenKind.LESS),
  LESS_EQUAL(TokenKind.LESS_EQUAL),
  GREATER(TokenKind.GREATER),
  GREATER_EQUAL(TokenKind.GREATER_EQUAL);

  private final TokenKind token;

  private OperatorKind(TokenKind token) {
    this.token = token;
  }

  /** Source spelling, e.g. "<=" */
  public String symbol() {
    return token.text();
  }

  private static final Map<TokenKind, OperatorKind> byToken =
      new EnumMap<TokenKind, OperatorKind>(TokenKind.class);

  static {
    for (OperatorKind op: values()) {
      byToken.put(op.token, op);
    }
  }

  /**
   * @return operator for the token kind, or null if it isn't a binary
   *         operator
   */
  public static OperatorKind fromToken(TokenKind kind) {
    return byToken.get(kind);
  }
}
