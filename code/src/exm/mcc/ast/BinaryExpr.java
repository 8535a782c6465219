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

import com.google.common.base.Preconditions;

/**
 * left operator right.  Operands are exclusively owned by this node.
 */
public class BinaryExpr extends Expression {
  private final Expression left;
  private final OperatorKind operator;
  private final Expression right;

  public BinaryExpr(Expression left, OperatorKind operator,
                    Expression right) {
    this.left = Preconditions.checkNotNull(left);
    this.operator = Preconditions.checkNotNull(operator);
    this.right = Preconditions.checkNotNull(right);
  }

  public Expression getLeft() {
    return left;
  }

  public OperatorKind getOperator() {
    return operator;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public <T, E extends Exception> T accept(ExprVisitor<T, E> visitor)
      throws E {
    return visitor.visitBinary(this);
  }

  @Override
  public int hashCode() {
    return (left.hashCode() * 31 + operator.hashCode()) * 31
            + right.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BinaryExpr)) {
      return false;
    }
    BinaryExpr other = (BinaryExpr) obj;
    return operator == other.operator && left.equals(other.left)
        && right.equals(other.right);
  }

  @Override
  public String toString() {
    return "(" + operator.symbol() + " " + left + " " + right + ")";
  }
}
