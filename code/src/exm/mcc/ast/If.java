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

public class If extends Statement {

  private final Expression condition;
  private final Statement thenBranch;
  /** null if no else */
  private final Statement elseBranch;

  public If(Expression condition, Statement thenBranch,
            Statement elseBranch) {
    this.condition = Preconditions.checkNotNull(condition);
    this.thenBranch = Preconditions.checkNotNull(thenBranch);
    this.elseBranch = elseBranch;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getThenBranch() {
    return thenBranch;
  }

  /**
   * @return else branch, or null if absent
   */
  public Statement getElseBranch() {
    return elseBranch;
  }

  public boolean hasElse() {
    return elseBranch != null;
  }

  @Override
  public <T, E extends Exception> T accept(StmtVisitor<T, E> visitor)
      throws E {
    return visitor.visitIf(this);
  }

  @Override
  public int hashCode() {
    int result = condition.hashCode() * 31 + thenBranch.hashCode();
    return result * 31 + (elseBranch == null ? 0 : elseBranch.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof If)) {
      return false;
    }
    If other = (If) obj;
    if (!condition.equals(other.condition) ||
        !thenBranch.equals(other.thenBranch)) {
      return false;
    }
    return elseBranch == null ? other.elseBranch == null
                              : elseBranch.equals(other.elseBranch);
  }

  @Override
  public String toString() {
    return "(if " + condition + " " + thenBranch +
           (elseBranch == null ? "" : " " + elseBranch) + ")";
  }
}
