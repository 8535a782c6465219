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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The single top-level construct: int name(params) { body }
 */
public class FunctionDecl extends Statement {
  private final String name;
  private final ImmutableList<String> parameters;
  private final Block body;
  private final SourcePos pos;

  public FunctionDecl(String name, List<String> parameters, Block body,
                      SourcePos pos) {
    this.name = Preconditions.checkNotNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.body = Preconditions.checkNotNull(body);
    this.pos = Preconditions.checkNotNull(pos);
  }

  public FunctionDecl(String name, List<String> parameters, Block body) {
    this(name, parameters, body, SourcePos.UNKNOWN);
  }

  public String getName() {
    return name;
  }

  /**
   * @return parameter names in declaration order
   */
  public List<String> getParameters() {
    return parameters;
  }

  public Block getBody() {
    return body;
  }

  public SourcePos getPos() {
    return pos;
  }

  @Override
  public <T, E extends Exception> T accept(StmtVisitor<T, E> visitor)
      throws E {
    return visitor.visitFunction(this);
  }

  @Override
  public int hashCode() {
    return (name.hashCode() * 31 + parameters.hashCode()) * 31
            + body.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunctionDecl)) {
      return false;
    }
    FunctionDecl other = (FunctionDecl) obj;
    return name.equals(other.name) && parameters.equals(other.parameters)
        && body.equals(other.body);
  }

  @Override
  public String toString() {
    return "(function " + name + " " + parameters + " " + body + ")";
  }
}
