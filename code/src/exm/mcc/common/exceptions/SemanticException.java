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

package exm.mcc.common.exceptions;

/**
 * Base class for errors found while checking variable declarations and
 * uses.  Each one names the variable at fault.
 */
public abstract class SemanticException extends UserException {

  public static enum Kind {
    DUPLICATE_DECLARATION,
    UNDECLARED_VARIABLE,
    UNINITIALIZED_VARIABLE,
  }

  private final String varName;

  protected SemanticException(String file, int line, int col,
                              String varName, String message) {
    super(file, line, col, message);
    this.varName = varName;
  }

  public abstract Kind getKind();

  public String getVarName() {
    return varName;
  }

  private static final long serialVersionUID = 1L;
}
