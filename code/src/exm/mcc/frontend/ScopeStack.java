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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.mcc.common.exceptions.MCCRuntimeError;

/**
 * Nested lexical scopes, kept as a stack of frames.  Each frame maps
 * variable name to whether it is initialized.  The frame below a frame
 * is its parent: lookups walk from the top of the stack downwards and
 * stop at the first frame containing the name.
 *
 * Scopes are strictly nested, so a frame is discarded by popping it.
 */
public class ScopeStack {

  private final List<Map<String, Boolean>> frames =
                  new ArrayList<Map<String, Boolean>>();

  /**
   * Open a child scope of the current scope
   */
  public void push() {
    frames.add(new LinkedHashMap<String, Boolean>());
  }

  /**
   * Close the current scope, returning to its parent
   */
  public void pop() {
    if (frames.isEmpty()) {
      throw new MCCRuntimeError("Popped empty scope stack");
    }
    frames.remove(frames.size() - 1);
  }

  /**
   * @return number of open scopes
   */
  public int size() {
    return frames.size();
  }

  private Map<String, Boolean> top() {
    if (frames.isEmpty()) {
      throw new MCCRuntimeError("No open scope");
    }
    return frames.get(frames.size() - 1);
  }

  /**
   * Declare an uninitialized variable in the current scope.  Names in
   * enclosing scopes may be shadowed.
   * @return false if the name is already declared in the current scope
   */
  public boolean declare(String name) {
    Map<String, Boolean> scope = top();
    if (scope.containsKey(name)) {
      return false;
    }
    scope.put(name, false);
    return true;
  }

  /**
   * @return the depth at which the name is defined: 0 for the current
   *         scope, 1 for its parent, etc.  -1 if not declared anywhere
   */
  public int getDepth(String name) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      if (frames.get(i).containsKey(name)) {
        return frames.size() - 1 - i;
      }
    }
    return -1;
  }

  public boolean isDeclared(String name) {
    return getDepth(name) >= 0;
  }

  /**
   * @return initialized flag in the innermost scope declaring the name,
   *         false if not declared
   */
  public boolean isInitialized(String name) {
    int depth = getDepth(name);
    if (depth < 0) {
      return false;
    }
    return frameAtDepth(depth).get(name);
  }

  /**
   * Mark a variable initialized.  The flag is set in the scope that
   * owns the name, which may be an enclosing scope.
   * @return false if the name is not declared anywhere
   */
  public boolean initialize(String name) {
    int depth = getDepth(name);
    if (depth < 0) {
      return false;
    }
    frameAtDepth(depth).put(name, true);
    return true;
  }

  private Map<String, Boolean> frameAtDepth(int depth) {
    return frames.get(frames.size() - 1 - depth);
  }

  @Override
  public String toString() {
    return frames.toString();
  }
}
