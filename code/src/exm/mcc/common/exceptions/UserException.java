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
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  /** Source file name, or null if unknown */
  private final String file;

  /** 1-based line, or 0 if unknown */
  private final int line;

  /** 1-based column, or 0 if unknown */
  private final int col;

  /** Message without the location prefix */
  private final String rawMessage;

  public UserException(String file, int line, int col, String message) {
    super(buildLocation(file, line, col) + message);
    this.file = file;
    this.line = line;
    this.col = col;
    this.rawMessage = message;
  }

  public UserException(String message) {
    this(null, 0, 0, message);
  }

  /**
   * Location prefix in the usual compiler format, e.g. "foo.c:3:7: "
   */
  public static String buildLocation(String file, int line, int col) {
    if (line <= 0) {
      return file == null ? "" : file + ": ";
    }
    return (file == null ? "" : file + ":") + line + ":" +
           (col > 0 ? col + ":" : "") + " ";
  }

  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return col;
  }

  public String getRawMessage() {
    return rawMessage;
  }

  private static final long serialVersionUID = 1L;
}
