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

package exm.thorc.common.exceptions;

import exm.thorc.ast.FilePosition;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final String file;
  private final int line;
  private final int column;
  private final String rawMessage;

  public UserException(FilePosition pos, String message)
  {
    this(pos.file, pos.line, pos.column, message);
  }

  public UserException(String file, int line, int col, String message) {
    super(formatMessage(file, line, col, message));
    this.file = file;
    this.line = line;
    this.column = col;
    this.rawMessage = message;
  }

  public UserException(String message) {
    super(message);
    this.file = null;
    this.line = 0;
    this.column = 0;
    this.rawMessage = message;
  }

  private static String formatMessage(String file, int line, int col,
                                      String message) {
    return file + ":" + line + ":" + (col > 0 ? col + ":" : "") +
          " " + message;
  }

  /** @return source file, or null if error is not tied to a file */
  public String getFile() {
    return file;
  }

  /** @return 1-based line, or 0 if unknown */
  public int getLine() {
    return line;
  }

  /** @return 1-based column, or 0 if unknown */
  public int getColumn() {
    return column;
  }

  /** @return message without position prefix */
  public String getRawMessage() {
    return rawMessage;
  }

  private static final long serialVersionUID = 1L;
}
