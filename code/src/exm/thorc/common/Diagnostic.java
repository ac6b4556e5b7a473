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
package exm.thorc.common;

import exm.thorc.ast.FilePosition;
import exm.thorc.common.exceptions.UserException;

/**
 * A message for the user about a location in the source.
 * Immutable.
 */
public class Diagnostic {
  public static enum Severity {
    WARNING,
    ERROR;
  }

  public final Severity severity;
  /** null if not tied to a file */
  public final String file;
  public final int line;
  public final int column;
  public final String message;

  public Diagnostic(Severity severity, String file, int line, int column,
                    String message) {
    this.severity = severity;
    this.file = file;
    this.line = line;
    this.column = column;
    this.message = message;
  }

  public static Diagnostic warning(FilePosition pos, String message) {
    return new Diagnostic(Severity.WARNING, pos.file, pos.line, pos.column,
                          message);
  }

  public static Diagnostic error(UserException e) {
    return new Diagnostic(Severity.ERROR, e.getFile(), e.getLine(),
                          e.getColumn(), e.getRawMessage());
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (file != null) {
      sb.append(file);
      sb.append(':');
      sb.append(line);
      sb.append(':');
      if (column > 0) {
        sb.append(column);
        sb.append(':');
      }
      sb.append(' ');
    }
    sb.append(severity == Severity.ERROR ? "error: " : "warning: ");
    sb.append(message);
    return sb.toString();
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = severity.hashCode();
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + line;
    result = prime * result + column;
    result = prime * result + message.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Diagnostic))
      return false;
    Diagnostic other = (Diagnostic) obj;
    if (file == null) {
      if (other.file != null)
        return false;
    } else if (!file.equals(other.file)) {
      return false;
    }
    return severity == other.severity && line == other.line &&
           column == other.column && message.equals(other.message);
  }
}
