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
package exm.thorc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.thorc.ast.FilePosition;
import exm.thorc.common.Logging;

/**
 * Logging with source positions and indentation for nested output
 */
public class LogHelper {
  static final Logger logger = Logging.getThorLogger();

  public static void debug(FilePosition pos, String msg) {
    log(0, Level.DEBUG, pos, msg);
  }

  public static void trace(FilePosition pos, String msg) {
    log(0, Level.TRACE, pos, msg);
  }

  public static void warn(FilePosition pos, String msg) {
    log(0, Level.WARN, pos, msg);
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, null, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, null, msg);
  }

  public static void log(int indent, Level level, FilePosition pos,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    if (pos != null) {
      sb.append(pos.toString());
      sb.append(": ");
    }
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
