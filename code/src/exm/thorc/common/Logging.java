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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.thorc.common.exceptions.InvalidOptionException;
import exm.thorc.common.util.Pair;

public class Logging
{
  private static final String THORC_LOGGER_NAME = "exm.thorc";

  private static final String FILE_PATTERN = "%-5p %c{1} - %m%n";
  private static final String CONSOLE_PATTERN = "thorc %p: %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getThorLogger()
  {
    return Logger.getLogger(THORC_LOGGER_NAME);
  }

  /**
   * Configure log4j for the compiler.  Safe to call more than once:
   * previously attached appenders are replaced.
   * @param logfile if non-empty, log DEBUG (or TRACE) and up to this file.
   *                Otherwise only warnings reach stderr.
   * @param trace
   * @return the compiler's logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                      throws InvalidOptionException
  {
    Logger thorLogger = getThorLogger();
    thorLogger.removeAllAppenders();
    thorLogger.setAdditivity(false);

    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        thorLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      thorLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender appender = new ConsoleAppender(
          new PatternLayout(CONSOLE_PATTERN), ConsoleAppender.SYSTEM_ERR);
      thorLogger.addAppender(appender);
      thorLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return thorLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getThorLogger().warn(msg);
    else
      getThorLogger().debug("Duplicate Warning: " + msg);
  }
}
