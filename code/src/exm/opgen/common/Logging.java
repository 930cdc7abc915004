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
package exm.opgen.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.opgen.common.exceptions.OpGenRuntimeError;

public class Logging
{
  private static final String OPGEN_LOGGER_NAME = "exm.opgen";

  private static final String CONSOLE_PATTERN = "opgen: %-5p %m%n";
  private static final String FILE_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getLogger()
  {
    return Logger.getLogger(OPGEN_LOGGER_NAME);
  }

  /**
   * Warnings go to stderr.  If logfile is non-empty, everything at DEBUG
   * (or TRACE, if requested) also goes to the file.
   * @param logfile may be null or empty
   * @param trace
   * @return the generator logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger logger = getLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    ConsoleAppender console =
        new ConsoleAppender(new PatternLayout(CONSOLE_PATTERN),
                            ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new OpGenRuntimeError("Could not open log file: " + logfile, e);
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getLogger().warn(msg);
    else
      getLogger().debug("Duplicate Warning: " + msg);
  }
}
