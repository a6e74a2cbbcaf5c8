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

package exm.pylower.common;

import java.io.IOException;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.Sets;

import exm.pylower.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String PYLOWER_LOGGER_NAME = "exm.pylower";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted, keyed by level and text.  Shared by
   * concurrent lowering passes.
   */
  static final Set<String> emitted = Sets.newConcurrentHashSet();

  public static Logger getPyLowerLogger()
  {
    return Logger.getLogger(PYLOWER_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the pylower logger if a log file is given.
   * Without a log file the logger keeps whatever log4j.properties set up.
   * @param logfile path of log file, or empty for none
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the pylower logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                         throws InvalidOptionException
  {
    Logger logger = getPyLowerLogger();
    if (StringUtils.isEmpty(logfile)) {
      // Even if logging is disabled, this must be valid:
      return logger;
    }

    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile, false);
      logger.addAppender(appender);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file \"" +
                                       logfile + "\": " + e.getMessage());
    }
    logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
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
      getPyLowerLogger().warn(msg);
    else
      getPyLowerLogger().debug("Duplicate Warning: " + msg);
  }
}
