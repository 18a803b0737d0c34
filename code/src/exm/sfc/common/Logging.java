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
package exm.sfc.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sfc.common.exceptions.InvalidOptionException;
import exm.sfc.common.util.Pair;

public class Logging {
  private static final String SFC_LOGGER_NAME = "exm.sfc";

  private static final String CONSOLE_PATTERN = "%-5p %m%n";
  private static final String FILE_PATTERN = "%d{HH:mm:ss.SSS} %-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getSFCLogger() {
    return Logger.getLogger(SFC_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.  Warnings and above always go to stderr;
   * a log file, if given, gets everything at the selected level.
   * @param logfile log file name, or empty/null for none
   * @param verbose log at DEBUG rather than INFO
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean verbose)
                                        throws InvalidOptionException {
    Logger logger = getSFCLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);
    logger.setLevel(verbose ? Level.DEBUG : Level.INFO);

    ConsoleAppender console = new ConsoleAppender(
                          new PatternLayout(CONSOLE_PATTERN),
                          ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(verbose ? Level.DEBUG : Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        logger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \"" +
                                          logfile + "\": " + e.getMessage());
      }
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    synchronized (emitted) {
      return emitted.add(Pair.create(level, msg));
    }
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getSFCLogger().warn(msg);
    } else {
      Logging.getSFCLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
