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
package exm.sfc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.sfc.ast.SourceLocation;
import exm.sfc.common.Logging;

/**
 * Logging helpers for compiler passes: indented output and messages
 * prefixed with a source location
 */
public class LogHelper {

  private static final Logger logger = Logging.getSFCLogger();

  /**
     INFO-level with indentation for nice output
   */
  public static void info(int indent, String msg) {
    log(indent, Level.INFO, msg);
  }

  /**
    WARN-level with source location
   */
  public static void warn(SourceLocation loc, String msg) {
    log(0, Level.WARN, loc.toString() + ": ", msg);
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, msg);
  }

  public static void debug(SourceLocation loc, String msg) {
    log(0, Level.DEBUG, loc.toString() + ": ", msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static void log(int indent, Level level, String msg) {
    log(indent, level, "", msg);
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
