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
package exm.mcc.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.mcc.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String MCC_LOGGER_NAME = "exm.mcc";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  public static Logger getMCCLogger() {
    return Logger.getLogger(MCC_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  Any appenders from a previous call
   * are removed first, so this can be called more than once.
   * @param logfile file to log to, or null/empty to log warnings to stderr
   * @param trace if true, log at TRACE level to the file
   * @return the configured logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger mccLogger = getMCCLogger();
    mccLogger.removeAllAppenders();
    mccLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        mccLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \""
                      + logfile + "\": " + e.getMessage());
      }
      mccLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender appender = new ConsoleAppender(layout,
                                          ConsoleAppender.SYSTEM_ERR);
      mccLogger.addAppender(appender);
      mccLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    return mccLogger;
  }
}
