package exm.mcc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.mcc.common.Logging;

/**
 * Helper functions to augment log messages with the source location
 * and an indent matching nesting depth.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getMCCLogger();

  public static void debug(String location, int indent, String msg) {
    log(indent, Level.DEBUG, location, msg);
  }

  public static void trace(String location, int indent, String msg) {
    log(indent, Level.TRACE, location, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, "", msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    if (location.length() > 0) {
      sb.append(location);
      sb.append(' ');
    }
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
