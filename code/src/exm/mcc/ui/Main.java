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

package exm.mcc.ui;

import java.io.File;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.mcc.common.Logging;
import exm.mcc.common.Settings;
import exm.mcc.common.exceptions.InvalidOptionException;
import exm.mcc.common.exceptions.MCCFatal;

/**
 * Command line interface to MCC.  Options may also be passed
 * indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String TOKENS_FLAG = "t";
  private static final String AST_FLAG = "a";
  private static final String LOG_FILE_FLAG = "l";
  private static final String TRACE_FLAG = "T";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    try {
      Settings.initMCCProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args mccArgs = processArgs(args);
    recordArgValues(mccArgs);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File input = new File(mccArgs.inputFilename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }

    try {
      MCCompiler mcc = new MCCompiler(logger);
      mcc.compile(mccArgs.inputFilename, System.out);
    } catch (MCCFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(TOKENS_FLAG, "tokens", false, "Print the token stream");
    opts.addOption(AST_FLAG, "ast", false,
                   "Print the syntax tree after analysis");

    Option logFile = new Option(LOG_FILE_FLAG, "log-file", true,
                                "Write debug log to file");
    logFile.setArgName("file");
    opts.addOption(logFile);

    opts.addOption(TRACE_FLAG, "trace", false, "Enable trace logging");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    return new Args(remainingArgs[0], cmd.hasOption(TOKENS_FLAG),
                    cmd.hasOption(AST_FLAG),
                    cmd.getOptionValue(LOG_FILE_FLAG),
                    cmd.hasOption(TRACE_FLAG));
  }

  /**
   * Store in settings.  Flags given on the command line override
   * values from Java properties.
   * @param args
   */
  private static void recordArgValues(Args args) {
    if (args.dumpTokens) {
      Settings.set(Settings.DUMP_TOKENS, "true");
    }
    if (args.dumpAST) {
      Settings.set(Settings.DUMP_AST, "true");
    }
    if (args.logFile != null) {
      Settings.set(Settings.LOG_FILE, args.logFile);
    }
    if (args.trace) {
      Settings.set(Settings.LOG_TRACE, "true");
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("mcc [options] <input>", opts);
  }

  private static class Args {
    public final String inputFilename;
    public final boolean dumpTokens;
    public final boolean dumpAST;
    public final String logFile;
    public final boolean trace;

    public Args(String inputFilename, boolean dumpTokens, boolean dumpAST,
                String logFile, boolean trace) {
      super();
      this.inputFilename = inputFilename;
      this.dumpTokens = dumpTokens;
      this.dumpAST = dumpAST;
      this.logFile = logFile;
      this.trace = trace;
    }
  }
}
