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
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.mcc.ast.FunctionDecl;
import exm.mcc.common.Settings;
import exm.mcc.common.exceptions.InvalidOptionException;
import exm.mcc.common.exceptions.MCCFatal;
import exm.mcc.common.exceptions.UserException;
import exm.mcc.common.util.Misc;
import exm.mcc.frontend.ASTPrinter;
import exm.mcc.frontend.FrontEnd;
import exm.mcc.lexer.Token;

/**
 * This is the main entry point to the compiler
 */
public class MCCompiler {

  private final Logger logger;

  public MCCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Check a source file, printing the token dump and tree to output if
   * enabled in Settings.
   *
   * This function contains the high-level logic orchestrating the
   * different stages of the compiler
   * @param inputFile
   * @param output destination for dumps
   * @throws MCCFatal with the exit code if compilation failed
   */
  public void compile(String inputFile, PrintStream output) {
    try {
      logger.info("MCC starting: " + Misc.timestamp());
      String source = FileUtils.readFileToString(new File(inputFile),
                          Settings.getCharset(Settings.SOURCE_ENCODING));
      compileSource(inputFile, source, output);
      logger.debug("MCC done: " + Misc.timestamp());
    }
    catch (MCCFatal e) {
      // Rethrow
      throw e;
    }
    catch (IOException e) {
      System.err.println("I/O error while reading " + inputFile);
      System.err.println(e.getMessage());
      throw new MCCFatal(ExitCode.ERROR_IO.code());
    }
    catch (InvalidOptionException e) {
      System.err.println("Error in settings: " + e.getMessage());
      throw new MCCFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (UserException e) {
      System.err.println("mcc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new MCCFatal(ExitCode.ERROR_USER.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new MCCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Run lexer, parser and analyzer over source text.
   * @return the validated tree
   */
  public FunctionDecl compileSource(String inputFile, String source,
        PrintStream output) throws UserException, InvalidOptionException {
    FrontEnd frontEnd = new FrontEnd(inputFile);

    List<Token> tokens = frontEnd.tokenize(source).getOrThrow();
    if (Settings.getBoolean(Settings.DUMP_TOKENS)) {
      for (Token tok: tokens) {
        output.println(tok);
      }
    }

    FunctionDecl root = frontEnd.parseFunction(tokens).getOrThrow();
    logger.debug("Parsed function " + root.getName());

    frontEnd.analyze(root).getOrThrow();

    if (Settings.getBoolean(Settings.DUMP_AST)) {
      output.print(ASTPrinter.print(root));
    }
    output.flush();
    return root;
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("MCC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
