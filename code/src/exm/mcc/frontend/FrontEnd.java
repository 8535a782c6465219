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
package exm.mcc.frontend;

import java.util.List;

import exm.mcc.ast.FunctionDecl;
import exm.mcc.common.exceptions.InvalidSyntaxException;
import exm.mcc.common.exceptions.LexException;
import exm.mcc.common.exceptions.SemanticException;
import exm.mcc.lexer.Lexer;
import exm.mcc.lexer.Token;

/**
 * Entry points for collaborators that want each stage's outcome as a
 * value rather than an exception.  Stages must be called in order:
 * tokenize, parseFunction, analyze.
 */
public class FrontEnd {

  private final String inputFile;

  /**
   * @param inputFile name to use in error locations, null for default
   */
  public FrontEnd(String inputFile) {
    this.inputFile = inputFile == null ? Lexer.DEFAULT_SOURCE_NAME
                                       : inputFile;
  }

  public StageResult<List<Token>> tokenize(String sourceText) {
    try {
      return StageResult.success(Lexer.tokenize(inputFile, sourceText));
    } catch (LexException e) {
      return StageResult.failure(e);
    }
  }

  public StageResult<FunctionDecl> parseFunction(List<Token> tokens) {
    try {
      return StageResult.success(Parser.parseFunction(inputFile, tokens));
    } catch (InvalidSyntaxException e) {
      return StageResult.failure(e);
    }
  }

  /**
   * @return success holding the same root if the tree is valid
   */
  public StageResult<FunctionDecl> analyze(FunctionDecl root) {
    try {
      SemanticAnalyzer.analyze(inputFile, root);
      return StageResult.success(root);
    } catch (SemanticException e) {
      return StageResult.failure(e);
    }
  }

  /**
   * Run all three stages, stopping at the first failure.
   */
  public StageResult<FunctionDecl> compile(String sourceText) {
    StageResult<List<Token>> tokens = tokenize(sourceText);
    if (!tokens.isSuccess()) {
      return StageResult.failure(tokens.getError());
    }
    StageResult<FunctionDecl> tree = parseFunction(tokens.getValue());
    if (!tree.isSuccess()) {
      return tree;
    }
    return analyze(tree.getValue());
  }
}
