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

import java.util.ArrayDeque;
import java.util.Deque;

import exm.mcc.ast.BinaryExpr;
import exm.mcc.ast.Expression;
import exm.mcc.ast.Block;
import exm.mcc.ast.ExprVisitor;
import exm.mcc.ast.FunctionDecl;
import exm.mcc.ast.Identifier;
import exm.mcc.ast.If;
import exm.mcc.ast.NumberLiteral;
import exm.mcc.ast.Return;
import exm.mcc.ast.SourcePos;
import exm.mcc.ast.Statement;
import exm.mcc.ast.StmtVisitor;
import exm.mcc.ast.VarDecl;
import exm.mcc.common.exceptions.DoubleDefineException;
import exm.mcc.common.exceptions.SemanticException;
import exm.mcc.common.exceptions.UndefinedVarError;
import exm.mcc.common.exceptions.UninitializedVarError;
import exm.mcc.lexer.Lexer;

/**
 * Walks a parsed function checking that every variable is declared
 * before use, initialized before use, and declared at most once per
 * scope.  The tree is not modified.
 *
 * Analysis stops at the first error in traversal order (left to right,
 * outer to inner).
 */
public class SemanticAnalyzer
    implements StmtVisitor<Void, SemanticException>,
               ExprVisitor<Void, SemanticException> {

  private final String inputFile;

  /** Created fresh for each call to analyze() */
  private ScopeStack scopes;

  public SemanticAnalyzer(String inputFile) {
    this.inputFile = inputFile == null ? Lexer.DEFAULT_SOURCE_NAME
                                       : inputFile;
  }

  public SemanticAnalyzer() {
    this(Lexer.DEFAULT_SOURCE_NAME);
  }

  public static void analyze(String inputFile, FunctionDecl root)
      throws SemanticException {
    new SemanticAnalyzer(inputFile).analyze(root);
  }

  /**
   * Check a whole function.
   * @throws SemanticException describing the first problem found
   */
  public void analyze(FunctionDecl root) throws SemanticException {
    scopes = new ScopeStack();
    try {
      root.accept(this);
      LogHelper.debug(inputFile, 0, "Function " + root.getName() +
                      " passed semantic analysis");
    } finally {
      scopes = null;
    }
  }

  @Override
  public Void visitFunction(FunctionDecl fn) throws SemanticException {
    pushScope("function " + fn.getName());
    for (String param: fn.getParameters()) {
      if (!scopes.declare(param)) {
        throw new DoubleDefineException(inputFile, fn.getPos().line,
                                        fn.getPos().column, param);
      }
      scopes.initialize(param);
    }
    fn.getBody().accept(this);
    popScope("function " + fn.getName());
    return null;
  }

  @Override
  public Void visitVarDecl(VarDecl decl) throws SemanticException {
    String name = decl.getName();
    SourcePos pos = decl.getPos();
    if (!scopes.declare(name)) {
      throw new DoubleDefineException(inputFile, pos.line, pos.column, name);
    }
    // Declared but not yet initialized while checking the initializer
    decl.getInitializer().accept(this);
    scopes.initialize(name);
    LogHelper.trace(scopes.size() * 2, "declared " + name);
    return null;
  }

  @Override
  public Void visitReturn(Return ret) throws SemanticException {
    ret.getValue().accept(this);
    return null;
  }

  @Override
  public Void visitIf(If ifStmt) throws SemanticException {
    ifStmt.getCondition().accept(this);

    analyzeInScope(ifStmt.getThenBranch(), "then");

    if (ifStmt.hasElse()) {
      // Sibling of the then scope, not nested in it
      analyzeInScope(ifStmt.getElseBranch(), "else");
    }
    return null;
  }

  @Override
  public Void visitBlock(Block block) throws SemanticException {
    pushScope("block");
    for (Statement stmt: block.getStatements()) {
      stmt.accept(this);
    }
    popScope("block");
    return null;
  }

  private void analyzeInScope(Statement stmt, String what)
      throws SemanticException {
    pushScope(what);
    stmt.accept(this);
    popScope(what);
  }

  /**
   * Operator chains such as a + b + c + ... build trees that lean left
   * with one level per operator, so the left spine is walked with an
   * explicit stack.  Right operands are bounded by the parser's nesting
   * limit and are visited recursively.  Visit order is still left to
   * right.
   */
  @Override
  public Void visitBinary(BinaryExpr expr) throws SemanticException {
    Deque<BinaryExpr> spine = new ArrayDeque<BinaryExpr>();
    Expression curr = expr;
    while (curr instanceof BinaryExpr) {
      BinaryExpr bin = (BinaryExpr) curr;
      spine.push(bin);
      curr = bin.getLeft();
    }
    curr.accept(this);

    while (!spine.isEmpty()) {
      spine.pop().getRight().accept(this);
    }
    return null;
  }

  @Override
  public Void visitNumber(NumberLiteral expr) {
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier id) throws SemanticException {
    String name = id.getName();
    SourcePos pos = id.getPos();
    if (!scopes.isDeclared(name)) {
      throw new UndefinedVarError(inputFile, pos.line, pos.column, name);
    } else if (!scopes.isInitialized(name)) {
      throw new UninitializedVarError(inputFile, pos.line, pos.column, name);
    }
    return null;
  }

  private void pushScope(String what) {
    scopes.push();
    LogHelper.trace(scopes.size() * 2, "enter scope: " + what);
  }

  private void popScope(String what) {
    LogHelper.trace(scopes.size() * 2, "exit scope: " + what);
    scopes.pop();
  }
}
