package exm.mcc.frontend;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Joiner;

import exm.mcc.ast.BinaryExpr;
import exm.mcc.ast.Block;
import exm.mcc.ast.ExprVisitor;
import exm.mcc.ast.FunctionDecl;
import exm.mcc.ast.Identifier;
import exm.mcc.ast.If;
import exm.mcc.ast.NumberLiteral;
import exm.mcc.ast.Return;
import exm.mcc.ast.Statement;
import exm.mcc.ast.StmtVisitor;
import exm.mcc.ast.VarDecl;

/**
 * Renders a tree as labeled lines, indented two spaces per level.
 */
public class ASTPrinter
    implements StmtVisitor<Void, RuntimeException>,
               ExprVisitor<Void, RuntimeException> {

  private static final String INDENT = "  ";

  private final StringBuilder out = new StringBuilder();
  private int level = 0;

  public static String print(Statement root) {
    ASTPrinter printer = new ASTPrinter();
    root.accept(printer);
    return printer.out.toString();
  }

  private void line(String text) {
    out.append(StringUtils.repeat(INDENT, level));
    out.append(text);
    out.append('\n');
  }

  private void labeled(String label, Statement child) {
    line(label);
    level++;
    child.accept(this);
    level--;
  }

  @Override
  public Void visitFunction(FunctionDecl fn) {
    String header = "FunctionDecl " + fn.getName();
    if (!fn.getParameters().isEmpty()) {
      header += " (" + Joiner.on(", ").join(fn.getParameters()) + ")";
    }
    line(header);
    level++;
    fn.getBody().accept(this);
    level--;
    return null;
  }

  @Override
  public Void visitVarDecl(VarDecl decl) {
    line("VarDecl " + decl.getName());
    level++;
    decl.getInitializer().accept(this);
    level--;
    return null;
  }

  @Override
  public Void visitReturn(Return ret) {
    line("Return");
    level++;
    ret.getValue().accept(this);
    level--;
    return null;
  }

  @Override
  public Void visitIf(If ifStmt) {
    line("If");
    level++;
    line("Condition:");
    level++;
    ifStmt.getCondition().accept(this);
    level--;
    labeled("Then:", ifStmt.getThenBranch());
    if (ifStmt.hasElse()) {
      labeled("Else:", ifStmt.getElseBranch());
    }
    level--;
    return null;
  }

  @Override
  public Void visitBlock(Block block) {
    line("Block");
    level++;
    for (Statement stmt: block.getStatements()) {
      stmt.accept(this);
    }
    level--;
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpr expr) {
    line("BinaryExpr " + expr.getOperator().symbol());
    level++;
    expr.getLeft().accept(this);
    expr.getRight().accept(this);
    level--;
    return null;
  }

  @Override
  public Void visitNumber(NumberLiteral expr) {
    line("Number " + NumberLiteral.format(expr.getValue()));
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier expr) {
    line("Identifier " + expr.getName());
    return null;
  }
}
