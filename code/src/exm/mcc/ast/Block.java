package exm.mcc.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * { statements }.  Opens a new lexical scope.
 */
public class Block extends Statement {
  private final ImmutableList<Statement> statements;

  public Block(List<Statement> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  public List<Statement> getStatements() {
    return statements;
  }

  @Override
  public <T, E extends Exception> T accept(StmtVisitor<T, E> visitor)
      throws E {
    return visitor.visitBlock(this);
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Block)) {
      return false;
    }
    return statements.equals(((Block) obj).statements);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (Statement stmt: statements) {
      sb.append(' ');
      sb.append(stmt);
    }
    sb.append(" }");
    return sb.toString();
  }
}
