package exm.mcc.ast;

import com.google.common.base.Preconditions;

/**
 * Use of a variable in an expression.  Position is not part of equality.
 */
public class Identifier extends Expression {
  private final String name;
  private final SourcePos pos;

  public Identifier(String name, SourcePos pos) {
    this.name = Preconditions.checkNotNull(name);
    this.pos = Preconditions.checkNotNull(pos);
  }

  public Identifier(String name) {
    this(name, SourcePos.UNKNOWN);
  }

  public String getName() {
    return name;
  }

  public SourcePos getPos() {
    return pos;
  }

  @Override
  public <T, E extends Exception> T accept(ExprVisitor<T, E> visitor)
      throws E {
    return visitor.visitIdentifier(this);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Identifier)) {
      return false;
    }
    return name.equals(((Identifier) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }
}
