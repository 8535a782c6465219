package exm.mcc.ast;

import com.google.common.base.Preconditions;

/**
 * int name = initializer;  The initializer is mandatory.
 */
public class VarDecl extends Statement {
  private final String name;
  private final Expression initializer;
  private final SourcePos pos;

  public VarDecl(String name, Expression initializer, SourcePos pos) {
    this.name = Preconditions.checkNotNull(name);
    this.initializer = Preconditions.checkNotNull(initializer);
    this.pos = Preconditions.checkNotNull(pos);
  }

  public VarDecl(String name, Expression initializer) {
    this(name, initializer, SourcePos.UNKNOWN);
  }

  public String getName() {
    return name;
  }

  public Expression getInitializer() {
    return initializer;
  }

  /** Position of the declared name */
  public SourcePos getPos() {
    return pos;
  }

  @Override
  public <T, E extends Exception> T accept(StmtVisitor<T, E> visitor)
      throws E {
    return visitor.visitVarDecl(this);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + initializer.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof VarDecl)) {
      return false;
    }
    VarDecl other = (VarDecl) obj;
    return name.equals(other.name) && initializer.equals(other.initializer);
  }

  @Override
  public String toString() {
    return "(int " + name + " " + initializer + ")";
  }
}
