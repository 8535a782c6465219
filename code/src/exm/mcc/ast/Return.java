package exm.mcc.ast;

import com.google.common.base.Preconditions;

public class Return extends Statement {
  private final Expression value;

  public Return(Expression value) {
    this.value = Preconditions.checkNotNull(value);
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public <T, E extends Exception> T accept(StmtVisitor<T, E> visitor)
      throws E {
    return visitor.visitReturn(this);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Return)) {
      return false;
    }
    return value.equals(((Return) obj).value);
  }

  @Override
  public String toString() {
    return "(return " + value + ")";
  }
}
