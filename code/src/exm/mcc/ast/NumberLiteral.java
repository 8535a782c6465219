package exm.mcc.ast;

public class NumberLiteral extends Expression {
  private final double value;

  public NumberLiteral(double value) {
    this.value = value;
  }

  public double getValue() {
    return value;
  }

  /**
   * Format a value for display: integral values without a fraction
   */
  public static String format(double value) {
    if (!Double.isInfinite(value) && value == Math.rint(value)
        && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  @Override
  public <T, E extends Exception> T accept(ExprVisitor<T, E> visitor)
      throws E {
    return visitor.visitNumber(this);
  }

  @Override
  public int hashCode() {
    return Double.valueOf(value).hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NumberLiteral)) {
      return false;
    }
    return Double.compare(value, ((NumberLiteral) obj).value) == 0;
  }

  @Override
  public String toString() {
    return format(value);
  }
}
