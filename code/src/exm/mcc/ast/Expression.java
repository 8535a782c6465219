package exm.mcc.ast;

/**
 * Closed family of expression nodes: BinaryExpr, NumberLiteral and
 * Identifier.  Consumers dispatch with an ExprVisitor.
 */
public abstract class Expression {

  /* Only subclasses in this package */
  Expression() {
  }

  public abstract <T, E extends Exception> T accept(ExprVisitor<T, E> visitor)
      throws E;
}
