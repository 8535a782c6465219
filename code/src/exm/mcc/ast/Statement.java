package exm.mcc.ast;

/**
 * Closed family of statement nodes.  Consumers dispatch with a
 * StmtVisitor.
 */
public abstract class Statement {

  /* Only subclasses in this package */
  Statement() {
  }

  public abstract <T, E extends Exception> T accept(StmtVisitor<T, E> visitor)
      throws E;
}
