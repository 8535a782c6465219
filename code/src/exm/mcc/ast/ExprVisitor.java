package exm.mcc.ast;

/**
 * One method per expression variant.
 * @param <T> result of visiting
 * @param <E> checked exception the visitor may throw
 */
public interface ExprVisitor<T, E extends Exception> {
  T visitBinary(BinaryExpr expr) throws E;
  T visitNumber(NumberLiteral expr) throws E;
  T visitIdentifier(Identifier expr) throws E;
}
