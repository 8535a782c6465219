package exm.mcc.ast;

/**
 * One method per statement variant.
 * @param <T> result of visiting
 * @param <E> checked exception the visitor may throw
 */
public interface StmtVisitor<T, E extends Exception> {
  T visitFunction(FunctionDecl stmt) throws E;
  T visitVarDecl(VarDecl stmt) throws E;
  T visitReturn(Return stmt) throws E;
  T visitIf(If stmt) throws E;
  T visitBlock(Block stmt) throws E;
}
