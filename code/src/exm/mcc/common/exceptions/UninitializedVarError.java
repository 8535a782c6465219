package exm.mcc.common.exceptions;

/**
 * A variable was read while declared but not yet definitely initialized.
 */
public class UninitializedVarError
extends SemanticException
{
  public UninitializedVarError(String file, int line, int col,
                               String varName)
  {
    super(file, line, col, varName, "Use of uninitialized variable '" +
          varName + "'");
  }

  @Override
  public Kind getKind() {
    return Kind.UNINITIALIZED_VARIABLE;
  }

  private static final long serialVersionUID = 1L;
}
