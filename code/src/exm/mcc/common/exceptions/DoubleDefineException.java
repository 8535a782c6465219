package exm.mcc.common.exceptions;

public class DoubleDefineException
extends SemanticException
{
  public DoubleDefineException(String file, int line, int col,
                               String varName)
  {
    super(file, line, col, varName, "Variable '" + varName +
          "' is already declared in this scope");
  }

  @Override
  public Kind getKind() {
    return Kind.DUPLICATE_DECLARATION;
  }

  private static final long serialVersionUID = 1L;
}
