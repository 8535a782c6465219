package exm.mcc.common.exceptions;

/**
 * A character in the source text that doesn't start any token.
 */
public class LexException extends UserException {

  private final char offending;

  public LexException(String file, int line, int col, char offending) {
    super(file, line, col, "Unexpected character: " + offending);
    this.offending = offending;
  }

  public char getOffendingChar() {
    return offending;
  }

  private static final long serialVersionUID = 1L;
}
