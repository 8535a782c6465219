package exm.mcc.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class MCCFatal extends RuntimeException {
  public final int exitCode;

  public MCCFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
