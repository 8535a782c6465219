package exm.mcc.ast;

/**
 * 1-based line and column of a construct in the source text.
 */
public class SourcePos {
  /** Position for nodes built outside the parser */
  public static final SourcePos UNKNOWN = new SourcePos(0, 0);

  public final int line;
  public final int column;

  public SourcePos(int line, int column) {
    this.line = line;
    this.column = column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
