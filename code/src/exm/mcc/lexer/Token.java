package exm.mcc.lexer;

import com.google.common.base.Preconditions;

/**
 * A classified piece of source text with the line and column where it
 * starts.  Immutable.
 */
public class Token {
  private final TokenKind kind;
  private final String text;
  private final int line;
  private final int column;

  public Token(TokenKind kind, String text, int line, int column) {
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(text);
    Preconditions.checkArgument(line >= 1, "line must be >= 1: %s", line);
    Preconditions.checkArgument(column >= 1, "column must be >= 1: %s",
                                column);
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + kind.hashCode();
    result = prime * result + text.hashCode();
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Token))
      return false;
    Token other = (Token) obj;
    return kind == other.kind && text.equals(other.text) &&
           line == other.line && column == other.column;
  }

  /**
   * Format used by the token dump, e.g.
   * Token: IDENTIFIER | Value: 'x' | Line: 2 | Column: 9
   */
  @Override
  public String toString() {
    return "Token: " + kind.name() + " | Value: '" + text +
           "' | Line: " + line + " | Column: " + column;
  }
}
