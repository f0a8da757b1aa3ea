package org.breadnbutter.compiler;

import org.breadnbutter.model.Location;

// A lexical token with the 1-based line and column where it starts
public class Token {
  public final TokenType type;
  public final String text;
  public final int line;
  public final int column;

  public Token(TokenType type, String text, int line, int column) {
    this.type = type;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public boolean is(TokenType t) {
    return type == t;
  }

  public Location location(String source) {
    return new Location(source, line, column);
  }

  @Override
  public String toString() {
    return type + (text != null && !text.isEmpty() ? "('" + text + "')" : "") + "@" + line + ":" + column;
  }
}
