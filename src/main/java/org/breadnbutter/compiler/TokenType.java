package org.breadnbutter.compiler;

public enum TokenType {
  // keywords
  PLACE,
  COMPONENT,
  INCLUDE,
  SKETCH,
  POSITION,

  TEXT,         // free text or quoted string
  NUMBER,
  ARROW,        // ->
  LABEL,        // (label) following an arrow
  REGION_OPEN,  // [
  REGION_CLOSE, // ]
  COMMA,
  PIVOT,        // one of < ^ > _
  PLUS,
  MINUS,
  MARKER,       // run of nesting markers, depth = text length
  DESCRIPTION,  // /// comment
  NEWLINE,
  ERROR,        // malformed input, text holds the message
  EOF;

  public boolean isKeyword() {
    return ordinal() <= POSITION.ordinal();
  }

  // Returns null when the word is not a keyword
  static TokenType keyword(String word) {
    switch (word) {
      case "place":
        return PLACE;
      case "component":
        return COMPONENT;
      case "include":
        return INCLUDE;
      case "sketch":
        return SKETCH;
      case "position":
        return POSITION;
      default:
        return null;
    }
  }
}
