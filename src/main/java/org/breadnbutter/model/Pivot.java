package org.breadnbutter.model;

import com.google.gson.annotations.SerializedName;

// The edge of a referenced place that a relative coordinate is measured from
public enum Pivot {
  @SerializedName("left") LEFT('<'),
  @SerializedName("top") TOP('^'),
  @SerializedName("right") RIGHT('>'),
  @SerializedName("bottom") BOTTOM('_'),
  @SerializedName("center") CENTER('\0');

  private final char symbol;

  Pivot(char symbol) {
    this.symbol = symbol;
  }

  public char symbol() {
    return symbol;
  }

  // Pivots that only make sense on the x axis
  public boolean isHorizontal() {
    return this == LEFT || this == RIGHT;
  }

  // Pivots that only make sense on the y axis
  public boolean isVertical() {
    return this == TOP || this == BOTTOM;
  }

  public static boolean isSymbol(char c) {
    return fromSymbol(c) != null;
  }

  // Returns null when the character is not a pivot symbol
  public static Pivot fromSymbol(char c) {
    for (Pivot p : values()) {
      if (p != CENTER && p.symbol == c) {
        return p;
      }
    }
    return null;
  }
}
