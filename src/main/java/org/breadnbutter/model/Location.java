package org.breadnbutter.model;

import java.util.Objects;

// Represents a position in a source document, used for diagnostics
public class Location {
  public final String source;
  public final int line;
  public final int column;

  public Location(String source, int line, int column) {
    this.source = source;
    this.line = line;
    this.column = column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Location)) return false;
    Location that = (Location) o;
    return line == that.line && column == that.column && Objects.equals(source, that.source);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, line, column);
  }

  @Override
  public String toString() {
    return (source != null ? source : "<input>") + ":" + line + ":" + column;
  }
}
