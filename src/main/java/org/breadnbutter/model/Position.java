package org.breadnbutter.model;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

// A declared layout position; each axis is absolute or relative to another place
public class Position {
  public final Coordinate x;
  public final Coordinate y;
  transient Location location;

  public Position(Coordinate x, Coordinate y, Location location) {
    this.x = Objects.requireNonNull(x, "x");
    this.y = Objects.requireNonNull(y, "y");
    if (!x.isAbsolute() && x.pivot.isVertical()) {
      throw new IllegalArgumentException("x coordinate cannot use pivot " + x.pivot);
    }
    if (!y.isAbsolute() && y.pivot.isHorizontal()) {
      throw new IllegalArgumentException("y coordinate cannot use pivot " + y.pivot);
    }
    this.location = location;
  }

  public Position(Coordinate x, Coordinate y) {
    this(x, y, null);
  }

  public static Position absolute(double x, double y) {
    return new Position(Coordinate.absolute(x), Coordinate.absolute(y));
  }

  // Names of the places this position depends on, in axis order
  public Set<String> references() {
    Set<String> refs = new LinkedHashSet<>();
    if (!x.isAbsolute()) refs.add(x.place);
    if (!y.isAbsolute()) refs.add(y.place);
    return refs;
  }

  public Location location() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Position)) return false;
    Position that = (Position) o;
    return x.equals(that.x) && y.equals(that.y);
  }

  @Override
  public int hashCode() {
    return Objects.hash(x, y);
  }

  @Override
  public String toString() {
    return "Position{x=" + x + ", y=" + y + '}';
  }
}
