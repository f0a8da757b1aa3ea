package org.breadnbutter.model;

import java.util.Objects;

// A resolved absolute coordinate: the center of a place, with y growing downwards
public class Point {
  public static final Point ORIGIN = new Point(0, 0);

  public final double x;
  public final double y;

  public Point(double x, double y) {
    this.x = x;
    this.y = y;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Point)) return false;
    Point that = (Point) o;
    return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(x, y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
