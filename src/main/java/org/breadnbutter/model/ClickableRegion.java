package org.breadnbutter.model;

import java.util.Objects;

// A pixel rectangle on a sketch, mapped to an affordance label of the same place
public class ClickableRegion {
  public final int top;
  public final int left;
  public final int bottom;
  public final int right;
  public final String affordance;
  transient Location location;

  public ClickableRegion(int top, int left, int bottom, int right, String affordance, Location location) {
    if (right <= left) {
      throw new IllegalArgumentException("Region width must be positive: [" + top + "," + left + " " + bottom + "," + right + "]");
    }
    if (bottom <= top) {
      throw new IllegalArgumentException("Region height must be positive: [" + top + "," + left + " " + bottom + "," + right + "]");
    }
    this.top = top;
    this.left = left;
    this.bottom = bottom;
    this.right = right;
    this.affordance = Objects.requireNonNull(affordance, "affordance");
    this.location = location;
  }

  public ClickableRegion(int top, int left, int bottom, int right, String affordance) {
    this(top, left, bottom, right, affordance, null);
  }

  public int width() {
    return right - left;
  }

  public int height() {
    return bottom - top;
  }

  public Location location() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ClickableRegion)) return false;
    ClickableRegion that = (ClickableRegion) o;
    return top == that.top && left == that.left && bottom == that.bottom && right == that.right
        && affordance.equals(that.affordance);
  }

  @Override
  public int hashCode() {
    return Objects.hash(top, left, bottom, right, affordance);
  }

  @Override
  public String toString() {
    return "[" + top + "," + left + " " + bottom + "," + right + "] " + affordance;
  }
}
