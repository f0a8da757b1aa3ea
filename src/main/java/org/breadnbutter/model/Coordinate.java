package org.breadnbutter.model;

import java.util.Objects;

/**
 * One axis of a {@link Position}.
 *
 * <p>An absolute coordinate has no {@code place} and its value is {@code offset}. A relative
 * coordinate is measured from the {@code pivot} edge of {@code place}, shifted by {@code offset}.
 */
public class Coordinate {
  public final String place;
  public final Pivot pivot;
  public final double offset;

  private Coordinate(String place, Pivot pivot, double offset) {
    this.place = place;
    this.pivot = pivot;
    this.offset = offset;
  }

  public static Coordinate absolute(double value) {
    return new Coordinate(null, null, value);
  }

  public static Coordinate relative(String place, Pivot pivot, double offset) {
    Objects.requireNonNull(place, "place");
    return new Coordinate(place, pivot != null ? pivot : Pivot.CENTER, offset);
  }

  public boolean isAbsolute() {
    return place == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Coordinate)) return false;
    Coordinate that = (Coordinate) o;
    return Double.compare(that.offset, offset) == 0
        && Objects.equals(place, that.place)
        && pivot == that.pivot;
  }

  @Override
  public int hashCode() {
    return Objects.hash(place, pivot, offset);
  }

  @Override
  public String toString() {
    if (isAbsolute()) {
      return Double.toString(offset);
    }
    return "Coordinate{" +
        "place='" + place + '\'' +
        ", pivot=" + pivot +
        ", offset=" + offset +
        '}';
  }
}
