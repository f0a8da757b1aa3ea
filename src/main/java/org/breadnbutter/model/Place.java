package org.breadnbutter.model;

import java.util.Objects;

/**
 * A screen or section of the modelled software.
 *
 * <p>{@code position} is what the source declared; {@code resolvedPosition} is filled in by
 * position resolution and stays null until then.
 */
public class Place {
  public final String name;
  public final String description;
  public final AffordanceForest affordances;
  public final Position position;
  public final Point resolvedPosition;
  public final Sketch sketch;
  transient Location location;

  public Place(String name, String description, AffordanceForest affordances, Position position,
               Point resolvedPosition, Sketch sketch, Location location) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.affordances = affordances != null ? affordances : AffordanceForest.EMPTY;
    this.position = position;
    this.resolvedPosition = resolvedPosition;
    this.sketch = sketch;
    this.location = location;
  }

  public Place(String name, AffordanceForest affordances) {
    this(name, null, affordances, null, null, null, null);
  }

  public Place withAffordances(AffordanceForest forest) {
    return new Place(name, description, forest, position, resolvedPosition, sketch, location);
  }

  public Place withResolvedPosition(Point point) {
    return new Place(name, description, affordances, position, point, sketch, location);
  }

  public Location location() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Place)) return false;
    Place that = (Place) o;
    return name.equals(that.name)
        && Objects.equals(description, that.description)
        && affordances.equals(that.affordances)
        && Objects.equals(position, that.position)
        && Objects.equals(resolvedPosition, that.resolvedPosition)
        && Objects.equals(sketch, that.sketch);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, affordances, position, resolvedPosition, sketch);
  }

  @Override
  public String toString() {
    return "Place{" +
        "name='" + name + '\'' +
        ", affordances=" + affordances.size() +
        ", position=" + position +
        ", resolvedPosition=" + resolvedPosition +
        ", sketch=" + sketch +
        '}';
  }
}
