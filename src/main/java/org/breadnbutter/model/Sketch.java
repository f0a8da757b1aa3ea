package org.breadnbutter.model;

import java.util.List;
import java.util.Objects;

// An image attached to a place, annotated with clickable regions
public class Sketch {
  public final String path;
  public final List<ClickableRegion> regions;

  public Sketch(String path, List<ClickableRegion> regions) {
    this.path = Objects.requireNonNull(path, "path");
    this.regions = List.copyOf(regions);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Sketch)) return false;
    Sketch that = (Sketch) o;
    return path.equals(that.path) && regions.equals(that.regions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, regions);
  }

  @Override
  public String toString() {
    return "Sketch{path='" + path + "', regions=" + regions + '}';
  }
}
