package org.breadnbutter.model;

import java.util.Objects;

// Represents a navigational edge from an affordance to a target place
public class Connection {
  public final String label;   // optional, null when the arrow carries no "(label)"
  public final String target;  // name of the target place
  transient Location location;

  public Connection(String label, String target, Location location) {
    this.label = label;
    this.target = Objects.requireNonNull(target, "target");
    this.location = location;
  }

  public Connection(String label, String target) {
    this(label, target, null);
  }

  public Location location() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Connection)) return false;
    Connection that = (Connection) o;
    return Objects.equals(label, that.label) && target.equals(that.target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(label, target);
  }

  @Override
  public String toString() {
    return "-> " + (label != null ? "(" + label + ") " : "") + target;
  }
}
