package org.breadnbutter.model;

import java.util.Objects;

// A reusable, named group of affordances that places pull in with `include`
public class Component {
  public final String name;
  public final String description;
  public final AffordanceForest affordances;
  transient Location location;

  public Component(String name, String description, AffordanceForest affordances, Location location) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.affordances = affordances != null ? affordances : AffordanceForest.EMPTY;
    this.location = location;
  }

  public Component(String name, AffordanceForest affordances) {
    this(name, null, affordances, null);
  }

  public Component withAffordances(AffordanceForest forest) {
    return new Component(name, description, forest, location);
  }

  public Location location() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Component)) return false;
    Component that = (Component) o;
    return name.equals(that.name)
        && Objects.equals(description, that.description)
        && affordances.equals(that.affordances);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, affordances);
  }

  @Override
  public String toString() {
    return "Component{name='" + name + "', affordances=" + affordances.size() + '}';
  }
}
