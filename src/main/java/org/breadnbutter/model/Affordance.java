package org.breadnbutter.model;

import java.util.List;
import java.util.Objects;

/**
 * A node of an {@link AffordanceForest}.
 *
 * <p>Children are referenced by id (their index in the owning forest). A node whose
 * {@code include} is set stands for an unresolved {@code include} directive; such nodes never
 * survive reference resolution.
 */
public class Affordance {
  public final int id;
  public final String label;
  public final String description;
  public final List<Integer> children;
  public final List<Connection> connections;
  public final String include;
  transient Location location;

  Affordance(int id, String label, String description, List<Integer> children,
             List<Connection> connections, String include, Location location) {
    this.id = id;
    this.label = label;
    this.description = description;
    this.children = List.copyOf(children);
    this.connections = List.copyOf(connections);
    this.include = include;
    this.location = location;
  }

  public boolean isInclude() {
    return include != null;
  }

  public boolean hasConnections() {
    return !connections.isEmpty();
  }

  public Location location() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Affordance)) return false;
    Affordance that = (Affordance) o;
    return id == that.id
        && Objects.equals(label, that.label)
        && Objects.equals(description, that.description)
        && children.equals(that.children)
        && connections.equals(that.connections)
        && Objects.equals(include, that.include);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, label, description, children, connections, include);
  }

  @Override
  public String toString() {
    return "Affordance{" +
        "id=" + id +
        (isInclude() ? ", include='" + include + '\'' : ", label='" + label + '\'') +
        ", children=" + children +
        ", connections=" + connections +
        '}';
  }
}
