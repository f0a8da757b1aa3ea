package org.breadnbutter.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable arena used to assemble an {@link AffordanceForest}.
 *
 * <p>Nodes must be added parent first. Ids are handed out in insertion order, so a builder fed
 * in declaration order produces preorder ids.
 */
public class ForestBuilder {
  public static final int ROOT = -1;

  private final List<Slot> slots = new ArrayList<>();
  private final List<Integer> roots = new ArrayList<>();

  // Mutable counterpart of Affordance while the arena is being filled
  private static class Slot {
    final String label;
    final String description;
    final String include;
    final Location location;
    final List<Integer> children = new ArrayList<>();
    final List<Connection> connections = new ArrayList<>();

    Slot(String label, String description, String include, Location location) {
      this.label = label;
      this.description = description;
      this.include = include;
      this.location = location;
    }
  }

  public int addAffordance(int parent, String label, String description, Location location) {
    if (label == null) {
      throw new IllegalArgumentException("Affordance label is required");
    }
    return add(parent, new Slot(label, description, null, location));
  }

  public int addInclude(int parent, String name, Location location) {
    if (name == null) {
      throw new IllegalArgumentException("Include name is required");
    }
    return add(parent, new Slot(null, null, name, location));
  }

  private int add(int parent, Slot slot) {
    int id = slots.size();
    if (parent == ROOT) {
      roots.add(id);
    } else {
      Slot p = slots.get(parent);
      if (p.include != null) {
        throw new IllegalArgumentException("Include directive '" + p.include + "' cannot have children");
      }
      p.children.add(id);
    }
    slots.add(slot);
    return id;
  }

  public void addConnection(int id, Connection connection) {
    Slot slot = slots.get(id);
    if (slot.include != null) {
      throw new IllegalArgumentException("Include directive '" + slot.include + "' cannot have connections");
    }
    slot.connections.add(connection);
  }

  /**
   * Copies a single node of {@code source} (and its subtree) under {@code parent}.
   *
   * @return the id of the copied node in this builder
   */
  public int graft(AffordanceForest source, Affordance node, int parent) {
    int id = node.isInclude()
        ? addInclude(parent, node.include, node.location)
        : addAffordance(parent, node.label, node.description, node.location);
    for (Connection c : node.connections) {
      addConnection(id, c);
    }
    for (Affordance child : source.children(node)) {
      graft(source, child, id);
    }
    return id;
  }

  // Copies every root of source (with subtrees) under parent, keeping their order
  public void graft(AffordanceForest source, int parent) {
    for (Affordance root : source.roots()) {
      graft(source, root, parent);
    }
  }

  public int size() {
    return slots.size();
  }

  public AffordanceForest build() {
    List<Affordance> nodes = new ArrayList<>(slots.size());
    for (int i = 0; i < slots.size(); i++) {
      Slot s = slots.get(i);
      nodes.add(new Affordance(i, s.label, s.description, s.children, s.connections, s.include, s.location));
    }
    return new AffordanceForest(nodes, roots);
  }
}
