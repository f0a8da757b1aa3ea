package org.breadnbutter.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * An ordered forest of affordances stored as a flat arena.
 *
 * <p>Node ids are arena indices and follow declaration (preorder) order. The forest is
 * immutable; {@link #withConnection} and {@link #copy} hand out new arenas, so two forests never
 * share nodes that a caller could observe changing.
 */
public class AffordanceForest {
  public static final AffordanceForest EMPTY = new AffordanceForest(List.of(), List.of());

  public final List<Affordance> nodes;
  public final List<Integer> roots;

  AffordanceForest(List<Affordance> nodes, List<Integer> roots) {
    this.nodes = List.copyOf(nodes);
    this.roots = List.copyOf(roots);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public Affordance get(int id) {
    return nodes.get(id);
  }

  public List<Affordance> roots() {
    return resolve(roots);
  }

  public List<Affordance> children(Affordance parent) {
    return resolve(parent.children);
  }

  private List<Affordance> resolve(List<Integer> ids) {
    List<Affordance> out = new ArrayList<>(ids.size());
    for (int id : ids) {
      out.add(nodes.get(id));
    }
    return out;
  }

  // All nodes in depth-first declaration order
  public List<Affordance> preorder() {
    List<Affordance> out = new ArrayList<>(nodes.size());
    Deque<Integer> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) stack.push(roots.get(i));
    while (!stack.isEmpty()) {
      Affordance node = nodes.get(stack.pop());
      out.add(node);
      for (int i = node.children.size() - 1; i >= 0; i--) stack.push(node.children.get(i));
    }
    return out;
  }

  public List<Affordance> find(Predicate<Affordance> predicate) {
    List<Affordance> out = new ArrayList<>();
    for (Affordance node : nodes) {
      if (predicate.test(node)) out.add(node);
    }
    return out;
  }

  public List<Affordance> findByLabel(String label) {
    return find(a -> !a.isInclude() && label.equals(a.label));
  }

  public boolean hasIncludes() {
    for (Affordance node : nodes) {
      if (node.isInclude()) return true;
    }
    return false;
  }

  /** Returns a forest equal to this one with {@code connection} appended to node {@code id}. */
  public AffordanceForest withConnection(int id, Connection connection) {
    Objects.requireNonNull(connection, "connection");
    List<Affordance> copy = new ArrayList<>(nodes);
    Affordance a = nodes.get(id);
    if (a.isInclude()) {
      throw new IllegalArgumentException("Cannot connect an include directive: " + a.include);
    }
    List<Connection> connections = new ArrayList<>(a.connections);
    connections.add(connection);
    copy.set(id, new Affordance(a.id, a.label, a.description, a.children, connections, null, a.location));
    return new AffordanceForest(copy, roots);
  }

  public AffordanceForest copy() {
    ForestBuilder builder = new ForestBuilder();
    builder.graft(this, ForestBuilder.ROOT);
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AffordanceForest)) return false;
    AffordanceForest that = (AffordanceForest) o;
    return nodes.equals(that.nodes) && roots.equals(that.roots);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodes, roots);
  }

  @Override
  public String toString() {
    return "AffordanceForest{roots=" + roots + ", nodes=" + nodes + '}';
  }
}
