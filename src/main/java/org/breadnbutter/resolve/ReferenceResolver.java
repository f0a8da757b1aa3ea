package org.breadnbutter.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.breadnbutter.compiler.Diagnostic;
import org.breadnbutter.compiler.DiagnosticKind;
import org.breadnbutter.model.Affordance;
import org.breadnbutter.model.AffordanceForest;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.Component;
import org.breadnbutter.model.Connection;
import org.breadnbutter.model.ForestBuilder;
import org.breadnbutter.model.Place;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@code include} directives and connection targets against the declared names.
 *
 * <p>Each include is replaced by a fresh copy of the component's (already expanded) forest at
 * the include's position, so no two inclusion sites share nodes. Includes resolve against
 * components only; naming a place is an {@link DiagnosticKind#UNKNOWN_REFERENCE}. Every problem
 * in the document is collected before returning.
 */
public class ReferenceResolver {
  private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

  private final SymbolTable symbols;
  private final List<Diagnostic> errors = new ArrayList<>();
  private final Map<String, AffordanceForest> expanded = new HashMap<>();
  private final LinkedHashSet<String> expanding = new LinkedHashSet<>(); // active include chain
  private final Set<String> reportedCycles = new HashSet<>();

  public ReferenceResolver(List<Place> places, List<Component> components) {
    this.symbols = new SymbolTable(places, components);
    this.errors.addAll(symbols.errors());
  }

  public Breadboard resolve() {
    List<Component> components = new ArrayList<>();
    for (Component component : symbols.components()) {
      components.add(component.withAffordances(expandComponent(component, null)));
      checkConnections(component.affordances, "component '" + component.name + "'");
    }

    List<Place> places = new ArrayList<>();
    for (Place place : symbols.places()) {
      places.add(place.withAffordances(expand(place.affordances)));
      checkConnections(place.affordances, "place '" + place.name + "'");
    }

    log.debug("Resolved references for {} places and {} components ({} errors)",
        places.size(), components.size(), errors.size());
    return new Breadboard(places, components);
  }

  public List<Diagnostic> errors() {
    return errors;
  }

  public SymbolTable symbols() {
    return symbols;
  }

  // Returns the component's forest with all nested includes expanded
  AffordanceForest expandComponent(Component component, Affordance includeSite) {
    AffordanceForest done = expanded.get(component.name);
    if (done != null) {
      return done;
    }
    if (expanding.contains(component.name)) {
      reportIncludeCycle(component.name, includeSite);
      return AffordanceForest.EMPTY;
    }
    expanding.add(component.name);
    AffordanceForest forest = expand(component.affordances);
    expanding.remove(component.name);
    expanded.put(component.name, forest);
    return forest;
  }

  AffordanceForest expand(AffordanceForest source) {
    if (!source.hasIncludes()) {
      return source.copy();
    }
    ForestBuilder builder = new ForestBuilder();
    for (Affordance root : source.roots()) {
      copy(source, root, ForestBuilder.ROOT, builder);
    }
    return builder.build();
  }

  private void copy(AffordanceForest source, Affordance node, int parent, ForestBuilder builder) {
    if (node.isInclude()) {
      Component component = symbols.component(node.include);
      if (component == null) {
        String msg = symbols.place(node.include) != null
            ? "Cannot include place '" + node.include + "': only components can be included"
            : "Unknown component '" + node.include + "'";
        errors.add(new Diagnostic(DiagnosticKind.UNKNOWN_REFERENCE, msg, node.location()));
        return;
      }
      builder.graft(expandComponent(component, node), parent);
      return;
    }

    int id = builder.addAffordance(parent, node.label, node.description, node.location());
    for (Connection c : node.connections) {
      builder.addConnection(id, c);
    }
    for (Affordance child : source.children(node)) {
      copy(source, child, id, builder);
    }
  }

  private void reportIncludeCycle(String name, Affordance includeSite) {
    List<String> cycle = new ArrayList<>();
    boolean inCycle = false;
    for (String n : expanding) {
      inCycle |= n.equals(name);
      if (inCycle) cycle.add(n);
    }
    cycle.add(name);
    if (reportedCycles.add(String.join("\u0000", new TreeSet<>(cycle)))) {
      errors.add(new Diagnostic(DiagnosticKind.CYCLIC_INCLUDE,
          "Cyclic include: " + String.join(" -> ", cycle),
          includeSite != null ? includeSite.location() : null));
    }
  }

  // Checks the declared (unexpanded) forest, so an included connection is reported only once
  private void checkConnections(AffordanceForest forest, String owner) {
    for (Affordance node : forest.nodes) {
      for (Connection c : node.connections) {
        if (symbols.place(c.target) == null) {
          log.debug("Unknown connection target '{}' in {}", c.target, owner);
          errors.add(new Diagnostic(DiagnosticKind.UNKNOWN_PLACE,
              "Unknown place '" + c.target + "'", c.location()));
        }
      }
    }
  }
}
