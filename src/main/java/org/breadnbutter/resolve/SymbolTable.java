package org.breadnbutter.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.breadnbutter.compiler.Diagnostic;
import org.breadnbutter.compiler.DiagnosticKind;
import org.breadnbutter.model.Component;
import org.breadnbutter.model.Location;
import org.breadnbutter.model.Place;

/**
 * Declared names across every document of a compilation.
 *
 * <p>Places and components are separate namespaces. A name declared twice in the same namespace
 * is reported as {@link DiagnosticKind#DUPLICATE_NAME}; the first declaration stays in the table.
 */
public class SymbolTable {
  private final Map<String, Place> places = new LinkedHashMap<>();
  private final Map<String, Component> components = new LinkedHashMap<>();
  private final List<Diagnostic> errors = new ArrayList<>();

  public SymbolTable(Collection<Place> places, Collection<Component> components) {
    for (Place place : places) {
      declare(place);
    }
    for (Component component : components) {
      declare(component);
    }
  }

  void declare(Place place) {
    Place first = places.putIfAbsent(place.name, place);
    if (first != null) {
      errors.add(new Diagnostic(DiagnosticKind.DUPLICATE_NAME,
          "Duplicate place '" + place.name + "'" + firstDeclared(first.location()), place.location()));
    }
  }

  void declare(Component component) {
    Component first = components.putIfAbsent(component.name, component);
    if (first != null) {
      errors.add(new Diagnostic(DiagnosticKind.DUPLICATE_NAME,
          "Duplicate component '" + component.name + "'" + firstDeclared(first.location()), component.location()));
    }
  }

  private static String firstDeclared(Location location) {
    return location != null ? " (first declared at " + location + ")" : "";
  }

  public Place place(String name) {
    return places.get(name);
  }

  public Component component(String name) {
    return components.get(name);
  }

  public Collection<Place> places() {
    return places.values();
  }

  public Collection<Component> components() {
    return components.values();
  }

  public List<Diagnostic> errors() {
    return errors;
  }
}
