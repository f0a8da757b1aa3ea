package org.breadnbutter.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The root document: every place and component, keyed by name in declaration order.
 *
 * <p>Places and components live in separate namespaces. A resolved breadboard is immutable and
 * may be read from several threads.
 */
public class Breadboard {
  public final Map<String, Place> places;
  public final Map<String, Component> components;

  public Breadboard(List<Place> places, List<Component> components) {
    Map<String, Place> p = new LinkedHashMap<>();
    for (Place place : places) {
      if (p.put(place.name, place) != null) {
        throw new IllegalArgumentException("Duplicate place: " + place.name);
      }
    }
    Map<String, Component> c = new LinkedHashMap<>();
    for (Component component : components) {
      if (c.put(component.name, component) != null) {
        throw new IllegalArgumentException("Duplicate component: " + component.name);
      }
    }
    this.places = Collections.unmodifiableMap(p);
    this.components = Collections.unmodifiableMap(c);
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

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Breadboard)) return false;
    Breadboard that = (Breadboard) o;
    return places.equals(that.places) && components.equals(that.components);
  }

  @Override
  public int hashCode() {
    return Objects.hash(places, components);
  }

  @Override
  public String toString() {
    return "Breadboard{places=" + places.keySet() + ", components=" + components.keySet() + '}';
  }
}
