package org.breadnbutter.json;

import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.breadnbutter.model.Affordance;
import org.breadnbutter.model.AffordanceForest;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.ClickableRegion;
import org.breadnbutter.model.Component;
import org.breadnbutter.model.Connection;
import org.breadnbutter.model.Coordinate;
import org.breadnbutter.model.ForestBuilder;
import org.breadnbutter.model.Place;
import org.breadnbutter.model.Position;
import org.breadnbutter.model.Sketch;

/**
 * Converts a {@link Breadboard} to and from JSON.
 *
 * <p>Fields map one to one onto the model. Source locations are diagnostic metadata and are
 * not written. Reading back what was written yields an equal breadboard. Documents are rebuilt
 * through the model constructors on the way in, so a map key that differs from the entry's
 * name, or a forest whose ids do not match its structure, is rejected.
 */
public final class BreadboardJson {
  private static final Gson GSON = new GsonBuilder()
      .setPrettyPrinting()
      .disableHtmlEscaping()
      .create();

  private BreadboardJson() {}

  public static String toJson(Breadboard breadboard) {
    return GSON.toJson(breadboard);
  }

  /**
   * @throws com.google.gson.JsonIOException if writing fails
   */
  public static void write(Breadboard breadboard, Writer writer) {
    GSON.toJson(breadboard, writer);
  }

  /**
   * @throws JsonParseException if the text is not a breadboard document
   */
  public static Breadboard fromJson(String json) {
    return check(GSON.fromJson(json, Breadboard.class));
  }

  public static Breadboard read(Reader reader) {
    return check(GSON.fromJson(reader, Breadboard.class));
  }

  // Gson fills fields without running constructors, so the raw result is rebuilt through them
  private static Breadboard check(Breadboard raw) {
    if (raw == null) {
      throw new JsonParseException("Empty breadboard document");
    }
    if (raw.places == null || raw.components == null) {
      throw new JsonParseException("Breadboard document needs both 'places' and 'components'");
    }
    try {
      List<Place> places = new ArrayList<>();
      for (Map.Entry<String, Place> entry : raw.places.entrySet()) {
        Place place = entry.getValue();
        checkName(entry.getKey(), place != null ? place.name : null, "place");
        places.add(new Place(place.name, place.description, forest(place.affordances, "place '" + place.name + "'"),
            position(place.position), place.resolvedPosition, sketch(place.sketch), null));
      }
      List<Component> components = new ArrayList<>();
      for (Map.Entry<String, Component> entry : raw.components.entrySet()) {
        Component component = entry.getValue();
        checkName(entry.getKey(), component != null ? component.name : null, "component");
        components.add(new Component(component.name, component.description,
            forest(component.affordances, "component '" + component.name + "'"), null));
      }
      return new Breadboard(places, components);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new JsonParseException("Invalid breadboard document: " + e.getMessage(), e);
    }
  }

  private static void checkName(String key, String name, String what) {
    if (!key.equals(name)) {
      throw new JsonParseException("The " + what + " under key '" + key + "' is named '" + name + "'");
    }
  }

  private static Position position(Position raw) {
    if (raw == null) {
      return null;
    }
    return new Position(coordinate(raw.x), coordinate(raw.y));
  }

  private static Coordinate coordinate(Coordinate raw) {
    if (raw == null) {
      throw new JsonParseException("Position is missing a coordinate");
    }
    if (raw.place == null) {
      return Coordinate.absolute(raw.offset);
    }
    return Coordinate.relative(raw.place, raw.pivot, raw.offset);
  }

  private static Sketch sketch(Sketch raw) {
    if (raw == null) {
      return null;
    }
    List<ClickableRegion> regions = new ArrayList<>();
    for (ClickableRegion r : raw.regions) {
      regions.add(new ClickableRegion(r.top, r.left, r.bottom, r.right, r.affordance));
    }
    return new Sketch(raw.path, regions);
  }

  /**
   * Copies a forest node by node, starting from its roots. Every node must be reached exactly
   * once and the copy must give it the id it was stored with.
   */
  private static AffordanceForest forest(AffordanceForest raw, String owner) {
    if (raw == null || raw.nodes == null || raw.roots == null) {
      throw new JsonParseException("Malformed affordances of " + owner);
    }
    ForestBuilder builder = new ForestBuilder();
    for (Integer root : raw.roots) {
      copy(raw, root, ForestBuilder.ROOT, builder, owner);
    }
    if (builder.size() != raw.nodes.size()) {
      throw new JsonParseException("Affordances of " + owner + " has " + (raw.nodes.size() - builder.size())
          + " node(s) not reachable from a root");
    }
    return builder.build();
  }

  private static void copy(AffordanceForest raw, Integer id, int parent, ForestBuilder builder, String owner) {
    if (id == null || id < 0 || id >= raw.nodes.size()) {
      throw new JsonParseException("Affordance id " + id + " out of range in " + owner);
    }
    Affordance node = raw.nodes.get(id);
    if (node == null || node.id != id) {
      throw new JsonParseException("Affordance at index " + id + " of " + owner + " has the wrong id");
    }
    if (builder.size() != id) {
      throw new JsonParseException("Affordances of " + owner + " are not in declaration order at id " + id);
    }
    int copied = node.isInclude()
        ? builder.addInclude(parent, node.include, null)
        : builder.addAffordance(parent, node.label, node.description, null);
    if (node.connections != null) {
      for (Connection c : node.connections) {
        builder.addConnection(copied, new Connection(c.label, c.target));
      }
    }
    if (node.children != null) {
      for (Integer child : node.children) {
        copy(raw, child, copied, builder, owner);
      }
    }
  }
}
