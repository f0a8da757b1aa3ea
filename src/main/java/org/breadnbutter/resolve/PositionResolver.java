package org.breadnbutter.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.breadnbutter.compiler.Diagnostic;
import org.breadnbutter.compiler.DiagnosticKind;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.Coordinate;
import org.breadnbutter.model.Location;
import org.breadnbutter.model.Place;
import org.breadnbutter.model.Point;
import org.breadnbutter.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the absolute center of every place.
 *
 * <p>Positions form a graph: A depends on B when A's position names B. All cycles are found
 * before any coordinate is computed. Places are then evaluated in dependency order. A place on
 * a cycle, or one that depends on a cycle or an unknown place, gets no point. A place without
 * a declared position gets {@link PlaceGeometry#defaultPosition}.
 */
public class PositionResolver {
  private static final Logger log = LoggerFactory.getLogger(PositionResolver.class);

  private final PlaceGeometry geometry;
  private final List<Diagnostic> errors = new ArrayList<>();

  public PositionResolver(PlaceGeometry geometry) {
    this.geometry = geometry;
  }

  public Breadboard resolve(Breadboard board) {
    Map<String, Point> points = resolvePoints(board);
    List<Place> places = new ArrayList<>();
    for (Place place : board.places()) {
      places.add(place.withResolvedPosition(points.get(place.name)));
    }
    return new Breadboard(places, new ArrayList<>(board.components()));
  }

  public List<Diagnostic> errors() {
    return errors;
  }

  /**
   * @return the resolved point per place name; places that could not be resolved are absent
   */
  public Map<String, Point> resolvePoints(Breadboard board) {
    Map<String, List<String>> edges = new LinkedHashMap<>();
    Set<String> broken = new HashSet<>();
    for (Place place : board.places()) {
      List<String> deps = new ArrayList<>();
      if (place.position != null) {
        for (String ref : place.position.references()) {
          if (board.place(ref) == null) {
            Location at = place.position.location() != null ? place.position.location() : place.location();
            errors.add(new Diagnostic(DiagnosticKind.UNKNOWN_PLACE,
                "Unknown place '" + ref + "' in position of '" + place.name + "'", at));
            broken.add(place.name);
          } else {
            deps.add(ref);
          }
        }
      }
      edges.put(place.name, deps);
    }

    List<String> order = new ArrayList<>();
    Set<String> cyclic = findCycles(board, edges, order);

    Map<String, Point> points = new HashMap<>();
    for (String name : order) {
      if (broken.contains(name) || cyclic.contains(name)) {
        continue;
      }
      boolean ready = true;
      for (String dep : edges.get(name)) {
        ready &= points.containsKey(dep);
      }
      if (!ready) {
        log.debug("Skipping position of '{}': depends on an unresolved place", name);
        continue;
      }
      Place place = board.place(name);
      points.put(name, evaluate(board, place, points));
    }
    log.debug("Resolved {} of {} place positions", points.size(), board.places.size());
    return points;
  }

  /**
   * Finds the strongly connected components of the position graph with an iterative version of
   * Tarjan's algorithm. Every component of more than one place, or of a single place that
   * references itself, is a cycle and is reported once, with a closed path through all of its
   * places. Components come out dependencies first, and are appended to {@code order} in that
   * sequence.
   *
   * @return names of all places that lie on a cycle
   */
  Set<String> findCycles(Breadboard board, Map<String, List<String>> edges, List<String> order) {
    Map<String, Integer> index = new HashMap<>();
    Map<String, Integer> low = new HashMap<>();
    Deque<String> stack = new ArrayDeque<>();
    Set<String> onStack = new HashSet<>();
    Set<String> cyclic = new HashSet<>();
    int counter = 0;

    for (String start : edges.keySet()) {
      if (index.containsKey(start)) {
        continue;
      }
      List<String> path = new ArrayList<>();
      Deque<int[]> next = new ArrayDeque<>(); // next edge index per frame
      counter = visit(start, counter, index, low, stack, onStack, path, next);

      while (!path.isEmpty()) {
        String node = path.get(path.size() - 1);
        int[] frame = next.peek();
        List<String> deps = edges.get(node);
        if (frame[0] < deps.size()) {
          String dep = deps.get(frame[0]++);
          if (!index.containsKey(dep)) {
            counter = visit(dep, counter, index, low, stack, onStack, path, next);
          } else if (onStack.contains(dep)) {
            low.put(node, Math.min(low.get(node), index.get(dep)));
          }
          continue;
        }

        path.remove(path.size() - 1);
        next.pop();
        if (!path.isEmpty()) {
          String parent = path.get(path.size() - 1);
          low.put(parent, Math.min(low.get(parent), low.get(node)));
        }
        if (low.get(node).equals(index.get(node))) {
          Set<String> component = new HashSet<>();
          String member;
          do {
            member = stack.pop();
            onStack.remove(member);
            component.add(member);
            order.add(member);
          } while (!member.equals(node));

          if (component.size() > 1 || edges.get(node).contains(node)) {
            cyclic.addAll(component);
            reportCycle(board, edges, component);
          }
        }
      }
    }
    return cyclic;
  }

  private static int visit(String node, int counter, Map<String, Integer> index, Map<String, Integer> low,
                           Deque<String> stack, Set<String> onStack, List<String> path, Deque<int[]> next) {
    index.put(node, counter);
    low.put(node, counter);
    stack.push(node);
    onStack.add(node);
    path.add(node);
    next.push(new int[] {0});
    return counter + 1;
  }

  // Walks from the first declared member through every other member and back again
  private void reportCycle(Breadboard board, Map<String, List<String>> edges, Set<String> component) {
    String first = null;
    for (String name : edges.keySet()) {
      if (component.contains(name)) {
        first = name;
        break;
      }
    }
    List<String> walk = new ArrayList<>();
    walk.add(first);
    Set<String> seen = new HashSet<>(walk);
    String at = first;
    while (seen.size() < component.size()) {
      List<String> leg = shortestPath(edges, component, at, n -> !seen.contains(n));
      walk.addAll(leg);
      seen.addAll(leg);
      at = leg.get(leg.size() - 1);
    }
    String start = first;
    walk.addAll(shortestPath(edges, component, at, n -> n.equals(start)));

    Place place = board.place(first);
    errors.add(new Diagnostic(DiagnosticKind.CYCLIC_POSITION,
        "Cyclic position: " + String.join(" -> ", walk),
        place.position.location() != null ? place.position.location() : place.location()));
  }

  /**
   * Breadth-first search inside one component, taking at least one edge.
   *
   * @return the places after {@code from} up to and including the first one accepted by
   *     {@code goal}
   */
  private static List<String> shortestPath(Map<String, List<String>> edges, Set<String> component,
                                           String from, Predicate<String> goal) {
    Map<String, String> previous = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(from);
    while (!queue.isEmpty()) {
      String node = queue.poll();
      for (String dep : edges.get(node)) {
        if (!component.contains(dep) || previous.containsKey(dep)) {
          continue;
        }
        previous.put(dep, node);
        if (goal.test(dep)) {
          List<String> leg = new ArrayList<>();
          String n = dep;
          while (true) {
            leg.add(0, n);
            String p = previous.get(n);
            if (p.equals(from)) {
              break;
            }
            n = p;
          }
          return leg;
        }
        queue.add(dep);
      }
    }
    throw new IllegalStateException("No path from '" + from + "' inside its own cycle");
  }

  private Point evaluate(Breadboard board, Place place, Map<String, Point> points) {
    Position position = place.position;
    if (position == null) {
      return geometry.defaultPosition(place);
    }
    double x = axis(board, position.x, points, true);
    double y = axis(board, position.y, points, false);
    return new Point(x, y);
  }

  private double axis(Breadboard board, Coordinate coordinate, Map<String, Point> points, boolean horizontal) {
    if (coordinate.isAbsolute()) {
      return coordinate.offset;
    }
    Place ref = board.place(coordinate.place);
    Point origin = points.get(coordinate.place);
    double center = horizontal ? origin.x : origin.y;
    double half = (horizontal ? geometry.width(ref) : geometry.height(ref)) / 2;

    double base;
    switch (coordinate.pivot) {
      case LEFT:
      case TOP:
        base = center - half;
        break;
      case RIGHT:
      case BOTTOM:
        base = center + half;
        break;
      default:
        base = center;
        break;
    }
    return base + coordinate.offset;
  }
}
