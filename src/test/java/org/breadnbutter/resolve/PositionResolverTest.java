package org.breadnbutter.resolve;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.breadnbutter.compiler.Diagnostic;
import org.breadnbutter.compiler.DiagnosticKind;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.Coordinate;
import org.breadnbutter.model.Pivot;
import org.breadnbutter.model.Place;
import org.breadnbutter.model.Point;
import org.breadnbutter.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

class PositionResolverTest {

  private PositionResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new PositionResolver(new UniformGeometry(300, 200));
  }

  private static Place place(String name, Position position) {
    return new Place(name, null, null, position, null, null, null);
  }

  private static Position relative(String place, Pivot x, double dx, Pivot y, double dy) {
    return new Position(Coordinate.relative(place, x, dx), Coordinate.relative(place, y, dy));
  }

  private Map<String, Point> resolve(Place... places) {
    return resolver.resolvePoints(new Breadboard(List.of(places), List.of()));
  }

  @Test
  void testUndeclaredPositionUsesOrigin() {
    assertEquals(Point.ORIGIN, resolve(place("A", null)).get("A"));
  }

  @Test
  void testAbsolute() {
    assertEquals(new Point(40, 60), resolve(place("A", Position.absolute(40, 60))).get("A"));
  }

  @Test
  void testPivotsMeasureFromEdges() {
    Place ref = place("R", Position.absolute(1000, 500));

    Map<String, Point> points = resolve(ref,
        place("L", relative("R", Pivot.LEFT, 0, Pivot.TOP, 0)),
        place("B", relative("R", Pivot.RIGHT, 10, Pivot.BOTTOM, -10)),
        place("C", relative("R", Pivot.CENTER, 5, Pivot.CENTER, 0)));

    assertEquals(new Point(850, 400), points.get("L"));
    assertEquals(new Point(1160, 590), points.get("B"));
    assertEquals(new Point(1005, 500), points.get("C"));
    assertTrue(resolver.errors().isEmpty());
  }

  @Test
  void testMixedAxes() {
    Map<String, Point> points = resolve(
        place("A", Position.absolute(0, 0)),
        place("B", Position.absolute(500, 300)),
        place("C", new Position(Coordinate.relative("A", Pivot.RIGHT, 20), Coordinate.relative("B", Pivot.TOP, 0))));

    assertEquals(new Point(170, 200), points.get("C"));
  }

  @Test
  void testDeclarationOrderDoesNotMatter() {
    Map<String, Point> points = resolve(
        place("C", relative("B", Pivot.CENTER, 0, Pivot.BOTTOM, 0)),
        place("B", relative("A", Pivot.RIGHT, 10, Pivot.CENTER, 0)),
        place("A", Position.absolute(100, 50)));

    assertEquals(new Point(260, 50), points.get("B"));
    assertEquals(new Point(260, 150), points.get("C"));
  }

  @Test
  void testSelfReference() {
    Map<String, Point> points = resolve(place("A", relative("A", Pivot.RIGHT, 0, Pivot.CENTER, 0)));

    assertFalse(points.containsKey("A"));
    assertEquals(1, resolver.errors().size());
    assertEquals(DiagnosticKind.CYCLIC_POSITION, resolver.errors().get(0).kind);
    assertEquals("Cyclic position: A -> A", resolver.errors().get(0).message);
  }

  @Test
  void testTransitiveCycle() {
    Map<String, Point> points = resolve(
        place("A", relative("B", Pivot.RIGHT, 0, Pivot.CENTER, 0)),
        place("B", relative("C", Pivot.RIGHT, 0, Pivot.CENTER, 0)),
        place("C", relative("A", Pivot.RIGHT, 0, Pivot.CENTER, 0)),
        place("D", relative("A", Pivot.LEFT, 0, Pivot.CENTER, 0)),
        place("E", Position.absolute(1, 2)));

    assertEquals(List.of("Cyclic position: A -> B -> C -> A"),
        List.of(resolver.errors().get(0).message));
    assertEquals(1, resolver.errors().size());
    assertEquals(Map.of("E", new Point(1, 2)), points);
  }

  @Test
  void testCycleReachedThroughFinishedPlace() {
    Map<String, Point> points = resolve(
        place("A", new Position(Coordinate.relative("B", Pivot.CENTER, 0), Coordinate.relative("D", Pivot.CENTER, 0))),
        place("B", relative("C", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("C", relative("A", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("D", relative("B", Pivot.CENTER, 0, Pivot.CENTER, 0)));

    assertEquals(1, resolver.errors().size());
    assertEquals("Cyclic position: A -> B -> C -> A -> D -> B -> C -> A", resolver.errors().get(0).message);
    assertTrue(points.isEmpty());
  }

  @Test
  void testSeparateCyclesReportedSeparately() {
    Map<String, Point> points = resolve(
        place("A", relative("B", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("B", relative("A", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("C", relative("C", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("D", relative("C", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("E", null));

    List<String> messages = new ArrayList<>();
    for (Diagnostic error : resolver.errors()) {
      messages.add(error.message);
    }
    assertEquals(List.of("Cyclic position: A -> B -> A", "Cyclic position: C -> C"), messages);
    assertEquals(Map.of("E", Point.ORIGIN), points);
  }

  @Test
  void testUnknownPlace() {
    Map<String, Point> points = resolve(
        place("A", relative("Ghost", Pivot.CENTER, 0, Pivot.CENTER, 0)),
        place("B", relative("A", Pivot.CENTER, 0, Pivot.CENTER, 0)));

    Diagnostic error = resolver.errors().get(0);
    assertEquals(DiagnosticKind.UNKNOWN_PLACE, error.kind);
    assertEquals("Unknown place 'Ghost' in position of 'A'", error.message);
    assertEquals(1, resolver.errors().size());
    assertTrue(points.isEmpty());
  }

  @Test
  void testResolveFillsEveryPlace() {
    Breadboard board = resolver.resolve(new Breadboard(List.of(
        place("A", null),
        place("B", relative("A", Pivot.RIGHT, 50, Pivot.CENTER, 0))), List.of()));

    assertEquals(Point.ORIGIN, board.place("A").resolvedPosition);
    assertEquals(new Point(200, 0), board.place("B").resolvedPosition);
  }

  @Test
  void testCustomGeometry() {
    PlaceGeometry geometry = new PlaceGeometry() {
      @Override
      public double width(Place place) {
        return place.name.length() * 10;
      }

      @Override
      public double height(Place place) {
        return 40;
      }

      @Override
      public Point defaultPosition(Place place) {
        return new Point(-1, -1);
      }
    };
    resolver = new PositionResolver(geometry);

    Map<String, Point> points = resolve(
        place("Wide", null),
        place("B", relative("Wide", Pivot.RIGHT, 0, Pivot.BOTTOM, 0)));

    assertEquals(new Point(-1, -1), points.get("Wide"));
    assertEquals(new Point(19, 19), points.get("B"));
  }

  @Property
  void chainsResolveInAnyDeclarationOrder(@ForAll @IntRange(min = 1, max = 25) int length,
                                          @ForAll @IntRange(min = 0, max = 500) int gap,
                                          @ForAll boolean reversed) {
    List<Place> places = new ArrayList<>();
    places.add(place("P0", Position.absolute(0, 0)));
    for (int i = 1; i < length; i++) {
      places.add(place("P" + i, relative("P" + (i - 1), Pivot.RIGHT, gap, Pivot.CENTER, 0)));
    }
    if (reversed) {
      Collections.reverse(places);
    }

    PositionResolver chain = new PositionResolver(new UniformGeometry(300, 200));
    Map<String, Point> points = chain.resolvePoints(new Breadboard(places, List.of()));

    assertTrue(chain.errors().isEmpty());
    for (int i = 0; i < length; i++) {
      assertEquals(new Point((double) i * (150 + gap), 0), points.get("P" + i));
    }
  }

  @Property
  void ringsAreReportedOnce(@ForAll @IntRange(min = 1, max = 25) int length) {
    List<Place> places = new ArrayList<>();
    for (int i = 0; i < length; i++) {
      places.add(place("R" + i, relative("R" + ((i + 1) % length), Pivot.LEFT, 0, Pivot.CENTER, 0)));
    }

    PositionResolver ring = new PositionResolver(new UniformGeometry(300, 200));
    Map<String, Point> points = ring.resolvePoints(new Breadboard(places, List.of()));

    assertEquals(1, ring.errors().size());
    assertEquals(DiagnosticKind.CYCLIC_POSITION, ring.errors().get(0).kind);
    assertTrue(points.isEmpty());
  }
}
