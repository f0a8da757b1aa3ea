package org.breadnbutter.resolve;

import static org.breadnbutter.test.Fixtures.lines;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.breadnbutter.compiler.BreadboardCompiler;
import org.breadnbutter.compiler.Diagnostic;
import org.breadnbutter.compiler.DiagnosticKind;
import org.breadnbutter.compiler.ParsedDocument;
import org.breadnbutter.compiler.RegionMatching;
import org.breadnbutter.compiler.SourceDocument;
import org.breadnbutter.model.Affordance;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.ClickableRegion;
import org.breadnbutter.model.Place;
import org.junit.jupiter.api.Test;

class SketchRegionValidatorTest {

  private static Breadboard board(String text) {
    ParsedDocument doc = new BreadboardCompiler().parse(new SourceDocument("sketch.bnb", text));
    assertTrue(doc.errors.isEmpty(), () -> doc.errors.toString());
    return new ReferenceResolver(doc.places, doc.components).resolve();
  }

  private static List<DiagnosticKind> kinds(List<Diagnostic> errors) {
    return errors.stream().map(d -> d.kind).collect(Collectors.toList());
  }

  @Test
  void testRegionsMatchingOneConnectedAffordance() {
    Breadboard board = board(lines(
        "place A",
        "  include Nav",
        "  Save -> A",
        "  sketch a.png",
        "    [0,0 10,10] Save",
        "    [10,0 20,10] Home",
        "component Nav",
        "  Home -> A"));

    assertTrue(new SketchRegionValidator(RegionMatching.EXACT).validate(board).isEmpty());
  }

  @Test
  void testRegionWithoutMatch() {
    List<Diagnostic> errors = new SketchRegionValidator(RegionMatching.EXACT).validate(board(lines(
        "place A",
        "  Save -> A",
        "  sketch a.png",
        "    [0,0 10,10] Submit")));

    assertEquals(List.of(DiagnosticKind.UNMATCHED_REGION), kinds(errors));
    assertEquals("Region [0,0 10,10] Submit in place 'A' matches no affordance labelled 'Submit'",
        errors.get(0).message);
    assertEquals(4, errors.get(0).location.line);
  }

  @Test
  void testAmbiguousRegion() {
    List<Diagnostic> errors = new SketchRegionValidator(RegionMatching.EXACT).validate(board(lines(
        "place A",
        "  Save -> A",
        "  Menu",
        "  > Save -> A",
        "  sketch a.png",
        "    [0,0 10,10] Save")));

    assertEquals(List.of(DiagnosticKind.UNMATCHED_REGION), kinds(errors));
    assertTrue(errors.get(0).message.contains("matches 2 affordances"), errors.get(0).message);
  }

  @Test
  void testMatchedAffordanceMustNavigate() {
    List<Diagnostic> errors = new SketchRegionValidator(RegionMatching.EXACT).validate(board(lines(
        "place A",
        "  include Nav",
        "  sketch a.png",
        "    [0,0 10,10] Logo",
        "component Nav",
        "  Logo")));

    assertEquals(List.of(DiagnosticKind.AFFORDANCE_WITHOUT_CONNECTION), kinds(errors));
  }

  @Test
  void testNormalizedMatching() {
    Breadboard board = board(lines(
        "place A",
        "  Sign Up -> A",
        "  sketch a.png",
        "    [0,0 10,10] sign   UP"));

    assertEquals(1, new SketchRegionValidator(RegionMatching.EXACT).validate(board).size());
    assertTrue(new SketchRegionValidator(RegionMatching.NORMALIZED).validate(board).isEmpty());
  }

  @Test
  void testValidateReturnsTheMatch() {
    Breadboard board = board(lines("place A", "  Go -> A", "  Stay"));
    Place a = board.place("A");
    SketchRegionValidator validator = new SketchRegionValidator(RegionMatching.EXACT);

    Affordance match = validator.validate(a, new ClickableRegion(0, 0, 5, 5, "Go"));
    assertEquals("Go", match.label);
    assertNull(validator.validate(a, new ClickableRegion(0, 0, 5, 5, "Stay")));
    assertEquals(1, validator.errors().size());
  }

  @Test
  void testPlacesWithoutSketchAreSkipped() {
    assertTrue(new SketchRegionValidator(RegionMatching.EXACT).validate(board("place A")).isEmpty());
  }
}
