package org.breadnbutter.json;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.breadnbutter.compiler.BreadboardCompiler;
import org.breadnbutter.compiler.CompilerOptions;
import org.breadnbutter.model.AffordanceForest;
import org.breadnbutter.model.Breadboard;
import org.breadnbutter.model.Point;
import org.breadnbutter.test.Fixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.StringLength;

class BreadboardJsonTest {

  private static Breadboard board;

  @BeforeAll
  static void compile() {
    board = new BreadboardCompiler().compile(Fixtures.registration()).orElseThrow();
  }

  @Test
  void testRoundTrip() {
    Breadboard read = BreadboardJson.fromJson(BreadboardJson.toJson(board));

    assertEquals(board, read);
    assertEquals(new Point(10, -112), read.place("Home").resolvedPosition);
    assertEquals("Support", read.place("Registration").affordances.findByLabel("Sign Up").get(0).connections.get(1).target);
  }

  @Test
  void testStreamRoundTrip() {
    StringWriter writer = new StringWriter();
    BreadboardJson.write(board, writer);

    assertEquals(board, BreadboardJson.read(new StringReader(writer.toString())));
  }

  @Test
  void testDocumentShape() {
    JsonObject json = JsonParser.parseString(BreadboardJson.toJson(board)).getAsJsonObject();

    JsonObject home = json.getAsJsonObject("places").getAsJsonObject("Home");
    assertEquals("top", home.getAsJsonObject("position").getAsJsonObject("y").get("pivot").getAsString());
    assertEquals(-112, home.getAsJsonObject("resolvedPosition").get("y").getAsDouble());
    assertEquals("sketches/home.png", home.getAsJsonObject("sketch").get("path").getAsString());
    assertFalse(home.has("location"));
    assertTrue(json.getAsJsonObject("components").has("Header"));
  }

  @Test
  void testNoHtmlEscaping() {
    Breadboard quoted = new BreadboardCompiler().compile("place \"<Login> & Co\"").orElseThrow();
    assertTrue(BreadboardJson.toJson(quoted).contains("<Login> & Co"));
  }

  @Test
  void testRejectsNonBreadboards() {
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(""));
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson("{}"));
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson("{\"places\": [1, 2"));
  }

  @Test
  void testReadBoardIsImmutable() {
    Breadboard read = BreadboardJson.fromJson(BreadboardJson.toJson(board));

    assertThrows(UnsupportedOperationException.class, () -> read.places.remove("Home"));
    assertThrows(UnsupportedOperationException.class, () -> read.components.clear());
    AffordanceForest forest = read.place("Home").affordances;
    assertThrows(UnsupportedOperationException.class, () -> forest.nodes.remove(0));
    assertThrows(UnsupportedOperationException.class, () -> forest.roots.add(9));
    assertThrows(UnsupportedOperationException.class, () -> forest.get(2).children.clear());
    assertThrows(UnsupportedOperationException.class, () -> forest.get(1).connections.clear());
    assertThrows(UnsupportedOperationException.class,
        () -> read.place("Registration").sketch.regions.clear());
  }

  @Test
  void testKeyMustMatchName() {
    JsonObject json = JsonParser.parseString(BreadboardJson.toJson(board)).getAsJsonObject();
    JsonObject places = json.getAsJsonObject("places");
    places.add("Elsewhere", places.remove("Home"));

    JsonParseException e = assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(json.toString()));
    assertTrue(e.getMessage().contains("'Elsewhere'"), e.getMessage());
  }

  @Test
  void testMalformedForestsRejected() {
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(editHomeNodes(nodes ->
        nodes.get(2).getAsJsonObject().getAsJsonArray("children").add(99))));
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(editHomeNodes(nodes ->
        nodes.get(0).getAsJsonObject().addProperty("id", 7))));
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(editHomeNodes(nodes ->
        nodes.get(4).getAsJsonObject().getAsJsonArray("children").add(2))));
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(editHomeNodes(nodes ->
        nodes.get(1).getAsJsonObject().remove("label"))));
    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(editHomeNodes(nodes ->
        nodes.add(nodes.get(0).deepCopy()))));
  }

  @Test
  void testInvalidRegionRejected() {
    JsonObject json = JsonParser.parseString(BreadboardJson.toJson(board)).getAsJsonObject();
    json.getAsJsonObject("places").getAsJsonObject("Registration").getAsJsonObject("sketch")
        .getAsJsonArray("regions").get(0).getAsJsonObject().addProperty("right", 0);

    assertThrows(JsonParseException.class, () -> BreadboardJson.fromJson(json.toString()));
  }

  // Home's forest: Logo, Contact, Dashboard { Recent Activity { Open Item }, Settings }
  private static String editHomeNodes(Consumer<JsonArray> edit) {
    JsonObject json = JsonParser.parseString(BreadboardJson.toJson(board)).getAsJsonObject();
    edit.accept(json.getAsJsonObject("places").getAsJsonObject("Home")
        .getAsJsonObject("affordances").getAsJsonArray("nodes"));
    return json.toString();
  }

  @Property(tries = 50)
  void generatedBoardsSurviveRoundTrip(@ForAll @IntRange(min = 1, max = 8) int count,
                                       @ForAll @IntRange(min = -500, max = 500) int x,
                                       @ForAll @AlphaChars @StringLength(min = 1, max = 12) String label) {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      lines.add("place P" + i);
      lines.add("  \"" + label + "\" -> (next) P" + ((i + 1) % count));
      lines.add("  > Nested");
      lines.add(i == 0 ? "  position " + x + ", 7" : "  position > P" + (i - 1) + " + " + i);
    }
    BreadboardCompiler compiler = new BreadboardCompiler(CompilerOptions.defaults().withParallelParsing(false));
    Breadboard generated = compiler.compile(String.join("\n", lines)).orElseThrow();

    assertEquals(generated, BreadboardJson.fromJson(BreadboardJson.toJson(generated)));
  }
}
