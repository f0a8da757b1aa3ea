package org.breadnbutter.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AffordanceForestTest {

  private AffordanceForest forest;

  // Menu { Profile { Edit -> Settings }, Logout -> Home }, Help
  @BeforeEach
  void setUp() {
    ForestBuilder builder = new ForestBuilder();
    int menu = builder.addAffordance(ForestBuilder.ROOT, "Menu", null, null);
    int profile = builder.addAffordance(menu, "Profile", "Your account", null);
    int edit = builder.addAffordance(profile, "Edit", null, null);
    builder.addConnection(edit, new Connection(null, "Settings"));
    int logout = builder.addAffordance(menu, "Logout", null, null);
    builder.addConnection(logout, new Connection("bye", "Home"));
    builder.addAffordance(ForestBuilder.ROOT, "Help", null, null);
    forest = builder.build();
  }

  private static List<String> labels(List<Affordance> nodes) {
    return nodes.stream().map(a -> a.label).collect(Collectors.toList());
  }

  @Test
  void testIdsAreArenaIndices() {
    assertEquals(5, forest.size());
    for (int i = 0; i < forest.size(); i++) {
      assertEquals(i, forest.get(i).id);
    }
    assertEquals(List.of(0, 4), forest.roots);
    assertEquals(List.of("Profile", "Logout"), labels(forest.children(forest.get(0))));
  }

  @Test
  void testPreorder() {
    assertEquals(List.of("Menu", "Profile", "Edit", "Logout", "Help"), labels(forest.preorder()));
  }

  @Test
  void testFind() {
    assertEquals(List.of("Edit", "Logout"), labels(forest.find(Affordance::hasConnections)));
    assertEquals(2, forest.findByLabel("Edit").get(0).id);
    assertTrue(forest.findByLabel("Nope").isEmpty());
  }

  @Test
  void testWithConnectionLeavesOriginalUntouched() {
    AffordanceForest connected = forest.withConnection(4, new Connection(null, "Docs"));

    assertFalse(forest.get(4).hasConnections());
    assertEquals(List.of(new Connection(null, "Docs")), connected.get(4).connections);
    assertNotEquals(forest, connected);
  }

  @Test
  void testCopyIsEqualButDistinct() {
    AffordanceForest copy = forest.copy();

    assertEquals(forest, copy);
    assertNotSame(forest.get(0), copy.get(0));
    assertEquals("Your account", copy.get(1).description);
  }

  @Test
  void testGraftRenumbersUnderNewParent() {
    ForestBuilder builder = new ForestBuilder();
    int top = builder.addAffordance(ForestBuilder.ROOT, "Top", null, null);
    builder.graft(forest, top);
    AffordanceForest grafted = builder.build();

    assertEquals(List.of("Top", "Menu", "Profile", "Edit", "Logout", "Help"), labels(grafted.preorder()));
    assertEquals(List.of(1, 5), grafted.get(0).children);
    assertEquals(List.of(new Connection("bye", "Home")), grafted.get(4).connections);
  }

  @Test
  void testIncludeDirectivesAreLeaves() {
    ForestBuilder builder = new ForestBuilder();
    int include = builder.addInclude(ForestBuilder.ROOT, "Header", null);

    assertThrows(IllegalArgumentException.class, () -> builder.addAffordance(include, "Child", null, null));
    assertThrows(IllegalArgumentException.class, () -> builder.addConnection(include, new Connection(null, "A")));
    AffordanceForest built = builder.build();
    assertTrue(built.hasIncludes());
    assertTrue(built.findByLabel("Header").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> built.withConnection(0, new Connection(null, "A")));
  }

  @Test
  void testEmpty() {
    assertTrue(AffordanceForest.EMPTY.isEmpty());
    assertTrue(AffordanceForest.EMPTY.preorder().isEmpty());
    assertEquals(AffordanceForest.EMPTY, new ForestBuilder().build());
  }
}
