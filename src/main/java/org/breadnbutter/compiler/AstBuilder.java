package org.breadnbutter.compiler;

import java.util.ArrayList;
import java.util.List;

import org.breadnbutter.compiler.ParseTree.Block;
import org.breadnbutter.compiler.ParseTree.BlockKind;
import org.breadnbutter.compiler.ParseTree.ConnectionNode;
import org.breadnbutter.compiler.ParseTree.CoordinateNode;
import org.breadnbutter.compiler.ParseTree.Item;
import org.breadnbutter.compiler.ParseTree.RegionNode;
import org.breadnbutter.model.AffordanceForest;
import org.breadnbutter.model.ClickableRegion;
import org.breadnbutter.model.Component;
import org.breadnbutter.model.Connection;
import org.breadnbutter.model.Coordinate;
import org.breadnbutter.model.ForestBuilder;
import org.breadnbutter.model.Place;
import org.breadnbutter.model.Position;
import org.breadnbutter.model.Sketch;

/**
 * Materializes the typed model from a {@link ParseTree}.
 *
 * <p>Affordance ids are handed out in declaration order, so the same source always yields the
 * same ids. No name is looked up here.
 */
public class AstBuilder {

  public ParsedDocument build(ParseTree tree, List<Diagnostic> syntaxErrors) {
    List<Place> places = new ArrayList<>();
    List<Component> components = new ArrayList<>();
    for (Block block : tree.blocks) {
      AffordanceForest forest = buildForest(block.items);
      if (block.kind == BlockKind.COMPONENT) {
        components.add(new Component(block.name, block.description, forest, block.location));
      } else {
        places.add(new Place(block.name, block.description, forest, buildPosition(block),
            null, buildSketch(block), block.location));
      }
    }
    return new ParsedDocument(tree.source, places, components, syntaxErrors);
  }

  AffordanceForest buildForest(List<Item> items) {
    ForestBuilder builder = new ForestBuilder();
    for (Item item : items) {
      addItem(builder, item, ForestBuilder.ROOT);
    }
    return builder.build();
  }

  private void addItem(ForestBuilder builder, Item item, int parent) {
    if (item.isInclude()) {
      builder.addInclude(parent, item.include, item.location);
      return;
    }
    int id = builder.addAffordance(parent, item.label, item.description, item.location);
    for (ConnectionNode c : item.connections) {
      builder.addConnection(id, new Connection(c.label, c.target, c.location));
    }
    for (Item child : item.children) {
      addItem(builder, child, id);
    }
  }

  private Position buildPosition(Block block) {
    if (block.position == null) {
      return null;
    }
    return new Position(coordinate(block.position.x), coordinate(block.position.y), block.position.location);
  }

  private Coordinate coordinate(CoordinateNode node) {
    if (node.place == null) {
      return Coordinate.absolute(node.offset);
    }
    return Coordinate.relative(node.place, node.pivot, node.offset);
  }

  private Sketch buildSketch(Block block) {
    if (block.sketch == null) {
      return null;
    }
    List<ClickableRegion> regions = new ArrayList<>();
    for (RegionNode r : block.sketch.regions) {
      regions.add(new ClickableRegion(r.top, r.left, r.bottom, r.right, r.label, r.location));
    }
    return new Sketch(block.sketch.path, regions);
  }
}
