package org.breadnbutter.compiler;

import java.util.ArrayList;
import java.util.List;

import org.breadnbutter.model.Location;
import org.breadnbutter.model.Pivot;

/**
 * Raw result of parsing one source document: the {@code place} and {@code component} blocks in
 * source order. Names are kept exactly as written; nothing is looked up yet.
 */
public class ParseTree {
  public final String source;
  public final List<Block> blocks = new ArrayList<>();

  public ParseTree(String source) {
    this.source = source;
  }

  public enum BlockKind {
    PLACE,
    COMPONENT
  }

  public static class Block {
    public final BlockKind kind;
    public final String name;
    public final String description;
    public final Location location;
    public final List<Item> items = new ArrayList<>(); // depth-0 items
    public PositionNode position;
    public SketchNode sketch;

    Block(BlockKind kind, String name, String description, Location location) {
      this.kind = kind;
      this.name = name;
      this.description = description;
      this.location = location;
    }
  }

  // An affordance line, or an include directive when `include` is set
  public static class Item {
    public final String label;
    public final String include;
    public final String description;
    public final int depth;
    public final Location location;
    public final List<Item> children = new ArrayList<>();
    public final List<ConnectionNode> connections = new ArrayList<>();

    Item(String label, String include, String description, int depth, Location location) {
      this.label = label;
      this.include = include;
      this.description = description;
      this.depth = depth;
      this.location = location;
    }

    boolean isInclude() {
      return include != null;
    }
  }

  public static class ConnectionNode {
    public final String label;
    public final String target;
    public final Location location;

    ConnectionNode(String label, String target, Location location) {
      this.label = label;
      this.target = target;
      this.location = location;
    }
  }

  // place == null means an absolute coordinate
  public static class CoordinateNode {
    public final Pivot pivot;
    public final String place;
    public final double offset;

    CoordinateNode(Pivot pivot, String place, double offset) {
      this.pivot = pivot;
      this.place = place;
      this.offset = offset;
    }
  }

  public static class PositionNode {
    public final CoordinateNode x;
    public final CoordinateNode y;
    public final Location location;

    PositionNode(CoordinateNode x, CoordinateNode y, Location location) {
      this.x = x;
      this.y = y;
      this.location = location;
    }
  }

  public static class SketchNode {
    public final String path;
    public final Location location;
    public final List<RegionNode> regions = new ArrayList<>();

    SketchNode(String path, Location location) {
      this.path = path;
      this.location = location;
    }
  }

  public static class RegionNode {
    public final int top;
    public final int left;
    public final int bottom;
    public final int right;
    public final String label;
    public final Location location;

    RegionNode(int top, int left, int bottom, int right, String label, Location location) {
      this.top = top;
      this.left = left;
      this.bottom = bottom;
      this.right = right;
      this.label = label;
      this.location = location;
    }
  }
}
