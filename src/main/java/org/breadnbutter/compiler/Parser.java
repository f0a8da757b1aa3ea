package org.breadnbutter.compiler;

import java.util.ArrayList;
import java.util.List;

import org.breadnbutter.compiler.ParseTree.Block;
import org.breadnbutter.compiler.ParseTree.BlockKind;
import org.breadnbutter.compiler.ParseTree.ConnectionNode;
import org.breadnbutter.compiler.ParseTree.CoordinateNode;
import org.breadnbutter.compiler.ParseTree.Item;
import org.breadnbutter.compiler.ParseTree.PositionNode;
import org.breadnbutter.compiler.ParseTree.RegionNode;
import org.breadnbutter.compiler.ParseTree.SketchNode;
import org.breadnbutter.model.Location;
import org.breadnbutter.model.Pivot;

/**
 * Groups a token stream into {@code place} and {@code component} blocks.
 *
 * <p>Works one logical line at a time. A malformed line is recorded as a
 * {@link DiagnosticKind#SYNTAX_ERROR} and skipped; parsing carries on with the next line, so a
 * single pass reports every syntax problem in the document.
 */
public class Parser {
  private final Iterable<Token> tokens;
  private final String source;
  private final List<Diagnostic> errors = new ArrayList<>();

  private ParseTree tree;
  private Block block;
  private final List<Item> open = new ArrayList<>(); // open.get(d) = latest item at depth d
  private final List<String> pendingDescription = new ArrayList<>();
  private boolean inSketch;

  public Parser(Iterable<Token> tokens, String source) {
    this.tokens = tokens;
    this.source = source;
  }

  public ParseTree parse() {
    tree = new ParseTree(source);
    block = null;
    open.clear();
    pendingDescription.clear();
    errors.clear();
    inSketch = false;

    List<Token> line = new ArrayList<>();
    for (Token t : tokens) {
      if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF)) {
        if (!line.isEmpty()) {
          parseLine(line);
        }
        line = new ArrayList<>();
      } else {
        line.add(t);
      }
    }
    return tree;
  }

  public List<Diagnostic> errors() {
    return errors;
  }

  void syntaxError(String msg, Token at) {
    errors.add(new Diagnostic(DiagnosticKind.SYNTAX_ERROR, msg, at.location(source)));
  }

  private Location loc(Token t) {
    return t.location(source);
  }

  void parseLine(List<Token> line) {
    Token first = line.get(0);
    for (Token t : line) {
      if (t.is(TokenType.ERROR)) {
        syntaxError(t.text, t);
        return;
      }
    }
    if (first.is(TokenType.DESCRIPTION)) {
      pendingDescription.add(first.text);
      return;
    }

    Cursor c = new Cursor(line);
    int depth = 0;
    if (c.peekIs(TokenType.MARKER)) {
      depth = c.next().text.length();
      if (c.atEnd()) {
        syntaxError("Expected an affordance after nesting markers", first);
        return;
      }
    }

    Token head = c.next();
    boolean sketchLine = false;
    if (head.is(TokenType.PLACE) || head.is(TokenType.COMPONENT)) {
      startBlock(head, c, depth);
    } else if (block == null) {
      syntaxError("Expected 'place' or 'component' but found '" + head.text + "'", head);
    } else {
      switch (head.type) {
        case INCLUDE:
          parseInclude(head, c, depth);
          break;
        case POSITION:
          parsePosition(head, c, depth);
          break;
        case SKETCH:
          sketchLine = parseSketch(head, c, depth);
          break;
        case REGION_OPEN:
          parseRegion(head, c, depth);
          sketchLine = inSketch;
          break;
        case ARROW:
          c.back();
          parseContinuation(head, c, depth);
          break;
        case TEXT:
          parseAffordance(head, c, depth);
          break;
        default:
          syntaxError("Unexpected '" + head.text + "'", head);
          break;
      }
    }
    inSketch = sketchLine;
  }

  void startBlock(Token keyword, Cursor c, int depth) {
    BlockKind kind = keyword.is(TokenType.PLACE) ? BlockKind.PLACE : BlockKind.COMPONENT;
    open.clear();
    String what = keyword.text;
    if (depth > 0) {
      syntaxError("'" + what + "' cannot be nested", keyword);
      block = detached(kind, keyword);
      return;
    }
    Token name = c.nextIf(TokenType.TEXT);
    if (name == null || name.text.isEmpty()) {
      syntaxError("Expected " + what + " name after '" + what + "'", keyword);
      block = detached(kind, keyword);
      return;
    }
    block = new Block(kind, name.text, takeDescription(), loc(keyword));
    tree.blocks.add(block);
  }

  // Keeps parsing the lines of a broken block header without adding the block to the tree
  private Block detached(BlockKind kind, Token keyword) {
    pendingDescription.clear();
    return new Block(kind, null, null, loc(keyword));
  }

  void parseInclude(Token keyword, Cursor c, int depth) {
    Token name = c.nextIf(TokenType.TEXT);
    if (name == null || name.text.isEmpty()) {
      syntaxError("Expected component name after 'include'", keyword);
      return;
    }
    attach(new Item(null, name.text, null, depth, loc(keyword)), keyword);
  }

  void parseAffordance(Token label, Cursor c, int depth) {
    if (label.text.isEmpty()) {
      syntaxError("Expected affordance label", label);
      return;
    }
    List<ConnectionNode> connections = parseConnections(c);
    if (connections == null) {
      return;
    }
    Item item = new Item(label.text, null, takeDescription(), depth, loc(label));
    if (attach(item, label)) {
      item.connections.addAll(connections);
    }
  }

  // A line made only of arrows continues the latest affordance at the same depth
  void parseContinuation(Token arrow, Cursor c, int depth) {
    List<ConnectionNode> connections = parseConnections(c);
    if (connections == null) {
      return;
    }
    if (depth >= open.size()) {
      syntaxError("No affordance at depth " + depth + " to attach connections to", arrow);
      return;
    }
    Item target = open.get(depth);
    if (target.isInclude()) {
      syntaxError("Cannot attach connections to include '" + target.include + "'", arrow);
      return;
    }
    target.connections.addAll(connections);
  }

  // Returns null (after recording an error) when the arrows are malformed
  List<ConnectionNode> parseConnections(Cursor c) {
    List<ConnectionNode> out = new ArrayList<>();
    while (!c.atEnd()) {
      Token arrow = c.next();
      if (!arrow.is(TokenType.ARROW)) {
        syntaxError("Expected '->' but found '" + arrow.text + "'", arrow);
        return null;
      }
      String label = null;
      if (c.peekIs(TokenType.LABEL)) {
        label = c.next().text;
      }
      Token target = c.nextIf(TokenType.TEXT);
      if (target == null || target.text.isEmpty()) {
        syntaxError("Expected target place after '->'", arrow);
        return null;
      }
      out.add(new ConnectionNode(label, target.text, loc(arrow)));
    }
    return out;
  }

  boolean attach(Item item, Token at) {
    int d = item.depth;
    if (d > open.size()) {
      syntaxError("Nesting depth " + d + " has no parent at depth " + (d - 1), at);
      return false;
    }
    Item parent = d > 0 ? open.get(d - 1) : null;
    if (parent != null && parent.isInclude()) {
      syntaxError("Cannot nest under include '" + parent.include + "'", at);
      return false;
    }
    while (open.size() > d) {
      open.remove(open.size() - 1);
    }
    if (parent == null) {
      block.items.add(item);
    } else {
      parent.children.add(item);
    }
    open.add(item);
    return true;
  }

  void parsePosition(Token keyword, Cursor c, int depth) {
    if (!directiveAllowed(keyword, depth)) {
      return;
    }
    if (block.position != null) {
      syntaxError("Place '" + block.name + "' already has a position", keyword);
      return;
    }

    List<List<Token>> groups = new ArrayList<>();
    List<Token> group = new ArrayList<>();
    while (!c.atEnd()) {
      Token t = c.next();
      if (t.is(TokenType.COMMA)) {
        groups.add(group);
        group = new ArrayList<>();
      } else {
        group.add(t);
      }
    }
    groups.add(group);

    if (groups.size() > 2) {
      syntaxError("Expected at most two coordinates after 'position'", keyword);
      return;
    }
    if (groups.get(0).isEmpty()) {
      syntaxError("Expected coordinate after 'position'", keyword);
      return;
    }
    CoordinateNode x = parseCoordinate(groups.get(0), keyword);
    if (x == null) {
      return;
    }
    CoordinateNode y = null;
    if (groups.size() == 2) {
      if (groups.get(1).isEmpty()) {
        syntaxError("Expected y coordinate after ','", keyword);
        return;
      }
      y = parseCoordinate(groups.get(1), keyword);
      if (y == null) {
        return;
      }
    } else if (x.place == null) {
      y = new CoordinateNode(null, null, 0);
    } else if (x.pivot.isVertical()) {
      // a lone top/bottom coordinate describes the y axis
      y = x;
      x = new CoordinateNode(Pivot.CENTER, y.place, 0);
    } else {
      y = new CoordinateNode(Pivot.CENTER, x.place, 0);
    }

    if (x.place != null && x.pivot.isVertical()) {
      syntaxError("x coordinate cannot use pivot '" + x.pivot.symbol() + "'", keyword);
      return;
    }
    if (y.place != null && y.pivot.isHorizontal()) {
      syntaxError("y coordinate cannot use pivot '" + y.pivot.symbol() + "'", keyword);
      return;
    }
    block.position = new PositionNode(x, y, loc(keyword));
  }

  // [pivot] (number | name [(+|-) number])
  CoordinateNode parseCoordinate(List<Token> g, Token anchor) {
    int k = 0;
    Pivot pivot = null;
    if (k < g.size() && g.get(k).is(TokenType.PIVOT)) {
      pivot = Pivot.fromSymbol(g.get(k++).text.charAt(0));
    }
    String place = null;
    if (k < g.size() && g.get(k).is(TokenType.TEXT)) {
      Token name = g.get(k++);
      if (name.text.isEmpty()) {
        syntaxError("Expected place name", name);
        return null;
      }
      place = name.text;
    }
    double sign = 1;
    boolean signed = false;
    if (k < g.size() && (g.get(k).is(TokenType.PLUS) || g.get(k).is(TokenType.MINUS))) {
      sign = g.get(k).is(TokenType.MINUS) ? -1 : 1;
      signed = true;
      k++;
    }
    Double offset = null;
    if (k < g.size() && g.get(k).is(TokenType.NUMBER)) {
      Token number = g.get(k++);
      try {
        offset = sign * Double.parseDouble(number.text);
      } catch (NumberFormatException e) {
        syntaxError("Invalid number '" + number.text + "'", number);
        return null;
      }
    } else if (signed) {
      syntaxError("Expected number after sign", g.get(k - 1));
      return null;
    }
    if (k < g.size()) {
      syntaxError("Unexpected '" + g.get(k).text + "' in position", g.get(k));
      return null;
    }
    if (place == null && offset == null) {
      syntaxError("Expected a number or a place name", g.isEmpty() ? anchor : g.get(0));
      return null;
    }
    if (place == null && pivot != null) {
      syntaxError("Pivot '" + pivot.symbol() + "' requires a place name", g.get(0));
      return null;
    }
    if (place == null) {
      return new CoordinateNode(null, null, offset);
    }
    return new CoordinateNode(pivot != null ? pivot : Pivot.CENTER, place, offset != null ? offset : 0);
  }

  boolean parseSketch(Token keyword, Cursor c, int depth) {
    if (!directiveAllowed(keyword, depth)) {
      return false;
    }
    if (block.sketch != null) {
      syntaxError("Place '" + block.name + "' already has a sketch", keyword);
      return false;
    }
    Token path = c.nextIf(TokenType.TEXT);
    if (path == null || path.text.isEmpty()) {
      syntaxError("Expected image path after 'sketch'", keyword);
      return false;
    }
    block.sketch = new SketchNode(path.text, loc(keyword));
    return true;
  }

  // [top,left bottom,right] Label
  void parseRegion(Token open, Cursor c, int depth) {
    if (!inSketch || block.sketch == null) {
      syntaxError("Clickable region outside of a sketch", open);
      return;
    }
    if (depth > 0) {
      syntaxError("Clickable regions cannot be nested", open);
      return;
    }
    Integer top = expectInt(c, open);
    if (top == null || expect(c, TokenType.COMMA, "','", open) == null) return;
    Integer left = expectInt(c, open);
    if (left == null) return;
    Integer bottom = expectInt(c, open);
    if (bottom == null || expect(c, TokenType.COMMA, "','", open) == null) return;
    Integer right = expectInt(c, open);
    if (right == null || expect(c, TokenType.REGION_CLOSE, "']'", open) == null) return;

    Token label = c.nextIf(TokenType.TEXT);
    if (label == null || label.text.isEmpty()) {
      syntaxError("Expected affordance label after ']'", open);
      return;
    }
    if (right <= left) {
      syntaxError("Clickable region width must be positive", open);
      return;
    }
    if (bottom <= top) {
      syntaxError("Clickable region height must be positive", open);
      return;
    }
    block.sketch.regions.add(new RegionNode(top, left, bottom, right, label.text, loc(open)));
  }

  private Integer expectInt(Cursor c, Token anchor) {
    Token t = expect(c, TokenType.NUMBER, "pixel coordinate", anchor);
    if (t == null) {
      return null;
    }
    try {
      return Integer.parseInt(t.text);
    } catch (NumberFormatException e) {
      syntaxError("Region coordinates must be whole pixels, found '" + t.text + "'", t);
      return null;
    }
  }

  private Token expect(Cursor c, TokenType type, String what, Token anchor) {
    Token t = c.nextIf(type);
    if (t == null) {
      Token found = c.atEnd() ? anchor : c.peek();
      syntaxError("Expected " + what + (c.atEnd() ? " before end of line" : " but found '" + found.text + "'"), found);
    }
    return t;
  }

  private boolean directiveAllowed(Token keyword, int depth) {
    if (depth > 0) {
      syntaxError("'" + keyword.text + "' cannot be nested", keyword);
      return false;
    }
    if (block.kind == BlockKind.COMPONENT) {
      syntaxError("Components cannot declare a " + keyword.text, keyword);
      return false;
    }
    return true;
  }

  private String takeDescription() {
    if (pendingDescription.isEmpty()) {
      return null;
    }
    String description = String.join("\n", pendingDescription);
    pendingDescription.clear();
    return description;
  }

  // Read position over the tokens of one line
  static class Cursor {
    private final List<Token> line;
    private int pos = 0;

    Cursor(List<Token> line) {
      this.line = line;
    }

    boolean atEnd() {
      return pos >= line.size();
    }

    Token peek() {
      return line.get(pos);
    }

    boolean peekIs(TokenType type) {
      return !atEnd() && line.get(pos).is(type);
    }

    Token next() {
      return line.get(pos++);
    }

    Token nextIf(TokenType type) {
      return peekIs(type) ? next() : null;
    }

    void back() {
      pos--;
    }
  }
}
