package org.breadnbutter.compiler;

import java.util.Objects;

// A named piece of breadboard source text; the name only appears in diagnostics
public class SourceDocument {
  public final String name;
  public final String text;

  public SourceDocument(String name, String text) {
    this.name = Objects.requireNonNull(name, "name");
    this.text = Objects.requireNonNull(text, "text");
  }

  @Override
  public String toString() {
    return "SourceDocument{name='" + name + "', length=" + text.length() + '}';
  }
}
