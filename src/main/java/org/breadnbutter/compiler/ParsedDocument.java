package org.breadnbutter.compiler;

import java.util.List;

import org.breadnbutter.model.Component;
import org.breadnbutter.model.Place;

/**
 * The typed but unresolved entities of one source document, together with the syntax errors
 * found while parsing it. Include, connection, position and region names are still raw text.
 */
public class ParsedDocument {
  public final String source;
  public final List<Place> places;
  public final List<Component> components;
  public final List<Diagnostic> errors;

  public ParsedDocument(String source, List<Place> places, List<Component> components, List<Diagnostic> errors) {
    this.source = source;
    this.places = List.copyOf(places);
    this.components = List.copyOf(components);
    this.errors = List.copyOf(errors);
  }
}
