package org.breadnbutter.compiler;

import java.util.Objects;

import org.breadnbutter.model.Location;

// Represents a compilation error, with the source location when one is known
public class Diagnostic {
  public final DiagnosticKind kind;
  public final String message;
  public final Location location;

  public Diagnostic(DiagnosticKind kind, String message, Location location) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.message = message;
    this.location = location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Diagnostic)) return false;
    Diagnostic that = (Diagnostic) o;
    return kind == that.kind && Objects.equals(message, that.message) && Objects.equals(location, that.location);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message, location);
  }

  @Override
  public String toString() {
    return (location != null ? location + ": " : "") + kind + ": " + message;
  }
}
