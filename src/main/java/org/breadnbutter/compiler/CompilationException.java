package org.breadnbutter.compiler;

import java.util.List;
import java.util.stream.Collectors;

// Thrown when a caller insists on a value from a failed compilation
public class CompilationException extends RuntimeException {
  private final List<Diagnostic> diagnostics;

  public CompilationException(List<Diagnostic> diagnostics) {
    super(format(diagnostics));
    this.diagnostics = List.copyOf(diagnostics);
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  private static String format(List<Diagnostic> diagnostics) {
    return diagnostics.size() + " error(s):\n" + diagnostics.stream()
        .map(Diagnostic::toString)
        .collect(Collectors.joining("\n"));
  }
}
