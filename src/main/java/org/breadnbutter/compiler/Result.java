package org.breadnbutter.compiler;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a compilation: either a value or a non-empty list of diagnostics, never both.
 *
 * @param <T> type of the successful value
 */
public final class Result<T> {
  private final T value;
  private final List<Diagnostic> diagnostics;

  private Result(T value, List<Diagnostic> diagnostics) {
    this.value = value;
    this.diagnostics = diagnostics;
  }

  public static <T> Result<T> ok(T value) {
    return new Result<>(Objects.requireNonNull(value, "value"), List.of());
  }

  public static <T> Result<T> failed(List<Diagnostic> diagnostics) {
    if (diagnostics == null || diagnostics.isEmpty()) {
      throw new IllegalArgumentException("A failed result needs at least one diagnostic");
    }
    return new Result<>(null, List.copyOf(diagnostics));
  }

  public boolean isSuccess() {
    return value != null;
  }

  /**
   * @throws IllegalStateException if the compilation failed
   */
  public T value() {
    if (value == null) {
      throw new IllegalStateException("Compilation failed with " + diagnostics.size() + " error(s)");
    }
    return value;
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public T orElseThrow() {
    if (value == null) {
      throw new CompilationException(diagnostics);
    }
    return value;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Result.ok(" + value + ")" : "Result.failed(" + diagnostics + ")";
  }
}
