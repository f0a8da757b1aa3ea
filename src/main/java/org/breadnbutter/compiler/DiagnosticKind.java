package org.breadnbutter.compiler;

public enum DiagnosticKind {
  SYNTAX_ERROR,
  UNKNOWN_REFERENCE,
  UNKNOWN_PLACE,
  DUPLICATE_NAME,
  CYCLIC_POSITION,
  CYCLIC_INCLUDE,
  UNMATCHED_REGION,
  AFFORDANCE_WITHOUT_CONNECTION
}
