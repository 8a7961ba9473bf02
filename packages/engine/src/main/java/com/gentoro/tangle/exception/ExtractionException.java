package com.gentoro.tangle.exception;

import java.util.Map;

/**
 * The block extractor failed or returned a malformed structure. Carries the converter's diagnostic
 * output (stderr) when there is one.
 */
public class ExtractionException extends TangleException {
  private final String diagnostics;

  public ExtractionException(String message, String diagnostics) {
    super(TangleErrorCode.EXTRACTION_ERROR, message, contextOf(diagnostics));
    this.diagnostics = diagnostics == null ? "" : diagnostics;
  }

  public ExtractionException(String message, String diagnostics, Throwable cause) {
    super(TangleErrorCode.EXTRACTION_ERROR, message, contextOf(diagnostics), cause);
    this.diagnostics = diagnostics == null ? "" : diagnostics;
  }

  /** Raw diagnostic text reported by the converter, never null. */
  public String getDiagnostics() {
    return diagnostics;
  }

  private static Map<String, Object> contextOf(String diagnostics) {
    return diagnostics == null || diagnostics.isBlank() ? Map.of() : Map.of("stderr", diagnostics);
  }
}
