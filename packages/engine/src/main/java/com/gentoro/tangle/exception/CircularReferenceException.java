package com.gentoro.tangle.exception;

import java.util.List;
import java.util.Map;

/**
 * The block graph contains a cycle. Expansion never raises this; only the explicit acyclicity check
 * does.
 */
public class CircularReferenceException extends TangleException {
  private final List<String> path;

  public CircularReferenceException(List<String> path) {
    super(
        TangleErrorCode.CIRCULAR_REFERENCE,
        "Circular reference detected: " + String.join(" -> ", path),
        Map.of("path", List.copyOf(path)));
    this.path = List.copyOf(path);
  }

  public List<String> getPath() {
    return path;
  }
}
