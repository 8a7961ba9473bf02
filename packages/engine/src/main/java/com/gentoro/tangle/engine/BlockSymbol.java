package com.gentoro.tangle.engine;

import java.util.List;

/**
 * Outline entry for one block, shaped for display and serialization.
 *
 * @param startLine 1-based line of the opening fence
 * @param endLine 1-based line of the closing fence
 */
public record BlockSymbol(
    String identifier,
    int occurrenceIndex,
    String language,
    int startLine,
    int endLine,
    List<String> dependencies,
    List<String> dependents) {

  public BlockSymbol {
    dependencies = List.copyOf(dependencies);
    dependents = List.copyOf(dependents);
  }
}
