package com.gentoro.tangle.model;

import java.util.Objects;

/**
 * Where a block lives: the document, the span from opening to closing fence, and the span of the
 * identifier token inside the opening fence.
 */
public record SourceLocation(String documentId, TextRange range, TextRange identifierRange) {

  public SourceLocation {
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(identifierRange, "identifierRange");
  }
}
