package com.gentoro.tangle.model;

import java.util.Objects;

/** Span of document positions; {@link #contains} treats both ends as inside. */
public record TextRange(TextPosition start, TextPosition end) {

  public TextRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.compareTo(start) < 0) {
      throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
    }
  }

  public static TextRange of(int startLine, int startColumn, int endLine, int endColumn) {
    return new TextRange(
        new TextPosition(startLine, startColumn), new TextPosition(endLine, endColumn));
  }

  public boolean contains(TextPosition position) {
    return position.compareTo(start) >= 0 && position.compareTo(end) <= 0;
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
