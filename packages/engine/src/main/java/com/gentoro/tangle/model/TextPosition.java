package com.gentoro.tangle.model;

/** Zero-based line and column within a document. */
public record TextPosition(int line, int column) implements Comparable<TextPosition> {

  public TextPosition {
    if (line < 0 || column < 0) {
      throw new IllegalArgumentException("Negative position: " + line + ":" + column);
    }
  }

  @Override
  public int compareTo(TextPosition o) {
    return line != o.line ? Integer.compare(line, o.line) : Integer.compare(column, o.column);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
