package com.gentoro.tangle.syntax;

import java.util.Optional;

/**
 * A fence line of a fenced code block: up to three spaces of indentation, then three or more
 * backticks or tildes, optionally followed by an info string on the opening line. Deeper or
 * tab indentation makes an indented code block instead.
 *
 * @param indent column of the first fence character
 * @param fenceChar {@code `} or {@code ~}
 * @param length number of fence characters
 * @param info trimmed text after the fence characters (empty for closing fences)
 */
public record FenceLine(int indent, char fenceChar, int length, String info) {

  private static final int MIN_FENCE_LENGTH = 3;
  private static final int MAX_INDENT = 3;

  /** Parse {@code line} as a fence line, or return empty if it is not one. */
  public static Optional<FenceLine> parse(String line) {
    if (line == null) return Optional.empty();
    int indent = 0;
    while (indent < line.length() && line.charAt(indent) == ' ') {
      indent++;
    }
    if (indent > MAX_INDENT || indent >= line.length()) return Optional.empty();
    char c = line.charAt(indent);
    if (c != '`' && c != '~') return Optional.empty();
    int end = indent;
    while (end < line.length() && line.charAt(end) == c) {
      end++;
    }
    int length = end - indent;
    if (length < MIN_FENCE_LENGTH) return Optional.empty();
    return Optional.of(new FenceLine(indent, c, length, line.substring(end).trim()));
  }

  /** True when {@code line} closes a block opened by this fence. */
  public boolean isClosedBy(String line) {
    Optional<FenceLine> other = parse(line);
    return other.isPresent()
        && other.get().fenceChar == fenceChar
        && other.get().length >= length
        && other.get().info.isEmpty();
  }
}
