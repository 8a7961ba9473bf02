package com.gentoro.tangle.location;

import com.gentoro.tangle.exception.LocationNotFoundException;
import com.gentoro.tangle.model.ReferenceMarker;
import com.gentoro.tangle.model.TextRange;
import com.gentoro.tangle.syntax.FenceAttributes;
import com.gentoro.tangle.syntax.FenceLine;
import com.gentoro.tangle.syntax.LiterateSyntax;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Maps blocks reported by an extractor back to their exact position in the source text.
 *
 * <p>When the extractor reports source lines, the block is resolved at those lines. Otherwise it is
 * matched by identifier and occurrence ordinal: the Nth fence whose first {@code #id} attribute
 * equals the identifier. The ordinal scan follows the CommonMark fence rules for top-level and
 * block-quoted fences. Fences inside other fences are not considered, since the scanner skips to
 * the closing fence of every block it enters. Results depend only on the text.
 */
public class LocationResolver {

  /**
   * Locate occurrence {@code occurrenceIndex} of {@code identifier}.
   *
   * @throws LocationNotFoundException when there are not enough matching fences, or the matching
   *     fence is never closed
   */
  public BlockSpan locate(String text, String identifier, int occurrenceIndex) {
    return index(text).locate(identifier, occurrenceIndex);
  }

  /** Scan {@code text} once so that many blocks of the same document can be located cheaply. */
  public FenceIndex index(String text) {
    List<String> lines = splitLines(text == null ? "" : text);
    Map<String, List<FenceEntry>> byIdentifier = new HashMap<>();

    int i = 0;
    while (i < lines.size()) {
      String line = lines.get(i);
      QuotedLine quoted = QuotedLine.of(line);
      Optional<FenceLine> opener = FenceLine.parse(quoted.content());
      if (opener.isEmpty()) {
        i++;
        continue;
      }
      int close = findClosingFence(lines, i, quoted.depth(), opener.get());
      FenceAttributes attrs = FenceAttributes.parse(opener.get().info());
      if (attrs.identifier() != null) {
        int fenceEnd = quoted.offset() + opener.get().indent() + opener.get().length();
        byIdentifier
            .computeIfAbsent(attrs.identifier(), k -> new ArrayList<>())
            .add(new FenceEntry(i, close, identifierColumn(line, fenceEnd, attrs.identifier())));
      }
      // unclosed fence runs to the end of its container
      i = close < 0 ? skipContainer(lines, i, quoted.depth()) : close + 1;
    }
    return new FenceIndex(lines, byIdentifier);
  }

  /** Every {@code <<identifier>>} marker in the text, in document order. */
  public List<ReferenceMarker> scanReferences(String documentId, String text) {
    List<String> lines = splitLines(text == null ? "" : text);
    List<ReferenceMarker> out = new ArrayList<>();
    for (int ln = 0; ln < lines.size(); ln++) {
      Matcher m = LiterateSyntax.REFERENCE.matcher(lines.get(ln));
      while (m.find()) {
        out.add(
            new ReferenceMarker(m.group(1), documentId, TextRange.of(ln, m.start(), ln, m.end())));
      }
    }
    return out;
  }

  // A fence is closed only at its own quote depth; leaving the quote ends it unclosed.
  private static int findClosingFence(
      List<String> lines, int openLine, int depth, FenceLine opener) {
    for (int j = openLine + 1; j < lines.size(); j++) {
      QuotedLine quoted = QuotedLine.of(lines.get(j));
      if (quoted.depth() < depth) return -1;
      if (quoted.depth() == depth && opener.isClosedBy(quoted.content())) {
        return j;
      }
    }
    return -1;
  }

  private static int skipContainer(List<String> lines, int openLine, int depth) {
    int j = openLine + 1;
    while (j < lines.size() && QuotedLine.of(lines.get(j)).depth() >= depth) {
      j++;
    }
    return j;
  }

  // Column of the identifier token (after '#') within the opening line.
  static int identifierColumn(String line, int from, String identifier) {
    String needle = "#" + identifier;
    int start = from;
    while (true) {
      int at = line.indexOf(needle, start);
      if (at < 0) return from;
      int after = at + needle.length();
      boolean boundary =
          after >= line.length()
              || Character.isWhitespace(line.charAt(after))
              || line.charAt(after) == '}';
      if (boundary) return at + 1;
      start = at + 1;
    }
  }

  static List<String> splitLines(String text) {
    String[] raw = text.split("\n", -1);
    List<String> lines = new ArrayList<>(raw.length);
    for (String l : raw) {
      lines.add(l.endsWith("\r") ? l.substring(0, l.length() - 1) : l);
    }
    return lines;
  }

  /** A line split into its block-quote prefix ({@code > > }) and the text after it. */
  record QuotedLine(int depth, int offset, String content) {

    static QuotedLine of(String line) {
      int depth = 0;
      int pos = 0;
      while (true) {
        int p = pos;
        int spaces = 0;
        while (p < line.length() && line.charAt(p) == ' ' && spaces < 3) {
          p++;
          spaces++;
        }
        if (p >= line.length() || line.charAt(p) != '>') break;
        p++;
        if (p < line.length() && line.charAt(p) == ' ') p++;
        depth++;
        pos = p;
      }
      return new QuotedLine(depth, pos, line.substring(pos));
    }
  }

  private record FenceEntry(int openLine, int closeLine, int identifierColumn) {}

  /** Fences of one document text, grouped by identifier in document order. */
  public static final class FenceIndex {
    private final List<String> lines;
    private final Map<String, List<FenceEntry>> byIdentifier;

    private FenceIndex(List<String> lines, Map<String, List<FenceEntry>> byIdentifier) {
      this.lines = lines;
      this.byIdentifier = byIdentifier;
    }

    /** Number of fences whose identifier is {@code identifier}. */
    public int count(String identifier) {
      return byIdentifier.getOrDefault(identifier, List.of()).size();
    }

    public BlockSpan locate(String identifier, int occurrenceIndex) {
      List<FenceEntry> entries = byIdentifier.getOrDefault(identifier, List.of());
      if (occurrenceIndex < 0 || occurrenceIndex >= entries.size()) {
        throw new LocationNotFoundException(
            identifier,
            occurrenceIndex,
            "only %d matching fence(s) in document".formatted(entries.size()));
      }
      FenceEntry entry = entries.get(occurrenceIndex);
      return span(
          identifier,
          occurrenceIndex,
          entry.openLine(),
          entry.closeLine(),
          entry.identifierColumn());
    }

    /**
     * Resolve a block whose fence lines the extractor already knows. The fence may sit inside any
     * container, so only the opening line is inspected for the identifier.
     *
     * @throws LocationNotFoundException when the lines fall outside the text or the fence is never
     *     closed
     */
    public BlockSpan locateAt(String identifier, int occurrenceIndex, int openLine, int closeLine) {
      if (openLine < 0 || openLine >= lines.size() || closeLine >= lines.size()) {
        throw new LocationNotFoundException(
            identifier,
            occurrenceIndex,
            "reported lines %d-%d are outside the document".formatted(openLine + 1, closeLine + 1));
      }
      String opener = lines.get(openLine);
      int fenceStart = firstFenceColumn(opener);
      int column = identifierColumn(opener, fenceStart, identifier);
      return span(identifier, occurrenceIndex, openLine, closeLine, column);
    }

    private BlockSpan span(
        String identifier, int occurrenceIndex, int openLine, int closeLine, int column) {
      if (closeLine < openLine) {
        throw new LocationNotFoundException(
            identifier,
            occurrenceIndex,
            "no closing fence after line %d".formatted(openLine + 1));
      }
      TextRange range = TextRange.of(openLine, 0, closeLine, lines.get(closeLine).length());
      TextRange idRange = TextRange.of(openLine, column, openLine, column + identifier.length());
      return new BlockSpan(range, idRange);
    }

    private static int firstFenceColumn(String line) {
      for (int c = 0; c < line.length(); c++) {
        char ch = line.charAt(c);
        if (ch == '`' || ch == '~') return c;
      }
      return 0;
    }
  }
}
