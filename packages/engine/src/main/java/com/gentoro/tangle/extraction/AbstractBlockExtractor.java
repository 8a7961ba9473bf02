package com.gentoro.tangle.extraction;

import com.gentoro.tangle.logging.LoggingService;
import com.gentoro.tangle.syntax.LiterateSyntax;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for extractors: subclasses find code fences, this class keeps the named ones, strips
 * the trailing newline, records references and numbers occurrences per identifier.
 */
public abstract class AbstractBlockExtractor implements BlockExtractor {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(AbstractBlockExtractor.class);

  /**
   * A code fence found by the underlying converter. Identifier may be null or blank.
   *
   * <p>Converters that track source positions report the 0-based lines of the opening and closing
   * fence; {@code closeLine} is negative when the fence was never closed. Converters without
   * positions use {@link RawBlock#UNKNOWN_LINE} for both.
   */
  public record Fence(
      String identifier, String language, String content, int openLine, int closeLine) {

    public Fence(String identifier, String language, String content) {
      this(identifier, language, content, RawBlock.UNKNOWN_LINE, RawBlock.UNKNOWN_LINE);
    }
  }

  /** Return every code fence in document order, named or not. */
  protected abstract List<Fence> findFences(String documentText);

  @Override
  public final List<RawBlock> extract(String documentText) {
    List<Fence> fences = findFences(documentText == null ? "" : documentText);
    Map<String, Integer> occurrences = new HashMap<>();
    List<RawBlock> blocks = new ArrayList<>();
    for (Fence fence : fences) {
      if (fence.identifier() == null || fence.identifier().isBlank()) {
        continue;
      }
      String identifier = fence.identifier().trim();
      String content = stripTrailingNewline(fence.content());
      int occurrence = occurrences.merge(identifier, 1, Integer::sum) - 1;
      blocks.add(
          new RawBlock(
              identifier,
              fence.language(),
              content,
              new ArrayList<>(LiterateSyntax.references(content)),
              occurrence,
              fence.openLine(),
              fence.closeLine()));
    }
    log.debug(
        "{} extractor found {} fences, {} named blocks", name(), fences.size(), blocks.size());
    return blocks;
  }

  static String stripTrailingNewline(String content) {
    if (content == null) return "";
    if (content.endsWith("\r\n")) return content.substring(0, content.length() - 2);
    if (content.endsWith("\n")) return content.substring(0, content.length() - 1);
    return content;
  }
}
