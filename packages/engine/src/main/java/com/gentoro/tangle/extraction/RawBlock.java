package com.gentoro.tangle.extraction;

import java.util.List;
import java.util.Objects;

/**
 * A code block as reported by a {@link BlockExtractor}, before it is matched back to the source
 * text.
 *
 * @param identifier block name, never blank
 * @param language first class of the block, possibly empty
 * @param content raw, unexpanded content without the trailing newline
 * @param references identifiers mentioned via {@code <<id>>}, in order of first appearance
 * @param occurrenceIndex number of earlier blocks in the same document sharing this identifier
 * @param openLine 0-based line of the opening fence, or {@link #UNKNOWN_LINE}
 * @param closeLine 0-based line of the closing fence; negative when unknown or never closed
 */
public record RawBlock(
    String identifier,
    String language,
    String content,
    List<String> references,
    int occurrenceIndex,
    int openLine,
    int closeLine) {

  public static final int UNKNOWN_LINE = -1;

  public RawBlock {
    Objects.requireNonNull(identifier, "identifier");
    language = language == null ? "" : language;
    content = content == null ? "" : content;
    references = List.copyOf(references);
  }

  /** Block whose position must be recovered from the text by occurrence ordinal. */
  public RawBlock(
      String identifier,
      String language,
      String content,
      List<String> references,
      int occurrenceIndex) {
    this(identifier, language, content, references, occurrenceIndex, UNKNOWN_LINE, UNKNOWN_LINE);
  }

  /** True when the extractor reported where the opening fence sits. */
  public boolean hasPosition() {
    return openLine >= 0;
  }
}
