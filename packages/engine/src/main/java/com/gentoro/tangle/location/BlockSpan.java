package com.gentoro.tangle.location;

import com.gentoro.tangle.model.TextRange;

/**
 * Resolved position of one block.
 *
 * @param range from the start of the opening fence line to the end of the closing fence line
 * @param identifierRange the identifier token inside the opening fence, without the {@code #}
 */
public record BlockSpan(TextRange range, TextRange identifierRange) {}
