package com.gentoro.tangle.extraction.flexmark;

import com.gentoro.tangle.exception.ExtractionException;
import com.gentoro.tangle.extraction.AbstractBlockExtractor;
import com.gentoro.tangle.extraction.RawBlock;
import com.gentoro.tangle.syntax.FenceAttributes;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process extractor backed by flexmark-java. Walks the whole markdown AST, so fences nested in
 * lists or block quotes are found as well. Each fence carries the source lines of its markers.
 */
public class FlexmarkBlockExtractor extends AbstractBlockExtractor {

  private final Parser parser = Parser.builder().build();

  @Override
  protected List<Fence> findFences(String documentText) {
    Node root;
    try {
      root = parser.parse(documentText);
    } catch (RuntimeException e) {
      throw new ExtractionException("Markdown parsing failed", e.getMessage(), e);
    }
    List<Fence> out = new ArrayList<>();
    collect(root, out);
    return out;
  }

  // Depth-first, document order.
  private void collect(Node node, List<Fence> out) {
    Node child = node.getFirstChild();
    while (child != null) {
      if (child instanceof FencedCodeBlock fenced) {
        FenceAttributes attrs = FenceAttributes.parse(fenced.getInfo().toString());
        out.add(
            new Fence(
                attrs.identifier(),
                attrs.language(),
                fenced.getContentChars().toString(),
                fenced.getStartLineNumber(),
                closingLine(fenced)));
      } else {
        collect(child, out);
      }
      child = child.getNext();
    }
  }

  // Negative when the fence runs to the end of its container.
  private static int closingLine(FencedCodeBlock fenced) {
    BasedSequence closing = fenced.getClosingMarker();
    if (closing == null || closing.isNull() || closing.length() == 0) {
      return RawBlock.UNKNOWN_LINE;
    }
    return fenced.getDocument().getLineNumber(closing.getStartOffset());
  }

  @Override
  public String name() {
    return FlexmarkBlockExtractorProvider.ID;
  }
}
