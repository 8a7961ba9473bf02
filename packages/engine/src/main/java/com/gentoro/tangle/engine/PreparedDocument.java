package com.gentoro.tangle.engine;

import com.gentoro.tangle.model.Block;
import com.gentoro.tangle.model.ReferenceMarker;
import java.util.List;

/**
 * A document turned into blocks and located against its text, not yet applied to the registry.
 *
 * @param droppedBlocks blocks reported by the extractor that could not be indexed
 */
public record PreparedDocument(
    String documentId, List<Block> blocks, List<ReferenceMarker> markers, int droppedBlocks) {

  public PreparedDocument {
    blocks = List.copyOf(blocks);
    markers = List.copyOf(markers);
  }
}
