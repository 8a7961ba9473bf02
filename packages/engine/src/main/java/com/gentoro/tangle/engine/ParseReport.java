package com.gentoro.tangle.engine;

import com.gentoro.tangle.model.CircularReference;
import java.util.List;

/**
 * Summary of one applied parse.
 *
 * @param cycles every cycle of the graph after the document was applied
 */
public record ParseReport(
    String documentId, int blockCount, int droppedBlocks, List<CircularReference> cycles) {

  public ParseReport {
    cycles = List.copyOf(cycles);
  }
}
