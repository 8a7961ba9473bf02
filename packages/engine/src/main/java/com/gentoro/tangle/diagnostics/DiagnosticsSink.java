package com.gentoro.tangle.diagnostics;

import com.gentoro.tangle.model.CircularReference;
import java.util.List;

/**
 * Receives advisory findings produced while documents are indexed.
 *
 * <p>Decouples the engine (producer) from where the findings end up: logs, an editor's problem
 * list, or nowhere. Implementations must be cheap and must not throw.
 */
public interface DiagnosticsSink {

  /**
   * The graph contains cycles after {@code documentId} was applied. Reported for the whole graph,
   * not only for cycles passing through that document.
   */
  void circularReferences(String documentId, List<CircularReference> cycles);

  /**
   * A block reported by the extractor was not indexed.
   *
   * @param reason short human-readable cause, e.g. "no closing fence after line 12"
   */
  void blockDropped(String documentId, String identifier, int occurrenceIndex, String reason);

  /** Parsing {@code documentId} failed; its previous blocks were kept. */
  void parseFailed(String documentId, Throwable error);
}
