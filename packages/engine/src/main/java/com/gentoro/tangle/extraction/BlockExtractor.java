package com.gentoro.tangle.extraction;

import com.gentoro.tangle.exception.ExtractionException;
import java.util.List;

/**
 * Converts raw document text into the ordered list of named code blocks it contains.
 *
 * <p>Implementations may call out to an external process and block while doing so; callers are
 * expected to invoke them off any latency sensitive thread.
 */
public interface BlockExtractor {

  /**
   * @param documentText full text of the document
   * @return named blocks in document order, with per-identifier occurrence indexes assigned
   * @throws ExtractionException when the conversion fails or yields a malformed structure
   */
  List<RawBlock> extract(String documentText);

  /** Stable identifier of the implementation, matching its provider id. */
  String name();
}
