package com.gentoro.tangle.engine;

/**
 * Result of a scheduled parse.
 *
 * @param generation sequence number of the request for its document, starting at 1
 * @param report what was applied; null when the request was superseded
 */
public record ParseOutcome(String documentId, long generation, Status status, ParseReport report) {

  public enum Status {
    /** The document's blocks were replaced with this request's result. */
    APPLIED,
    /** A newer request for the same document arrived first; the result was discarded. */
    SUPERSEDED
  }

  static ParseOutcome applied(long generation, ParseReport report) {
    return new ParseOutcome(report.documentId(), generation, Status.APPLIED, report);
  }

  static ParseOutcome superseded(String documentId, long generation) {
    return new ParseOutcome(documentId, generation, Status.SUPERSEDED, null);
  }

  public boolean isApplied() {
    return status == Status.APPLIED;
  }
}
