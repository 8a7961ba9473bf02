package com.gentoro.tangle.exception;

import java.util.Map;

/** A block reported by extraction could not be matched to its source text. */
public class LocationNotFoundException extends TangleException {
  private final String reason;

  public LocationNotFoundException(String identifier, int occurrenceIndex, String reason) {
    super(
        TangleErrorCode.LOCATION_NOT_FOUND,
        "Could not locate block #%s (occurrence %d): %s"
            .formatted(identifier, occurrenceIndex, reason),
        Map.of("identifier", identifier, "occurrence", occurrenceIndex));
    this.reason = reason;
  }

  /** Short cause without the block coordinates. */
  public String getReason() {
    return reason;
  }
}
