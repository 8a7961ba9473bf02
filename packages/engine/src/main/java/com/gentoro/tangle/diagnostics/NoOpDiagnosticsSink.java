package com.gentoro.tangle.diagnostics;

import com.gentoro.tangle.model.CircularReference;
import java.util.List;

/** No-op implementation used when diagnostics reporting is disabled. */
public class NoOpDiagnosticsSink implements DiagnosticsSink {
  @Override
  public void circularReferences(String documentId, List<CircularReference> cycles) {}

  @Override
  public void blockDropped(
      String documentId, String identifier, int occurrenceIndex, String reason) {}

  @Override
  public void parseFailed(String documentId, Throwable error) {}
}
