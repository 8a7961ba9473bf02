package com.gentoro.tangle.diagnostics;

import com.gentoro.tangle.exception.ErrorDetails;
import com.gentoro.tangle.exception.ExceptionUtil;
import com.gentoro.tangle.model.CircularReference;
import com.gentoro.tangle.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostics sink that emits structured JSON messages to the application logs under the
 * "tangle.diagnostics" category. Every message has a stable shape:
 *
 * <pre>
 * {
 *   "kind": "circular-references|block-dropped|parse-failed",
 *   "documentId": "docs/intro.md",
 *   "attrs": { ... },
 *   "protocolVersion": 1
 * }
 * </pre>
 */
public class LoggingDiagnosticsSink implements DiagnosticsSink {
  private static final int PROTOCOL_VERSION = 1;

  private final org.slf4j.Logger log;

  public LoggingDiagnosticsSink(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void circularReferences(String documentId, List<CircularReference> cycles) {
    List<String> rendered = new ArrayList<>();
    for (CircularReference cycle : cycles) {
      rendered.add(cycle.toString());
    }
    emitWarn(
        createPayload(
            "circular-references", documentId, Map.of("count", cycles.size(), "cycles", rendered)));
  }

  @Override
  public void blockDropped(
      String documentId, String identifier, int occurrenceIndex, String reason) {
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("identifier", identifier);
    attrs.put("occurrenceIndex", occurrenceIndex);
    attrs.put("reason", reason == null ? "" : reason);
    emitWarn(createPayload("block-dropped", documentId, attrs));
  }

  @Override
  public void parseFailed(String documentId, Throwable error) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("type", details.type());
    attrs.put("code", details.code().name());
    attrs.put("message", details.message());
    attrs.put("context", details.context());
    attrs.put("timestamp", details.timestamp().toString());
    emitError(createPayload("parse-failed", documentId, attrs));
  }

  /** Build the payload map. Protected so tests can inspect it by subclassing. */
  protected Map<String, Object> createPayload(
      String kind, String documentId, Map<String, Object> attrs) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("kind", kind);
    payload.put("documentId", documentId);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("protocolVersion", PROTOCOL_VERSION);
    return payload;
  }

  void emitWarn(Map<String, Object> payload) {
    log.warn("[tangle.diagnostics] {}", JacksonUtility.toJson(payload));
  }

  void emitError(Map<String, Object> payload) {
    log.error("[tangle.diagnostics] {}", JacksonUtility.toJson(payload));
  }
}
