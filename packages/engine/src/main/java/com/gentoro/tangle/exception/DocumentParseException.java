package com.gentoro.tangle.exception;

import java.util.Map;

/** A document could not be turned into blocks for a reason other than extraction itself. */
public class DocumentParseException extends TangleException {
  public DocumentParseException(String documentId, String message, Throwable cause) {
    super(
        TangleErrorCode.PARSE_ERROR,
        "Failed to parse document %s: %s".formatted(documentId, message),
        Map.of("documentId", documentId),
        cause);
  }
}
