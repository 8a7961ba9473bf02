package com.gentoro.tangle.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error information for logs and diagnostics payloads. */
public record ErrorDetails(
    String type,
    String message,
    TangleErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
