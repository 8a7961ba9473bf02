package com.gentoro.tangle.diagnostics;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tangle.exception.ExtractionException;
import com.gentoro.tangle.model.CircularReference;
import com.gentoro.tangle.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

@ExtendWith(MockitoExtension.class)
class LoggingDiagnosticsSinkTest {

  @Mock private Logger logger;

  private JsonNode capturedWarn() {
    ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(logger).warn(eq("[tangle.diagnostics] {}"), payload.capture());
    return JacksonUtility.readTree(payload.getValue().toString());
  }

  @Test
  void cyclesAreRenderedAsArrows() {
    new LoggingDiagnosticsSink(logger)
        .circularReferences("doc.md", List.of(new CircularReference(List.of("a", "b"), "a")));

    JsonNode json = capturedWarn();
    assertEquals("circular-references", json.get("kind").asText());
    assertEquals("doc.md", json.get("documentId").asText());
    assertEquals(1, json.at("/attrs/count").asInt());
    assertEquals("a -> b -> a", json.at("/attrs/cycles/0").asText());
    assertEquals(1, json.get("protocolVersion").asInt());
  }

  @Test
  void droppedBlockCarriesItsCoordinates() {
    new LoggingDiagnosticsSink(logger).blockDropped("doc.md", "main", 2, "no closing fence");

    JsonNode json = capturedWarn();
    assertEquals("block-dropped", json.get("kind").asText());
    assertEquals("main", json.at("/attrs/identifier").asText());
    assertEquals(2, json.at("/attrs/occurrenceIndex").asInt());
    assertEquals("no closing fence", json.at("/attrs/reason").asText());
  }

  @Test
  void parseFailureIsLoggedAsError() {
    new LoggingDiagnosticsSink(logger)
        .parseFailed("doc.md", new ExtractionException("converter crashed", "bad input"));

    ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(logger).error(eq("[tangle.diagnostics] {}"), payload.capture());
    JsonNode json = JacksonUtility.readTree(payload.getValue().toString());
    assertEquals("parse-failed", json.get("kind").asText());
    assertEquals("EXTRACTION_ERROR", json.at("/attrs/code").asText());
    assertEquals("bad input", json.at("/attrs/context/stderr").asText());
    assertFalse(json.at("/attrs/timestamp").asText().isEmpty());
  }

  @Test
  void payloadShape() {
    Map<String, Object> payload =
        new LoggingDiagnosticsSink(logger).createPayload("k", "d", Map.of("x", 1));
    assertEquals(
        List.of("kind", "documentId", "attrs", "protocolVersion"), List.copyOf(payload.keySet()));
  }
}
