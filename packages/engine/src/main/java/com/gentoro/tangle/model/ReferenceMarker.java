package com.gentoro.tangle.model;

/** One {@code <<identifier>>} marker found in a document's text. */
public record ReferenceMarker(String identifier, String documentId, TextRange range) {}
