package com.gentoro.tangle.exception;

import java.util.Map;

/** Top-level expansion was requested for an identifier without any block. */
public class BlockNotFoundException extends TangleException {
  private final String identifier;

  public BlockNotFoundException(String identifier) {
    super(
        TangleErrorCode.NOT_FOUND,
        "Block with identifier \"%s\" not found".formatted(identifier),
        Map.of("identifier", identifier));
    this.identifier = identifier;
  }

  public String getIdentifier() {
    return identifier;
  }
}
