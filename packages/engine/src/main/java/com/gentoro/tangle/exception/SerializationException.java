package com.gentoro.tangle.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends TangleException {
  public SerializationException(String message) {
    super(TangleErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(TangleErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
