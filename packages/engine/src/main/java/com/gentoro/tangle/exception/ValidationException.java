package com.gentoro.tangle.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends TangleException {
  public ValidationException(String message) {
    super(TangleErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(TangleErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
