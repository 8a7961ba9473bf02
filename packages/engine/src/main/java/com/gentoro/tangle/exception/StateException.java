package com.gentoro.tangle.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends TangleException {
  public StateException(String message) {
    super(TangleErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(TangleErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
