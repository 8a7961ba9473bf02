package com.gentoro.tangle.exception;

/** I/O operation failed (filesystem, classpath, process streams). */
public class IoException extends TangleException {
  public IoException(String message) {
    super(TangleErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(TangleErrorCode.IO_ERROR, message, cause);
  }
}
