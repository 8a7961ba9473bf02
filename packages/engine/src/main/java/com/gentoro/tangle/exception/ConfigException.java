package com.gentoro.tangle.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends TangleException {
  public ConfigException(String message) {
    super(TangleErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TangleErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
