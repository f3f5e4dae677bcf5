package com.gentoro.injob.exception;

/** Invalid or missing configuration. */
public class ConfigException extends InJobException {
  public ConfigException(String message) {
    super(InJobErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(InJobErrorCode.CONFIG_ERROR, message, cause);
  }
}
