package com.gentoro.injob.exception;

/** Listener could not be created or started. */
public class NetworkException extends InJobException {
  public NetworkException(String message) {
    super(InJobErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(InJobErrorCode.NETWORK_ERROR, message, cause);
  }
}
