package com.gentoro.injob.exception;

/** Operation invoked while a component is in the wrong lifecycle state. */
public class StateException extends InJobException {
  public StateException(String message) {
    super(InJobErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(InJobErrorCode.STATE_ERROR, message, cause);
  }
}
