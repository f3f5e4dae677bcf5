package com.gentoro.injob.exception;

/** Failure while starting or running a runtime component. */
public class ExecutionException extends InJobException {
  public ExecutionException(String message) {
    super(InJobErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(InJobErrorCode.EXECUTION_ERROR, message, cause);
  }
}
