package com.gentoro.injob.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the daemon. Carries an {@link InJobErrorCode} and an optional
 * context map with details useful for logging (job name, condition, configuration key, ...).
 */
public class InJobException extends RuntimeException {
  private final InJobErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public InJobException(InJobErrorCode code, String message) {
    super(message);
    this.code = code == null ? InJobErrorCode.UNKNOWN : code;
  }

  public InJobException(InJobErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? InJobErrorCode.UNKNOWN : code;
  }

  public InJobErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Adds a context entry and returns this exception for chaining. */
  public InJobException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
