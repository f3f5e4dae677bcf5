package com.gentoro.injob.exception;

import java.util.function.Function;

/** Utility helpers for turning exceptions into messages and domain exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Extract a short, user-facing message from a throwable. Wrapper exceptions without a message of
   * their own are skipped in favour of the first cause that has one; when no message exists in the
   * chain the simple class name of the top-level throwable is returned.
   *
   * @param t the throwable to extract the message from
   * @return the error message, never {@code null}
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        return message.trim();
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }
    return t.getClass().getSimpleName();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static InJobException rethrowIfUnchecked(
      Throwable t, Function<Throwable, InJobException> supplier) {
    if (t instanceof InJobException) {
      return (InJobException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
