package com.example.sessionguard.exception;

/**
 * Session Exception
 *
 * Raised when a session is mutated from a context that only permits reading,
 * or when an operation needs a session that is not there.
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
