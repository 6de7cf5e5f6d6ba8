package com.example.sessionguard.exception;

/**
 * Authentication backend failure.
 */
public class BackendException extends RuntimeException {

  private final Kind kind;

  public enum Kind {
    // The presented credential or refresh token has expired.
    EXPIRED,
    // The presented credential or refresh token was rejected.
    INVALID,
    // The backend could not be reached or answered with a server error.
    UNREACHABLE
  }

  public BackendException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public BackendException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
