package com.example.sessionguard.exception;

import java.util.List;

/**
 * Malformed access policy. Fatal at startup: an ambiguous policy must not
 * silently fail open or closed at request time.
 */
public class PolicyException extends RuntimeException {

  private final List<String> errors;

  public PolicyException(List<String> errors) {
    super(String.format("Access policy validation failed with %d error(s):\n- %s",
                        errors.size(), String.join("\n- ", errors)));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
