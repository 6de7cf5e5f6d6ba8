package com.example.sessionguard.adapter.backend;

import com.example.sessionguard.exception.BackendException;

import java.util.function.Predicate;

/**
 * Circuit breaker failure predicate: only an unreachable backend counts as a failure.
 * A rejected refresh token is a normal answer and must not open the circuit.
 */
public class BackendFailurePredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof BackendException) {
      return ((BackendException) throwable).getKind() == BackendException.Kind.UNREACHABLE;
    }
    return true;
  }
}
