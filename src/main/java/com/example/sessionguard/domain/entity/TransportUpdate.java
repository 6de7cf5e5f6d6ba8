package com.example.sessionguard.domain.entity;

/**
 * What the outgoing response does to the transport cookie.
 *
 * @param action SET, CLEAR or NONE
 * @param value  the encoded artifact for SET, empty for CLEAR, {@code null} for NONE
 */
public record TransportUpdate(Action action, String value) {

  private static final TransportUpdate NONE = new TransportUpdate(Action.NONE, null);
  private static final TransportUpdate CLEAR = new TransportUpdate(Action.CLEAR, "");

  public enum Action {
    SET,
    CLEAR,
    NONE
  }

  public static TransportUpdate set(String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Transport value cannot be null or empty");
    }
    return new TransportUpdate(Action.SET, value);
  }

  public static TransportUpdate clear() {
    return CLEAR;
  }

  public static TransportUpdate none() {
    return NONE;
  }
}
