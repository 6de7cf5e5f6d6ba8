package com.example.sessionguard.domain.entity;

/**
 * The single outcome of guarding one request.
 *
 * @param type     ALLOW, REDIRECT or DENY
 * @param location redirect location, only for REDIRECT
 * @param status   HTTP status, only for DENY
 */
public record RouteDecision(Type type, String location, int status) {

  private static final RouteDecision ALLOW = new RouteDecision(Type.ALLOW, null, 0);

  public enum Type {
    ALLOW,
    REDIRECT,
    DENY
  }

  public static RouteDecision allow() {
    return ALLOW;
  }

  public static RouteDecision redirect(String location) {
    return new RouteDecision(Type.REDIRECT, location, 0);
  }

  public static RouteDecision deny(int status) {
    return new RouteDecision(Type.DENY, null, status);
  }

  public boolean isAllow() {
    return type == Type.ALLOW;
  }

  public boolean isRedirect() {
    return type == Type.REDIRECT;
  }

  public boolean isDeny() {
    return type == Type.DENY;
  }
}
