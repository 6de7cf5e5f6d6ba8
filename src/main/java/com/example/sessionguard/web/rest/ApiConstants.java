package com.example.sessionguard.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String SESSION_BASE = "/session";

    // Auth paths
    public static final String SIGN_IN = "/sign-in";
    public static final String SIGN_OUT = "/sign-out";

    // Session paths
    public static final String STATUS = "/status";

    private ApiPath() {}
  }

  public static final class Param {
    public static final String IDENTIFIER = "identifier";
    public static final String SECRET = "secret";
    public static final String NEXT = "next";
    public static final String ERROR = "error";

    private Param() {}
  }

  public static final class ErrorCode {
    public static final String INVALID_CREDENTIALS = "invalid_credentials";
    public static final String SERVICE_UNAVAILABLE = "service_unavailable";
    public static final String TOO_MANY_ATTEMPTS = "too_many_attempts";

    private ErrorCode() {}
  }

  private ApiConstants() {}
}
