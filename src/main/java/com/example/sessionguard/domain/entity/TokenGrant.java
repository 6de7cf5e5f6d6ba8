package com.example.sessionguard.domain.entity;

/**
 * Token set returned by the authentication backend for a credential or refresh exchange.
 *
 * @param accessToken  the new access token
 * @param refreshToken the new refresh token, or {@code null} when the backend does not rotate it
 * @param expiresAt    access token expiry, UTC epoch seconds
 * @param subjectId    the authenticated subject, or {@code null} when the backend omits it
 */
public record TokenGrant(
    String accessToken,
    String refreshToken,
    long expiresAt,
    String subjectId
) {}
