package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.SessionArtifact;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

/**
 * Session Codec
 *
 * Converts a {@link SessionArtifact} to and from the transport cookie value: a compact
 * HS256 JWS. HMAC signing is deterministic, so equal artifacts always encode to the same value.
 * Decoding fails closed; anything malformed, truncated or unverifiable is "no session".
 * No network or clock access.
 */
@Slf4j
@Service
public class SessionCodec {

  static final String CLAIM_ACCESS_TOKEN = "at";
  static final String CLAIM_REFRESH_TOKEN = "rt";
  static final String CLAIM_SEQUENCE = "seq";

  private static final int MIN_KEY_LENGTH_BYTES = 32;
  private static final JWSHeader HEADER = new JWSHeader(JWSAlgorithm.HS256);

  private final JWSSigner signer;
  private final JWSVerifier verifier;

  @Autowired
  public SessionCodec(ApplicationProperties properties) {
    this(decodeKey(properties.session().signingKey()));
  }

  public SessionCodec(byte[] signingKey) {
    if (signingKey == null || signingKey.length < MIN_KEY_LENGTH_BYTES) {
      throw new SessionException("Invalid signing key length: expected at least 256 bits");
    }
    try {
      this.signer = new MACSigner(signingKey);
      this.verifier = new MACVerifier(signingKey);
    } catch (JOSEException e) {
      throw new SessionException("Failed to initialize session signing key", e);
    }
  }

  /**
   * Encode an artifact into its transport value.
   */
  public String encode(SessionArtifact artifact) {
    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .subject(artifact.subjectId())
        .expirationTime(Date.from(Instant.ofEpochSecond(artifact.expiresAt())))
        .claim(CLAIM_ACCESS_TOKEN, artifact.accessToken())
        .claim(CLAIM_REFRESH_TOKEN, artifact.refreshToken())
        .claim(CLAIM_SEQUENCE, artifact.refreshSequence())
        .build();

    SignedJWT jwt = new SignedJWT(HEADER, claims);
    try {
      jwt.sign(signer);
    } catch (JOSEException e) {
      throw new SessionException("Failed to sign session artifact", e);
    }
    return jwt.serialize();
  }

  /**
   * Decode a transport value. Never throws.
   *
   * @param transportValue raw cookie value, may be {@code null}
   * @return the artifact, or empty when the value is absent or cannot be trusted
   */
  public Optional<SessionArtifact> decode(String transportValue) {
    if (transportValue == null || transportValue.isBlank()) {
      return Optional.empty();
    }

    try {
      SignedJWT jwt = SignedJWT.parse(transportValue);
      if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
        log.debug("Rejected session value signed with unexpected algorithm {}", jwt.getHeader().getAlgorithm());
        return Optional.empty();
      }
      if (!jwt.verify(verifier)) {
        log.debug("Rejected session value with invalid signature");
        return Optional.empty();
      }

      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      String accessToken = claims.getStringClaim(CLAIM_ACCESS_TOKEN);
      String subjectId = claims.getSubject();
      Date expiration = claims.getExpirationTime();
      Long sequence = claims.getLongClaim(CLAIM_SEQUENCE);
      if (accessToken == null || subjectId == null || expiration == null || sequence == null) {
        log.debug("Rejected session value with missing claims");
        return Optional.empty();
      }

      return Optional.of(new SessionArtifact(
          accessToken,
          claims.getStringClaim(CLAIM_REFRESH_TOKEN),
          expiration.toInstant().getEpochSecond(),
          subjectId,
          sequence));

    } catch (ParseException | JOSEException e) {
      log.debug("Failed to decode session value: {}", e.getMessage());
      return Optional.empty();
    } catch (RuntimeException e) {
      log.debug("Session value rejected: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static byte[] decodeKey(String keyBase64) {
    try {
      return Base64.getDecoder().decode(keyBase64);
    } catch (IllegalArgumentException e) {
      throw new SessionException("Session signing key is not valid Base64", e);
    }
  }
}
