package com.codeheadsystems.delegate.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.delegate.server.model.Identities;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the bearer tokens that identify an account owner to the HTTP surfaces.
 * <p>
 * Tokens are signed with HMAC-SHA256 and carry the normalized account id as their subject.
 * Whoever authenticates the owner (wallet signature, SSO, ...) calls {@link #issueToken};
 * the framework adapters only ever call {@link #verify}.
 */
public class OwnerTokenManager {

  private static final Logger log = LoggerFactory.getLogger(OwnerTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;

  /**
   * Creates a new OwnerTokenManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token time-to-live in seconds
   */
  public OwnerTokenManager(byte[] secret, String issuer, long ttlSeconds) {
    if (ttlSeconds <= 0) {
      throw new IllegalArgumentException("Token TTL must be positive");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
  }

  /**
   * Issues a token for an authenticated account owner.
   *
   * @param accountId the owner's account
   * @return signed JWT string
   * @throws IllegalArgumentException if the account is the zero identity
   */
  public String issueToken(String accountId) {
    if (Identities.isZero(accountId)) {
      throw new IllegalArgumentException("Cannot issue a token for the zero account");
    }
    String jti = UUID.randomUUID().toString();
    Instant now = Instant.now();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(Identities.normalize(accountId))
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
    log.debug("Issued owner token jti={}", jti);
    return token;
  }

  /**
   * Result of a successful verification.
   *
   * @param accountId the account the token was issued for
   * @param jti       the JWT ID
   */
  public record VerifyResult(String accountId, String jti) {
  }

  /**
   * Verifies a token.
   *
   * @param token JWT string
   * @return the verified account, empty if the token is invalid, expired or from another issuer
   */
  public Optional<VerifyResult> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      if (decoded.getSubject() == null) {
        log.debug("Owner token jti={} has no subject", decoded.getId());
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), decoded.getId()));
    } catch (JWTVerificationException e) {
      log.debug("Owner token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
