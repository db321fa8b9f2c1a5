package com.github.spud.sample.ai.taskchat.domain.auth;

import com.github.spud.sample.ai.taskchat.application.config.SecurityProperties;
import com.github.spud.sample.ai.taskchat.domain.error.AuthenticationException;
import com.github.spud.sample.ai.taskchat.domain.error.AuthorizationException;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.isolation.SecurityAuditEvent;
import com.github.spud.sample.ai.taskchat.domain.isolation.SecurityAuditSink;
import com.github.spud.sample.ai.taskchat.infrastructure.observability.TraceContext;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import javax.crypto.SecretKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Verifies bearer credentials issued elsewhere and binds them to the user named in the request
 * path. Runs before any other component touches data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestAuthenticator {

  static final String EMAIL_CLAIM = "email";

  private static final String BEARER_PREFIX = "Bearer ";
  private static final int MIN_SECRET_BYTES = 32;

  private final SecurityProperties securityProperties;
  private final SecurityAuditSink auditSink;
  private final Clock clock;

  private SecretKey verificationKey;

  @PostConstruct
  void init() {
    String secret = securityProperties.getJwtSecret();
    if (!StringUtils.hasText(secret)) {
      throw new IllegalStateException("taskchat.security.jwt-secret must be configured");
    }
    byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
    if (keyBytes.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
        "taskchat.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.verificationKey = Keys.hmacShaKeyFor(keyBytes);
  }

  /**
   * Authenticate the request and check that the token subject owns the path.
   *
   * @param authorizationHeader raw {@code Authorization} header value, may be null
   * @param pathUserId user id taken from the request path
   */
  public UserContext authenticate(String authorizationHeader, String pathUserId) {
    UserContext user = verify(extractToken(authorizationHeader));
    if (!user.getUserId().equals(pathUserId)) {
      auditSink.record(SecurityAuditEvent.builder()
        .code(ErrorCode.USER_MISMATCH)
        .userId(user.getUserId())
        .targetUserId(pathUserId)
        .traceId(TraceContext.currentTraceId())
        .detail("token subject does not match path user")
        .occurredAt(clock.instant())
        .build());
      throw new AuthorizationException(ErrorCode.USER_MISMATCH,
        "Token subject does not match path user");
    }
    log.debug("Authenticated userId={}", user.getUserId());
    return user;
  }

  /**
   * Verify signature, expiry, issue time and required claims of a raw token.
   */
  public UserContext verify(String token) {
    Instant now = clock.instant();
    long skewSeconds = securityProperties.getAllowedClockSkew().toSeconds();

    Claims claims;
    try {
      claims = Jwts.parser()
        .verifyWith(verificationKey)
        .clock(() -> Date.from(clock.instant()))
        .clockSkewSeconds(skewSeconds)
        .build()
        .parseSignedClaims(token)
        .getPayload();
    } catch (ExpiredJwtException e) {
      throw new AuthenticationException(ErrorCode.EXPIRED_TOKEN, "Token expired", e);
    } catch (SignatureException e) {
      throw new AuthenticationException(ErrorCode.INVALID_SIGNATURE, "Token signature invalid", e);
    } catch (JwtException | IllegalArgumentException e) {
      throw new AuthenticationException(ErrorCode.INVALID_TOKEN, "Token malformed", e);
    }

    String subject = claims.getSubject();
    String email = claims.get(EMAIL_CLAIM, String.class);
    Date issuedAt = claims.getIssuedAt();
    Date expiration = claims.getExpiration();
    if (!StringUtils.hasText(subject) || !StringUtils.hasText(email)
      || issuedAt == null || expiration == null) {
      throw new AuthenticationException(ErrorCode.INVALID_TOKEN, "Token lacks required claims");
    }
    if (!expiration.toInstant().plusSeconds(skewSeconds).isAfter(now)) {
      throw new AuthenticationException(ErrorCode.EXPIRED_TOKEN, "Token expired");
    }
    if (issuedAt.toInstant().minusSeconds(skewSeconds).isAfter(now)) {
      throw new AuthenticationException(ErrorCode.INVALID_TOKEN, "Token issued in the future");
    }

    return UserContext.builder()
      .userId(subject)
      .email(email)
      .issuedAt(issuedAt.toInstant())
      .expiresAt(expiration.toInstant())
      .authenticatedAt(now)
      .build();
  }

  private static String extractToken(String authorizationHeader) {
    if (!StringUtils.hasText(authorizationHeader)) {
      throw new AuthenticationException(ErrorCode.MISSING_TOKEN, "Authorization header missing");
    }
    if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      throw new AuthenticationException(ErrorCode.INVALID_TOKEN, "Authorization is not a bearer");
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new AuthenticationException(ErrorCode.MISSING_TOKEN, "Bearer token empty");
    }
    return token;
  }
}
