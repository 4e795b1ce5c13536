package com.shopfront.productservice.security;

import com.shopfront.productservice.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and validates HMAC-signed access tokens.
 *
 * A token is a compact JWS carrying {@code sub} (the seller's username),
 * {@code iat} and {@code exp}. The service holds no state besides the key
 * derived from {@link JwtProperties} at construction, so the same instance
 * is shared by all request threads.
 */
@Component
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private final MacAlgorithm algorithm;
    private final SecretKey signingKey;
    private final Duration accessTokenTtl;
    private final Clock clock;

    public TokenService(JwtProperties properties, Clock clock) {
        this.algorithm = resolveAlgorithm(properties.getAlgorithm());

        byte[] secret = properties.getSecret().getBytes(StandardCharsets.UTF_8);
        int minBytes = algorithm.getKeyBitLength() / Byte.SIZE;
        if (secret.length < minBytes) {
            throw new IllegalStateException(String.format(
                    "jwt.secret is %d bytes but %s requires at least %d", secret.length, algorithm.getId(), minBytes));
        }
        this.signingKey = new SecretKeySpec(secret, "HmacSHA" + algorithm.getKeyBitLength());
        this.accessTokenTtl = properties.getAccessTokenTtl();
        this.clock = clock;

        log.info("Token service ready: algorithm={}, ttl={}", algorithm.getId(), accessTokenTtl);
    }

    /**
     * Issues a token for {@code subject} valid for the configured TTL from now.
     */
    public String issue(String subject) {
        return issue(subject, clock.instant(), accessTokenTtl);
    }

    /**
     * @param subject the seller's username
     * @param now     issue instant, written as {@code iat}
     * @param ttl     lifetime; {@code exp} is {@code now + ttl}
     * @return the compact, signed token
     */
    public String issue(String subject, Instant now, Duration ttl) {
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, algorithm)
                .compact();
    }

    /**
     * Validates {@code token} against the current clock.
     */
    public String validate(String token) {
        return validate(token, clock.instant());
    }

    /**
     * Verifies the signature and expiry of {@code token} as of {@code now}.
     *
     * @return the subject embedded in the token
     * @throws TokenValidationException with {@link TokenError#EXPIRED} when
     *         {@code exp <= now}, or {@link TokenError#MALFORMED} for anything
     *         that cannot be parsed or verified
     */
    public String validate(String token, Instant now) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(TokenError.MALFORMED, "Token is empty");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenValidationException(TokenError.EXPIRED, "Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException(TokenError.MALFORMED, "Token could not be verified", e);
        }

        // jjwt accepts exp == now; an expiry instant is already outside the token's lifetime
        Date expiration = claims.getExpiration();
        if (expiration == null) {
            throw new TokenValidationException(TokenError.MALFORMED, "Token has no expiration");
        }
        if (!expiration.toInstant().isAfter(now)) {
            throw new TokenValidationException(TokenError.EXPIRED, "Token has expired");
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenValidationException(TokenError.MALFORMED, "Token has no subject");
        }
        return subject;
    }

    private static MacAlgorithm resolveAlgorithm(String id) {
        return switch (id) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalStateException(
                    "Unsupported jwt.algorithm '" + id + "', expected HS256, HS384 or HS512");
        };
    }
}
