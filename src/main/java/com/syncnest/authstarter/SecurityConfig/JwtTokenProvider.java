package com.syncnest.authstarter.SecurityConfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncnest.authstarter.config.TokenSettings;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.exception.AuthExceptions;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Signs and verifies HS256 access tokens.
 * <p>
 * {@code sub} is the numeric user id, {@code role} the role name. A random {@code jti}
 * keeps two tokens minted in the same second distinct.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenProvider {

    static final String ROLE_CLAIM = "role";
    private static final Duration CLOCK_SKEW = Duration.ofSeconds(30);

    private final TokenSettings settings;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    /** Cached signing key & parser */
    private SecretKey signingKey;
    private JwtParser jwtParser;

    @PostConstruct
    void init() {
        signingKey = Keys.hmacShaKeyFor(settings.accessSecret().getBytes(StandardCharsets.UTF_8));

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(CLOCK_SKEW.getSeconds()); // tolerate small clock drift

        if (settings.issuer() != null) {
            parserBuilder = parserBuilder.requireIssuer(settings.issuer());
        }
        jwtParser = parserBuilder.build();
    }

    /** Mint an access token for the subject, valid for the configured access lifetime. */
    public String issue(long subjectId, UserRole role) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(settings.accessTokenSeconds());

        var builder = Jwts.builder()
                .subject(Long.toString(subjectId))
                .claim(ROLE_CLAIM, role.name())
                .id(UUID.randomUUID().toString().replace("-", ""))
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt));
        if (settings.issuer() != null) {
            builder = builder.issuer(settings.issuer());
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256).compact();
    }

    /**
     * Read the claims WITHOUT checking the signature or expiry. Only for reading {@code exp}
     * when blacklisting; never a trust decision.
     *
     * @throws AuthExceptions.InvalidToken if the token is not a three-part JWT with a JSON payload
     */
    public AccessTokenClaims decode(String token) {
        if (token == null) {
            throw new AuthExceptions.InvalidToken();
        }
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new AuthExceptions.InvalidToken();
        }
        final JsonNode payload;
        try {
            payload = objectMapper.readTree(Decoders.BASE64URL.decode(parts[1]));
        } catch (IOException | RuntimeException e) {
            log.debug("Cannot decode access token payload: {}", e.getMessage());
            throw new AuthExceptions.InvalidToken();
        }
        if (payload == null || !payload.isObject()) {
            throw new AuthExceptions.InvalidToken();
        }
        return new AccessTokenClaims(
                longOrNull(payload.get("sub")),
                roleOrNull(payload.get(ROLE_CLAIM)),
                instantOrNull(payload.get("iat")),
                instantOrNull(payload.get("exp")));
    }

    /**
     * Full verification: signature, expiry (30s skew), issuer when configured, and
     * presence of {@code sub}, {@code role} and {@code exp}.
     *
     * @throws AuthExceptions.TokenExpired if the token is past its expiry
     * @throws AuthExceptions.InvalidToken for anything else
     */
    public AccessTokenClaims verify(String token) {
        final Claims claims;
        try {
            claims = jwtParser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthExceptions.TokenExpired();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT: {}", e.getMessage());
            throw new AuthExceptions.InvalidToken();
        }

        Long subjectId = parseSubject(claims.getSubject());
        UserRole role = parseRole(claims.get(ROLE_CLAIM, String.class));
        if (subjectId == null || role == null || claims.getExpiration() == null) {
            throw new AuthExceptions.InvalidToken();
        }
        Instant issuedAt = claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant();
        return new AccessTokenClaims(subjectId, role, issuedAt, claims.getExpiration().toInstant());
    }

    /** Lifetime stamped into new tokens; the orchestrator reports this as {@code expiresIn}. */
    public long getAccessTokenSeconds() {
        return settings.accessTokenSeconds();
    }

    /** How far past {@code exp} {@link #verify} still accepts a token. */
    public Duration getClockSkew() {
        return CLOCK_SKEW;
    }

    // ---------- helpers ----------

    private static Long parseSubject(String sub) {
        if (sub == null) return null;
        try {
            return Long.parseLong(sub);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static UserRole parseRole(String role) {
        if (role == null) return null;
        try {
            return UserRole.parse(role);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Long longOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.canConvertToLong()) return node.asLong();
        return node.isTextual() ? parseSubject(node.asText()) : null;
    }

    private static UserRole roleOrNull(JsonNode node) {
        return (node == null || !node.isTextual()) ? null : parseRole(node.asText());
    }

    private static Instant instantOrNull(JsonNode node) {
        return (node == null || !node.canConvertToLong()) ? null : Instant.ofEpochSecond(node.asLong());
    }
}
