package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.config.TokenSettings;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.support.MutableClock;
import com.syncnest.authstarter.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenProviderTest {

    private MutableClock clock;
    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        provider = TestJwt.provider(TestTokens.settings(), clock);
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        void returnsSubjectAndRole() {
            String token = provider.issue(42L, UserRole.ROLE_MANAGER);

            AccessTokenClaims claims = provider.verify(token);

            assertEquals(42L, claims.subjectId());
            assertEquals(UserRole.ROLE_MANAGER, claims.role());
            assertEquals(clock.instant(), claims.issuedAt());
            assertEquals(clock.instant().plusSeconds(TestTokens.ACCESS_SECONDS), claims.expiresAt());
        }

        @Test
        void toleratesSmallClockSkew() {
            String token = provider.issue(1L, UserRole.ROLE_USER);
            clock.advance(Duration.ofSeconds(TestTokens.ACCESS_SECONDS + 10));

            assertEquals(1L, provider.verify(token).subjectId());
        }

        @Test
        void expiredTokenIsReportedAsExpired() {
            String token = provider.issue(1L, UserRole.ROLE_USER);
            clock.advance(Duration.ofSeconds(TestTokens.ACCESS_SECONDS + 60));

            assertThrows(AuthExceptions.TokenExpired.class, () -> provider.verify(token));
        }

        @Test
        void tamperedPayloadIsInvalid() {
            String token = provider.issue(1L, UserRole.ROLE_USER);
            String[] parts = token.split("\\.");
            String forged = parts[0] + "." + parts[1].substring(0, parts[1].length() - 2) + "AA." + parts[2];

            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.verify(forged));
        }

        @Test
        void tokenSignedWithAnotherSecretIsInvalid() {
            TokenSettings other = new TokenSettings("another-secret-another-secret-1234567",
                    TestTokens.ACCESS_SECONDS, TestTokens.REFRESH_SECONDS, null, true, 32);
            String foreign = TestJwt.provider(other, clock).issue(1L, UserRole.ROLE_ADMIN);

            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.verify(foreign));
        }

        @Test
        void garbageIsInvalid() {
            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.verify("not-a-jwt"));
            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.verify(""));
        }

        @Test
        void issuerIsEnforcedWhenConfigured() {
            TokenSettings withIssuer = new TokenSettings(TestTokens.SECRET,
                    TestTokens.ACCESS_SECONDS, TestTokens.REFRESH_SECONDS, "auth-starter", true, 32);
            JwtTokenProvider strict = TestJwt.provider(withIssuer, clock);

            String noIssuer = provider.issue(1L, UserRole.ROLE_USER);

            assertThrows(AuthExceptions.InvalidToken.class, () -> strict.verify(noIssuer));
            assertEquals(1L, strict.verify(strict.issue(1L, UserRole.ROLE_USER)).subjectId());
        }
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("reads claims of an expired token without verifying it")
        void readsExpiredToken() {
            String token = provider.issue(7L, UserRole.ROLE_USER);
            Instant expectedExp = clock.instant().plusSeconds(TestTokens.ACCESS_SECONDS);
            clock.advance(Duration.ofDays(1));

            AccessTokenClaims claims = provider.decode(token);

            assertEquals(7L, claims.subjectId());
            assertEquals(UserRole.ROLE_USER, claims.role());
            assertEquals(expectedExp, claims.expiresAt());
        }

        @Test
        void rejectsMalformedInput() {
            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.decode("a.b"));
            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.decode("a.%%%.c"));
            assertThrows(AuthExceptions.InvalidToken.class, () -> provider.decode(null));
        }
    }

    @Test
    @DisplayName("two tokens minted in the same second differ")
    void tokensAreUnique() {
        assertNotEquals(provider.issue(1L, UserRole.ROLE_USER), provider.issue(1L, UserRole.ROLE_USER));
    }

    @Test
    void reportsConfiguredLifetime() {
        assertEquals(TestTokens.ACCESS_SECONDS, provider.getAccessTokenSeconds());
    }
}
