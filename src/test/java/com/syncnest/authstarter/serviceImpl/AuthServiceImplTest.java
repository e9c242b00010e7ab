package com.syncnest.authstarter.serviceImpl;

import com.syncnest.authstarter.SecurityConfig.AccessTokenAuthenticator;
import com.syncnest.authstarter.SecurityConfig.AuthenticatedUser;
import com.syncnest.authstarter.SecurityConfig.JwtTokenProvider;
import com.syncnest.authstarter.SecurityConfig.TestJwt;
import com.syncnest.authstarter.SecurityConfig.TokenBlacklistService;
import com.syncnest.authstarter.config.TokenSettings;
import com.syncnest.authstarter.dto.AuthResponse;
import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.dto.LoginRequest;
import com.syncnest.authstarter.dto.RefreshTokenRequest;
import com.syncnest.authstarter.dto.RegisterRequest;
import com.syncnest.authstarter.dto.UserView;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.exception.RequestExceptions;
import com.syncnest.authstarter.exception.UserExceptions;
import com.syncnest.authstarter.support.InMemoryKeyValueStore;
import com.syncnest.authstarter.support.InMemoryUserService;
import com.syncnest.authstarter.support.MutableClock;
import com.syncnest.authstarter.support.TestTokens;
import com.syncnest.authstarter.utils.ExpiryDurations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AuthServiceImplTest {

    private static final String PASSWORD = "Sup3r$ecret";
    private static final ClientMetadata META = ClientMetadata.builder()
            .ipAddress("192.0.2.10")
            .userAgent("auth-test")
            .build();

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private InMemoryUserService users;
    private PasswordEncoder encoder;
    private JwtTokenProvider tokens;
    private RefreshTokenServiceImpl refreshTokens;
    private AccessTokenAuthenticator authenticator;
    private AuthServiceImpl auth;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-05-10T12:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        users = new InMemoryUserService();
        encoder = new BCryptPasswordEncoder(4);
        wire(TestTokens.settings());
    }

    private void wire(TokenSettings settings) {
        tokens = TestJwt.provider(settings, clock);
        refreshTokens = new RefreshTokenServiceImpl(store, settings, TestTokens.objectMapper(), clock);
        TokenBlacklistService blacklist = new TokenBlacklistService(store, tokens, settings, clock);
        authenticator = new AccessTokenAuthenticator(blacklist, tokens, users);
        TokenLifecycleServiceImpl lifecycle = new TokenLifecycleServiceImpl(tokens, refreshTokens, blacklist, users);
        auth = new AuthServiceImpl(users, encoder, lifecycle);
    }

    private static RegisterRequest registration(String email) {
        return RegisterRequest.builder().email(email).password(PASSWORD).firstName("Ada").build();
    }

    private static LoginRequest login(String email, String password) {
        return LoginRequest.builder().email(email).password(password).build();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void createsPlainUserAndSignsIn() {
            AuthResponse response = auth.register(registration("  Ada@Example.com "), META);

            AuthenticatedUser principal = authenticator.authenticate(response.getTokens().getAccessToken());
            assertEquals("ada@example.com", principal.email());
            assertEquals(UserRole.ROLE_USER, principal.role());
            assertNotEquals(PASSWORD, users.findByEmail("ada@example.com").orElseThrow().getPassword());
        }

        @Test
        void duplicateEmailIsRejected() {
            auth.register(registration("ada@example.com"), META);
            int writesBefore = store.writeCount();

            assertThrows(UserExceptions.EmailTaken.class,
                    () -> auth.register(registration("ADA@example.com"), META));
            assertEquals(writesBefore, store.writeCount());
        }
    }

    @Nested
    @DisplayName("login")
    class Login {

        @BeforeEach
        void registerAda() {
            auth.register(registration("ada@example.com"), META);
        }

        @Test
        void correctPasswordIssuesPairWithMetadata() {
            AuthResponse response = auth.login(login("ada@example.com", PASSWORD), META);

            var record = refreshTokens.verify(response.getTokens().getRefreshToken()).orElseThrow();
            assertEquals("192.0.2.10", record.ipAddress());
            assertEquals("auth-test", record.userAgent());
        }

        @Test
        @DisplayName("wrong password writes nothing to the store")
        void wrongPassword() {
            int writesBefore = store.writeCount();

            assertThrows(AuthExceptions.InvalidCredentials.class,
                    () -> auth.login(login("ada@example.com", "Wr0ng$pass"), META));
            assertEquals(writesBefore, store.writeCount());
        }

        @Test
        void unknownEmailLooksLikeWrongPassword() {
            assertThrows(AuthExceptions.InvalidCredentials.class,
                    () -> auth.login(login("nobody@example.com", PASSWORD), META));
        }

        @Test
        @DisplayName("unknown email still pays for a password check")
        void unknownEmailRunsPasswordCheck() {
            PasswordEncoder spyEncoder = mock(PasswordEncoder.class);
            AuthServiceImpl withMock = new AuthServiceImpl(users, spyEncoder,
                    new TokenLifecycleServiceImpl(tokens, refreshTokens,
                            new TokenBlacklistService(store, tokens, TestTokens.settings(), clock), users));

            assertThrows(AuthExceptions.InvalidCredentials.class,
                    () -> withMock.login(login("nobody@example.com", PASSWORD), META));
            verify(spyEncoder).matches(eq(PASSWORD), anyString());
        }

        @Test
        void expiresInFollowsHumanReadableLifetime() {
            wire(new TokenSettings(TestTokens.SECRET, ExpiryDurations.toSeconds("2h"),
                    TestTokens.REFRESH_SECONDS, null, true, 32));
            assertEquals(7200, auth.login(login("ada@example.com", PASSWORD), META).getTokens().getExpiresIn());

            wire(new TokenSettings(TestTokens.SECRET, ExpiryDurations.toSeconds("900"),
                    TestTokens.REFRESH_SECONDS, null, true, 32));
            assertEquals(900, auth.login(login("ada@example.com", PASSWORD), META).getTokens().getExpiresIn());
        }
    }

    @Test
    @DisplayName("register, login, refresh, logout")
    void fullSession() {
        AuthResponse registered = auth.register(registration("ada@example.com"), META);
        long userId = authenticator.authenticate(registered.getTokens().getAccessToken()).id();

        AuthResponse loggedIn = auth.login(login("ada@example.com", PASSWORD), META);
        AuthResponse refreshed = auth.refresh(
                new RefreshTokenRequest(loggedIn.getTokens().getRefreshToken()), META);

        assertThrows(AuthExceptions.InvalidRefreshToken.class,
                () -> auth.refresh(new RefreshTokenRequest(loggedIn.getTokens().getRefreshToken()), META));

        String access = refreshed.getTokens().getAccessToken();
        assertTrue(auth.logout(userId, access).isSuccess());

        assertThrows(AuthExceptions.TokenRevoked.class, () -> authenticator.authenticate(access));
        assertThrows(AuthExceptions.InvalidRefreshToken.class,
                () -> auth.refresh(new RefreshTokenRequest(refreshed.getTokens().getRefreshToken()), META));
        assertThrows(AuthExceptions.InvalidRefreshToken.class,
                () -> auth.refresh(new RefreshTokenRequest(registered.getTokens().getRefreshToken()), META));
    }

    @Test
    void logoutWithoutTokenIsBadRequest() {
        assertThrows(RequestExceptions.InvalidHeader.class, () -> auth.logout(1L, " "));
        assertThrows(RequestExceptions.InvalidHeader.class, () -> auth.logout(1L, null));
    }

    @Nested
    @DisplayName("me")
    class Me {

        @Test
        void returnsSafeView() {
            AuthResponse response = auth.register(registration("ada@example.com"), META);
            long id = authenticator.authenticate(response.getTokens().getAccessToken()).id();

            UserView view = auth.me(id);

            assertEquals("ada@example.com", view.getEmail());
            assertEquals("Ada", view.getFirstName());
        }

        @Test
        void unknownUser() {
            assertThrows(UserExceptions.UserNotFound.class, () -> auth.me(404L));
        }
    }
}
