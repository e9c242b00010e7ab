package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.exception.AuthExceptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JwtAuthFilterTest {

    private AccessTokenAuthenticator authenticator;
    private JwtAuthFilter filter;

    @BeforeEach
    void setUp() {
        authenticator = mock(AccessTokenAuthenticator.class);
        filter = new JwtAuthFilter(authenticator);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validTokenAuthenticatesRequest() throws Exception {
        AuthenticatedUser user = new AuthenticatedUser(7L, "dave@example.com", UserRole.ROLE_USER);
        when(authenticator.authenticate("abc")).thenReturn(user);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        request.addHeader("Authorization", "bearer abc");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertSame(user, auth.getPrincipal());
        assertEquals("abc", request.getAttribute(JwtAuthFilter.ACCESS_TOKEN_ATTR));
        assertNotNull(chain.getRequest());
    }

    @Test
    void rejectedTokenIsRecordedAndChainContinues() throws Exception {
        AuthExceptions.TokenRevoked revoked = new AuthExceptions.TokenRevoked();
        when(authenticator.authenticate("abc")).thenThrow(revoked);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        request.addHeader("Authorization", "Bearer abc");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertSame(revoked, request.getAttribute(JwtAuthFilter.AUTH_ERROR_ATTR));
        assertNotNull(chain.getRequest());
    }

    @Test
    void noHeaderSkipsAuthentication() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/auth/login");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        verifyNoInteractions(authenticator);
        assertNull(request.getAttribute(JwtAuthFilter.AUTH_ERROR_ATTR));
    }

    @Test
    void resolvesBearerHeader() {
        assertEquals("tok", JwtAuthFilter.resolveBearerToken("Bearer tok"));
        assertEquals("tok", JwtAuthFilter.resolveBearerToken("BEARER  tok "));
        assertNull(JwtAuthFilter.resolveBearerToken("Basic dXNlcjpwYXNz"));
        assertNull(JwtAuthFilter.resolveBearerToken("Bearer "));
        assertNull(JwtAuthFilter.resolveBearerToken(null));
    }
}
