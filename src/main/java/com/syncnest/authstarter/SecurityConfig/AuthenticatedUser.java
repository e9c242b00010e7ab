package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.entity.UserRole;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.security.Principal;
import java.util.List;

/** Principal placed in the SecurityContext for a request with a valid access token. */
public record AuthenticatedUser(long id, String email, UserRole role) implements Principal {

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(role.name()));
    }

    @Override
    public String getName() {
        return Long.toString(id);
    }
}
