package com.syncnest.authstarter.service;

import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.model.RefreshTokenRecord;

import java.util.Optional;

public interface RefreshTokenService {

    /** Mint an opaque refresh token for the user and add it to the user's index. */
    String issue(long userId, UserRole role, ClientMetadata metadata);

    /**
     * Look the token up. Empty when unknown, lapsed, past its embedded expiry (the entry is
     * then deleted eagerly), or when the store cannot be reached.
     */
    Optional<RefreshTokenRecord> verify(String token);

    /**
     * Atomically take the token out of the store. Of several concurrent callers presenting the
     * same token at most one gets the record back.
     */
    Optional<RefreshTokenRecord> consume(String token);

    /** Revoke one token. Unknown tokens are a no-op. */
    void revoke(String token);

    /**
     * Revoke every outstanding token of the user, one by one; a failing item is logged, skipped
     * and left in the index so that calling this again retries it. Returns the number of
     * records actually deleted.
     */
    int revokeAll(long userId);
}
