package com.syncnest.authstarter.serviceImpl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.model.RefreshTokenRecord;
import com.syncnest.authstarter.store.StoreUnavailableException;
import com.syncnest.authstarter.support.InMemoryKeyValueStore;
import com.syncnest.authstarter.support.MutableClock;
import com.syncnest.authstarter.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RefreshTokenServiceImplTest {

    private static final ClientMetadata META = ClientMetadata.builder()
            .ipAddress("203.0.113.9")
            .userAgent("JUnit")
            .build();

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private ObjectMapper mapper;
    private RefreshTokenServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        mapper = TestTokens.objectMapper();
        service = new RefreshTokenServiceImpl(store, TestTokens.settings(), mapper, clock);
    }

    @Nested
    @DisplayName("issue")
    class Issue {

        @Test
        void recordCarriesUserRoleExpiryAndMetadata() {
            String token = service.issue(5L, UserRole.ROLE_ADMIN, META);

            RefreshTokenRecord record = service.verify(token).orElseThrow();
            long now = clock.instant().getEpochSecond();
            assertEquals(5L, record.userId());
            assertEquals("ROLE_ADMIN", record.role());
            assertEquals(now, record.createdAt());
            assertEquals(now + TestTokens.REFRESH_SECONDS, record.expiresAt());
            assertEquals("203.0.113.9", record.ipAddress());
            assertEquals("JUnit", record.userAgent());
        }

        @Test
        void storeTtlMatchesLifetimeAndTokenIsIndexed() {
            String token = service.issue(5L, UserRole.ROLE_USER, null);

            assertEquals(Duration.ofSeconds(TestTokens.REFRESH_SECONDS), store.lastTtl("refresh:" + token));
            assertEquals(Set.of(token), store.members("user:refresh_tokens:5"));
            assertEquals(Duration.ofSeconds(TestTokens.REFRESH_SECONDS), store.lastTtl("user:refresh_tokens:5"));
        }

        @Test
        void tokensAreOpaqueAndDistinct() {
            String a = service.issue(5L, UserRole.ROLE_USER, META);
            String b = service.issue(5L, UserRole.ROLE_USER, META);

            assertNotEquals(a, b);
            assertTrue(a.matches("[A-Za-z0-9_-]{43}"), a);
        }

        @Test
        void storeOutagePropagates() {
            store.failAll();
            assertThrows(StoreUnavailableException.class, () -> service.issue(5L, UserRole.ROLE_USER, META));
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        void unknownTokenIsEmpty() {
            assertTrue(service.verify("never-issued").isEmpty());
            assertTrue(service.verify(null).isEmpty());
        }

        @Test
        @DisplayName("lapsed store entry reads as invalid")
        void lapsedEntry() {
            String token = service.issue(5L, UserRole.ROLE_USER, META);
            clock.advance(Duration.ofSeconds(TestTokens.REFRESH_SECONDS));

            assertTrue(service.verify(token).isEmpty());
        }

        @Test
        @DisplayName("record past its embedded expiry is deleted eagerly")
        void embeddedExpiryWins() throws Exception {
            long now = clock.instant().getEpochSecond();
            RefreshTokenRecord stale = new RefreshTokenRecord(9L, "ROLE_USER", now - 1, now - 100, null, null);
            store.set("refresh:stale", mapper.writeValueAsString(stale), Duration.ofHours(1));
            store.addToSet("user:refresh_tokens:9", "stale", Duration.ofHours(1));

            assertTrue(service.verify("stale").isEmpty());
            assertFalse(store.exists("refresh:stale"));
            assertTrue(store.members("user:refresh_tokens:9").isEmpty());
        }

        @Test
        void corruptRecordIsInvalid() {
            store.set("refresh:corrupt", "{not json", Duration.ofHours(1));
            assertTrue(service.verify("corrupt").isEmpty());
        }

        @Test
        @DisplayName("fails closed when the store is down")
        void failsClosed() {
            String token = service.issue(5L, UserRole.ROLE_USER, META);
            store.failAll();

            assertTrue(service.verify(token).isEmpty());
        }
    }

    @Nested
    @DisplayName("consume")
    class Consume {

        @Test
        void singleUse() {
            String token = service.issue(5L, UserRole.ROLE_USER, META);

            assertTrue(service.consume(token).isPresent());
            assertTrue(service.consume(token).isEmpty());
            assertTrue(service.verify(token).isEmpty());
            assertFalse(store.members("user:refresh_tokens:5").contains(token));
        }

        @Test
        void failsClosedWhenStoreIsDown() {
            String token = service.issue(5L, UserRole.ROLE_USER, META);
            store.failAll();

            assertTrue(service.consume(token).isEmpty());
        }
    }

    @Nested
    @DisplayName("revoke")
    class Revoke {

        @Test
        void removesRecordAndIndexEntry() {
            String keep = service.issue(5L, UserRole.ROLE_USER, META);
            String drop = service.issue(5L, UserRole.ROLE_USER, META);

            service.revoke(drop);

            assertTrue(service.verify(drop).isEmpty());
            assertTrue(service.verify(keep).isPresent());
            assertEquals(Set.of(keep), store.members("user:refresh_tokens:5"));
        }

        @Test
        @DisplayName("second revoke is a no-op with the same end state")
        void idempotent() {
            String token = service.issue(5L, UserRole.ROLE_USER, META);

            service.revoke(token);
            Set<String> afterFirst = store.keys();
            assertDoesNotThrow(() -> service.revoke(token));

            assertEquals(afterFirst, store.keys());
        }

        @Test
        void unknownTokenIsNoOp() {
            assertDoesNotThrow(() -> service.revoke("never-issued"));
        }
    }

    @Nested
    @DisplayName("revokeAll")
    class RevokeAll {

        @Test
        void revokesEveryTokenOfTheUserOnly() {
            String a = service.issue(5L, UserRole.ROLE_USER, META);
            String b = service.issue(5L, UserRole.ROLE_USER, META);
            String other = service.issue(6L, UserRole.ROLE_USER, META);

            assertEquals(2, service.revokeAll(5L));

            assertTrue(service.verify(a).isEmpty());
            assertTrue(service.verify(b).isEmpty());
            assertFalse(store.exists("user:refresh_tokens:5"));
            assertTrue(service.verify(other).isPresent());
        }

        @Test
        @DisplayName("one failing item does not stop the others")
        void bestEffortPerItem() {
            String stuck = service.issue(5L, UserRole.ROLE_USER, META);
            String a = service.issue(5L, UserRole.ROLE_USER, META);
            String b = service.issue(5L, UserRole.ROLE_USER, META);
            store.failOn(key -> key.equals("refresh:" + stuck));

            assertEquals(2, service.revokeAll(5L));

            store.recover();
            assertTrue(service.verify(a).isEmpty());
            assertTrue(service.verify(b).isEmpty());
            assertEquals(Set.of(stuck), store.members("user:refresh_tokens:5"));

            assertEquals(1, service.revokeAll(5L));
            assertTrue(service.verify(stuck).isEmpty());
            assertFalse(store.exists("user:refresh_tokens:5"));
        }

        @Test
        void unreadableIndexRevokesNothingWithoutThrowing() {
            service.issue(5L, UserRole.ROLE_USER, META);
            store.failOn(key -> key.startsWith("user:refresh_tokens:"));

            assertEquals(0, service.revokeAll(5L));
        }

        @Test
        void userWithoutTokens() {
            assertEquals(0, service.revokeAll(99L));
        }
    }

    @Test
    void namespacesAreDisjoint() {
        String token = service.issue(5L, UserRole.ROLE_USER, META);
        assertEquals(Set.of("refresh:" + token, "user:refresh_tokens:5"), store.keys());
        assertEquals(Optional.empty(), store.get("blacklist:" + token));
    }
}
