/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sessionstore.core.inmemory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phonepe.sessionstore.core.SessionRecord;
import com.phonepe.sessionstore.core.codec.SessionRecordCodec;
import com.phonepe.sessionstore.core.errors.ErrorType;
import com.phonepe.sessionstore.core.errors.SessionStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemorySessionStore}
 */
class InMemorySessionStoreTest {
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = InMemorySessionStore.builder()
                .clock(clock)
                .build();
    }

    @Test
    void testSaveThenLoad() {
        final var sessionRecord = createRecord("s1", "alice", Duration.ofMinutes(30));

        store.save(sessionRecord).join();

        assertEquals(sessionRecord, store.load("s1").join().orElseThrow());
    }

    @Test
    void testLoadOfUnknownSessionIsEmpty() {
        assertTrue(store.load("never-saved").join().isEmpty());
    }

    @Test
    void testDeleteIsIdempotent() {
        store.save(createRecord("s1", "alice", Duration.ofMinutes(30))).join();

        assertDoesNotThrow(() -> store.delete("s1").join());
        assertDoesNotThrow(() -> store.delete("s1").join());
        assertDoesNotThrow(() -> store.delete("never-saved").join());
        assertTrue(store.load("s1").join().isEmpty());
    }

    @Test
    void testLaterSaveReplacesRecordAndExpiry() {
        store.save(createRecord("s1", "alice", Duration.ofMinutes(30))).join();
        final var replacement = createRecord("s1", "bob", Duration.ofMinutes(5));
        store.save(replacement).join();

        assertEquals(replacement, store.load("s1").join().orElseThrow());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(store.load("s1").join().isEmpty());
    }

    @Test
    void testRecordIsAbsentOnceExpired() {
        store.save(createRecord("s1", "alice", Duration.ofSeconds(60))).join();

        clock.advance(Duration.ofSeconds(59));
        assertTrue(store.load("s1").join().isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.load("s1").join().isEmpty());
    }

    @Test
    void testExpiredRecordsAreRemovedOnSaveWithoutBeingLoaded() {
        store.save(createRecord("abandoned", "alice", Duration.ofSeconds(1))).join();
        store.save(createRecord("active", "bob", Duration.ofHours(2))).join();
        assertEquals(2, store.size());

        clock.advance(Duration.ofHours(1));
        store.save(createRecord("fresh", "carol", Duration.ofMinutes(30))).join();

        assertEquals(2, store.size());
        assertTrue(store.load("active").join().isPresent());
        assertTrue(store.load("fresh").join().isPresent());
    }

    @Test
    void testStoredRecordIsNotAffectedByLaterMutations() {
        final var profile = JsonNodeFactory.instance.objectNode().put("name", "alice");
        final var sessionRecord = SessionRecord.builder()
                .id("s1")
                .data(Map.of("profile", profile))
                .expiryDate(NOW.plus(Duration.ofMinutes(30)))
                .build();
        store.save(sessionRecord).join();

        profile.put("name", "mallory");

        final var loaded = store.load("s1").join().orElseThrow();
        assertEquals("alice", loaded.getData().get("profile").get("name").asText());
    }

    @Test
    void testEncodeFailureIsReported() {
        final var failingStore = InMemorySessionStore.builder()
                .codec(new SessionRecordCodec(new ObjectMapper(new MessagePackFactory())
                                                      .registerModule(new JavaTimeModule())))
                .clock(clock)
                .build();
        final var sessionRecord = SessionRecord.builder()
                .id("s1")
                .data(Map.of("opaque", JsonNodeFactory.instance.pojoNode(new Object())))
                .expiryDate(NOW.plus(Duration.ofMinutes(30)))
                .build();

        final var error = assertThrows(CompletionException.class, () -> failingStore.save(sessionRecord).join());
        final var cause = assertInstanceOf(SessionStoreException.class, error.getCause());
        assertEquals(ErrorType.ENCODE, cause.getErrorType());
        assertTrue(failingStore.load("s1").join().isEmpty());
    }

    @Test
    void testConcurrentAccess() {
        final var numThreads = 10;
        final var sessionsPerThread = 50;
        final ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        try {
            final List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < numThreads; i++) {
                final var threadId = i;
                futures.add(CompletableFuture.runAsync(
                        () -> IntStream.range(0, sessionsPerThread)
                                .forEach(j -> {
                                    final var sessionId = "t%d-s%d".formatted(threadId, j);
                                    store.save(createRecord(sessionId, sessionId, Duration.ofMinutes(1))).join();
                                    assertEquals(sessionId, store.load(sessionId)
                                            .join()
                                            .orElseThrow()
                                            .getData()
                                            .get("user")
                                            .asText());
                                }), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        }
        finally {
            executor.shutdown();
        }
        assertTrue(store.load("t9-s49").join().isPresent());
    }

    private static SessionRecord createRecord(String id, String user, Duration validity) {
        return SessionRecord.builder()
                .id(id)
                .data(Map.<String, JsonNode>of("user", JsonNodeFactory.instance.textNode(user)))
                .expiryDate(NOW.plus(validity))
                .build();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
