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

import com.phonepe.sessionstore.core.SessionRecord;
import com.phonepe.sessionstore.core.SessionStore;
import com.phonepe.sessionstore.core.codec.SessionRecordCodec;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store that keeps encoded records in process memory. Expired records are dropped when they are read and
 * swept out on every save.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private record StoredRecord(Instant expiryDate, byte[] encoded) {
    }

    private final Map<String, StoredRecord> records = new ConcurrentHashMap<>();
    private final SessionRecordCodec codec;
    private final Clock clock;

    public InMemorySessionStore() {
        this(null, null);
    }

    @Builder
    public InMemorySessionStore(SessionRecordCodec codec, Clock clock) {
        this.codec = Objects.requireNonNullElseGet(codec, SessionRecordCodec::new);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    @Override
    public CompletableFuture<Void> save(@NonNull SessionRecord sessionRecord) {
        return CompletableFuture.completedFuture(sessionRecord)
                .thenApply(codec::encode)
                .thenAccept(encoded -> {
                    removeExpired();
                    records.put(sessionRecord.getId(), new StoredRecord(sessionRecord.getExpiryDate(), encoded));
                    log.debug("Saved session {} expiring at {}", sessionRecord.getId(), sessionRecord.getExpiryDate());
                });
    }

    @Override
    public CompletableFuture<Optional<SessionRecord>> load(@NonNull String sessionId) {
        final var stored = records.get(sessionId);
        if (null == stored) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!stored.expiryDate().isAfter(clock.instant())) {
            log.debug("Session {} expired at {}", sessionId, stored.expiryDate());
            records.remove(sessionId, stored);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(stored.encoded())
                .thenApply(codec::decode)
                .thenApply(Optional::of);
    }

    @Override
    public CompletableFuture<Void> delete(@NonNull String sessionId) {
        final var removed = records.remove(sessionId);
        log.debug("Deleted session {}. Was present: {}", sessionId, removed != null);
        return CompletableFuture.completedFuture(null);
    }

    int size() {
        return records.size();
    }

    private void removeExpired() {
        final var now = clock.instant();
        if (records.values().removeIf(stored -> !stored.expiryDate().isAfter(now))) {
            log.debug("Removed expired sessions. Remaining: {}", records.size());
        }
    }
}
