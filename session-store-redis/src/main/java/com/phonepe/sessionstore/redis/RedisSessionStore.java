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

package com.phonepe.sessionstore.redis;

import com.google.common.base.Strings;
import com.phonepe.sessionstore.core.SessionRecord;
import com.phonepe.sessionstore.core.SessionStore;
import com.phonepe.sessionstore.core.codec.SessionRecordCodec;
import com.phonepe.sessionstore.core.errors.ErrorType;
import com.phonepe.sessionstore.core.errors.SessionStoreException;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RFuture;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Session store backed by redis. Each record lives at {@code <prefix>:<session id>} and carries an absolute expiry,
 * so redis drops it on its own once the session has expired. Every operation is exactly one command.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {
    public static final String DEFAULT_KEY_PREFIX = "tower_session";

    private final RedissonClient client;
    private final String keyPrefix;
    private final SessionRecordCodec codec;

    @Builder
    public RedisSessionStore(@NonNull RedissonClient client, String keyPrefix, SessionRecordCodec codec) {
        this.client = client;
        this.keyPrefix = Strings.isNullOrEmpty(keyPrefix) ? DEFAULT_KEY_PREFIX : keyPrefix;
        this.codec = Objects.requireNonNullElseGet(codec, SessionRecordCodec::new);
    }

    @Override
    public CompletableFuture<Void> save(@NonNull SessionRecord sessionRecord) {
        final var key = key(sessionRecord.getId());
        final var expiry = sessionRecord.expiryEpochSeconds();
        return CompletableFuture.completedFuture(sessionRecord)
                .thenApply(codec::encode)
                .thenCompose(encoded -> backendCall(
                        "SET", key,
                        () -> client.getScript(ByteArrayCodec.INSTANCE)
                                .<String>evalAsync(RScript.Mode.READ_WRITE,
                                                   LuaScripts.SET_WITH_ABSOLUTE_EXPIRY,
                                                   RScript.ReturnType.STATUS,
                                                   List.<Object>of(key),
                                                   encoded,
                                                   Long.toString(expiry).getBytes(StandardCharsets.US_ASCII))))
                .thenAccept(reply -> log.debug("Saved session at {} expiring at {}. Reply: {}", key, expiry, reply));
    }

    @Override
    public CompletableFuture<Optional<SessionRecord>> load(@NonNull String sessionId) {
        final var key = key(sessionId);
        return backendCall("GET", key, () -> client.<byte[]>getBucket(key, ByteArrayCodec.INSTANCE).getAsync())
                .thenApply(bytes -> {
                    if (null == bytes) {
                        log.debug("No session found at {}", key);
                    }
                    return Optional.ofNullable(bytes).map(codec::decode);
                });
    }

    @Override
    public CompletableFuture<Void> delete(@NonNull String sessionId) {
        final var key = key(sessionId);
        return backendCall("DEL", key, () -> client.getBucket(key, ByteArrayCodec.INSTANCE).deleteAsync())
                .thenAccept(deleted -> log.debug("Deleted session at {}. Was present: {}", key, deleted));
    }

    String key(String sessionId) {
        return "%s:%s".formatted(keyPrefix, sessionId);
    }

    @Override
    public String toString() {
        return "RedisSessionStore(keyPrefix=%s)".formatted(keyPrefix);
    }

    /**
     * Runs one redis command inside the returned future. Failures, whether raised while issuing the command or
     * reported by the server, complete the future with a {@link ErrorType#BACKEND} error.
     */
    private <T> CompletableFuture<T> backendCall(String command, String key, Supplier<RFuture<T>> call) {
        return CompletableFuture.completedFuture(key)
                .thenCompose(ignored -> call.get().toCompletableFuture())
                .handle((result, error) -> {
                    if (null != error) {
                        final var cause = error instanceof CompletionException && error.getCause() != null
                                          ? error.getCause()
                                          : error;
                        log.error("Redis {} failed for {}: {}", command, key, cause.getMessage());
                        throw SessionStoreException.error(ErrorType.BACKEND, cause);
                    }
                    return result;
                });
    }
}
