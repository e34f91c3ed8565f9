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

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

import java.util.Objects;

/**
 * Redis client wrapper. The wrapped {@link RedissonClient} is thread safe, pools its connections and reconnects on
 * its own, so a single instance should be shared by all stores in the process.
 */
@Slf4j
public class RedisClient implements AutoCloseable {
    public static final int DEFAULT_DATABASE = 0;
    public static final int DEFAULT_CONNECTION_POOL_SIZE = 64;
    public static final int DEFAULT_MIN_IDLE_CONNECTIONS = 8;
    public static final int DEFAULT_TIMEOUT_MS = 3_000;

    @Getter
    private final RedissonClient redissonClient;

    /**
     * @param serverUrl          Address of the server, for example {@code redis://localhost:6379}
     * @param password           Password, if the server needs one
     * @param database           Database index
     * @param connectionPoolSize Maximum number of pooled connections
     * @param timeoutMs          Time to wait for a reply to a command
     */
    @Builder
    public RedisClient(
            @NonNull String serverUrl,
            String password,
            Integer database,
            Integer connectionPoolSize,
            Integer timeoutMs) {
        final var poolSize = Objects.requireNonNullElse(connectionPoolSize, DEFAULT_CONNECTION_POOL_SIZE);
        final var config = new Config();
        config.useSingleServer()
                .setAddress(serverUrl)
                .setPassword(password)
                .setDatabase(Objects.requireNonNullElse(database, DEFAULT_DATABASE))
                .setConnectionPoolSize(poolSize)
                .setConnectionMinimumIdleSize(Math.min(poolSize, DEFAULT_MIN_IDLE_CONNECTIONS))
                .setTimeout(Objects.requireNonNullElse(timeoutMs, DEFAULT_TIMEOUT_MS));
        this.redissonClient = Redisson.create(config);
        log.info("Created redis client for {} with pool size {}", serverUrl, poolSize);
    }

    @Override
    public void close() {
        log.info("Shutting down redis client");
        redissonClient.shutdown();
    }
}
