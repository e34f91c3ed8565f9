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

package com.phonepe.sessionstore.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.sessionstore.core.utils.JsonNodeComparators;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state for one session. Two records are equal when their data match by value: numbers compare by
 * magnitude irrespective of the node type holding them, since the stored form keeps the value and not the type.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SessionRecord {
    /**
     * Opaque id of the session, owned by the session management layer
     */
    @NonNull
    String id;

    /**
     * Session scoped key/value state. Semantics are owned by the application.
     */
    @NonNull
    @Builder.Default
    Map<String, JsonNode> data = Map.of();

    /**
     * Absolute instant after which the record is no longer valid
     */
    @NonNull
    Instant expiryDate;

    /**
     * Expiry as integer seconds since epoch. Passed through as-is, past or negative values are not adjusted.
     */
    public long expiryEpochSeconds() {
        return expiryDate.getEpochSecond();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionRecord)) {
            return false;
        }
        final var other = (SessionRecord) o;
        return id.equals(other.id)
                && expiryDate.equals(other.expiryDate)
                && sameData(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, data.keySet(), expiryDate);
    }

    private boolean sameData(Map<String, JsonNode> otherData) {
        if (!data.keySet().equals(otherData.keySet())) {
            return false;
        }
        return data.entrySet()
                .stream()
                .allMatch(entry -> {
                    final var mine = entry.getValue();
                    final var theirs = otherData.get(entry.getKey());
                    if (null == mine || null == theirs) {
                        return mine == theirs;
                    }
                    return mine.equals(JsonNodeComparators.NUMERIC_VALUE, theirs);
                });
    }
}
