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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A storage system for session records. Implementations persist whatever record they are handed and hand it back
 * on load. Generation of ids, cookie handling and deciding when a session is renewed or ended belong to the caller.
 * <p>
 * Failures complete the returned future exceptionally with a
 * {@link com.phonepe.sessionstore.core.errors.SessionStoreException}.
 */
public interface SessionStore {
    /**
     * Saves the record, replacing any record (and expiry) stored earlier under the same id.
     *
     * @param sessionRecord The record to persist
     * @return A future that completes once the backend has accepted the record
     */
    CompletableFuture<Void> save(SessionRecord sessionRecord);

    /**
     * Loads the record stored under the given id.
     *
     * @param sessionId Id of the session
     * @return The record, or empty if nothing is stored for the id (never written or already expired)
     */
    CompletableFuture<Optional<SessionRecord>> load(String sessionId);

    /**
     * Deletes the record stored under the given id. Deleting an absent record is not an error.
     *
     * @param sessionId Id of the session
     * @return A future that completes once the backend has processed the deletion
     */
    CompletableFuture<Void> delete(String sessionId);
}
