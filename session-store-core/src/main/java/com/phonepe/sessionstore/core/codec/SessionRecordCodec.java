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

package com.phonepe.sessionstore.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.sessionstore.core.SessionRecord;
import com.phonepe.sessionstore.core.errors.ErrorType;
import com.phonepe.sessionstore.core.errors.SessionStoreException;
import com.phonepe.sessionstore.core.utils.MapperUtils;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Converts {@link SessionRecord}s to and from their stored binary (MessagePack) form
 */
@Slf4j
public class SessionRecordCodec {
    private final ObjectMapper mapper;

    public SessionRecordCodec() {
        this(MapperUtils.createMsgPackMapper());
    }

    public SessionRecordCodec(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(@NonNull SessionRecord sessionRecord) {
        try {
            return mapper.writeValueAsBytes(sessionRecord);
        }
        catch (JsonProcessingException e) {
            log.error("Could not encode session record {}: {}", sessionRecord.getId(), e.getMessage());
            throw SessionStoreException.error(ErrorType.ENCODE, e);
        }
    }

    public SessionRecord decode(@NonNull byte[] bytes) {
        try {
            return mapper.readValue(bytes, SessionRecord.class);
        }
        catch (IOException e) {
            log.warn("Could not decode {} bytes as a session record: {}", bytes.length, e.getMessage());
            throw SessionStoreException.error(ErrorType.DECODE, e);
        }
    }
}
