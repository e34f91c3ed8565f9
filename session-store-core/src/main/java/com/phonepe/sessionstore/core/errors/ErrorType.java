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

package com.phonepe.sessionstore.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failures reported by session stores
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    BACKEND("Backend error: %s"),
    DECODE("Error decoding session record: %s"),
    ENCODE("Error encoding session record: %s"),
    ;

    private final String message;
}
