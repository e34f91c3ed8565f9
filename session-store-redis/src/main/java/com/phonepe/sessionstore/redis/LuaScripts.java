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

/**
 * Lua scripts run against redis
 */
public final class LuaScripts {

    /**
     * Stores a value with an absolute expiry in one atomic command.
     * <ul>
     *     <li>KEYS[1]: session key</li>
     *     <li>ARGV[1]: encoded session record</li>
     *     <li>ARGV[2]: expiry as unix seconds</li>
     * </ul>
     * Replies with the status of the underlying SET.
     */
    public static final String SET_WITH_ABSOLUTE_EXPIRY =
            "return redis.call('SET', KEYS[1], ARGV[1], 'EXAT', ARGV[2])";

    private LuaScripts() {
    }
}
