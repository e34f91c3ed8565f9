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

package com.phonepe.sessionstore.core.utils;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.experimental.UtilityClass;

import java.util.Comparator;

/**
 * Comparators for use with {@link JsonNode#equals(Comparator, JsonNode)}
 */
@UtilityClass
public class JsonNodeComparators {

    /**
     * Treats numeric nodes as equal when they hold the same value, whatever their node type. Only a result of zero
     * is meaningful, the comparator does not define an ordering.
     */
    public static final Comparator<JsonNode> NUMERIC_VALUE = JsonNodeComparators::compareNumericValue;

    private static int compareNumericValue(JsonNode lhs, JsonNode rhs) {
        if (lhs.equals(rhs)) {
            return 0;
        }
        if (!lhs.isNumber() || !rhs.isNumber()) {
            return 1;
        }
        if (lhs.isFloatingPointNumber() || rhs.isFloatingPointNumber()) {
            return Double.compare(lhs.doubleValue(), rhs.doubleValue());
        }
        return lhs.bigIntegerValue().compareTo(rhs.bigIntegerValue());
    }
}
