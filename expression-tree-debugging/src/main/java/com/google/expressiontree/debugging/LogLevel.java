/*
 * Copyright (C) 2024 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package com.google.expressiontree.debugging;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * How much a {@link com.google.expressiontree.debugging.visitors.DebugExpressionVisitor} reports.
 * Levels are ordered: {@code NONE < BASIC < DETAILED}.
 */
public enum LogLevel {
    /** Nothing is logged. */
    NONE,
    /** One record per visited node whose category is enabled. */
    BASIC,
    /** As {@link #BASIC}, plus the time spent below timed nodes. */
    DETAILED;

    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static LogLevel fromString(String value) {
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level: " + value);
    }
}
