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

package com.google.expressiontree.debugging.tree;

/**
 * The destination of a jump. Targets are compared by identity.
 */
public final class LabelTarget {
    private final Class<?> type;
    private final String name;

    LabelTarget(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * The type of the value passed when jumping to this target, {@code void.class} when none is.
     */
    public Class<?> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name == null ? "<label>" : name;
    }
}
