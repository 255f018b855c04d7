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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class of every node in an expression tree. Nodes are immutable; a visitor that wants a
 * different tree gets one back from the node's {@code update} method.
 */
public abstract class Expression {

    private final ExpressionType nodeType;
    private final Class<?> type;

    Expression(ExpressionType nodeType, Class<?> type) {
        this.nodeType = nodeType;
        this.type = type;
    }

    public ExpressionType getNodeType() {
        return nodeType;
    }

    /**
     * The static type of the value this expression produces, {@code void.class} for statements.
     */
    public Class<?> getType() {
        return type;
    }

    /**
     * Dispatches to the hook of {@code visitor} that matches this node kind.
     *
     * @return the node the hook produced, which is {@code this} when nothing was replaced
     */
    public abstract Expression accept(ExpressionVisitor visitor);

    static String join(List<?> items) {
        return join(items, ", ");
    }

    static String join(List<?> items, String separator) {
        return items.stream().map(String::valueOf).collect(Collectors.joining(separator));
    }

    static boolean sameElements(List<?> first, List<?> second) {
        if (first == second) {
            return true;
        }
        if (first.size() != second.size()) {
            return false;
        }
        for (int i = 0; i < first.size(); i++) {
            if (first.get(i) != second.get(i)) {
                return false;
            }
        }
        return true;
    }

    static String typeName(Class<?> type) {
        return type == null ? "?" : type.getSimpleName();
    }
}
