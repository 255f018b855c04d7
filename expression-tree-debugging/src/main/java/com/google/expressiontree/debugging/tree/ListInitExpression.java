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

/**
 * Creates a collection and adds each initializer to it, as in {@code new ArrayList<>() {1, 2}}.
 */
public final class ListInitExpression extends Expression {
    private final NewExpression newExpression;
    private final List<ElementInit> initializers;

    ListInitExpression(NewExpression newExpression, List<ElementInit> initializers) {
        super(ExpressionType.LIST_INIT, newExpression.getType());
        this.newExpression = newExpression;
        this.initializers = List.copyOf(initializers);
    }

    public NewExpression getNewExpression() {
        return newExpression;
    }

    public List<ElementInit> getInitializers() {
        return initializers;
    }

    public ListInitExpression update(NewExpression newExpression, List<ElementInit> initializers) {
        if (newExpression == this.newExpression && sameElements(initializers, this.initializers)) {
            return this;
        }
        return new ListInitExpression(newExpression, initializers);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitListInit(this);
    }

    @Override
    public String toString() {
        return newExpression + " {" + join(initializers) + "}";
    }
}
