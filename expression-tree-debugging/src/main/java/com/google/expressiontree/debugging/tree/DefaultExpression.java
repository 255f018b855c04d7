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
 * The default value of a type; with type {@code void} it is the empty expression.
 */
public final class DefaultExpression extends Expression {

    DefaultExpression(Class<?> type) {
        super(ExpressionType.DEFAULT, type);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitDefault(this);
    }

    @Override
    public String toString() {
        return getType() == void.class ? "default" : "default(" + typeName(getType()) + ")";
    }
}
