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
 * A literal value.
 */
public final class ConstantExpression extends Expression {
    private final Object value;

    ConstantExpression(Object value, Class<?> type) {
        super(ExpressionType.CONSTANT, type);
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        if (value instanceof Character) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
