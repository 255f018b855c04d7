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
 * A named parameter or local variable. Parameters are compared by identity: two parameters with
 * the same name and type are still distinct variables.
 */
public final class ParameterExpression extends Expression {
    private final String name;

    ParameterExpression(Class<?> type, String name) {
        super(ExpressionType.PARAMETER, type);
        this.name = name;
    }

    /**
     * The parameter name, or {@code null} for an anonymous parameter.
     */
    public String getName() {
        return name;
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public String toString() {
        return name == null ? "<param>" : name;
    }
}
