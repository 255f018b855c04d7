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
 * An operation bound at run time by name, such as a call through {@code invokedynamic}.
 */
public final class DynamicExpression extends Expression {
    private final String operation;
    private final List<Expression> arguments;

    DynamicExpression(Class<?> type, String operation, List<Expression> arguments) {
        super(ExpressionType.DYNAMIC, type);
        this.operation = operation;
        this.arguments = List.copyOf(arguments);
    }

    public String getOperation() {
        return operation;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public DynamicExpression update(List<Expression> arguments) {
        if (sameElements(arguments, this.arguments)) {
            return this;
        }
        return new DynamicExpression(getType(), operation, arguments);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitDynamic(this);
    }

    @Override
    public String toString() {
        return "dynamic " + operation + "(" + join(arguments) + ")";
    }
}
