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
 * Calls a constructor.
 */
public final class NewExpression extends Expression {
    private final List<Expression> arguments;

    NewExpression(Class<?> type, List<Expression> arguments) {
        super(ExpressionType.NEW, type);
        this.arguments = List.copyOf(arguments);
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public NewExpression update(List<Expression> arguments) {
        if (sameElements(arguments, this.arguments)) {
            return this;
        }
        return new NewExpression(getType(), arguments);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitNew(this);
    }

    @Override
    public String toString() {
        return "new " + typeName(getType()) + "(" + join(arguments) + ")";
    }
}
