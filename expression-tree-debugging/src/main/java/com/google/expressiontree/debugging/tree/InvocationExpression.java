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
 * Applies a lambda, or any other expression of functional type, to a list of arguments.
 */
public final class InvocationExpression extends Expression {
    private final Expression expression;
    private final List<Expression> arguments;

    InvocationExpression(Class<?> type, Expression expression, List<Expression> arguments) {
        super(ExpressionType.INVOKE, type);
        this.expression = expression;
        this.arguments = List.copyOf(arguments);
    }

    public Expression getExpression() {
        return expression;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public InvocationExpression update(Expression expression, List<Expression> arguments) {
        if (expression == this.expression && sameElements(arguments, this.arguments)) {
            return this;
        }
        return new InvocationExpression(getType(), expression, arguments);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitInvocation(this);
    }

    @Override
    public String toString() {
        return "invoke(" + expression + (arguments.isEmpty() ? "" : ", " + join(arguments)) + ")";
    }
}
