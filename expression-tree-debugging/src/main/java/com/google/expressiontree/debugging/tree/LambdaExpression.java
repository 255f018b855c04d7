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
 * A lambda with a body and parameters. The node type is the type of the body's value.
 */
public final class LambdaExpression extends Expression {
    private final String name;
    private final Expression body;
    private final List<ParameterExpression> parameters;

    LambdaExpression(String name, Expression body, List<ParameterExpression> parameters) {
        super(ExpressionType.LAMBDA, body.getType());
        this.name = name;
        this.body = body;
        this.parameters = List.copyOf(parameters);
    }

    /**
     * The name given to the lambda, or {@code null} if it is anonymous.
     */
    public String getName() {
        return name;
    }

    public Expression getBody() {
        return body;
    }

    public List<ParameterExpression> getParameters() {
        return parameters;
    }

    public LambdaExpression update(Expression body, List<ParameterExpression> parameters) {
        if (body == this.body && sameElements(parameters, this.parameters)) {
            return this;
        }
        return new LambdaExpression(name, body, parameters);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public String toString() {
        String parameterList = parameters.size() == 1 ? parameters.get(0).toString() : "(" + join(parameters) + ")";
        return parameterList + " -> " + body;
    }
}
