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
 * A sequence of expressions evaluated in order, with variables scoped to the block. The value of
 * the block is the value of its last expression.
 */
public final class BlockExpression extends Expression {
    private final List<ParameterExpression> variables;
    private final List<Expression> expressions;

    BlockExpression(List<ParameterExpression> variables, List<Expression> expressions) {
        super(ExpressionType.BLOCK, expressions.get(expressions.size() - 1).getType());
        this.variables = List.copyOf(variables);
        this.expressions = List.copyOf(expressions);
    }

    public List<ParameterExpression> getVariables() {
        return variables;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public Expression getResult() {
        return expressions.get(expressions.size() - 1);
    }

    public BlockExpression update(List<ParameterExpression> variables, List<Expression> expressions) {
        if (sameElements(variables, this.variables) && sameElements(expressions, this.expressions)) {
            return this;
        }
        return new BlockExpression(variables, expressions);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{ ");
        for (ParameterExpression variable : variables) {
            builder.append("var ").append(variable).append("; ");
        }
        return builder.append(join(expressions, "; ")).append(" }").toString();
    }
}
