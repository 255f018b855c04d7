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
 * Creates an array, either from a list of elements ({@link ExpressionType#NEW_ARRAY_INIT}) or from
 * the length of each dimension ({@link ExpressionType#NEW_ARRAY_BOUNDS}).
 */
public final class NewArrayExpression extends Expression {
    private final List<Expression> expressions;

    NewArrayExpression(ExpressionType nodeType, Class<?> arrayType, List<Expression> expressions) {
        super(nodeType, arrayType);
        this.expressions = List.copyOf(expressions);
    }

    /**
     * The elements for an initialized array, or the dimension lengths for a bounded one.
     */
    public List<Expression> getExpressions() {
        return expressions;
    }

    public NewArrayExpression update(List<Expression> expressions) {
        if (sameElements(expressions, this.expressions)) {
            return this;
        }
        return new NewArrayExpression(getNodeType(), getType(), expressions);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitNewArray(this);
    }

    @Override
    public String toString() {
        if (getNodeType() == ExpressionType.NEW_ARRAY_INIT) {
            return "new " + typeName(getType()) + " {" + join(expressions) + "}";
        }
        Class<?> elementType = getType();
        StringBuilder dimensions = new StringBuilder();
        for (Expression bound : expressions) {
            elementType = elementType.getComponentType();
            dimensions.append('[').append(bound).append(']');
        }
        return "new " + typeName(elementType) + dimensions;
    }
}
