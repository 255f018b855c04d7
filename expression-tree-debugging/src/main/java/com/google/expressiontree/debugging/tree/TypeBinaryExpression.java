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
 * Tests the run-time type of a value: {@link ExpressionType#TYPE_IS} accepts subtypes,
 * {@link ExpressionType#TYPE_EQUAL} only the exact type.
 */
public final class TypeBinaryExpression extends Expression {
    private final Expression expression;
    private final Class<?> typeOperand;

    TypeBinaryExpression(ExpressionType nodeType, Expression expression, Class<?> typeOperand) {
        super(nodeType, boolean.class);
        this.expression = expression;
        this.typeOperand = typeOperand;
    }

    public Expression getExpression() {
        return expression;
    }

    public Class<?> getTypeOperand() {
        return typeOperand;
    }

    public TypeBinaryExpression update(Expression expression) {
        if (expression == this.expression) {
            return this;
        }
        return new TypeBinaryExpression(getNodeType(), expression, typeOperand);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitTypeBinary(this);
    }

    @Override
    public String toString() {
        if (getNodeType() == ExpressionType.TYPE_EQUAL) {
            return "(" + expression + ".getClass() == " + typeName(typeOperand) + ".class)";
        }
        return "(" + expression + " instanceof " + typeName(typeOperand) + ")";
    }
}
