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
 * A binary operator applied to two operands, for example {@code a + b} or {@code items[i]}.
 */
public final class BinaryExpression extends Expression {
    private final Expression left;
    private final Expression right;

    BinaryExpression(ExpressionType nodeType, Class<?> type, Expression left, Expression right) {
        super(nodeType, type);
        this.left = left;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public BinaryExpression update(Expression left, Expression right) {
        if (left == this.left && right == this.right) {
            return this;
        }
        return new BinaryExpression(getNodeType(), getType(), left, right);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        switch (getNodeType()) {
            case ARRAY_INDEX:
                return left + "[" + right + "]";
            case ASSIGN:
                return left + " = " + right;
            default:
                return "(" + left + " " + getNodeType().getSymbol() + " " + right + ")";
        }
    }
}
