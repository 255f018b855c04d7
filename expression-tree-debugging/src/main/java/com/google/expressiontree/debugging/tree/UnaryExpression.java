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
 * A unary operator applied to one operand. The operand is {@code null} only for a rethrow.
 */
public final class UnaryExpression extends Expression {
    private final Expression operand;

    UnaryExpression(ExpressionType nodeType, Class<?> type, Expression operand) {
        super(nodeType, type);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    public UnaryExpression update(Expression operand) {
        if (operand == this.operand) {
            return this;
        }
        return new UnaryExpression(getNodeType(), getType(), operand);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        switch (getNodeType()) {
            case POST_INCREMENT:
            case POST_DECREMENT:
                return operand + getNodeType().getSymbol();
            case CONVERT:
                return "(" + typeName(getType()) + ") " + operand;
            case TYPE_AS:
                return "(" + operand + " as " + typeName(getType()) + ")";
            case ARRAY_LENGTH:
                return operand + ".length";
            case QUOTE:
                return "quote(" + operand + ")";
            case THROW:
                return operand == null ? "throw" : "throw " + operand;
            default:
                return getNodeType().getSymbol() + operand;
        }
    }
}
