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
 * Node types of an expression tree. Binary and unary operators carry the symbol used when the node
 * is rendered as text.
 */
public enum ExpressionType {
    ADD(Category.BINARY, "+"),
    SUBTRACT(Category.BINARY, "-"),
    MULTIPLY(Category.BINARY, "*"),
    DIVIDE(Category.BINARY, "/"),
    MODULO(Category.BINARY, "%"),
    AND(Category.BINARY, "&"),
    OR(Category.BINARY, "|"),
    EXCLUSIVE_OR(Category.BINARY, "^"),
    AND_ALSO(Category.BINARY, "&&"),
    OR_ELSE(Category.BINARY, "||"),
    EQUAL(Category.BINARY, "=="),
    NOT_EQUAL(Category.BINARY, "!="),
    LESS_THAN(Category.BINARY, "<"),
    LESS_THAN_OR_EQUAL(Category.BINARY, "<="),
    GREATER_THAN(Category.BINARY, ">"),
    GREATER_THAN_OR_EQUAL(Category.BINARY, ">="),
    LEFT_SHIFT(Category.BINARY, "<<"),
    RIGHT_SHIFT(Category.BINARY, ">>"),
    UNSIGNED_RIGHT_SHIFT(Category.BINARY, ">>>"),
    COALESCE(Category.BINARY, "??"),
    ARRAY_INDEX(Category.BINARY, "[]"),
    ASSIGN(Category.BINARY, "="),

    NEGATE(Category.UNARY, "-"),
    UNARY_PLUS(Category.UNARY, "+"),
    NOT(Category.UNARY, "!"),
    ONES_COMPLEMENT(Category.UNARY, "~"),
    PRE_INCREMENT(Category.UNARY, "++"),
    PRE_DECREMENT(Category.UNARY, "--"),
    POST_INCREMENT(Category.UNARY, "++"),
    POST_DECREMENT(Category.UNARY, "--"),
    CONVERT(Category.UNARY, "(cast)"),
    TYPE_AS(Category.UNARY, "as"),
    ARRAY_LENGTH(Category.UNARY, ".length"),
    QUOTE(Category.UNARY, "quote"),
    THROW(Category.UNARY, "throw"),

    TYPE_IS(Category.TYPE_BINARY, "instanceof"),
    TYPE_EQUAL(Category.TYPE_BINARY, "=="),

    BLOCK,
    CONDITIONAL,
    CONSTANT,
    DEBUG_INFO,
    DEFAULT,
    DYNAMIC,
    EXTENSION,
    GOTO,
    INDEX,
    INVOKE,
    LABEL,
    LAMBDA,
    LIST_INIT,
    LOOP,
    MEMBER_ACCESS,
    MEMBER_INIT,
    CALL,
    NEW,
    NEW_ARRAY_INIT,
    NEW_ARRAY_BOUNDS,
    PARAMETER,
    RUNTIME_VARIABLES,
    SWITCH,
    TRY;

    private enum Category {
        BINARY,
        UNARY,
        TYPE_BINARY,
        STRUCTURE
    }

    private final Category category;
    private final String symbol;

    ExpressionType() {
        this(Category.STRUCTURE, null);
    }

    ExpressionType(Category category, String symbol) {
        this.category = category;
        this.symbol = symbol;
    }

    public boolean isBinary() {
        return category == Category.BINARY;
    }

    public boolean isUnary() {
        return category == Category.UNARY;
    }

    public boolean isTypeBinary() {
        return category == Category.TYPE_BINARY;
    }

    /**
     * Operators whose result is always a boolean, whatever the operand types.
     */
    public boolean isPredicate() {
        switch (this) {
            case AND_ALSO:
            case OR_ELSE:
            case EQUAL:
            case NOT_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case TYPE_IS:
            case TYPE_EQUAL:
                return true;
            default:
                return false;
        }
    }

    /**
     * The operator symbol, or {@code null} for structural node types.
     */
    public String getSymbol() {
        return symbol;
    }
}
