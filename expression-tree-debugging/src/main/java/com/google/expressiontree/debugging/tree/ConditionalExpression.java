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
 * {@code test ? ifTrue : ifFalse}. A statement-style {@code if} without an else branch has an empty
 * {@link DefaultExpression} of type {@code void} as its false branch.
 */
public final class ConditionalExpression extends Expression {
    private final Expression test;
    private final Expression ifTrue;
    private final Expression ifFalse;

    ConditionalExpression(Class<?> type, Expression test, Expression ifTrue, Expression ifFalse) {
        super(ExpressionType.CONDITIONAL, type);
        this.test = test;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getIfTrue() {
        return ifTrue;
    }

    public Expression getIfFalse() {
        return ifFalse;
    }

    public ConditionalExpression update(Expression test, Expression ifTrue, Expression ifFalse) {
        if (test == this.test && ifTrue == this.ifTrue && ifFalse == this.ifFalse) {
            return this;
        }
        return new ConditionalExpression(getType(), test, ifTrue, ifFalse);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public String toString() {
        return "(" + test + " ? " + ifTrue + " : " + ifFalse + ")";
    }
}
