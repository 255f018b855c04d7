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
 * Creates an object and assigns some of its members, as in {@code new Point() {x = 1, y = 2}}.
 */
public final class MemberInitExpression extends Expression {
    private final NewExpression newExpression;
    private final List<MemberAssignment> bindings;

    MemberInitExpression(NewExpression newExpression, List<MemberAssignment> bindings) {
        super(ExpressionType.MEMBER_INIT, newExpression.getType());
        this.newExpression = newExpression;
        this.bindings = List.copyOf(bindings);
    }

    public NewExpression getNewExpression() {
        return newExpression;
    }

    public List<MemberAssignment> getBindings() {
        return bindings;
    }

    public MemberInitExpression update(NewExpression newExpression, List<MemberAssignment> bindings) {
        if (newExpression == this.newExpression && sameElements(bindings, this.bindings)) {
            return this;
        }
        return new MemberInitExpression(newExpression, bindings);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitMemberInit(this);
    }

    @Override
    public String toString() {
        return newExpression + " {" + join(bindings) + "}";
    }
}
