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
 * Assigns a value to a member of an object created by a {@link MemberInitExpression}.
 */
public final class MemberAssignment {
    private final String memberName;
    private final Expression expression;

    MemberAssignment(String memberName, Expression expression) {
        this.memberName = memberName;
        this.expression = expression;
    }

    public String getMemberName() {
        return memberName;
    }

    public Expression getExpression() {
        return expression;
    }

    public MemberAssignment update(Expression expression) {
        if (expression == this.expression) {
            return this;
        }
        return new MemberAssignment(memberName, expression);
    }

    @Override
    public String toString() {
        return memberName + " = " + expression;
    }
}
