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
 * Reads a field or property. The target expression is {@code null} for static members.
 */
public final class MemberExpression extends Expression {
    private final Expression expression;
    private final Class<?> declaringType;
    private final String memberName;

    MemberExpression(Class<?> type, Expression expression, Class<?> declaringType, String memberName) {
        super(ExpressionType.MEMBER_ACCESS, type);
        this.expression = expression;
        this.declaringType = declaringType;
        this.memberName = memberName;
    }

    public Expression getExpression() {
        return expression;
    }

    public Class<?> getDeclaringType() {
        return declaringType;
    }

    public String getMemberName() {
        return memberName;
    }

    public boolean isStatic() {
        return expression == null;
    }

    public MemberExpression update(Expression expression) {
        if (expression == this.expression) {
            return this;
        }
        return new MemberExpression(getType(), expression, declaringType, memberName);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitMember(this);
    }

    @Override
    public String toString() {
        return (expression == null ? typeName(declaringType) : expression.toString()) + "." + memberName;
    }
}
