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
 * Calls a method. The target object is {@code null} for static methods.
 */
public final class MethodCallExpression extends Expression {
    private final Expression object;
    private final Class<?> declaringType;
    private final String methodName;
    private final List<Expression> arguments;

    MethodCallExpression(Class<?> type, Expression object, Class<?> declaringType, String methodName,
                         List<Expression> arguments) {
        super(ExpressionType.CALL, type);
        this.object = object;
        this.declaringType = declaringType;
        this.methodName = methodName;
        this.arguments = List.copyOf(arguments);
    }

    public Expression getObject() {
        return object;
    }

    public Class<?> getDeclaringType() {
        return declaringType;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public boolean isStatic() {
        return object == null;
    }

    public MethodCallExpression update(Expression object, List<Expression> arguments) {
        if (object == this.object && sameElements(arguments, this.arguments)) {
            return this;
        }
        return new MethodCallExpression(getType(), object, declaringType, methodName, arguments);
    }

    @Override
    public Expression accept(ExpressionVisitor visitor) {
        return visitor.visitMethodCall(this);
    }

    @Override
    public String toString() {
        String target = object == null ? typeName(declaringType) : object.toString();
        return target + "." + methodName + "(" + join(arguments) + ")";
    }
}
