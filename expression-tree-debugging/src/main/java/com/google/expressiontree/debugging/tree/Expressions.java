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

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factory methods for expression tree nodes. Required children are checked for {@code null}; the
 * result type of each node is derived from its operands unless given explicitly.
 */
public final class Expressions {

    private Expressions() {
    }

    // Constants, parameters and defaults

    public static ConstantExpression constant(Object value) {
        return new ConstantExpression(value, value == null ? Object.class : value.getClass());
    }

    public static ConstantExpression constant(Object value, Class<?> type) {
        checkNotNull(type, "type");
        if (value != null && !type.isPrimitive() && !type.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Value of type " + value.getClass().getName() + " is not assignable to " + type.getName());
        }
        return new ConstantExpression(value, type);
    }

    public static ParameterExpression parameter(Class<?> type, String name) {
        checkNotNull(type, "type");
        if (type == void.class) {
            throw new IllegalArgumentException("A parameter cannot be of type void");
        }
        return new ParameterExpression(type, name);
    }

    public static ParameterExpression variable(Class<?> type, String name) {
        return parameter(type, name);
    }

    public static DefaultExpression defaultValue(Class<?> type) {
        return new DefaultExpression(checkNotNull(type, "type"));
    }

    public static DefaultExpression empty() {
        return new DefaultExpression(void.class);
    }

    // Operators

    public static BinaryExpression makeBinary(ExpressionType binaryType, Expression left, Expression right) {
        checkNotNull(binaryType, "binaryType");
        checkNotNull(left, "left");
        checkNotNull(right, "right");
        if (!binaryType.isBinary()) {
            throw new IllegalArgumentException(binaryType + " is not a binary operator");
        }
        Class<?> type;
        if (binaryType.isPredicate()) {
            type = boolean.class;
        } else if (binaryType == ExpressionType.ARRAY_INDEX) {
            if (!left.getType().isArray()) {
                throw new IllegalArgumentException("Array index requires an array, got " + left.getType().getName());
            }
            type = left.getType().getComponentType();
        } else {
            type = left.getType();
        }
        return new BinaryExpression(binaryType, type, left, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return makeBinary(ExpressionType.ADD, left, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return makeBinary(ExpressionType.SUBTRACT, left, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return makeBinary(ExpressionType.MULTIPLY, left, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return makeBinary(ExpressionType.DIVIDE, left, right);
    }

    public static BinaryExpression modulo(Expression left, Expression right) {
        return makeBinary(ExpressionType.MODULO, left, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return makeBinary(ExpressionType.EQUAL, left, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return makeBinary(ExpressionType.NOT_EQUAL, left, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return makeBinary(ExpressionType.LESS_THAN, left, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return makeBinary(ExpressionType.GREATER_THAN, left, right);
    }

    public static BinaryExpression andAlso(Expression left, Expression right) {
        return makeBinary(ExpressionType.AND_ALSO, left, right);
    }

    public static BinaryExpression orElse(Expression left, Expression right) {
        return makeBinary(ExpressionType.OR_ELSE, left, right);
    }

    public static BinaryExpression coalesce(Expression left, Expression right) {
        return makeBinary(ExpressionType.COALESCE, left, right);
    }

    public static BinaryExpression assign(Expression left, Expression right) {
        return makeBinary(ExpressionType.ASSIGN, left, right);
    }

    public static BinaryExpression arrayIndex(Expression array, Expression index) {
        return makeBinary(ExpressionType.ARRAY_INDEX, array, index);
    }

    public static UnaryExpression makeUnary(ExpressionType unaryType, Expression operand, Class<?> type) {
        checkNotNull(unaryType, "unaryType");
        if (!unaryType.isUnary()) {
            throw new IllegalArgumentException(unaryType + " is not a unary operator");
        }
        if (operand == null && unaryType != ExpressionType.THROW) {
            throw new IllegalArgumentException("operand must not be null");
        }
        if (type == null) {
            switch (unaryType) {
                case CONVERT:
                case TYPE_AS:
                    throw new IllegalArgumentException(unaryType + " requires a target type");
                case ARRAY_LENGTH:
                    type = int.class;
                    break;
                case THROW:
                    type = void.class;
                    break;
                case NOT:
                    type = operand.getType() == Boolean.class ? boolean.class : operand.getType();
                    break;
                default:
                    type = operand.getType();
            }
        }
        return new UnaryExpression(unaryType, type, operand);
    }

    public static UnaryExpression negate(Expression operand) {
        return makeUnary(ExpressionType.NEGATE, operand, null);
    }

    public static UnaryExpression not(Expression operand) {
        return makeUnary(ExpressionType.NOT, operand, null);
    }

    public static UnaryExpression convert(Expression operand, Class<?> type) {
        return makeUnary(ExpressionType.CONVERT, operand, checkNotNull(type, "type"));
    }

    public static UnaryExpression typeAs(Expression operand, Class<?> type) {
        if (checkNotNull(type, "type").isPrimitive()) {
            throw new IllegalArgumentException("Cannot apply 'as' to primitive type " + type.getName());
        }
        return makeUnary(ExpressionType.TYPE_AS, operand, type);
    }

    public static UnaryExpression arrayLength(Expression array) {
        if (!checkNotNull(array, "array").getType().isArray()) {
            throw new IllegalArgumentException("Array length requires an array, got " + array.getType().getName());
        }
        return makeUnary(ExpressionType.ARRAY_LENGTH, array, null);
    }

    public static UnaryExpression quote(LambdaExpression lambda) {
        return makeUnary(ExpressionType.QUOTE, lambda, LambdaExpression.class);
    }

    public static UnaryExpression throwing(Expression exception) {
        return makeUnary(ExpressionType.THROW, checkNotNull(exception, "exception"), null);
    }

    public static UnaryExpression rethrow() {
        return makeUnary(ExpressionType.THROW, null, null);
    }

    public static TypeBinaryExpression typeIs(Expression expression, Class<?> type) {
        return new TypeBinaryExpression(ExpressionType.TYPE_IS, checkNotNull(expression, "expression"),
                checkNotNull(type, "type"));
    }

    public static TypeBinaryExpression typeEqual(Expression expression, Class<?> type) {
        return new TypeBinaryExpression(ExpressionType.TYPE_EQUAL, checkNotNull(expression, "expression"),
                checkNotNull(type, "type"));
    }

    // Control flow

    public static BlockExpression block(Expression... expressions) {
        return block(Collections.emptyList(), Arrays.asList(expressions));
    }

    public static BlockExpression block(List<ParameterExpression> variables, List<Expression> expressions) {
        checkElements(variables, "variables");
        checkElements(expressions, "expressions");
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("A block requires at least one expression");
        }
        return new BlockExpression(variables, expressions);
    }

    public static ConditionalExpression condition(Expression test, Expression ifTrue, Expression ifFalse) {
        checkNotNull(test, "test");
        checkNotNull(ifTrue, "ifTrue");
        checkNotNull(ifFalse, "ifFalse");
        if (test.getType() != boolean.class && test.getType() != Boolean.class) {
            throw new IllegalArgumentException("Condition must be boolean, got " + test.getType().getName());
        }
        Class<?> type = ifTrue.getType() == ifFalse.getType() ? ifTrue.getType() : void.class;
        return new ConditionalExpression(type, test, ifTrue, ifFalse);
    }

    public static ConditionalExpression ifThen(Expression test, Expression ifTrue) {
        return condition(test, ifTrue, empty());
    }

    public static LabelTarget label(Class<?> type, String name) {
        return new LabelTarget(checkNotNull(type, "type"), name);
    }

    public static LabelTarget label(String name) {
        return label(void.class, name);
    }

    public static LabelExpression label(LabelTarget target) {
        return label(target, null);
    }

    public static LabelExpression label(LabelTarget target, Expression defaultValue) {
        return new LabelExpression(checkNotNull(target, "target"), defaultValue);
    }

    public static GotoExpression makeGoto(GotoKind kind, LabelTarget target, Expression value, Class<?> type) {
        return new GotoExpression(checkNotNull(type, "type"), checkNotNull(kind, "kind"),
                checkNotNull(target, "target"), value);
    }

    public static GotoExpression jump(LabelTarget target) {
        return makeGoto(GotoKind.GOTO, target, null, void.class);
    }

    public static GotoExpression breakTo(LabelTarget target) {
        return makeGoto(GotoKind.BREAK, target, null, void.class);
    }

    public static GotoExpression breakTo(LabelTarget target, Expression value) {
        return makeGoto(GotoKind.BREAK, target, value, void.class);
    }

    public static GotoExpression continueTo(LabelTarget target) {
        return makeGoto(GotoKind.CONTINUE, target, null, void.class);
    }

    public static GotoExpression returnTo(LabelTarget target, Expression value) {
        return makeGoto(GotoKind.RETURN, target, value, void.class);
    }

    public static LoopExpression loop(Expression body) {
        return loop(body, null, null);
    }

    public static LoopExpression loop(Expression body, LabelTarget breakLabel) {
        return loop(body, breakLabel, null);
    }

    public static LoopExpression loop(Expression body, LabelTarget breakLabel, LabelTarget continueLabel) {
        checkNotNull(body, "body");
        if (continueLabel != null && continueLabel.getType() != void.class) {
            throw new IllegalArgumentException("A continue label must be of type void");
        }
        return new LoopExpression(body, breakLabel, continueLabel);
    }

    public static SwitchCase switchCase(Expression body, Expression... testValues) {
        checkNotNull(body, "body");
        List<Expression> values = Arrays.asList(testValues);
        checkElements(values, "testValues");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("A switch case requires at least one test value");
        }
        return new SwitchCase(values, body);
    }

    public static SwitchExpression makeSwitch(Expression switchValue, Expression defaultBody, SwitchCase... cases) {
        checkNotNull(switchValue, "switchValue");
        List<SwitchCase> caseList = Arrays.asList(cases);
        checkElements(caseList, "cases");
        Class<?> type;
        if (!caseList.isEmpty()) {
            type = caseList.get(0).getBody().getType();
        } else if (defaultBody != null) {
            type = defaultBody.getType();
        } else {
            type = void.class;
        }
        return new SwitchExpression(type, switchValue, caseList, defaultBody);
    }

    public static CatchBlock catchBlock(Class<? extends Throwable> test, Expression body) {
        return makeCatch(test, null, body, null);
    }

    public static CatchBlock catchBlock(ParameterExpression variable, Expression body) {
        checkNotNull(variable, "variable");
        if (!Throwable.class.isAssignableFrom(variable.getType())) {
            throw new IllegalArgumentException("A catch variable must be a Throwable, got " + variable.getType().getName());
        }
        return makeCatch(variable.getType().asSubclass(Throwable.class), variable, body, null);
    }

    public static CatchBlock makeCatch(Class<? extends Throwable> test, ParameterExpression variable, Expression body,
                                       Expression filter) {
        checkNotNull(test, "test");
        checkNotNull(body, "body");
        if (filter != null && filter.getType() != boolean.class && filter.getType() != Boolean.class) {
            throw new IllegalArgumentException("A catch filter must be boolean, got " + filter.getType().getName());
        }
        return new CatchBlock(test, variable, filter, body);
    }

    public static TryExpression tryCatch(Expression body, CatchBlock... handlers) {
        return makeTry(body, null, null, handlers);
    }

    public static TryExpression tryFinally(Expression body, Expression finallyBody) {
        return makeTry(body, finallyBody, null);
    }

    public static TryExpression tryCatchFinally(Expression body, Expression finallyBody, CatchBlock... handlers) {
        return makeTry(body, finallyBody, null, handlers);
    }

    public static TryExpression tryFault(Expression body, Expression faultBody) {
        return makeTry(body, null, faultBody);
    }

    public static TryExpression makeTry(Expression body, Expression finallyBody, Expression faultBody,
                                        CatchBlock... handlers) {
        checkNotNull(body, "body");
        List<CatchBlock> handlerList = Arrays.asList(handlers);
        checkElements(handlerList, "handlers");
        if (finallyBody != null && faultBody != null) {
            throw new IllegalArgumentException("A try expression cannot have both a finally and a fault block");
        }
        if (faultBody != null && !handlerList.isEmpty()) {
            throw new IllegalArgumentException("A try expression with a fault block cannot have handlers");
        }
        if (handlerList.isEmpty() && finallyBody == null && faultBody == null) {
            throw new IllegalArgumentException("A try expression requires a handler, a finally or a fault block");
        }
        return new TryExpression(body.getType(), body, handlerList, finallyBody, faultBody);
    }

    public static DebugInfoExpression debugInfo(String fileName, int startLine, int startColumn, int endLine,
                                                int endColumn) {
        checkNotNull(fileName, "fileName");
        if (startLine < 1 || startColumn < 1 || endLine < startLine
                || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("Invalid source span " + startLine + ":" + startColumn + "-"
                    + endLine + ":" + endColumn);
        }
        return new DebugInfoExpression(fileName, startLine, startColumn, endLine, endColumn);
    }

    public static DebugInfoExpression clearDebugInfo(String fileName) {
        checkNotNull(fileName, "fileName");
        int clear = DebugInfoExpression.CLEAR_LINE;
        return new DebugInfoExpression(fileName, clear, 0, clear, 0);
    }

    // Members, calls and object creation

    public static MemberExpression field(Expression expression, String name, Class<?> type) {
        checkNotNull(expression, "expression");
        return new MemberExpression(checkNotNull(type, "type"), expression, expression.getType(),
                checkNotNull(name, "name"));
    }

    public static MemberExpression staticField(Class<?> declaringType, String name, Class<?> type) {
        return new MemberExpression(checkNotNull(type, "type"), null, checkNotNull(declaringType, "declaringType"),
                checkNotNull(name, "name"));
    }

    public static MethodCallExpression call(Expression instance, String methodName, Class<?> returnType,
                                            Expression... arguments) {
        checkNotNull(instance, "instance");
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        return new MethodCallExpression(checkNotNull(returnType, "returnType"), instance, instance.getType(),
                checkNotNull(methodName, "methodName"), argumentList);
    }

    public static MethodCallExpression callStatic(Class<?> declaringType, String methodName, Class<?> returnType,
                                                  Expression... arguments) {
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        return new MethodCallExpression(checkNotNull(returnType, "returnType"), null,
                checkNotNull(declaringType, "declaringType"), checkNotNull(methodName, "methodName"), argumentList);
    }

    /**
     * Calls a reflected method; {@code instance} must be {@code null} exactly when the method is static.
     */
    public static MethodCallExpression call(Expression instance, Method method, Expression... arguments) {
        checkNotNull(method, "method");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (isStatic != (instance == null)) {
            throw new IllegalArgumentException(isStatic
                    ? "Static method " + method.getName() + " requires a null instance"
                    : "Instance method " + method.getName() + " requires an instance");
        }
        if (arguments.length != method.getParameterCount()) {
            throw new IllegalArgumentException("Method " + method.getName() + " takes " + method.getParameterCount()
                    + " arguments, got " + arguments.length);
        }
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        return new MethodCallExpression(method.getReturnType(), instance, method.getDeclaringClass(),
                method.getName(), argumentList);
    }

    public static IndexExpression arrayAccess(Expression array, Expression... indexes) {
        checkNotNull(array, "array");
        List<Expression> indexList = Arrays.asList(indexes);
        checkElements(indexList, "indexes");
        Class<?> type = array.getType();
        for (int i = 0; i < indexList.size(); i++) {
            if (!type.isArray()) {
                throw new IllegalArgumentException("Too many indexes for " + array.getType().getName());
            }
            type = type.getComponentType();
        }
        return new IndexExpression(type, array, null, indexList);
    }

    public static IndexExpression property(Expression instance, String indexer, Class<?> type, Expression... arguments) {
        checkNotNull(instance, "instance");
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        return new IndexExpression(checkNotNull(type, "type"), instance, checkNotNull(indexer, "indexer"), argumentList);
    }

    public static InvocationExpression invoke(Expression expression, Expression... arguments) {
        checkNotNull(expression, "expression");
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        if (expression instanceof LambdaExpression) {
            int expected = ((LambdaExpression) expression).getParameters().size();
            if (expected != argumentList.size()) {
                throw new IllegalArgumentException("Lambda takes " + expected + " arguments, got " + argumentList.size());
            }
            return new InvocationExpression(expression.getType(), expression, argumentList);
        }
        return new InvocationExpression(Object.class, expression, argumentList);
    }

    public static LambdaExpression lambda(Expression body, ParameterExpression... parameters) {
        return lambda(null, body, Arrays.asList(parameters));
    }

    public static LambdaExpression lambda(String name, Expression body, List<ParameterExpression> parameters) {
        checkNotNull(body, "body");
        checkElements(parameters, "parameters");
        if (parameters.stream().distinct().count() != parameters.size()) {
            throw new IllegalArgumentException("A lambda cannot declare the same parameter twice");
        }
        return new LambdaExpression(name, body, parameters);
    }

    public static DynamicExpression dynamic(String operation, Class<?> returnType, Expression... arguments) {
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        return new DynamicExpression(checkNotNull(returnType, "returnType"), checkNotNull(operation, "operation"),
                argumentList);
    }

    public static NewExpression newInstance(Class<?> type, Expression... arguments) {
        checkNotNull(type, "type");
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers()) || type.isPrimitive()) {
            throw new IllegalArgumentException("Cannot instantiate " + type.getName());
        }
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        return new NewExpression(type, argumentList);
    }

    public static ElementInit elementInit(String addMethod, Expression... arguments) {
        List<Expression> argumentList = Arrays.asList(arguments);
        checkElements(argumentList, "arguments");
        if (argumentList.isEmpty()) {
            throw new IllegalArgumentException("An element initializer requires at least one argument");
        }
        return new ElementInit(checkNotNull(addMethod, "addMethod"), argumentList);
    }

    public static ListInitExpression listInit(NewExpression newExpression, ElementInit... initializers) {
        checkNotNull(newExpression, "newExpression");
        List<ElementInit> initializerList = Arrays.asList(initializers);
        checkElements(initializerList, "initializers");
        if (initializerList.isEmpty()) {
            throw new IllegalArgumentException("A list initializer requires at least one element");
        }
        return new ListInitExpression(newExpression, initializerList);
    }

    /**
     * A list initializer that adds each element with the collection's {@code add} method.
     */
    public static ListInitExpression listInit(NewExpression newExpression, Expression... elements) {
        ElementInit[] initializers = new ElementInit[elements.length];
        for (int i = 0; i < elements.length; i++) {
            initializers[i] = elementInit("add", elements[i]);
        }
        return listInit(newExpression, initializers);
    }

    public static MemberAssignment bind(String memberName, Expression expression) {
        return new MemberAssignment(checkNotNull(memberName, "memberName"), checkNotNull(expression, "expression"));
    }

    public static MemberInitExpression memberInit(NewExpression newExpression, MemberAssignment... bindings) {
        checkNotNull(newExpression, "newExpression");
        List<MemberAssignment> bindingList = Arrays.asList(bindings);
        checkElements(bindingList, "bindings");
        return new MemberInitExpression(newExpression, bindingList);
    }

    public static NewArrayExpression newArrayInit(Class<?> elementType, Expression... elements) {
        checkNotNull(elementType, "elementType");
        if (elementType == void.class) {
            throw new IllegalArgumentException("Cannot create an array of void");
        }
        List<Expression> elementList = Arrays.asList(elements);
        checkElements(elementList, "elements");
        return new NewArrayExpression(ExpressionType.NEW_ARRAY_INIT, arrayOf(elementType, 1), elementList);
    }

    public static NewArrayExpression newArrayBounds(Class<?> elementType, Expression... bounds) {
        checkNotNull(elementType, "elementType");
        if (elementType == void.class) {
            throw new IllegalArgumentException("Cannot create an array of void");
        }
        List<Expression> boundList = Arrays.asList(bounds);
        checkElements(boundList, "bounds");
        if (boundList.isEmpty()) {
            throw new IllegalArgumentException("An array requires at least one dimension");
        }
        return new NewArrayExpression(ExpressionType.NEW_ARRAY_BOUNDS, arrayOf(elementType, boundList.size()),
                boundList);
    }

    public static RuntimeVariablesExpression runtimeVariables(ParameterExpression... variables) {
        List<ParameterExpression> variableList = Arrays.asList(variables);
        checkElements(variableList, "variables");
        return new RuntimeVariablesExpression(variableList);
    }

    private static Class<?> arrayOf(Class<?> elementType, int dimensions) {
        return Array.newInstance(elementType, new int[dimensions]).getClass();
    }

    private static <T> T checkNotNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    private static void checkElements(List<?> elements, String name) {
        checkNotNull(elements, name);
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == null) {
                throw new IllegalArgumentException(name + "[" + i + "] must not be null");
            }
        }
    }
}
