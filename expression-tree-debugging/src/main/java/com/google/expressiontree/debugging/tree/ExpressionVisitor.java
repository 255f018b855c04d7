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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Visitor for an {@link Expression} tree. By default every hook visits the children of its node in
 * evaluation order and rebuilds the node from the results, so a subclass only overrides the hooks
 * for the node kinds it cares about. A node whose children all come back unchanged is returned as
 * is; a visitor that replaces nothing therefore returns the very tree it was given.
 */
public abstract class ExpressionVisitor {

    /**
     * Dispatches {@code node} to the hook for its kind. Returns {@code null} for a {@code null} node.
     */
    public Expression visit(Expression node) {
        return node == null ? null : node.accept(this);
    }

    /**
     * Visits every element, returning the original list if no element was replaced.
     */
    public List<Expression> visit(List<Expression> nodes) {
        return visitElements(nodes, this::visit);
    }

    /**
     * Visits a node whose parent requires a specific node class, for example the parameters of a
     * lambda.
     *
     * @throws IllegalStateException if the visit replaced the node with one of another class
     */
    public <T extends Expression> T visitAndConvert(T node, String callerName) {
        if (node == null) {
            return null;
        }
        Expression visited = visit(node);
        if (!node.getClass().isInstance(visited)) {
            throw new IllegalStateException("When called from " + callerName + ", rewriting a node of type "
                    + node.getClass().getSimpleName() + " must return a non-null value of the same type. "
                    + "Override " + callerName + " and change it to not visit children of this type.");
        }
        @SuppressWarnings("unchecked")
        T converted = (T) visited;
        return converted;
    }

    public <T extends Expression> List<T> visitAndConvert(List<T> nodes, String callerName) {
        return visitElements(nodes, node -> visitAndConvert(node, callerName));
    }

    public Expression visitBinary(BinaryExpression node) {
        return node.update(visit(node.getLeft()), visit(node.getRight()));
    }

    public Expression visitBlock(BlockExpression node) {
        return node.update(visitAndConvert(node.getVariables(), "visitBlock"), visit(node.getExpressions()));
    }

    public Expression visitConditional(ConditionalExpression node) {
        return node.update(visit(node.getTest()), visit(node.getIfTrue()), visit(node.getIfFalse()));
    }

    public Expression visitConstant(ConstantExpression node) {
        return node;
    }

    public Expression visitDebugInfo(DebugInfoExpression node) {
        return node;
    }

    public Expression visitDefault(DefaultExpression node) {
        return node;
    }

    public Expression visitDynamic(DynamicExpression node) {
        return node.update(visit(node.getArguments()));
    }

    public Expression visitExtension(ExtensionExpression node) {
        return node.visitChildren(this);
    }

    public Expression visitGoto(GotoExpression node) {
        return node.update(visitLabelTarget(node.getTarget()), visit(node.getValue()));
    }

    public Expression visitIndex(IndexExpression node) {
        return node.update(visit(node.getObject()), visit(node.getArguments()));
    }

    public Expression visitInvocation(InvocationExpression node) {
        return node.update(visit(node.getExpression()), visit(node.getArguments()));
    }

    public Expression visitLabel(LabelExpression node) {
        return node.update(visitLabelTarget(node.getTarget()), visit(node.getDefaultValue()));
    }

    public Expression visitLambda(LambdaExpression node) {
        return node.update(visit(node.getBody()), visitAndConvert(node.getParameters(), "visitLambda"));
    }

    public Expression visitListInit(ListInitExpression node) {
        return node.update(visitAndConvert(node.getNewExpression(), "visitListInit"),
                visitElements(node.getInitializers(), this::visitElementInit));
    }

    public Expression visitLoop(LoopExpression node) {
        return node.update(visitLabelTarget(node.getBreakLabel()), visitLabelTarget(node.getContinueLabel()),
                visit(node.getBody()));
    }

    public Expression visitMember(MemberExpression node) {
        return node.update(visit(node.getExpression()));
    }

    public Expression visitMemberInit(MemberInitExpression node) {
        return node.update(visitAndConvert(node.getNewExpression(), "visitMemberInit"),
                visitElements(node.getBindings(), this::visitMemberAssignment));
    }

    public Expression visitMethodCall(MethodCallExpression node) {
        return node.update(visit(node.getObject()), visit(node.getArguments()));
    }

    public Expression visitNew(NewExpression node) {
        return node.update(visit(node.getArguments()));
    }

    public Expression visitNewArray(NewArrayExpression node) {
        return node.update(visit(node.getExpressions()));
    }

    public Expression visitParameter(ParameterExpression node) {
        return node;
    }

    public Expression visitRuntimeVariables(RuntimeVariablesExpression node) {
        return node.update(visitAndConvert(node.getVariables(), "visitRuntimeVariables"));
    }

    public Expression visitSwitch(SwitchExpression node) {
        return node.update(visit(node.getSwitchValue()), visitElements(node.getCases(), this::visitSwitchCase),
                visit(node.getDefaultBody()));
    }

    public Expression visitTry(TryExpression node) {
        return node.update(visit(node.getBody()), visitElements(node.getHandlers(), this::visitCatchBlock),
                visit(node.getFinally()), visit(node.getFault()));
    }

    public Expression visitTypeBinary(TypeBinaryExpression node) {
        return node.update(visit(node.getExpression()));
    }

    public Expression visitUnary(UnaryExpression node) {
        return node.update(visit(node.getOperand()));
    }

    // Elements that are not expressions themselves.

    public LabelTarget visitLabelTarget(LabelTarget target) {
        return target;
    }

    public ElementInit visitElementInit(ElementInit initializer) {
        return initializer.update(visit(initializer.getArguments()));
    }

    public MemberAssignment visitMemberAssignment(MemberAssignment assignment) {
        return assignment.update(visit(assignment.getExpression()));
    }

    public SwitchCase visitSwitchCase(SwitchCase switchCase) {
        return switchCase.update(visit(switchCase.getTestValues()), visit(switchCase.getBody()));
    }

    public CatchBlock visitCatchBlock(CatchBlock handler) {
        return handler.update(visitAndConvert(handler.getVariable(), "visitCatchBlock"), visit(handler.getFilter()),
                visit(handler.getBody()));
    }

    private static <T> List<T> visitElements(List<T> elements, UnaryOperator<T> elementVisitor) {
        List<T> rewritten = null;
        for (int i = 0; i < elements.size(); i++) {
            T original = elements.get(i);
            T visited = elementVisitor.apply(original);
            if (rewritten != null) {
                rewritten.add(visited);
            } else if (visited != original) {
                rewritten = new ArrayList<>(elements.subList(0, i));
                rewritten.add(visited);
            }
        }
        return rewritten == null ? elements : Collections.unmodifiableList(rewritten);
    }
}
