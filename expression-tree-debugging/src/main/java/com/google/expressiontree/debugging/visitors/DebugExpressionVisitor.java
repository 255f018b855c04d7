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

package com.google.expressiontree.debugging.visitors;

import com.google.expressiontree.debugging.DebugVisitorOptions;
import com.google.expressiontree.debugging.LogLevel;
import com.google.expressiontree.debugging.LogSink;
import com.google.expressiontree.debugging.tree.BinaryExpression;
import com.google.expressiontree.debugging.tree.BlockExpression;
import com.google.expressiontree.debugging.tree.ConditionalExpression;
import com.google.expressiontree.debugging.tree.ConstantExpression;
import com.google.expressiontree.debugging.tree.DebugInfoExpression;
import com.google.expressiontree.debugging.tree.DefaultExpression;
import com.google.expressiontree.debugging.tree.DynamicExpression;
import com.google.expressiontree.debugging.tree.Expression;
import com.google.expressiontree.debugging.tree.ExpressionType;
import com.google.expressiontree.debugging.tree.ExpressionVisitor;
import com.google.expressiontree.debugging.tree.ExtensionExpression;
import com.google.expressiontree.debugging.tree.GotoExpression;
import com.google.expressiontree.debugging.tree.IndexExpression;
import com.google.expressiontree.debugging.tree.InvocationExpression;
import com.google.expressiontree.debugging.tree.LabelExpression;
import com.google.expressiontree.debugging.tree.LambdaExpression;
import com.google.expressiontree.debugging.tree.ListInitExpression;
import com.google.expressiontree.debugging.tree.LoopExpression;
import com.google.expressiontree.debugging.tree.MemberExpression;
import com.google.expressiontree.debugging.tree.MemberInitExpression;
import com.google.expressiontree.debugging.tree.MethodCallExpression;
import com.google.expressiontree.debugging.tree.NewArrayExpression;
import com.google.expressiontree.debugging.tree.NewExpression;
import com.google.expressiontree.debugging.tree.ParameterExpression;
import com.google.expressiontree.debugging.tree.RuntimeVariablesExpression;
import com.google.expressiontree.debugging.tree.SwitchExpression;
import com.google.expressiontree.debugging.tree.TryExpression;
import com.google.expressiontree.debugging.tree.TypeBinaryExpression;
import com.google.expressiontree.debugging.tree.UnaryExpression;
import com.google.expressiontree.debugging.util.Slf4jLogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Walks an expression tree and logs every node it visits, without changing the tree.
 *
 * <p>For each node whose category is enabled in the {@link DebugVisitorOptions}, one {@code INFO}
 * record {@code "<hook>: <description>"} is written to the sink before the node's children are
 * visited. At {@link LogLevel#DETAILED}, method calls, binary and unary expressions are also timed:
 * a {@code DEBUG} record with the milliseconds spent visiting the node's children follows them.
 * Each timed node measures its own interval, so nested timed nodes report correctly.
 *
 * <p>Logging never interrupts the walk. A record that fails to format or write is reported on this
 * class's own logger and skipped.
 *
 * <p>Instances are not thread safe: the options may be changed between walks but not during one.
 */
public class DebugExpressionVisitor extends ExpressionVisitor {

    private static final Logger logger = LoggerFactory.getLogger(DebugExpressionVisitor.class);

    static final String VISIT_TEMPLATE = "{}: {}";
    static final String ELAPSED_TEMPLATE = "{}: {} completed in {} ms";
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final LogSink sink;
    private DebugVisitorOptions options;

    public DebugExpressionVisitor(LogSink sink) {
        this(sink, new DebugVisitorOptions());
    }

    public DebugExpressionVisitor(LogSink sink, DebugVisitorOptions options) {
        this.sink = Objects.requireNonNull(sink, "A log sink is required to debug expression trees");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Logs through {@code logger}, see {@link Slf4jLogSink}.
     */
    public DebugExpressionVisitor(Logger logger) {
        this(new Slf4jLogSink(logger));
    }

    public LogSink getSink() {
        return sink;
    }

    public DebugVisitorOptions getOptions() {
        return options;
    }

    public void setOptions(DebugVisitorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public Expression visitMethodCall(MethodCallExpression node) {
        return timedHook("visitMethodCall", options.isLogMethodCalls(), node::getMethodName,
                node::getMethodName, () -> super.visitMethodCall(node));
    }

    @Override
    public Expression visitBinary(BinaryExpression node) {
        return timedHook("visitBinary", options.isLogBinaryExpressions(), () -> describeBinary(node),
                () -> node.getNodeType().name(), () -> super.visitBinary(node));
    }

    @Override
    public Expression visitUnary(UnaryExpression node) {
        return timedHook("visitUnary", options.isLogUnaryExpressions(), node::toString,
                () -> node.getNodeType().name(), () -> super.visitUnary(node));
    }

    @Override
    public Expression visitConstant(ConstantExpression node) {
        return hook("visitConstant", options.isLogConstants() || logsValuesOrTypes(), node::toString,
                () -> super.visitConstant(node));
    }

    @Override
    public Expression visitLambda(LambdaExpression node) {
        return hook("visitLambda", options.isLogLambdas(), () -> describeLambda(node),
                () -> super.visitLambda(node));
    }

    @Override
    public Expression visitParameter(ParameterExpression node) {
        return hook("visitParameter", options.isLogParameters(), node::toString,
                () -> super.visitParameter(node));
    }

    @Override
    public Expression visitMember(MemberExpression node) {
        return hook("visitMember", options.isLogMembers() || logsValuesOrTypes(), node::getMemberName,
                () -> super.visitMember(node));
    }

    // Structure that also produces values

    @Override
    public Expression visitIndex(IndexExpression node) {
        return hook("visitIndex", logsStructureValuesOrTypes(), node::toString,
                () -> super.visitIndex(node));
    }

    @Override
    public Expression visitInvocation(InvocationExpression node) {
        return hook("visitInvocation", logsStructureValuesOrTypes(),
                () -> "INVOKE with " + count(node.getArguments().size(), "argument"),
                () -> super.visitInvocation(node));
    }

    @Override
    public Expression visitNew(NewExpression node) {
        return hook("visitNew", logsStructureValuesOrTypes(), () -> "NEW " + node.getType().getSimpleName(),
                () -> super.visitNew(node));
    }

    @Override
    public Expression visitNewArray(NewArrayExpression node) {
        return hook("visitNewArray", logsStructureValuesOrTypes(),
                () -> node.getNodeType() + " " + node.getType().getSimpleName(),
                () -> super.visitNewArray(node));
    }

    @Override
    public Expression visitTypeBinary(TypeBinaryExpression node) {
        return hook("visitTypeBinary", options.isLogExpressionStructure() || options.isLogExpressionTypes(),
                node::toString, () -> super.visitTypeBinary(node));
    }

    // Pure structure

    @Override
    public Expression visitBlock(BlockExpression node) {
        return hook("visitBlock", options.isLogExpressionStructure(),
                () -> "BLOCK with " + count(node.getExpressions().size(), "expression")
                        + " and " + count(node.getVariables().size(), "variable"),
                () -> super.visitBlock(node));
    }

    @Override
    public Expression visitConditional(ConditionalExpression node) {
        return hook("visitConditional", options.isLogExpressionStructure(), () -> "CONDITIONAL " + node.getTest(),
                () -> super.visitConditional(node));
    }

    @Override
    public Expression visitDebugInfo(DebugInfoExpression node) {
        return hook("visitDebugInfo", options.isLogExpressionStructure(), node::toString,
                () -> super.visitDebugInfo(node));
    }

    @Override
    public Expression visitDefault(DefaultExpression node) {
        return hook("visitDefault", options.isLogExpressionStructure(), node::toString,
                () -> super.visitDefault(node));
    }

    @Override
    public Expression visitDynamic(DynamicExpression node) {
        return hook("visitDynamic", options.isLogExpressionStructure(), () -> "DYNAMIC " + node.getOperation(),
                () -> super.visitDynamic(node));
    }

    @Override
    public Expression visitExtension(ExtensionExpression node) {
        return hook("visitExtension", options.isLogExpressionStructure(), () -> "EXTENSION " + node.getName(),
                () -> super.visitExtension(node));
    }

    @Override
    public Expression visitGoto(GotoExpression node) {
        return hook("visitGoto", options.isLogExpressionStructure(), () -> node.getKind() + " " + node.getTarget(),
                () -> super.visitGoto(node));
    }

    @Override
    public Expression visitLabel(LabelExpression node) {
        return hook("visitLabel", options.isLogExpressionStructure(), () -> "LABEL " + node.getTarget(),
                () -> super.visitLabel(node));
    }

    @Override
    public Expression visitListInit(ListInitExpression node) {
        return hook("visitListInit", options.isLogExpressionStructure(),
                () -> "LIST_INIT " + node.getType().getSimpleName() + " with "
                        + count(node.getInitializers().size(), "element"),
                () -> super.visitListInit(node));
    }

    @Override
    public Expression visitLoop(LoopExpression node) {
        return hook("visitLoop", options.isLogExpressionStructure(),
                () -> node.getBreakLabel() == null ? "LOOP" : "LOOP until " + node.getBreakLabel(),
                () -> super.visitLoop(node));
    }

    @Override
    public Expression visitMemberInit(MemberInitExpression node) {
        return hook("visitMemberInit", options.isLogExpressionStructure(),
                () -> "MEMBER_INIT " + node.getType().getSimpleName() + " with "
                        + count(node.getBindings().size(), "binding"),
                () -> super.visitMemberInit(node));
    }

    @Override
    public Expression visitRuntimeVariables(RuntimeVariablesExpression node) {
        return hook("visitRuntimeVariables", options.isLogExpressionStructure(),
                () -> "RUNTIME_VARIABLES " + node.getVariables(),
                () -> super.visitRuntimeVariables(node));
    }

    @Override
    public Expression visitSwitch(SwitchExpression node) {
        return hook("visitSwitch", options.isLogExpressionStructure(),
                () -> "SWITCH with " + count(node.getCases().size(), "case"),
                () -> super.visitSwitch(node));
    }

    @Override
    public Expression visitTry(TryExpression node) {
        return hook("visitTry", options.isLogExpressionStructure(),
                () -> "TRY with " + count(node.getHandlers().size(), "handler"),
                () -> super.visitTry(node));
    }

    private boolean logsValuesOrTypes() {
        return options.isLogExpressionValues() || options.isLogExpressionTypes();
    }

    private boolean logsStructureValuesOrTypes() {
        return options.isLogExpressionStructure() || logsValuesOrTypes();
    }

    private boolean isEnabled(boolean categoryEnabled) {
        return categoryEnabled && options.getLogLevel().isAtLeast(LogLevel.BASIC);
    }

    private Expression hook(String hookName, boolean categoryEnabled, Supplier<String> description,
                            Supplier<Expression> descent) {
        if (isEnabled(categoryEnabled)) {
            write(Level.INFO, VISIT_TEMPLATE, hookName, description);
        }
        return descent.get();
    }

    private Expression timedHook(String hookName, boolean categoryEnabled, Supplier<String> description,
                                 Supplier<String> descriptor, Supplier<Expression> descent) {
        if (!isEnabled(categoryEnabled)) {
            return descent.get();
        }
        write(Level.INFO, VISIT_TEMPLATE, hookName, description);
        if (options.getLogLevel() != LogLevel.DETAILED) {
            return descent.get();
        }

        long start = System.nanoTime();
        Expression result = descent.get();
        double elapsedMillis = (System.nanoTime() - start) / NANOS_PER_MILLI;
        write(Level.DEBUG, ELAPSED_TEMPLATE, hookName, descriptor, elapsedMillis);
        return result;
    }

    private void write(Level level, String template, String hookName, Supplier<String> description,
                       Object... extraArguments) {
        try {
            Object[] arguments = new Object[2 + extraArguments.length];
            arguments[0] = hookName;
            arguments[1] = description.get();
            System.arraycopy(extraArguments, 0, arguments, 2, extraArguments.length);
            sink.log(level, template, arguments);
        } catch (RuntimeException e) {
            logger.warn("Could not write {} record for {}", level, hookName, e);
        }
    }

    private static String describeBinary(BinaryExpression node) {
        if (node.getNodeType() == ExpressionType.ARRAY_INDEX) {
            return node.toString();
        }
        return node.getLeft() + " " + node.getNodeType().getSymbol() + " " + node.getRight();
    }

    private static String describeLambda(LambdaExpression node) {
        String name = node.getName() == null ? "lambda" : node.getName();
        return node.getParameters().stream()
                .map(ParameterExpression::toString)
                .collect(Collectors.joining(", ", name + "(", ")"));
    }

    private static String count(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
