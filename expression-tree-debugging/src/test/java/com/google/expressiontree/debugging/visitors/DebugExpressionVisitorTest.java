package com.google.expressiontree.debugging.visitors;

import com.google.expressiontree.debugging.DebugVisitorOptions;
import com.google.expressiontree.debugging.LogLevel;
import com.google.expressiontree.debugging.LogSink;
import com.google.expressiontree.debugging.RecordingLogSink;
import com.google.expressiontree.debugging.tree.ConditionalExpression;
import com.google.expressiontree.debugging.tree.Expression;
import com.google.expressiontree.debugging.tree.ExtensionExpression;
import com.google.expressiontree.debugging.tree.LabelTarget;
import com.google.expressiontree.debugging.tree.LambdaExpression;
import com.google.expressiontree.debugging.tree.ParameterExpression;
import com.google.expressiontree.debugging.util.Slf4jLogSink;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.google.expressiontree.debugging.tree.Expressions.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class DebugExpressionVisitorTest {

    /** The option flags, in the order they appear on {@link DebugVisitorOptions}. */
    enum Flag {
        METHOD_CALLS, BINARY, UNARY, CONSTANTS, LAMBDAS, PARAMETERS, MEMBERS, STRUCTURE, VALUES, TYPES;

        void enable(DebugVisitorOptions options) {
            switch (this) {
                case METHOD_CALLS: options.setLogMethodCalls(true); break;
                case BINARY: options.setLogBinaryExpressions(true); break;
                case UNARY: options.setLogUnaryExpressions(true); break;
                case CONSTANTS: options.setLogConstants(true); break;
                case LAMBDAS: options.setLogLambdas(true); break;
                case PARAMETERS: options.setLogParameters(true); break;
                case MEMBERS: options.setLogMembers(true); break;
                case STRUCTURE: options.setLogExpressionStructure(true); break;
                case VALUES: options.setLogExpressionValues(true); break;
                case TYPES: options.setLogExpressionTypes(true); break;
            }
        }
    }

    /** A user-defined node kind with no children. */
    static final class Marker extends ExtensionExpression {
        Marker() {
            super(void.class);
        }
    }

    public static class Point {
        public int x;
        public int y;
    }

    RecordingLogSink sink;
    DebugExpressionVisitor visitor;

    @Before
    public void setUp() {
        sink = new RecordingLogSink();
        visitor = new DebugExpressionVisitor(sink);
    }

    @Test
    public void additionLogsTheNodeBeforeItsOperands() {
        Expression tree = add(constant(3), constant(4));

        Expression result = visitor.visit(tree);

        assertSame(tree, result);
        assertEquals(Arrays.asList("visitBinary: 3 + 4", "visitConstant: 3", "visitConstant: 4"), sink.getMessages());
        assertEquals(3, sink.getRecords(Level.INFO).size());
    }

    @Test
    public void noneLevelLogsNothing() {
        visitor.getOptions().setLogLevel(LogLevel.NONE);
        Expression tree = sampleTree();

        Expression result = visitor.visit(tree);

        assertSame(tree, result);
        assertTrue(sink.getRecords().isEmpty());
    }

    @Test
    public void detailedCallWithoutArgumentsIsLoggedThenTimed() {
        visitor.getOptions().setLogLevel(LogLevel.DETAILED);

        visitor.visit(callStatic(System.class, "nanoTime", long.class));

        List<RecordingLogSink.Record> records = sink.getRecords();
        assertEquals(2, records.size());
        assertEquals(Level.INFO, records.get(0).getLevel());
        assertEquals("visitMethodCall: nanoTime", records.get(0).getMessage());
        assertEquals(Level.DEBUG, records.get(1).getLevel());
        assertEquals(DebugExpressionVisitor.ELAPSED_TEMPLATE, records.get(1).getTemplate());
        assertEquals("visitMethodCall", records.get(1).getHookName());
        assertEquals("nanoTime", records.get(1).getArguments()[1]);
        assertTrue(elapsedMillis(records.get(1)) >= 0);
    }

    @Test
    public void nestedTimedNodesEachMeasureTheirOwnSubtree() {
        visitor.getOptions().setLogLevel(LogLevel.DETAILED);
        Expression call = callStatic(Math.class, "abs", int.class, negate(constant(2)));

        visitor.visit(add(constant(1), call));

        assertEquals(Arrays.asList(
                "INFO visitBinary", "INFO visitConstant", "INFO visitMethodCall", "INFO visitUnary",
                "INFO visitConstant", "DEBUG visitUnary", "DEBUG visitMethodCall", "DEBUG visitBinary"),
                levelsAndHooks());

        List<RecordingLogSink.Record> timings = sink.getRecords(Level.DEBUG);
        double unary = elapsedMillis(timings.get(0));
        double methodCall = elapsedMillis(timings.get(1));
        double binary = elapsedMillis(timings.get(2));
        assertTrue(unary >= 0);
        assertTrue(methodCall >= unary);
        assertTrue(binary >= methodCall);
    }

    @Test
    public void basicLevelDoesNotTime() {
        visitor.visit(callStatic(Math.class, "abs", int.class, negate(constant(2))));

        assertTrue(sink.getRecords(Level.DEBUG).isEmpty());
        assertEquals(3, sink.getRecords(Level.INFO).size());
    }

    @Test
    public void disabledKindIsSkippedButItsChildrenAreVisited() {
        visitor.getOptions().setLogBinaryExpressions(false);

        visitor.visit(add(constant(3), constant(4)));

        assertEquals(Arrays.asList("visitConstant: 3", "visitConstant: 4"), sink.getMessages());
    }

    @Test
    public void disabledTimedKindIsNotTimed() {
        visitor.getOptions().setLogLevel(LogLevel.DETAILED);
        visitor.getOptions().setLogMethodCalls(false);

        visitor.visit(callStatic(Math.class, "abs", int.class, constant(2)));

        assertEquals(Arrays.asList("visitConstant: 2"), sink.getMessages());
    }

    @Test
    public void visitingTwiceLeavesTheTreeUntouched() {
        Expression tree = sampleTree();
        String rendered = tree.toString();

        Expression first = visitor.visit(tree);
        int recordsAfterFirstWalk = sink.getRecords().size();
        Expression second = visitor.visit(first);

        assertSame(tree, first);
        assertSame(tree, second);
        assertEquals(rendered, tree.toString());
        assertEquals(2 * recordsAfterFirstWalk, sink.getRecords().size());
    }

    @Test
    public void optionsChangedBetweenWalksApplyToTheNextWalk() {
        Expression tree = add(constant(3), constant(4));
        visitor.visit(tree);
        sink.clear();

        DebugVisitorOptions quiet = new DebugVisitorOptions();
        quiet.setLogLevel(LogLevel.NONE);
        visitor.setOptions(quiet);
        visitor.visit(tree);

        assertTrue(sink.getRecords().isEmpty());
    }

    @Test
    public void everyNodeKindIsLoggedWithAllOptionsEnabled() {
        visitor.visit(sampleTree());

        for (String hook : Arrays.asList("visitBlock", "visitConditional", "visitConstant", "visitDebugInfo",
                "visitDefault", "visitDynamic", "visitExtension", "visitGoto", "visitIndex", "visitInvocation",
                "visitLabel", "visitLambda", "visitListInit", "visitLoop", "visitMember", "visitMemberInit",
                "visitMethodCall", "visitNew", "visitNewArray", "visitParameter", "visitRuntimeVariables",
                "visitSwitch", "visitTry", "visitTypeBinary", "visitUnary", "visitBinary")) {
            assertTrue("no record for " + hook, sink.hasRecordFor(hook));
        }
    }

    // Option flags that enable each node kind

    @Test
    public void methodCallsAreGatedByTheirOwnFlag() {
        assertEnabledOnlyBy(callStatic(Math.class, "random", double.class), "visitMethodCall",
                EnumSet.of(Flag.METHOD_CALLS));
    }

    @Test
    public void operatorsAreGatedByTheirOwnFlags() {
        assertEnabledOnlyBy(add(constant(1), constant(2)), "visitBinary", EnumSet.of(Flag.BINARY));
        assertEnabledOnlyBy(negate(constant(1)), "visitUnary", EnumSet.of(Flag.UNARY));
    }

    @Test
    public void lambdasAndParametersAreGatedByTheirOwnFlags() {
        assertEnabledOnlyBy(lambda(constant(1)), "visitLambda", EnumSet.of(Flag.LAMBDAS));
        assertEnabledOnlyBy(parameter(int.class, "x"), "visitParameter", EnumSet.of(Flag.PARAMETERS));
    }

    @Test
    public void constantsAndMembersAreAlsoGatedByValuesAndTypes() {
        assertEnabledOnlyBy(constant(1), "visitConstant", EnumSet.of(Flag.CONSTANTS, Flag.VALUES, Flag.TYPES));
        assertEnabledOnlyBy(staticField(Integer.class, "MAX_VALUE", int.class), "visitMember",
                EnumSet.of(Flag.MEMBERS, Flag.VALUES, Flag.TYPES));
    }

    @Test
    public void valueProducingStructureIsGatedByStructureValuesAndTypes() {
        Set<Flag> flags = EnumSet.of(Flag.STRUCTURE, Flag.VALUES, Flag.TYPES);
        assertEnabledOnlyBy(arrayAccess(parameter(int[].class, "a"), constant(0)), "visitIndex", flags);
        assertEnabledOnlyBy(invoke(lambda(constant(1))), "visitInvocation", flags);
        assertEnabledOnlyBy(newInstance(StringBuilder.class), "visitNew", flags);
        assertEnabledOnlyBy(newArrayInit(int.class, constant(1)), "visitNewArray", flags);
    }

    @Test
    public void typeTestsAreGatedByStructureAndTypes() {
        assertEnabledOnlyBy(typeIs(constant("s"), String.class), "visitTypeBinary",
                EnumSet.of(Flag.STRUCTURE, Flag.TYPES));
    }

    @Test
    public void pureStructureIsGatedByStructureOnly() {
        Set<Flag> flags = EnumSet.of(Flag.STRUCTURE);
        LabelTarget exit = label("exit");
        assertEnabledOnlyBy(block(constant(1)), "visitBlock", flags);
        assertEnabledOnlyBy(condition(constant(true), constant(1), constant(2)), "visitConditional", flags);
        assertEnabledOnlyBy(debugInfo("Query.java", 1, 1, 1, 10), "visitDebugInfo", flags);
        assertEnabledOnlyBy(defaultValue(int.class), "visitDefault", flags);
        assertEnabledOnlyBy(dynamic("concat", String.class, constant("a")), "visitDynamic", flags);
        assertEnabledOnlyBy(new Marker(), "visitExtension", flags);
        assertEnabledOnlyBy(jump(exit), "visitGoto", flags);
        assertEnabledOnlyBy(label(exit), "visitLabel", flags);
        assertEnabledOnlyBy(listInit(newInstance(ArrayList.class), constant(1)), "visitListInit", flags);
        assertEnabledOnlyBy(loop(breakTo(exit), exit), "visitLoop", flags);
        assertEnabledOnlyBy(memberInit(newInstance(Point.class), bind("x", constant(1))), "visitMemberInit", flags);
        assertEnabledOnlyBy(runtimeVariables(variable(int.class, "i")), "visitRuntimeVariables", flags);
        assertEnabledOnlyBy(makeSwitch(constant(1), null, switchCase(constant("one"), constant(1))), "visitSwitch",
                flags);
        assertEnabledOnlyBy(tryFinally(constant(1), empty()), "visitTry", flags);
    }

    // Descriptions

    @Test
    public void describesTheSalientFieldOfEachNode() {
        ParameterExpression x = parameter(int.class, "x");
        LambdaExpression square = lambda("square", multiply(x, x), Arrays.asList(x));

        visitor.visit(square);
        visitor.visit(field(parameter(Point.class, "p"), "y", int.class));
        visitor.visit(constant("text"));
        visitor.visit(not(constant(true)));

        assertEquals(Arrays.asList(
                "visitLambda: square(x)", "visitBinary: x * x", "visitParameter: x", "visitParameter: x",
                "visitParameter: x",
                "visitMember: y", "visitParameter: p",
                "visitConstant: \"text\"",
                "visitUnary: !true", "visitConstant: true"), sink.getMessages());
    }

    @Test
    public void describesStructuralNodesByKind() {
        LabelTarget done = label("done");

        visitor.visit(block(Arrays.asList(variable(int.class, "i")), Arrays.asList(loop(breakTo(done), done))));

        assertEquals(Arrays.asList(
                "visitBlock: BLOCK with 1 expression and 1 variable", "visitParameter: i",
                "visitLoop: LOOP until done", "visitGoto: BREAK done"), sink.getMessages());
    }

    // Failures

    @Test(expected = NullPointerException.class)
    public void refusesToBeBuiltWithoutASink() {
        new DebugExpressionVisitor((LogSink) null);
    }

    @Test
    public void failingSinkDoesNotInterruptTheWalk() {
        List<String> attempts = new ArrayList<>();
        DebugExpressionVisitor failing = new DebugExpressionVisitor((level, template, arguments) -> {
            attempts.add((String) arguments[0]);
            throw new IllegalStateException("disk full");
        });
        failing.getOptions().setLogLevel(LogLevel.DETAILED);
        Expression tree = add(constant(3), constant(4));

        Expression result = failing.visit(tree);

        assertSame(tree, result);
        assertEquals(Arrays.asList("visitBinary", "visitConstant", "visitConstant", "visitBinary"), attempts);
    }

    @Test
    public void descriptionThatFailsIsSkipped() {
        Object unprintable = new Object() {
            @Override
            public String toString() {
                throw new UnsupportedOperationException("no text form");
            }
        };
        Expression tree = condition(constant(true), constant(unprintable), constant(2));

        Expression result = visitor.visit(tree);

        assertSame(tree, result);
        assertEquals(Arrays.asList("visitConstant: true", "visitConstant: 2"),
                sink.getMessages().subList(1, sink.getMessages().size()));
        assertFalse(sink.getMessages().get(0).contains("unprintable"));
    }

    @Test
    public void loggerConstructorUsesTheSlf4jSink() {
        DebugExpressionVisitor slf4jVisitor = new DebugExpressionVisitor(LoggerFactory.getLogger("expressions"));

        assertTrue(slf4jVisitor.getSink() instanceof Slf4jLogSink);
        assertEquals(LogLevel.BASIC, slf4jVisitor.getOptions().getLogLevel());
    }

    private void assertEnabledOnlyBy(Expression node, String hook, Set<Flag> enablingFlags) {
        for (Flag flag : Flag.values()) {
            DebugVisitorOptions options = new DebugVisitorOptions().disableAll();
            flag.enable(options);
            RecordingLogSink recording = new RecordingLogSink();

            new DebugExpressionVisitor(recording, options).visit(node);

            assertEquals(hook + " with only " + flag + " enabled", enablingFlags.contains(flag),
                    recording.hasRecordFor(hook));
        }

        RecordingLogSink none = new RecordingLogSink();
        new DebugExpressionVisitor(none, new DebugVisitorOptions().disableAll()).visit(node);
        assertTrue(none.getRecords().isEmpty());
    }

    private List<String> levelsAndHooks() {
        List<String> result = new ArrayList<>();
        for (RecordingLogSink.Record record : sink.getRecords()) {
            result.add(record.getLevel() + " " + record.getHookName());
        }
        return result;
    }

    private static double elapsedMillis(RecordingLogSink.Record record) {
        return (Double) record.getArguments()[2];
    }

    /** A tree that contains every node kind at least once. */
    private static Expression sampleTree() {
        ParameterExpression items = parameter(int[].class, "items");
        ParameterExpression i = variable(int.class, "i");
        ParameterExpression error = variable(IllegalStateException.class, "e");
        LabelTarget done = label("done");

        LambdaExpression sum = lambda("sum", add(arrayAccess(items, constant(0)), staticField(Integer.class,
                "MAX_VALUE", int.class)), Arrays.asList(items));
        ConditionalExpression check = condition(typeIs(constant("s"), String.class),
                invoke(sum, newArrayInit(int.class, constant(1), constant(2))),
                negate(callStatic(Math.class, "abs", int.class, constant(-3))));

        return block(Arrays.asList(i), Arrays.asList(
                debugInfo("Query.java", 3, 1, 3, 42),
                assign(i, check),
                dynamic("describe", String.class, i),
                listInit(newInstance(ArrayList.class), i),
                memberInit(newInstance(Point.class), bind("x", i)),
                runtimeVariables(i),
                new Marker(),
                loop(block(jump(done), label(done)), done),
                makeSwitch(i, defaultValue(int.class), switchCase(constant(0), constant(1))),
                tryCatch(i, catchBlock(error, i))));
    }
}
