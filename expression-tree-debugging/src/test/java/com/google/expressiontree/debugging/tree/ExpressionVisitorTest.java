package com.google.expressiontree.debugging.tree;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.expressiontree.debugging.tree.Expressions.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class ExpressionVisitorTest {

    /** Records the leaves it reaches, in order. */
    static class LeafCollector extends ExpressionVisitor {
        final List<String> leaves = new ArrayList<>();

        @Override
        public Expression visitConstant(ConstantExpression node) {
            leaves.add(node.toString());
            return node;
        }

        @Override
        public Expression visitParameter(ParameterExpression node) {
            leaves.add(node.getName());
            return node;
        }
    }

    /** Replaces every integer constant with the next integer. */
    static class Increment extends ExpressionVisitor {
        @Override
        public Expression visitConstant(ConstantExpression node) {
            if (node.getValue() instanceof Integer) {
                return constant((Integer) node.getValue() + 1);
            }
            return node;
        }
    }

    /** An extension node that wraps one child. */
    static final class Traced extends ExtensionExpression {
        final Expression inner;

        Traced(Expression inner) {
            super(inner.getType());
            this.inner = inner;
        }

        @Override
        protected Expression visitChildren(ExpressionVisitor visitor) {
            Expression visited = visitor.visit(inner);
            return visited == inner ? this : new Traced(visited);
        }
    }

    @Test
    public void visitsChildrenInEvaluationOrder() {
        ParameterExpression x = parameter(int.class, "x");
        ParameterExpression e = variable(RuntimeException.class, "e");
        LabelTarget end = label("end");
        Expression tree = block(
                condition(lessThan(x, constant(1)), constant(2), constant(3)),
                lambda(add(x, constant(4)), x),
                makeSwitch(x, constant(7), switchCase(constant(6), constant(5))),
                makeTry(constant(8), null, null, makeCatch(RuntimeException.class, e, constant(10), equal(e, constant(9)))),
                tryFinally(constant(11), constant(12)),
                label(end, constant(13)));

        LeafCollector collector = new LeafCollector();
        collector.visit(tree);

        assertEquals(Arrays.asList(
                "x", "1", "2", "3",
                "x", "4", "x",
                "x", "5", "6", "7",
                "8", "e", "e", "9", "10",
                "11", "12",
                "13"), collector.leaves);
    }

    @Test
    public void visitorThatReplacesNothingReturnsTheSameTree() {
        Expression tree = block(
                listInit(newInstance(ArrayList.class), constant("a"), constant("b")),
                memberInit(newInstance(StringBuilder.class), bind("length", constant(0))),
                arrayAccess(newArrayBounds(int.class, constant(2), constant(3)), constant(0), constant(1)),
                new Traced(constant("traced")));

        assertSame(tree, new LeafCollector().visit(tree));
    }

    @Test
    public void rewritingRebuildsOnlyTheChangedPath() {
        ConstantExpression three = constant(3);
        ConstantExpression text = constant("four");
        BinaryExpression sum = add(three, constant(1));
        MethodCallExpression call = call(text, "length", int.class);
        BlockExpression tree = block(sum, call);

        Expression rewritten = new Increment().visit(tree);

        assertNotSame(tree, rewritten);
        BlockExpression block = (BlockExpression) rewritten;
        assertEquals("(4 + 2)", block.getExpressions().get(0).toString());
        assertSame(call, block.getExpressions().get(1));
        assertEquals("(3 + 1)", tree.getExpressions().get(0).toString());
    }

    @Test
    public void extensionChildrenAreVisitedThroughVisitChildren() {
        Traced traced = new Traced(constant(1));

        Expression rewritten = new Increment().visit(traced);

        assertEquals("2", ((Traced) rewritten).inner.toString());
        assertEquals(ExpressionType.EXTENSION, rewritten.getNodeType());
    }

    @Test(expected = IllegalStateException.class)
    public void rewritingALambdaParameterIntoAnotherKindFails() {
        ParameterExpression x = parameter(int.class, "x");
        ExpressionVisitor inline = new ExpressionVisitor() {
            @Override
            public Expression visitParameter(ParameterExpression node) {
                return constant(0);
            }
        };

        inline.visit(lambda(x, x));
    }

    @Test
    public void nullChildrenStayNull() {
        LabelTarget exit = label("exit");
        GotoExpression jump = breakTo(exit);

        GotoExpression visited = (GotoExpression) new Increment().visit(jump);

        assertSame(jump, visited);
        assertNull(visited.getValue());
    }

    @Test
    public void rendersSourceLikeText() {
        ParameterExpression items = parameter(String[].class, "items");
        ParameterExpression i = variable(int.class, "i");

        assertEquals("(3 + 4)", add(constant(3), constant(4)).toString());
        assertEquals("items[i]", arrayIndex(items, i).toString());
        assertEquals("items.length", arrayLength(items).toString());
        assertEquals("Math.max(i, 1)", callStatic(Math.class, "max", int.class, i, constant(1)).toString());
        assertEquals("new int[2][3]", newArrayBounds(int.class, constant(2), constant(3)).toString());
        assertEquals("new String[] {\"a\", \"b\"}", newArrayInit(String.class, constant("a"), constant("b")).toString());
        assertEquals("(Object) i", convert(i, Object.class).toString());
        assertEquals("(items instanceof Object[])", typeIs(items, Object[].class).toString());
        assertEquals("i -> (i * 2)", lambda(multiply(i, constant(2)), i).toString());
        assertEquals("default(Integer)", defaultValue(Integer.class).toString());
    }
}
