package com.google.expressiontree.debugging.tree;

import org.junit.Test;

import java.lang.reflect.Method;
import java.util.Collections;

import static com.google.expressiontree.debugging.tree.Expressions.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ExpressionsTest {

    @Test
    public void derivesResultTypes() {
        ParameterExpression values = parameter(long[].class, "values");

        assertEquals(boolean.class, equal(constant(1), constant(2)).getType());
        assertEquals(Integer.class, add(constant(1), constant(2)).getType());
        assertEquals(long.class, arrayIndex(values, constant(0)).getType());
        assertEquals(int.class, arrayLength(values).getType());
        assertEquals(long[][].class, newArrayBounds(long.class, constant(1), constant(2)).getType());
        assertEquals(String.class, block(constant(1), constant("last")).getType());
        assertEquals(void.class, ifThen(constant(true), constant(1)).getType());
        assertEquals(Object.class, constant(null).getType());
    }

    @Test
    public void reflectedStaticCallUsesTheMethodSignature() throws NoSuchMethodException {
        Method abs = Math.class.getMethod("abs", int.class);

        MethodCallExpression call = call(null, abs, constant(-1));

        assertTrue(call.isStatic());
        assertEquals(int.class, call.getType());
        assertEquals(Math.class, call.getDeclaringType());
        assertEquals("abs", call.getMethodName());
        assertNull(call.getObject());
    }

    @Test(expected = IllegalArgumentException.class)
    public void reflectedInstanceCallRequiresAnInstance() throws NoSuchMethodException {
        call(null, String.class.getMethod("length"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void reflectedCallChecksArity() throws NoSuchMethodException {
        call(null, Math.class.getMethod("abs", int.class));
    }

    @Test(expected = IllegalArgumentException.class)
    public void makeBinaryRejectsUnaryOperators() {
        makeBinary(ExpressionType.NEGATE, constant(1), constant(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void conditionRequiresABooleanTest() {
        condition(constant(1), constant(2), constant(3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiredChildrenMustNotBeNull() {
        add(constant(1), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void argumentListsMustNotContainNull() {
        callStatic(Math.class, "max", int.class, constant(1), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void blocksMustNotBeEmpty() {
        block(Collections.emptyList(), Collections.emptyList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void typeAsRejectsPrimitives() {
        typeAs(constant(1), int.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void faultBlocksCannotHaveHandlers() {
        makeTry(constant(1), null, empty(), catchBlock(RuntimeException.class, constant(2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invokingALambdaChecksArity() {
        invoke(lambda(constant(1), parameter(int.class, "x")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void interfacesCannotBeInstantiated() {
        newInstance(Runnable.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void lambdaParametersMustBeDistinct() {
        ParameterExpression x = parameter(int.class, "x");
        lambda(x, x, x);
    }

    @Test
    public void clearedDebugInfoIsRecognised() {
        assertTrue(clearDebugInfo("Query.java").isClear());
        assertEquals("#Query.java(3,1)-(3,42)", debugInfo("Query.java", 3, 1, 3, 42).toString());
    }
}
