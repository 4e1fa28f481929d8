package com.control.cfs.expr;

import org.junit.Test;

import static org.junit.Assert.*;

public class ExprsTest {

    private static final Variable X = Exprs.variable("x", 0);

    @Test
    public void testIdentitiesSimplify() {
        assertSame(X, Exprs.add(Exprs.ZERO, X));
        assertSame(X, Exprs.add(X, Exprs.ZERO));
        assertSame(X, Exprs.mul(Exprs.ONE, X));
        assertSame(Exprs.ZERO, Exprs.mul(X, Exprs.ZERO));
        assertSame(X, Exprs.pow(X, 1.0));
        assertSame(Exprs.ONE, Exprs.pow(X, 0.0));
        assertSame(X, Exprs.neg(Exprs.neg(X)));
    }

    @Test
    public void testConstantsFold() {
        assertEquals(new Constant(6.0), Exprs.mul(Exprs.constant(2), Exprs.constant(3)));
        assertEquals(new Constant(-1.0), Exprs.sub(Exprs.constant(2), Exprs.constant(3)));
        assertEquals(new Constant(8.0), Exprs.pow(Exprs.constant(2), 3));
        assertEquals(new Constant(0.0), Exprs.call(Function.SIN, Exprs.ZERO));
    }

    @Test
    public void testConstantsMoveLeft() {
        Expr e = Exprs.mul(X, Exprs.constant(3));
        assertTrue(e instanceof Product);
        assertEquals(new Constant(3.0), ((Product) e).left());
        assertEquals(new Negation(X), Exprs.mul(Exprs.constant(-1), X));
    }

    @Test
    public void testDot() {
        Expr d = Exprs.dot(new Expr[] { X, Exprs.ZERO }, new Expr[] { Exprs.constant(2), X });
        assertEquals(4.0, d.evaluate(new double[] { 2.0 }), 0.0);
    }

    @Test(expected = ArithmeticException.class)
    public void testDivisionByConstantZero() {
        Exprs.div(X, Exprs.ZERO);
    }

    @Test
    public void testVariablesCollected() {
        Variable y = Exprs.variable("y", 3);
        Expr e = Exprs.add(Exprs.call(Function.SIN, X), Exprs.mul(Exprs.constant(2), y));
        assertTrue(e.variables().get(0));
        assertTrue(e.variables().get(3));
        assertFalse(e.variables().get(1));
    }

    @Test
    public void testToStringParenthesises() {
        Expr e = Exprs.mul(Exprs.add(X, Exprs.ONE), X);
        assertEquals("(x + 1)*x", e.toString());
    }
}
