package com.control.cfs.expr;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SymbolicDifferentiatorTest {

    private static final Variable X = Exprs.variable("x", 0);
    private static final Variable Y = Exprs.variable("y", 1);
    private static final List<Variable> VARS = List.of(X, Y);

    private static Expr[] grad(String text) {
        return SymbolicDifferentiator.INSTANCE.gradient(ExprParser.parse(text, VARS), VARS);
    }

    /** Central difference check of every partial at {@code at}. */
    private static void assertMatchesFiniteDifference(String text, double[] at) {
        Expr f = ExprParser.parse(text, VARS);
        Expr[] g = SymbolicDifferentiator.INSTANCE.gradient(f, VARS);
        double h = 1e-6;
        for (int i = 0; i < at.length; i++) {
            double[] plus = at.clone(), minus = at.clone();
            plus[i] += h;
            minus[i] -= h;
            double fd = (f.evaluate(plus) - f.evaluate(minus)) / (2 * h);
            assertEquals(text + " d/d" + VARS.get(i), fd, g[i].evaluate(at), 1e-6 * Math.max(1.0, Math.abs(fd)));
        }
    }

    @Test
    public void testPolynomial() {
        Expr[] g = grad("x^2 * y + 3*y");
        double[] at = { 2.0, 5.0 };
        assertEquals(20.0, g[0].evaluate(at), 1e-12);
        assertEquals(7.0, g[1].evaluate(at), 1e-12);
    }

    @Test
    public void testUnusedVariableIsExactZero() {
        Expr[] g = grad("sin(x)");
        assertSame(Exprs.ZERO, g[1]);
        assertTrue(grad("4.5")[0].isZero());
    }

    @Test
    public void testLinearFunctionHasConstantGradient() {
        Expr[] g = grad("2*x - y");
        assertTrue(g[0].isConstant());
        assertTrue(g[1].isConstant());
        assertEquals(2.0, g[0].evaluate(new double[2]), 0.0);
        assertEquals(-1.0, g[1].evaluate(new double[2]), 0.0);
    }

    @Test
    public void testChainAndQuotientRules() {
        double[] at = { 0.4, 1.3 };
        assertMatchesFiniteDifference("sin(x*y)", at);
        assertMatchesFiniteDifference("cos(x)^3", at);
        assertMatchesFiniteDifference("exp(-x^2) / (1 + y^2)", at);
        assertMatchesFiniteDifference("log(1 + x*y) - sqrt(y)", at);
        assertMatchesFiniteDifference("tan(x) + tanh(y)", at);
        assertMatchesFiniteDifference("x / y", at);
        assertMatchesFiniteDifference("abs(x - y)", at);
    }

    @Test(expected = NonDifferentiableException.class)
    public void testSignHasNoDerivative() {
        grad("sign(x)");
    }

    @Test
    public void testSignOfConstantIsDifferentiable() {
        // d/dx sign(2) is zero; nothing depends on x
        Expr[] g = grad("sign(2) * x");
        assertEquals(1.0, g[0].evaluate(new double[2]), 0.0);
    }
}
