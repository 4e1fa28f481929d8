package com.control.cfs.expr;

import com.control.cfs.api.CompiledExpr;
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class ExprCompilerTest {

    private static final List<Variable> VARS = List.of(Exprs.variable("a", 0), Exprs.variable("b", 1),
            Exprs.variable("c", 2));

    private static final String[] EXPRESSIONS = {
            "a + b * c",
            "-a^2 + 3*b - c/2",
            "sin(a) * cos(b) + exp(-c)",
            "tan(a) / (1 + b^2)",
            "sqrt(a^2 + b^2 + 1) - log(2 + c^2)",
            "abs(a - b) + sign(c) * tanh(a)",
            "(a - 1)^3 * (b + 2)^-1",
            "2",
    };

    @Test
    public void testCompiledMatchesInterpreted() {
        Random rnd = new Random(42);
        for (String text : EXPRESSIONS) {
            Expr e = ExprParser.parse(text, VARS);
            CompiledExpr c = ExprCompiler.compile(e);
            for (int i = 0; i < 50; i++) {
                double[] z = { rnd.nextDouble() * 2 - 1, rnd.nextDouble() * 2 - 1, rnd.nextDouble() * 2 - 1 };
                double expected = e.evaluate(z);
                assertEquals(text, expected, c.evaluate(z), 1e-12 * Math.max(1.0, Math.abs(expected)));
            }
        }
    }

    @Test
    public void testCompileAll() {
        Expr[] es = { ExprParser.parse("a", VARS), ExprParser.parse("b*c", VARS) };
        CompiledExpr[] cs = ExprCompiler.compileAll(es);
        assertEquals(2, cs.length);
        assertEquals(1.0, cs[0].evaluate(new double[] { 1, 2, 3 }), 0.0);
        assertEquals(6.0, cs[1].evaluate(new double[] { 1, 2, 3 }), 0.0);
    }
}
