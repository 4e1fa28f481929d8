package com.control.cfs.engine;

import org.junit.Test;

import static org.junit.Assert.*;

public class IntegrationRuleTest {

    @Test
    public void testTrapezoidExactForLinear() {
        double dt = 0.25;
        double[] f = new double[9];
        for (int j = 0; j < f.length; j++)
            f[j] = 1 + 2 * j * dt;
        double[] out = new double[f.length];
        IntegrationRule.TRAPEZOID.integrate(f, dt, out);
        for (int j = 0; j < f.length; j++) {
            double t = j * dt;
            assertEquals(t + t * t, out[j], 1e-12);
        }
    }

    @Test
    public void testRectangleUsesLeftPoint() {
        double[] f = { 1, 2, 3, 4 };
        double[] out = new double[4];
        IntegrationRule.RECTANGLE.integrate(f, 0.5, out);
        assertArrayEquals(new double[] { 0.0, 0.5, 1.5, 3.0 }, out, 0.0);
    }

    @Test
    public void testIntegrateProductStartsAtZero() {
        double[] u = { 2, 2, 2 };
        double[] e = { 1, 3, 5 };
        double[] out = { 9, 9, 9 };
        IntegrationRule.TRAPEZOID.integrateProduct(u, e, 1.0, out);
        assertArrayEquals(new double[] { 0.0, 4.0, 12.0 }, out, 0.0);
    }

    @Test
    public void testIncrement() {
        assertEquals(0.5 * 0.1 * 5, IntegrationRule.TRAPEZOID.increment(2, 3, 0.1), 0.0);
        assertEquals(0.2, IntegrationRule.RECTANGLE.increment(2, 3, 0.1), 0.0);
    }
}
