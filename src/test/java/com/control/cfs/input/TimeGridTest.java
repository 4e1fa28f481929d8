package com.control.cfs.input;

import com.control.cfs.api.ConfigurationException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TimeGridTest {

    @Test
    public void testSpanIncludesBothEnds() {
        TimeGrid g = TimeGrid.span(0.0, 1.0, 0.001);
        assertEquals(1001, g.samples());
        assertEquals(0.0, g.time(0), 0.0);
        assertEquals(1.0, g.tf(), 1e-12);
        assertEquals(0.5, g.time(500), 1e-12);
    }

    @Test
    public void testFromTimes() {
        TimeGrid g = TimeGrid.fromTimes(new double[] { 1.0, 1.25, 1.5, 1.75 });
        assertEquals(1.0, g.t0(), 0.0);
        assertEquals(0.25, g.dt(), 1e-15);
        assertEquals(4, g.samples());
        assertArrayEquals(new double[] { 1.0, 1.25, 1.5, 1.75 }, g.times(), 1e-15);
    }

    @Test(expected = ConfigurationException.class)
    public void testNonUniformTimesRejected() {
        TimeGrid.fromTimes(new double[] { 0.0, 0.1, 0.3 });
    }

    @Test(expected = ConfigurationException.class)
    public void testSpanNotMultipleOfStepRejected() {
        TimeGrid.span(0.0, 1.0, 0.3);
    }

    @Test(expected = ConfigurationException.class)
    public void testZeroStepRejected() {
        TimeGrid.of(0.0, 0.0, 10);
    }

    @Test(expected = ConfigurationException.class)
    public void testNegativeStepRejected() {
        TimeGrid.span(0.0, 1.0, -0.1);
    }

    @Test(expected = ConfigurationException.class)
    public void testReversedSpanRejected() {
        TimeGrid.span(1.0, 0.0, 0.1);
    }

    @Test(expected = ConfigurationException.class)
    public void testEmptyGridRejected() {
        TimeGrid.of(0.0, 0.1, 0);
    }

    @Test
    public void testEquality() {
        assertEquals(TimeGrid.of(0.0, 0.5, 3), TimeGrid.span(0.0, 1.0, 0.5));
        assertTrue(TimeGrid.of(0.0, 0.1, 11).sameAs(TimeGrid.span(0.0, 1.0, 0.1)));
        assertNotEquals(TimeGrid.of(0.0, 0.5, 3), TimeGrid.of(0.0, 0.5, 4));
    }
}
