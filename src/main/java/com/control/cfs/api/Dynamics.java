package com.control.cfs.api;

/**
 * Right-hand side of an ordinary differential equation ż = f(t, z).
 */
@FunctionalInterface
public interface Dynamics {

    /**
     * @param t    Time.
     * @param z    State at t. Must not be modified.
     * @param dzdt Receives f(t, z).
     */
    void derivative(double t, double[] z, double[] dzdt);
}
