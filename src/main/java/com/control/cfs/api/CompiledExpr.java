package com.control.cfs.api;

/**
 * A scalar expression compiled into a closure over the state vector.
 *
 * Evaluation does not walk or rebuild any expression tree.
 */
@FunctionalInterface
public interface CompiledExpr {

    double evaluate(double[] state);
}
