package com.control.cfs.api;

import com.control.cfs.expr.Expr;
import com.control.cfs.expr.Variable;

import java.util.List;

/**
 * Symbolic differentiation collaborator used by the Lie-derivative recursion.
 *
 * Given a scalar expression and the state variable vector, returns the
 * gradient as one expression per variable, in variable order. Calls are
 * synchronous and free of side effects.
 */
@FunctionalInterface
public interface Differentiator {

    /**
     * @param f         Scalar expression to differentiate.
     * @param variables State variables z1..zn.
     * @return ∂f/∂z_i for i = 1..n.
     * @throws com.control.cfs.expr.NonDifferentiableException if any partial
     *                                                          derivative is
     *                                                          undefined.
     */
    Expr[] gradient(Expr f, List<Variable> variables);
}
