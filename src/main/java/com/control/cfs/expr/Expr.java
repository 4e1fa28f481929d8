package com.control.cfs.expr;

import java.util.BitSet;

/**
 * A scalar expression over a vector of state variables.
 *
 * Expressions are immutable trees. They are built through {@link Exprs}, which
 * folds constants and drops neutral terms so that repeated differentiation
 * does not grow trees with zeros and ones.
 */
public interface Expr {

    /**
     * Evaluates the expression by walking the tree.
     *
     * @param state Values of the state variables, indexed by
     *              {@link Variable#index()}.
     */
    double evaluate(double[] state);

    /**
     * Partial derivative with respect to the state variable at
     * {@code variableIndex}.
     *
     * @throws NonDifferentiableException if the tree contains a function whose
     *                                    derivative is undefined.
     */
    Expr differentiate(int variableIndex);

    /** Adds the indexes of every variable referenced by this tree. */
    void collectVariables(BitSet out);

    /** Binding strength used to print without redundant parentheses. */
    int precedence();

    default boolean isConstant() {
        return false;
    }

    default boolean isZero() {
        return false;
    }

    default boolean isOne() {
        return false;
    }

    default BitSet variables() {
        BitSet bits = new BitSet();
        collectVariables(bits);
        return bits;
    }

    int PREC_SUM = 1;
    int PREC_PRODUCT = 2;
    int PREC_UNARY = 3;
    int PREC_POWER = 4;
    int PREC_ATOM = 5;
}
