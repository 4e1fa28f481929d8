package com.control.cfs.expr;

import java.util.BitSet;

/** {@code f(argument)} for an elementary {@link Function}. */
public record FunctionCall(Function function, Expr argument) implements Expr {

    @Override
    public double evaluate(double[] state) {
        return function.apply(argument.evaluate(state));
    }

    @Override
    public Expr differentiate(int variableIndex) {
        Expr inner = argument.differentiate(variableIndex);
        if (inner.isZero())
            return Exprs.ZERO;
        // chain rule: f'(g) g'
        return Exprs.mul(function.derivativeAt(argument), inner);
    }

    @Override
    public void collectVariables(BitSet out) {
        argument.collectVariables(out);
    }

    @Override
    public int precedence() {
        return PREC_ATOM;
    }

    @Override
    public String toString() {
        return function.symbol() + "(" + argument + ")";
    }
}
