package com.control.cfs.expr;

import java.util.BitSet;

/** {@code base ^ exponent} with a constant exponent. */
public record Power(Expr base, double exponent) implements Expr {

    @Override
    public double evaluate(double[] state) {
        double b = base.evaluate(state);
        if (exponent == 2.0)
            return b * b;
        return Math.pow(b, exponent);
    }

    @Override
    public Expr differentiate(int variableIndex) {
        // (f^c)' = c f^(c-1) f'
        return Exprs.mul(
                Exprs.mul(Exprs.constant(exponent), Exprs.pow(base, exponent - 1.0)),
                base.differentiate(variableIndex));
    }

    @Override
    public void collectVariables(BitSet out) {
        base.collectVariables(out);
    }

    @Override
    public int precedence() {
        return PREC_POWER;
    }

    @Override
    public String toString() {
        return Exprs.wrap(base, PREC_ATOM) + "^" + new Constant(exponent);
    }
}
