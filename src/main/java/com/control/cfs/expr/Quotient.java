package com.control.cfs.expr;

import java.util.BitSet;

/** {@code numerator / denominator}. */
public record Quotient(Expr numerator, Expr denominator) implements Expr {

    @Override
    public double evaluate(double[] state) {
        return numerator.evaluate(state) / denominator.evaluate(state);
    }

    @Override
    public Expr differentiate(int variableIndex) {
        // (f/g)' = (f'g - fg') / g^2
        Expr top = Exprs.sub(
                Exprs.mul(numerator.differentiate(variableIndex), denominator),
                Exprs.mul(numerator, denominator.differentiate(variableIndex)));
        return Exprs.div(top, Exprs.pow(denominator, 2));
    }

    @Override
    public void collectVariables(BitSet out) {
        numerator.collectVariables(out);
        denominator.collectVariables(out);
    }

    @Override
    public int precedence() {
        return PREC_PRODUCT;
    }

    @Override
    public String toString() {
        return Exprs.wrap(numerator, PREC_PRODUCT) + "/" + Exprs.wrap(denominator, PREC_UNARY);
    }
}
