package com.control.cfs.expr;

import com.control.cfs.api.Differentiator;

import java.util.BitSet;
import java.util.List;

/**
 * Exact differentiation over {@link Expr} trees.
 *
 * Partial derivatives with respect to variables that do not occur in the
 * expression are returned as zero without walking the tree.
 */
public final class SymbolicDifferentiator implements Differentiator {

    public static final SymbolicDifferentiator INSTANCE = new SymbolicDifferentiator();

    @Override
    public Expr[] gradient(Expr f, List<Variable> variables) {
        BitSet used = f.variables();
        Expr[] grad = new Expr[variables.size()];
        for (int i = 0; i < grad.length; i++) {
            int vi = variables.get(i).index();
            grad[i] = used.get(vi) ? f.differentiate(vi) : Exprs.ZERO;
        }
        return grad;
    }
}
