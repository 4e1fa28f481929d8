package com.control.cfs.expr;

import com.control.cfs.api.CompiledExpr;

/**
 * Compiles {@link Expr} trees into nested closures.
 *
 * The tree is inspected once, at compile time. The returned closure only
 * performs arithmetic and array reads, which keeps repeated numeric evaluation
 * at many states free of tree dispatch and allocation.
 */
public final class ExprCompiler {
    private ExprCompiler() {
        // Utility class
    }

    public static CompiledExpr compile(Expr e) {
        if (e instanceof Constant c) {
            final double v = c.value();
            return z -> v;
        }
        if (e instanceof Variable var) {
            final int i = var.index();
            return z -> z[i];
        }
        if (e instanceof Sum s) {
            final CompiledExpr l = compile(s.left());
            final CompiledExpr r = compile(s.right());
            return z -> l.evaluate(z) + r.evaluate(z);
        }
        if (e instanceof Product p) {
            if (p.left() instanceof Constant c) {
                final double k = c.value();
                final CompiledExpr r = compile(p.right());
                return z -> k * r.evaluate(z);
            }
            final CompiledExpr l = compile(p.left());
            final CompiledExpr r = compile(p.right());
            return z -> l.evaluate(z) * r.evaluate(z);
        }
        if (e instanceof Quotient q) {
            final CompiledExpr n = compile(q.numerator());
            final CompiledExpr d = compile(q.denominator());
            return z -> n.evaluate(z) / d.evaluate(z);
        }
        if (e instanceof Power pw) {
            final CompiledExpr b = compile(pw.base());
            final double k = pw.exponent();
            if (k == 2.0)
                return z -> {
                    double x = b.evaluate(z);
                    return x * x;
                };
            return z -> Math.pow(b.evaluate(z), k);
        }
        if (e instanceof Negation n) {
            final CompiledExpr o = compile(n.operand());
            return z -> -o.evaluate(z);
        }
        if (e instanceof FunctionCall fc) {
            final CompiledExpr a = compile(fc.argument());
            final Function f = fc.function();
            return switch (f) {
                case SIN -> z -> Math.sin(a.evaluate(z));
                case COS -> z -> Math.cos(a.evaluate(z));
                case EXP -> z -> Math.exp(a.evaluate(z));
                default -> z -> f.apply(a.evaluate(z));
            };
        }
        // Unknown node type: fall back to interpretation
        return e::evaluate;
    }

    public static CompiledExpr[] compileAll(Expr[] exprs) {
        CompiledExpr[] out = new CompiledExpr[exprs.length];
        for (int i = 0; i < exprs.length; i++)
            out[i] = compile(exprs[i]);
        return out;
    }
}
