package com.control.cfs.expr;

import java.util.Locale;

/**
 * Elementary functions recognised by {@link ExprParser} and differentiated by
 * {@link FunctionCall}.
 */
public enum Function {
    SIN {
        @Override
        public double apply(double x) {
            return Math.sin(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.call(COS, arg);
        }
    },
    COS {
        @Override
        public double apply(double x) {
            return Math.cos(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.neg(Exprs.call(SIN, arg));
        }
    },
    TAN {
        @Override
        public double apply(double x) {
            return Math.tan(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            // 1 / cos^2
            return Exprs.pow(Exprs.call(COS, arg), -2);
        }
    },
    EXP {
        @Override
        public double apply(double x) {
            return Math.exp(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.call(EXP, arg);
        }
    },
    LOG {
        @Override
        public double apply(double x) {
            return Math.log(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.pow(arg, -1);
        }
    },
    SQRT {
        @Override
        public double apply(double x) {
            return Math.sqrt(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.mul(Exprs.constant(0.5), Exprs.pow(arg, -0.5));
        }
    },
    TANH {
        @Override
        public double apply(double x) {
            return Math.tanh(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.sub(Exprs.ONE, Exprs.pow(Exprs.call(TANH, arg), 2));
        }
    },
    ABS {
        @Override
        public double apply(double x) {
            return Math.abs(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            return Exprs.call(SIGN, arg);
        }
    },
    SIGN {
        @Override
        public double apply(double x) {
            return Math.signum(x);
        }

        @Override
        Expr derivativeAt(Expr arg) {
            throw new NonDifferentiableException("sign(" + arg + ") has no derivative at 0");
        }
    };

    public abstract double apply(double x);

    /** Derivative of f with respect to its argument, evaluated at {@code arg}. */
    abstract Expr derivativeAt(Expr arg);

    public String symbol() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Resolves a function by its lower-case name, or null if unknown. */
    public static Function fromSymbol(String symbol) {
        for (Function f : values())
            if (f.symbol().equals(symbol))
                return f;
        return null;
    }
}
