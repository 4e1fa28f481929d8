package com.control.cfs.system;

import com.control.cfs.api.CompiledExpr;
import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.Dynamics;
import com.control.cfs.expr.Expr;
import com.control.cfs.expr.ExprCompiler;
import com.control.cfs.expr.ExprParser;
import com.control.cfs.expr.Exprs;
import com.control.cfs.expr.Variable;
import com.control.cfs.input.InputSignal;

import java.util.*;

/**
 * A control-affine system ż = g0(z) + Σ_{i=1..m} u_i(t) g_i(z), y = h(z).
 *
 * Holds the state variables z1..zn, the m+1 vector fields (field id 0 is the
 * drift, ids 1..m the controlled fields, matching alphabet symbol ids) and
 * the scalar output h. Every expression may only reference the declared
 * state variables.
 */
public final class ControlAffineSystem {
    private final List<Variable> state;
    // fields[id][component]
    private final Expr[][] fields;
    private final Expr output;

    // Compiled lazily for simulation
    private volatile CompiledExpr[][] compiledFields;
    private volatile CompiledExpr compiledOutput;

    private ControlAffineSystem(List<Variable> state, Expr[][] fields, Expr output) {
        this.state = state;
        this.fields = fields;
        this.output = output;
    }

    /**
     * Starts a system over state variables with the given names, indexed in
     * declaration order.
     */
    public static Builder builder(String... stateNames) {
        return new Builder(Arrays.asList(stateNames));
    }

    public static Builder builder(List<String> stateNames) {
        return new Builder(stateNames);
    }

    public List<Variable> state() {
        return state;
    }

    /** State dimension n. */
    public int stateDimension() {
        return state.size();
    }

    /** Number of controlled fields m. */
    public int controlledChannels() {
        return fields.length - 1;
    }

    /** m + 1: one symbol per field. */
    public int alphabetSize() {
        return fields.length;
    }

    /** Components of field g_id (id 0 = drift). The returned array is a copy. */
    public Expr[] field(int id) {
        if (id < 0 || id >= fields.length)
            throw new IndexOutOfBoundsException("Field g" + id + " outside [0, " + (fields.length - 1) + "]");
        return fields[id].clone();
    }

    public Expr output() {
        return output;
    }

    /** h(z). */
    public double outputValue(double[] z) {
        checkState(z);
        return compiledOutput().evaluate(z);
    }

    /**
     * ż = g0(z) + Σ u_i g_i(z) for the given controlled input values.
     *
     * @param z   State.
     * @param u   Controlled inputs u1..um.
     * @param out Receives ż.
     */
    public void velocity(double[] z, double[] u, double[] out) {
        CompiledExpr[][] g = compiledFields();
        for (int c = 0; c < out.length; c++) {
            double v = g[0][c].evaluate(z);
            for (int i = 1; i < g.length; i++)
                v += u[i - 1] * g[i][c].evaluate(z);
            out[c] = v;
        }
    }

    /**
     * The closed-loop vector field driven by {@code input}, with controlled
     * channels linearly interpolated between samples.
     */
    public Dynamics dynamics(InputSignal input) {
        if (input.channelCount() != controlledChannels())
            throw new ConfigurationException("System has " + controlledChannels()
                    + " controlled fields, input has " + input.channelCount() + " channels");
        final int m = controlledChannels();
        return (t, z, dzdt) -> {
            double[] u = new double[m];
            for (int i = 0; i < m; i++)
                u[i] = input.interpolate(i + 1, t);
            velocity(z, u, dzdt);
        };
    }

    public CompiledExpr compiledOutput() {
        CompiledExpr c = compiledOutput;
        if (c == null) {
            c = ExprCompiler.compile(output);
            compiledOutput = c;
        }
        return c;
    }

    private CompiledExpr[][] compiledFields() {
        CompiledExpr[][] c = compiledFields;
        if (c == null) {
            c = new CompiledExpr[fields.length][];
            for (int i = 0; i < fields.length; i++)
                c[i] = ExprCompiler.compileAll(fields[i]);
            compiledFields = c;
        }
        return c;
    }

    public void checkState(double[] z) {
        if (z.length != state.size())
            throw new ConfigurationException("State vector has " + z.length + " components, system has "
                    + state.size());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ControlAffineSystem[state=").append(state);
        for (int i = 0; i < fields.length; i++)
            sb.append(", g").append(i).append('=').append(Arrays.toString(fields[i]));
        return sb.append(", h=").append(output).append(']').toString();
    }

    /**
     * Fluent builder. Fields are given either as expression text over the
     * declared state names or as {@link Expr} trees. A missing drift defaults
     * to the zero field.
     */
    public static final class Builder {
        private final List<Variable> state = new ArrayList<>();
        private final ExprParser parser;
        private Expr[] drift;
        private final List<Expr[]> controlled = new ArrayList<>();
        private Expr output;

        private Builder(List<String> stateNames) {
            if (stateNames.isEmpty())
                throw new ConfigurationException("System needs at least one state variable");
            for (int i = 0; i < stateNames.size(); i++)
                state.add(Exprs.variable(stateNames.get(i), i));
            try {
                this.parser = new ExprParser(state);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }

        /** Variable handle for building {@link Expr} trees by hand. */
        public Variable var(String name) {
            for (Variable v : state)
                if (v.name().equals(name))
                    return v;
            throw new ConfigurationException("Unknown state variable: " + name);
        }

        public Builder drift(String... components) {
            return drift(parseAll(components));
        }

        public Builder drift(Expr... components) {
            this.drift = components.clone();
            return this;
        }

        /** Adds the next controlled field g_{m+1}. */
        public Builder field(String... components) {
            return field(parseAll(components));
        }

        public Builder field(Expr... components) {
            controlled.add(components.clone());
            return this;
        }

        public Builder output(String expression) {
            return output(parse(expression));
        }

        public Builder output(Expr expression) {
            this.output = expression;
            return this;
        }

        public ControlAffineSystem build() {
            final int n = state.size();
            if (output == null)
                throw new ConfigurationException("Output function h(z) is not set");
            Expr[] g0 = drift;
            if (g0 == null) {
                g0 = new Expr[n];
                Arrays.fill(g0, Exprs.ZERO);
            }
            Expr[][] fields = new Expr[controlled.size() + 1][];
            fields[0] = g0;
            for (int i = 0; i < controlled.size(); i++)
                fields[i + 1] = controlled.get(i);

            for (int i = 0; i < fields.length; i++) {
                if (fields[i].length != n)
                    throw new ConfigurationException("Field g" + i + " has " + fields[i].length
                            + " components, state dimension is " + n);
                for (Expr e : fields[i])
                    checkVariables(e, "g" + i);
            }
            checkVariables(output, "h");
            return new ControlAffineSystem(List.copyOf(state), fields, output);
        }

        private void checkVariables(Expr e, String where) {
            if (e == null)
                throw new ConfigurationException("Null component in " + where);
            BitSet used = e.variables();
            if (used.length() > state.size())
                throw new ConfigurationException(where + " = " + e + " references a variable beyond the "
                        + state.size() + " declared states");
        }

        private Expr[] parseAll(String[] components) {
            Expr[] out = new Expr[components.length];
            for (int i = 0; i < components.length; i++)
                out[i] = parse(components[i]);
            return out;
        }

        private Expr parse(String text) {
            try {
                return parser.parse(text);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Cannot parse '" + text + "': " + e.getMessage(), e);
            }
        }
    }
}
