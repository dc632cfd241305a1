/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Binder.java

Abstract:

    Arrow's theorem encoding: introduction and closing of quantified
    variables

Author:

    arrow-theorem developers 2026-10-18

Notes:

    Builders never create variables themselves. Every variable a body
    sees was introduced by the enclosing forAll/exists call, which also
    closes it, so a finished sentence has no free variables.

--*/

package arrow.logic;

import java.util.ArrayList;
import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;

/**
 * Binds integer variables over {@link Range}s, either as solver quantifiers
 * or by expanding the body over every value of the ranges.
 **/
public abstract class Binder
{
    /**
     * The matrix of a quantified sentence. Receives one term per declared
     * variable, in declaration order.
     **/
    @FunctionalInterface
    public interface Body
    {
        BoolExpr apply(IntExpr[] vars);
    }

    /**
     * A variable declaration: display name and the range it is guarded by.
     **/
    public static final class Var
    {
        private final String name;
        private final Range range;

        public Var(String name, Range range)
        {
            this.name = name;
            this.range = range;
        }

        public String getName()
        {
            return name;
        }

        public Range getRange()
        {
            return range;
        }

        @Override
        public String toString()
        {
            return name + ":" + range;
        }
    }

    protected final Context ctx;

    protected Binder(Context ctx)
    {
        this.ctx = ctx;
    }

    /**
     * Closed quantifiers. Each call creates fresh constants, abstracts them
     * with {@code mkForall}/{@code mkExists} and guards them by their
     * ranges.
     **/
    public static Binder symbolic(Context ctx)
    {
        return new Symbolic(ctx);
    }

    /**
     * Finite expansion: {@code forAll} becomes a conjunction and
     * {@code exists} a disjunction over all combinations of range values.
     * Every range must be bounded.
     **/
    public static Binder grounded(Context ctx)
    {
        return new Grounded(ctx);
    }

    public Context getContext()
    {
        return ctx;
    }

    public abstract BoolExpr forAll(List<Var> vars, Body body);

    public abstract BoolExpr exists(List<Var> vars, Body body);

    protected static void requireVars(List<Var> vars)
    {
        if (vars == null || vars.isEmpty())
            throw new IllegalArgumentException("no variables to bind");
    }

    private static final class Symbolic extends Binder
    {
        Symbolic(Context ctx)
        {
            super(ctx);
        }

        @Override
        public BoolExpr forAll(List<Var> vars, Body body)
        {
            requireVars(vars);
            IntExpr[] consts = fresh(vars);
            BoolExpr matrix = body.apply(consts.clone());
            BoolExpr guard = guard(vars, consts);
            if (guard != null)
                matrix = ctx.mkImplies(guard, matrix);
            return ctx.mkForall(consts, matrix, 1, null, null, null, null);
        }

        @Override
        public BoolExpr exists(List<Var> vars, Body body)
        {
            requireVars(vars);
            IntExpr[] consts = fresh(vars);
            BoolExpr matrix = body.apply(consts.clone());
            BoolExpr guard = guard(vars, consts);
            if (guard != null)
                matrix = ctx.mkAnd(guard, matrix);
            return ctx.mkExists(consts, matrix, 1, null, null, null, null);
        }

        private IntExpr[] fresh(List<Var> vars)
        {
            IntExpr[] consts = new IntExpr[vars.size()];
            for (int i = 0; i < consts.length; i++)
                consts[i] = (IntExpr) ctx.mkFreshConst(vars.get(i).getName(),
                        ctx.getIntSort());
            return consts;
        }

        // null when no variable is bounded
        private BoolExpr guard(List<Var> vars, IntExpr[] consts)
        {
            List<BoolExpr> guards = new ArrayList<BoolExpr>();
            for (int i = 0; i < consts.length; i++)
            {
                Range r = vars.get(i).getRange();
                if (r.isBounded())
                    guards.add(r.guard(ctx, consts[i]));
            }
            if (guards.isEmpty())
                return null;
            if (guards.size() == 1)
                return guards.get(0);
            return ctx.mkAnd(guards.toArray(new BoolExpr[0]));
        }
    }

    private static final class Grounded extends Binder
    {
        Grounded(Context ctx)
        {
            super(ctx);
        }

        @Override
        public BoolExpr forAll(List<Var> vars, Body body)
        {
            List<BoolExpr> instances = expand(vars, body);
            if (instances.size() == 1)
                return instances.get(0);
            return ctx.mkAnd(instances.toArray(new BoolExpr[0]));
        }

        @Override
        public BoolExpr exists(List<Var> vars, Body body)
        {
            List<BoolExpr> instances = expand(vars, body);
            if (instances.size() == 1)
                return instances.get(0);
            return ctx.mkOr(instances.toArray(new BoolExpr[0]));
        }

        private List<BoolExpr> expand(List<Var> vars, Body body)
        {
            requireVars(vars);
            IntExpr[][] values = new IntExpr[vars.size()][];
            for (int i = 0; i < values.length; i++)
            {
                Var v = vars.get(i);
                if (!v.getRange().isBounded())
                    throw new IllegalStateException("cannot ground unbounded variable "
                            + v.getName());
                int[] ints = v.getRange().values();
                values[i] = new IntExpr[ints.length];
                for (int j = 0; j < ints.length; j++)
                    values[i][j] = ctx.mkInt(ints[j]);
            }

            List<BoolExpr> res = new ArrayList<BoolExpr>();
            collect(values, 0, new IntExpr[values.length], body, res);
            return res;
        }

        private static void collect(IntExpr[][] values, int depth,
                IntExpr[] current, Body body, List<BoolExpr> out)
        {
            if (depth == values.length)
            {
                out.add(body.apply(current.clone()));
                return;
            }
            for (IntExpr v : values[depth])
            {
                current[depth] = v;
                collect(values, depth + 1, current, body, out);
            }
        }
    }
}
