/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    AxiomBuilder.java

Abstract:

    Arrow's theorem encoding: base class of the sentence builders

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.axioms;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;

import arrow.logic.Binder;
import arrow.logic.Relations;
import arrow.logic.Universe;

/**
 * Builds one closed sentence over the shared {@link Relations}. Variables
 * come only from {@link #binder}.
 **/
public abstract class AxiomBuilder
{
    protected final Context ctx;
    protected final Relations rel;
    protected final Universe universe;
    protected final Binder binder;

    protected AxiomBuilder(Relations relations, Universe universe,
            Binder binder)
    {
        this.ctx = relations.getContext();
        this.rel = relations;
        this.universe = universe;
        this.binder = binder;
    }

    public abstract BoolExpr build();

    protected BoolExpr eq(IntExpr a, IntExpr b)
    {
        return ctx.mkEq(a, b);
    }

    protected BoolExpr neq(IntExpr a, IntExpr b)
    {
        return ctx.mkNot(ctx.mkEq(a, b));
    }

    protected BoolExpr and(BoolExpr... conjuncts)
    {
        return ctx.mkAnd(conjuncts);
    }

    protected BoolExpr or(BoolExpr... disjuncts)
    {
        return ctx.mkOr(disjuncts);
    }

    protected BoolExpr not(BoolExpr a)
    {
        return ctx.mkNot(a);
    }

    protected BoolExpr implies(BoolExpr premise, BoolExpr conclusion)
    {
        return ctx.mkImplies(premise, conclusion);
    }

    protected BoolExpr iff(BoolExpr a, BoolExpr b)
    {
        return ctx.mkIff(a, b);
    }
}
