/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    NonDictatorship.java

Abstract:

    Arrow's theorem encoding: no agent's order always is the social
    order

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.axioms;

import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.IntExpr;

import arrow.logic.Binder;
import arrow.logic.Relations;
import arrow.logic.Universe;

/**
 * <pre>
 * not exists x. forall s, a, b. p(x,a,b,s) = w(a,b,s)
 * </pre>
 **/
public final class NonDictatorship extends AxiomBuilder
{
    public NonDictatorship(Relations relations, Universe universe,
            Binder binder)
    {
        super(relations, universe, binder);
    }

    @Override
    public BoolExpr build()
    {
        return not(binder.exists(List.of(universe.agent("x")),
                v -> dictates(v[0])));
    }

    private BoolExpr dictates(IntExpr x)
    {
        List<Binder.Var> vars = List.of(universe.state("s"),
                universe.alternative("a"), universe.alternative("b"));
        return binder.forAll(vars,
                v -> iff(rel.prefers(x, v[1], v[2], v[0]),
                        rel.ranks(v[1], v[2], v[0])));
    }
}
