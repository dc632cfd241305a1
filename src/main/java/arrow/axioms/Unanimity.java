/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Unanimity.java

Abstract:

    Arrow's theorem encoding: unanimous preferences are respected

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
 * forall a, b, s. (forall x. p(x,a,b,s)) implies w(a,b,s)
 * </pre>
 **/
public final class Unanimity extends AxiomBuilder
{
    public Unanimity(Relations relations, Universe universe, Binder binder)
    {
        super(relations, universe, binder);
    }

    @Override
    public BoolExpr build()
    {
        List<Binder.Var> vars = List.of(universe.alternative("a"),
                universe.alternative("b"), universe.state("s"));
        return binder.forAll(vars, v -> {
            IntExpr a = v[0], b = v[1], s = v[2];
            BoolExpr everyone = binder.forAll(List.of(universe.agent("x")),
                    x -> rel.prefers(x[0], a, b, s));
            return implies(everyone, rel.ranks(a, b, s));
        });
    }
}
