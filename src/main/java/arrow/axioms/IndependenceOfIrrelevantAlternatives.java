/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    IndependenceOfIrrelevantAlternatives.java

Abstract:

    Arrow's theorem encoding: the social order of a pair depends only on
    the individual orders of that pair

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
 * forall a, b, s1, s2.
 *     (forall x. p(x,a,b,s1) = p(x,a,b,s2)) implies w(a,b,s1) = w(a,b,s2)
 * </pre>
 **/
public final class IndependenceOfIrrelevantAlternatives extends AxiomBuilder
{
    public IndependenceOfIrrelevantAlternatives(Relations relations,
            Universe universe, Binder binder)
    {
        super(relations, universe, binder);
    }

    @Override
    public BoolExpr build()
    {
        List<Binder.Var> vars = List.of(universe.alternative("a"),
                universe.alternative("b"), universe.state("s1"),
                universe.state("s2"));
        return binder.forAll(vars, v -> {
            IntExpr a = v[0], b = v[1], s1 = v[2], s2 = v[3];
            BoolExpr agree = binder.forAll(List.of(universe.agent("x")),
                    x -> iff(rel.prefers(x[0], a, b, s1),
                            rel.prefers(x[0], a, b, s2)));
            return implies(agree, iff(rel.ranks(a, b, s1), rel.ranks(a, b, s2)));
        });
    }
}
