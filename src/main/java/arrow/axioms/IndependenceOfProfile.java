/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    IndependenceOfProfile.java

Abstract:

    Arrow's theorem encoding: the welfare ranking is a function of the
    profile

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
 * Two states with identical individual preferences have identical welfare
 * rankings:
 * 
 * <pre>
 * forall s1, s2.
 *     (forall x, a, b. p(x,a,b,s1) = p(x,a,b,s2))
 *     implies (forall a, b. w(a,b,s1) = w(a,b,s2))
 * </pre>
 **/
public final class IndependenceOfProfile extends AxiomBuilder
{
    public IndependenceOfProfile(Relations relations, Universe universe,
            Binder binder)
    {
        super(relations, universe, binder);
    }

    @Override
    public BoolExpr build()
    {
        List<Binder.Var> states = List.of(universe.state("s1"),
                universe.state("s2"));
        return binder.forAll(states, v -> {
            IntExpr s1 = v[0], s2 = v[1];
            return implies(sameProfile(s1, s2), sameRanking(s1, s2));
        });
    }

    private BoolExpr sameProfile(IntExpr s1, IntExpr s2)
    {
        List<Binder.Var> vars = List.of(universe.agent("x"),
                universe.alternative("a"), universe.alternative("b"));
        return binder.forAll(vars, v -> iff(rel.prefers(v[0], v[1], v[2], s1),
                rel.prefers(v[0], v[1], v[2], s2)));
    }

    private BoolExpr sameRanking(IntExpr s1, IntExpr s2)
    {
        List<Binder.Var> vars = List.of(universe.alternative("a"),
                universe.alternative("b"));
        return binder.forAll(vars,
                v -> iff(rel.ranks(v[0], v[1], s1), rel.ranks(v[0], v[1], s2)));
    }
}
